package io.github.drompincen.remindclaw.gateway.controller;

import io.github.drompincen.remindclaw.protocol.api.DeliveryStatsDto;
import io.github.drompincen.remindclaw.protocol.api.RecurringReminderRequest;
import io.github.drompincen.remindclaw.protocol.api.ReminderDto;
import io.github.drompincen.remindclaw.protocol.api.ReminderKind;
import io.github.drompincen.remindclaw.protocol.api.ScheduleReminderRequest;
import io.github.drompincen.remindclaw.runtime.delivery.NotificationBridge;
import io.github.drompincen.remindclaw.runtime.reminder.ReminderOperations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReminderControllerTest {

    @Mock private ReminderOperations reminderOperations;
    @Mock private NotificationBridge bridge;

    private ReminderController controller;

    @BeforeEach
    void setUp() {
        controller = new ReminderController(reminderOperations, bridge);
    }

    @Test
    void createReturnsConfirmation() {
        when(reminderOperations.setReminder("tea", "5m", "UTC"))
                .thenReturn("✅ Reminder set for Mar 02 at 08:05 AM (5m) [r_1]");

        ResponseEntity<Map<String, String>> response = controller.create(new ScheduleReminderRequest("tea", "5m", "UTC"));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).containsEntry("message", "✅ Reminder set for Mar 02 at 08:05 AM (5m) [r_1]");
    }

    @Test
    void createReturns400OnRejectedInput() {
        when(reminderOperations.setReminder("tea", "yesterday", null)).thenReturn("❌ Time must be in the future");

        ResponseEntity<Map<String, String>> response = controller.create(new ScheduleReminderRequest("tea", "yesterday", null));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(response.getBody()).containsEntry("message", "❌ Time must be in the future");
    }

    @Test
    void createRecurringDelegates() {
        when(reminderOperations.setRecurringReminder("standup", "daily at 9am", "UTC"))
                .thenReturn("✅ Recurring: daily at 9am\n⏰ Next: Mar 02 at 09:00 AM [rec_1]");

        var response = controller.createRecurring(new RecurringReminderRequest("standup", "daily at 9am", "UTC"));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
    }

    @Test
    void cancelUnknownReturns404() {
        when(reminderOperations.cancelReminder("r_9")).thenReturn("❌ 'r_9' not found");

        assertThat(controller.cancel("r_9").getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void listAndClearWrapMessages() {
        when(reminderOperations.listReminders()).thenReturn("📭 No reminders");
        when(reminderOperations.clearAllReminders()).thenReturn("✅ Cleared 0 reminder(s)");

        assertThat(controller.list()).containsEntry("message", "📭 No reminders");
        assertThat(controller.clear()).containsEntry("message", "✅ Cleared 0 reminder(s)");
    }

    @Test
    void activeReturnsDtos() {
        ReminderDto dto = new ReminderDto("r_1", "tea", ReminderKind.ONE_SHOT, "UTC",
                Instant.parse("2026-03-02T08:05:00Z"), null, Instant.parse("2026-03-02T08:05:00Z"),
                Instant.parse("2026-03-02T08:00:00Z"));
        when(reminderOperations.activeReminders()).thenReturn(List.of(dto));

        assertThat(controller.active()).containsExactly(dto);
    }

    @Test
    void timeWithUnknownZoneReturns400() {
        when(reminderOperations.getCurrentTime("Nowhere/City")).thenReturn("❌ Unknown timezone 'Nowhere/City'");

        assertThat(controller.time("Nowhere/City").getStatusCode().value()).isEqualTo(400);
    }

    @Test
    void deliveryExposesBridgeStats() {
        DeliveryStatsDto stats = new DeliveryStatsDto(true, "ws-1", 3, 3, 2, 1, "socket closed");
        when(bridge.describe()).thenReturn(stats);

        assertThat(controller.delivery()).isEqualTo(stats);
    }
}
