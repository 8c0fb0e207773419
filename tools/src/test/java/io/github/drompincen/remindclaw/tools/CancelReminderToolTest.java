package io.github.drompincen.remindclaw.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.remindclaw.runtime.reminder.ReminderOperations;
import io.github.drompincen.remindclaw.runtime.tools.ToolContext;
import io.github.drompincen.remindclaw.runtime.tools.ToolResult;
import io.github.drompincen.remindclaw.runtime.tools.ToolStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CancelReminderToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock private ReminderOperations reminderOperations;

    private CancelReminderTool tool;
    private final ToolContext ctx = new ToolContext("session-1", null);

    @BeforeEach
    void setUp() {
        tool = new CancelReminderTool();
        tool.setReminderOperations(reminderOperations);
    }

    @Test
    void failsWithoutReminderId() {
        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode(), ToolStream.NO_OP);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("'reminderId' is required");
    }

    @Test
    void cancelsById() {
        when(reminderOperations.cancelReminder("r_2")).thenReturn("✅ Cancelled: tea");

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("reminderId", "r_2"), ToolStream.NO_OP);

        assertThat(result.output().path("message").asText()).isEqualTo("✅ Cancelled: tea");
        assertThat(result.output().path("ok").asBoolean()).isTrue();
    }

    @Test
    void unknownIdIsNotOk() {
        when(reminderOperations.cancelReminder("r_9")).thenReturn("❌ 'r_9' not found");

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("reminderId", "r_9"), ToolStream.NO_OP);

        assertThat(result.success()).isTrue();
        assertThat(result.output().path("ok").asBoolean()).isFalse();
    }
}
