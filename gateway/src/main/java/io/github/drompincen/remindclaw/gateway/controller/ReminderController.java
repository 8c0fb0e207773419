package io.github.drompincen.remindclaw.gateway.controller;

import io.github.drompincen.remindclaw.protocol.api.DeliveryStatsDto;
import io.github.drompincen.remindclaw.protocol.api.RecurringReminderRequest;
import io.github.drompincen.remindclaw.protocol.api.ReminderDto;
import io.github.drompincen.remindclaw.protocol.api.ScheduleReminderRequest;
import io.github.drompincen.remindclaw.runtime.delivery.NotificationBridge;
import io.github.drompincen.remindclaw.runtime.reminder.ReminderOperations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
public class ReminderController {

    private static final String FAILURE_MARKER = "❌";

    private final ReminderOperations reminderOperations;
    private final NotificationBridge bridge;

    public ReminderController(ReminderOperations reminderOperations, NotificationBridge bridge) {
        this.reminderOperations = reminderOperations;
        this.bridge = bridge;
    }

    @PostMapping("/api/reminders")
    public ResponseEntity<Map<String, String>> create(@RequestBody ScheduleReminderRequest req) {
        return reply(reminderOperations.setReminder(req.text(), req.when(), req.timezone()), HttpStatus.BAD_REQUEST);
    }

    @PostMapping("/api/reminders/recurring")
    public ResponseEntity<Map<String, String>> createRecurring(@RequestBody RecurringReminderRequest req) {
        return reply(reminderOperations.setRecurringReminder(req.text(), req.pattern(), req.timezone()),
                HttpStatus.BAD_REQUEST);
    }

    @GetMapping("/api/reminders")
    public Map<String, String> list() {
        return Map.of("message", reminderOperations.listReminders());
    }

    @GetMapping("/api/reminders/active")
    public List<ReminderDto> active() {
        return reminderOperations.activeReminders();
    }

    @DeleteMapping("/api/reminders/{id}")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String id) {
        return reply(reminderOperations.cancelReminder(id), HttpStatus.NOT_FOUND);
    }

    @DeleteMapping("/api/reminders")
    public Map<String, String> clear() {
        return Map.of("message", reminderOperations.clearAllReminders());
    }

    @GetMapping("/api/reminders/delivery")
    public DeliveryStatsDto delivery() {
        return bridge.describe();
    }

    @GetMapping("/api/time")
    public ResponseEntity<Map<String, String>> time(@RequestParam(required = false) String timezone) {
        return reply(reminderOperations.getCurrentTime(timezone), HttpStatus.BAD_REQUEST);
    }

    private static ResponseEntity<Map<String, String>> reply(String message, HttpStatus failureStatus) {
        Map<String, String> body = Map.of("message", message);
        if (!message.startsWith(FAILURE_MARKER)) return ResponseEntity.ok(body);
        return ResponseEntity.status(failureStatus).body(body);
    }
}
