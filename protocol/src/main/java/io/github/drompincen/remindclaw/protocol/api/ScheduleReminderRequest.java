package io.github.drompincen.remindclaw.protocol.api;

public record ScheduleReminderRequest(
        String text,
        String when,
        String timezone
) {}
