package io.github.drompincen.remindclaw.protocol.api;

public record RecurringReminderRequest(
        String text,
        String pattern,
        String timezone
) {}
