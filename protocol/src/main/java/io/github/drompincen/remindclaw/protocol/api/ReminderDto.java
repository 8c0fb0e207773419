package io.github.drompincen.remindclaw.protocol.api;

import java.time.Instant;

public record ReminderDto(
        String reminderId,
        String text,
        ReminderKind kind,
        String timezone,
        Instant fireAt,
        String pattern,
        Instant nextFireAt,
        Instant createdAt
) {}
