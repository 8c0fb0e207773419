package io.github.drompincen.remindclaw.runtime.reminder;

import io.github.drompincen.remindclaw.protocol.api.ReminderKind;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * An active reminder. One-shot jobs carry {@code fireAt}; recurring jobs carry the user's
 * {@code pattern} and its compiled {@code trigger}.
 */
public record ReminderJob(
        String id,
        String text,
        ReminderKind kind,
        ZoneId zone,
        Instant createdAt,
        ZonedDateTime fireAt,
        String pattern,
        Trigger trigger
) {

    public static ReminderJob oneShot(String id, String text, ZoneId zone, ZonedDateTime fireAt, Instant createdAt) {
        return new ReminderJob(id, text, ReminderKind.ONE_SHOT, zone, createdAt, fireAt, null, null);
    }

    public static ReminderJob recurring(String id, String text, ZoneId zone, String pattern, Trigger trigger,
                                        Instant createdAt) {
        return new ReminderJob(id, text, ReminderKind.RECURRING, zone, createdAt, null, pattern, trigger);
    }

    public boolean isRecurring() {
        return kind == ReminderKind.RECURRING;
    }

    /** Text handed to the notification bridge when the job fires. */
    public String payload() {
        return kind.marker() + " " + text;
    }
}
