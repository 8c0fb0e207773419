package io.github.drompincen.remindclaw.runtime.reminder;

/** The kind of failure a reminder operation reports back to its caller. */
public enum ReminderErrorKind {
    /** The time expression or recurrence pattern matched none of the accepted forms. */
    UNRECOGNIZED,
    /** A one-shot reminder resolved to an instant that is not in the future. */
    PAST_INSTANT,
    /** The timezone name is not a known region or offset id. */
    UNKNOWN_TIMEZONE,
    /** No delivery destination has been bound yet. */
    SINK_NOT_READY,
    /** No active reminder carries the requested id. */
    NOT_FOUND
}
