package io.github.drompincen.remindclaw.runtime.reminder;

/**
 * User-facing failure of a reminder operation. The message is short and meant to be shown
 * to the person who issued the request as is.
 */
public class ReminderException extends RuntimeException {

    static final String TIME_HELP =
            "Try: '30s', '5m', 'in 2 hours', 'tomorrow at 3pm', or '2024-12-25 10:00'";
    static final String PATTERN_HELP =
            "Try: 'daily at 9am', 'every monday at 10am', 'every hour', or a cron expression like '30 8 * * 1-5'";

    private final ReminderErrorKind kind;

    public ReminderException(ReminderErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ReminderException(ReminderErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ReminderException unrecognizedTime() {
        return new ReminderException(ReminderErrorKind.UNRECOGNIZED, TIME_HELP);
    }

    public static ReminderException unrecognizedPattern() {
        return new ReminderException(ReminderErrorKind.UNRECOGNIZED, PATTERN_HELP);
    }

    public static ReminderException unrecognizedPattern(Throwable cause) {
        return new ReminderException(ReminderErrorKind.UNRECOGNIZED, PATTERN_HELP, cause);
    }

    public static ReminderException emptyText() {
        return new ReminderException(ReminderErrorKind.UNRECOGNIZED, "Reminder text must not be empty");
    }

    public static ReminderException pastInstant() {
        return new ReminderException(ReminderErrorKind.PAST_INSTANT, "Time must be in the future");
    }

    public static ReminderException unknownTimezone(String timezone) {
        return new ReminderException(ReminderErrorKind.UNKNOWN_TIMEZONE, "Unknown timezone '" + timezone + "'");
    }

    public static ReminderException sinkNotReady() {
        return new ReminderException(ReminderErrorKind.SINK_NOT_READY, "Bot not ready");
    }

    public static ReminderException notFound(String reminderId) {
        return new ReminderException(ReminderErrorKind.NOT_FOUND, "'" + reminderId + "' not found");
    }

    public ReminderErrorKind kind() {
        return kind;
    }
}
