package io.github.drompincen.remindclaw.protocol.api;

public enum ReminderKind {
    ONE_SHOT("r_", "⏰"),
    RECURRING("rec_", "🔔");

    private final String idPrefix;
    private final String marker;

    ReminderKind(String idPrefix, String marker) {
        this.idPrefix = idPrefix;
        this.marker = marker;
    }

    /** Prefix put in front of the counter value when an id is allocated. */
    public String idPrefix() {
        return idPrefix;
    }

    /** Marker prepended to the delivered text and to list entries. */
    public String marker() {
        return marker;
    }
}
