package io.github.drompincen.remindclaw.runtime.reminder;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/** Computes successive fire instants of a recurring reminder. */
public interface Trigger {

    /** The first fire instant strictly after {@code instant}, in {@link #zone()}. */
    ZonedDateTime nextAfter(ZonedDateTime instant);

    ZoneId zone();

    String describe();
}
