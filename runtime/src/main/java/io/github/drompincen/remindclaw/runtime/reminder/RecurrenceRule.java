package io.github.drompincen.remindclaw.runtime.reminder;

import java.time.ZoneId;
import java.util.function.Predicate;

/**
 * One entry of the recurrence rule list: a predicate over the normalised pattern and the
 * builder producing the trigger when it matches.
 */
public record RecurrenceRule(String name, Predicate<String> matches, Builder builder) {

    @FunctionalInterface
    public interface Builder {
        Trigger build(String normalizedPattern, ZoneId zone);
    }
}
