package io.github.drompincen.remindclaw.runtime.reminder;

import java.time.ZonedDateTime;
import java.time.temporal.Temporal;
import java.util.Optional;

/**
 * Best-effort reading of free-form date/time phrases ("tomorrow at 3pm", "dec 25").
 *
 * <p>Implementations return either a zoned value ({@link ZonedDateTime},
 * {@link java.time.OffsetDateTime}, {@link java.time.Instant}) when the text names its own
 * zone, or a {@link java.time.LocalDateTime} that the caller localises. Relative phrases are
 * resolved against {@code now}.
 */
public interface FuzzyDateParser {

    Optional<Temporal> parse(String text, ZonedDateTime now);
}
