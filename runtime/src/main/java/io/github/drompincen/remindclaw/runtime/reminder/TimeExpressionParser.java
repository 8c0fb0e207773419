package io.github.drompincen.remindclaw.runtime.reminder;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a user supplied "when" expression into a concrete instant.
 *
 * <p>Forms are tried in order: shorthand ({@code 30s}, {@code 1.5h}), spelled-out units
 * ({@code 2 hours}, {@code 3 weeks}), then the {@link FuzzyDateParser}. A leading
 * {@code in } is ignored. The result is not checked against "now"; callers that need a
 * future instant reject past ones themselves.
 */
@Component
public class TimeExpressionParser {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final Pattern SHORTHAND = Pattern.compile("^([+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+))([smhd])$");
    private static final Pattern NUMBER = Pattern.compile("^[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)$");

    private static final Map<String, Long> SHORTHAND_UNITS = Map.of(
            "s", 1L,
            "m", 60L,
            "h", 3_600L,
            "d", 86_400L);

    private static final Map<String, Long> UNIT_WORDS = Map.ofEntries(
            Map.entry("second", 1L), Map.entry("seconds", 1L), Map.entry("sec", 1L), Map.entry("secs", 1L),
            Map.entry("minute", 60L), Map.entry("minutes", 60L), Map.entry("min", 60L), Map.entry("mins", 60L),
            Map.entry("hour", 3_600L), Map.entry("hours", 3_600L), Map.entry("hr", 3_600L), Map.entry("hrs", 3_600L),
            Map.entry("day", 86_400L), Map.entry("days", 86_400L),
            Map.entry("week", 604_800L), Map.entry("weeks", 604_800L));

    private final FuzzyDateParser fuzzyDateParser;
    private final Clock clock;

    public TimeExpressionParser(FuzzyDateParser fuzzyDateParser, Clock clock) {
        this.fuzzyDateParser = fuzzyDateParser;
        this.clock = clock;
    }

    /**
     * Resolves a timezone name. Blank names mean UTC.
     *
     * @throws ReminderException with {@link ReminderErrorKind#UNKNOWN_TIMEZONE}
     */
    public static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) return UTC;
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw ReminderException.unknownTimezone(timezone);
        }
    }

    public ZonedDateTime now(ZoneId zone) {
        return ZonedDateTime.now(clock).withZoneSameInstant(zone);
    }

    public ZonedDateTime parseInstant(String expression, ZoneId zone) {
        return parseInstant(expression, now(zone));
    }

    /**
     * Parses {@code expression} relative to {@code now}; results without a zone of their own are
     * placed in {@code now}'s zone.
     *
     * @throws ReminderException with {@link ReminderErrorKind#UNRECOGNIZED}
     */
    public ZonedDateTime parseInstant(String expression, ZonedDateTime now) {
        if (expression == null || expression.isBlank()) throw ReminderException.unrecognizedTime();

        String text = expression.trim();
        if (text.toLowerCase(Locale.ROOT).startsWith("in ")) {
            text = text.substring(3).trim();
        }
        String lower = text.toLowerCase(Locale.ROOT);

        Optional<Duration> offset = shorthand(lower).or(() -> spelledOut(lower));
        if (offset.isPresent()) return now.plus(offset.get());

        return fuzzyDateParser.parse(text, now)
                .map(parsed -> localize(parsed, now.getZone()))
                .orElseThrow(ReminderException::unrecognizedTime);
    }

    private static Optional<Duration> shorthand(String text) {
        Matcher m = SHORTHAND.matcher(text);
        if (!m.matches()) return Optional.empty();
        return Optional.of(scaled(m.group(1), SHORTHAND_UNITS.get(m.group(2))));
    }

    private static Optional<Duration> spelledOut(String text) {
        String[] parts = text.split("\\s+");
        if (parts.length < 2 || !NUMBER.matcher(parts[0]).matches()) return Optional.empty();
        Long unitSeconds = UNIT_WORDS.get(parts[1]);
        if (unitSeconds == null) return Optional.empty();
        return Optional.of(scaled(parts[0], unitSeconds));
    }

    private static Duration scaled(String magnitude, long unitSeconds) {
        double value = Double.parseDouble(magnitude);
        return Duration.ofMillis(Math.round(value * unitSeconds * 1000));
    }

    private static ZonedDateTime localize(Temporal parsed, ZoneId zone) {
        if (parsed instanceof ZonedDateTime zoned) return zoned;
        if (parsed instanceof OffsetDateTime offset) return offset.toZonedDateTime();
        if (parsed instanceof Instant instant) return instant.atZone(ZoneOffset.UTC);
        if (parsed instanceof LocalDateTime local) return local.atZone(zone);
        throw new IllegalStateException("Unsupported fuzzy parse result: " + parsed.getClass().getName());
    }
}
