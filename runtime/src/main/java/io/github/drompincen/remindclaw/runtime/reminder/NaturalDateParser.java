package io.github.drompincen.remindclaw.runtime.reminder;

import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Month;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAdjusters;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link FuzzyDateParser}. Understands ISO timestamps, {@code yyyy-MM-dd [time]},
 * today/tonight/tomorrow, weekday names, month-name dates, "next week"/"next month" and bare
 * clock times. Day phrases without a time resolve to 09:00; a bare ISO date to midnight.
 */
@Component
public class NaturalDateParser implements FuzzyDateParser {

    private static final LocalTime DEFAULT_TIME = LocalTime.of(9, 0);
    private static final LocalTime TONIGHT = LocalTime.of(20, 0);

    private static final Map<String, Month> MONTHS = new HashMap<>();
    private static final Map<String, DayOfWeek> WEEKDAYS = new HashMap<>();

    static {
        for (Month month : Month.values()) {
            MONTHS.put(month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT), month);
            MONTHS.put(month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toLowerCase(Locale.ROOT), month);
        }
        MONTHS.put("sept", Month.SEPTEMBER);
        for (DayOfWeek day : DayOfWeek.values()) {
            WEEKDAYS.put(day.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT), day);
            WEEKDAYS.put(day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toLowerCase(Locale.ROOT), day);
        }
        WEEKDAYS.put("tues", DayOfWeek.TUESDAY);
        WEEKDAYS.put("thur", DayOfWeek.THURSDAY);
        WEEKDAYS.put("thurs", DayOfWeek.THURSDAY);
    }

    private static final String TIME_TAIL = "(?:\\s+(?:at\\s+)?(.+))?";
    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})" + TIME_TAIL + "$");
    private static final Pattern RELATIVE_DAY = Pattern.compile("^(today|tonight|tomorrow)" + TIME_TAIL + "$");
    private static final Pattern WEEKDAY = Pattern.compile("^(?:(?:next|this|on)\\s+)?([a-z]+)" + TIME_TAIL + "$");
    private static final Pattern MONTH_DAY = Pattern.compile(
            "^(?:on\\s+)?([a-z]+)\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?(?:\\s+(\\d{4}))?" + TIME_TAIL + "$");
    private static final Pattern DAY_MONTH = Pattern.compile(
            "^(?:on\\s+)?(?:the\\s+)?(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?([a-z]+)\\.?,?(?:\\s+(\\d{4}))?" + TIME_TAIL + "$");
    private static final Pattern BARE_TIME = Pattern.compile("^(?:at\\s+)?(.+)$");

    @Override
    public Optional<Temporal> parse(String text, ZonedDateTime now) {
        if (text == null || text.isBlank()) return Optional.empty();
        String raw = text.trim();

        Optional<Temporal> zoned = parseZoned(raw);
        if (zoned.isPresent()) return zoned;

        try {
            return Optional.of(LocalDateTime.parse(raw));
        } catch (DateTimeParseException ignored) {
            // not an ISO local date-time, fall through to phrases
        }

        String value = raw.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        LocalDate today = now.toLocalDate();
        try {
            return parsePhrase(value, now, today).map(t -> (Temporal) t);
        } catch (DateTimeException e) {
            // e.g. "feb 30"
            return Optional.empty();
        }
    }

    private Optional<LocalDateTime> parsePhrase(String value, ZonedDateTime now, LocalDate today) {
        if (value.equals("next week")) return Optional.of(now.toLocalDateTime().plusWeeks(1));
        if (value.equals("next month")) return Optional.of(now.toLocalDateTime().plusMonths(1));

        Matcher m = ISO_DATE.matcher(value);
        if (m.matches()) {
            LocalDate date = LocalDate.parse(m.group(1));
            return withTime(date, m.group(2), LocalTime.MIDNIGHT);
        }

        m = RELATIVE_DAY.matcher(value);
        if (m.matches()) {
            String day = m.group(1);
            LocalDate date = day.equals("tomorrow") ? today.plusDays(1) : today;
            LocalTime fallback = day.equals("tonight") ? TONIGHT : DEFAULT_TIME;
            return withTime(date, m.group(2), fallback);
        }

        m = WEEKDAY.matcher(value);
        if (m.matches() && WEEKDAYS.containsKey(m.group(1))) {
            LocalDate date = today.with(TemporalAdjusters.next(WEEKDAYS.get(m.group(1))));
            return withTime(date, m.group(2), DEFAULT_TIME);
        }

        m = MONTH_DAY.matcher(value);
        if (m.matches() && MONTHS.containsKey(m.group(1))) {
            return withTime(dateOf(MONTHS.get(m.group(1)), m.group(2), m.group(3), today), m.group(4), DEFAULT_TIME);
        }

        m = DAY_MONTH.matcher(value);
        if (m.matches() && MONTHS.containsKey(m.group(2))) {
            return withTime(dateOf(MONTHS.get(m.group(2)), m.group(1), m.group(3), today), m.group(4), DEFAULT_TIME);
        }

        m = BARE_TIME.matcher(value);
        if (m.matches()) {
            return TimeOfDayParser.parse(m.group(1)).map(today::atTime);
        }
        return Optional.empty();
    }

    private static Optional<Temporal> parseZoned(String raw) {
        try {
            return Optional.of(ZonedDateTime.parse(raw));
        } catch (DateTimeParseException ignored) {
            // try the narrower forms below
        }
        try {
            return Optional.of(OffsetDateTime.parse(raw));
        } catch (DateTimeParseException ignored) {
            // try the narrower forms below
        }
        try {
            return Optional.of(Instant.parse(raw));
        } catch (DateTimeParseException ignored) {
            return Optional.empty();
        }
    }

    private static LocalDate dateOf(Month month, String day, String year, LocalDate today) {
        int y = year != null ? Integer.parseInt(year) : today.getYear();
        return LocalDate.of(y, month, Integer.parseInt(day));
    }

    private static Optional<LocalDateTime> withTime(LocalDate date, String timeText, LocalTime fallback) {
        if (timeText == null) return Optional.of(date.atTime(fallback));
        return TimeOfDayParser.parse(timeText).map(date::atTime);
    }
}
