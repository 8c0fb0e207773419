package io.github.drompincen.remindclaw.runtime.reminder;

import java.time.LocalTime;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses clock times such as {@code 9am}, {@code 10:30 pm}, {@code 14:00}, {@code noon}.
 */
public final class TimeOfDayParser {

    private static final Pattern CLOCK = Pattern.compile(
            "^(\\d{1,2})(?::(\\d{2}))?(?::(\\d{2}))?\\s*(am|pm|a\\.m\\.|p\\.m\\.)?$");

    private TimeOfDayParser() {}

    public static Optional<LocalTime> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String value = text.trim().toLowerCase(Locale.ROOT);

        if (value.equals("noon") || value.equals("midday")) return Optional.of(LocalTime.NOON);
        if (value.equals("midnight")) return Optional.of(LocalTime.MIDNIGHT);

        Matcher m = CLOCK.matcher(value);
        if (!m.matches()) return Optional.empty();

        int hour = Integer.parseInt(m.group(1));
        int minute = m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
        int second = m.group(3) != null ? Integer.parseInt(m.group(3)) : 0;
        String meridiem = m.group(4);

        if (meridiem != null) {
            if (hour < 1 || hour > 12) return Optional.empty();
            hour = hour % 12;
            if (meridiem.startsWith("p")) hour += 12;
        }
        if (hour > 23 || minute > 59 || second > 59) return Optional.empty();
        return Optional.of(LocalTime.of(hour, minute, second));
    }
}
