package io.github.drompincen.remindclaw.runtime.reminder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles recurrence patterns into {@link Trigger}s. Rules are evaluated in list order and the
 * first match wins; anything else with exactly five fields is read as a crontab line.
 */
@Component
public class RecurrenceCompiler {

    private static final Logger log = LoggerFactory.getLogger(RecurrenceCompiler.class);
    private static final int DEFAULT_HOUR = 9;
    private static final Pattern AT_MARKER = Pattern.compile("\\bat\\b\\s*(.*)$");

    private final List<RecurrenceRule> rules = List.of(
            new RecurrenceRule("daily",
                    p -> p.contains("daily") || p.contains("every day"),
                    (p, zone) -> CronTrigger.daily(hourAfterAt(p), zone)),
            new RecurrenceRule("weekly",
                    p -> p.contains("monday") || p.contains("weekly"),
                    (p, zone) -> CronTrigger.weekly("MON", hourAfterAt(p), zone)),
            new RecurrenceRule("hourly",
                    p -> p.contains("hour"),
                    (p, zone) -> CronTrigger.hourly(zone)),
            new RecurrenceRule("cron",
                    p -> p.split("\\s+").length == 5,
                    CronTrigger::fromCrontab));

    public List<RecurrenceRule> rules() {
        return rules;
    }

    /**
     * @throws ReminderException with {@link ReminderErrorKind#UNRECOGNIZED} when no rule applies or
     *         the matching rule cannot build a trigger
     */
    public Trigger compile(String pattern, ZoneId zone) {
        if (pattern == null || pattern.isBlank()) throw ReminderException.unrecognizedPattern();
        String normalized = pattern.trim().toLowerCase(Locale.ROOT);

        for (RecurrenceRule rule : rules) {
            if (!rule.matches().test(normalized)) continue;
            try {
                Trigger trigger = rule.builder().build(normalized, zone);
                log.debug("Pattern '{}' compiled by rule {} to {}", pattern, rule.name(), trigger.describe());
                return trigger;
            } catch (ReminderException e) {
                throw e;
            } catch (IllegalArgumentException e) {
                log.debug("Rule {} rejected pattern '{}': {}", rule.name(), pattern, e.getMessage());
                throw ReminderException.unrecognizedPattern(e);
            }
        }
        throw ReminderException.unrecognizedPattern();
    }

    static int hourAfterAt(String normalized) {
        Matcher m = AT_MARKER.matcher(normalized);
        if (!m.find()) return DEFAULT_HOUR;
        return TimeOfDayParser.parse(m.group(1))
                .map(LocalTime::getHour)
                .orElseThrow(ReminderException::unrecognizedPattern);
    }
}
