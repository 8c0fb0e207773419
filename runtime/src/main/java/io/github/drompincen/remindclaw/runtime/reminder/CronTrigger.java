package io.github.drompincen.remindclaw.runtime.reminder;

import org.springframework.scheduling.support.CronExpression;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * {@link Trigger} backed by a Spring {@link CronExpression} (six fields, seconds first)
 * evaluated in a fixed zone.
 */
public final class CronTrigger implements Trigger {

    private final CronExpression expression;
    private final String source;
    private final ZoneId zone;

    private CronTrigger(CronExpression expression, String source, ZoneId zone) {
        this.expression = expression;
        this.source = source;
        this.zone = zone;
    }

    /** @throws IllegalArgumentException if {@code sixFieldExpression} is not a valid cron expression */
    public static CronTrigger of(String sixFieldExpression, ZoneId zone) {
        return new CronTrigger(CronExpression.parse(sixFieldExpression), sixFieldExpression, zone);
    }

    /** Standard crontab form: minute hour day-of-month month day-of-week. */
    public static CronTrigger fromCrontab(String fiveFieldExpression, ZoneId zone) {
        return of("0 " + fiveFieldExpression.trim(), zone);
    }

    public static CronTrigger daily(int hour, ZoneId zone) {
        return of("0 0 " + hour + " * * *", zone);
    }

    public static CronTrigger weekly(String dayOfWeek, int hour, ZoneId zone) {
        return of("0 0 " + hour + " * * " + dayOfWeek, zone);
    }

    public static CronTrigger hourly(ZoneId zone) {
        return of("0 0 * * * *", zone);
    }

    @Override
    public ZonedDateTime nextAfter(ZonedDateTime instant) {
        ZonedDateTime next = expression.next(instant.withZoneSameInstant(zone));
        if (next == null) {
            throw new IllegalStateException("Cron expression '" + source + "' has no future fire time");
        }
        return next;
    }

    @Override
    public ZoneId zone() {
        return zone;
    }

    @Override
    public String describe() {
        return "cron(" + source + ") " + zone.getId();
    }

    @Override
    public String toString() {
        return describe();
    }
}
