package io.github.drompincen.remindclaw.runtime.reminder;

import io.github.drompincen.remindclaw.protocol.api.ReminderDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Reminder operations as the chat side sees them: every method returns a short message and
 * none of them throws.
 */
@Service
public class ReminderOperations {

    private static final Logger log = LoggerFactory.getLogger(ReminderOperations.class);

    private static final DateTimeFormatter DISPLAY_FMT =
            DateTimeFormatter.ofPattern("MMM dd 'at' hh:mm a", Locale.ENGLISH);
    private static final DateTimeFormatter CURRENT_TIME_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z", Locale.ENGLISH);

    static final String NO_REMINDERS = "📭 No reminders";

    private final ReminderScheduler scheduler;
    private final Clock clock;
    private final String defaultTimezone;

    public ReminderOperations(ReminderScheduler scheduler,
                              Clock clock,
                              @Value("${remindclaw.reminders.default-timezone:UTC}") String defaultTimezone) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.defaultTimezone = defaultTimezone;
    }

    public String setReminder(String text, String when, String timezone) {
        try {
            ScheduledReminder r = scheduler.scheduleOnce(text, when, zoneOrDefault(timezone));
            return "✅ Reminder set for " + DISPLAY_FMT.format(r.nextFireAt())
                    + " (" + formatDelta(r.timeUntil()) + ") [" + r.job().id() + "]";
        } catch (ReminderException e) {
            log.debug("Reminder rejected ({}): {}", e.kind(), e.getMessage());
            return "❌ " + e.getMessage();
        } catch (Exception e) {
            log.error("Failed to set reminder", e);
            return "❌ Failed to set reminder";
        }
    }

    public String setRecurringReminder(String text, String pattern, String timezone) {
        try {
            ScheduledReminder r = scheduler.scheduleRecurring(text, pattern, zoneOrDefault(timezone));
            return "✅ Recurring: " + r.job().pattern()
                    + "\n⏰ Next: " + DISPLAY_FMT.format(r.nextFireAt()) + " [" + r.job().id() + "]";
        } catch (ReminderException e) {
            log.debug("Recurring reminder rejected ({}): {}", e.kind(), e.getMessage());
            return "❌ " + e.getMessage();
        } catch (Exception e) {
            log.error("Failed to set recurring reminder", e);
            return "❌ Invalid pattern";
        }
    }

    public String listReminders() {
        List<ActiveReminder> active = scheduler.listActive();
        if (active.isEmpty()) return NO_REMINDERS;

        ZonedDateTime now = ZonedDateTime.now(clock);
        StringBuilder sb = new StringBuilder("📋 Active Reminders:\n");
        for (ActiveReminder reminder : active) {
            ReminderJob job = reminder.job();
            sb.append('\n').append(job.kind().marker()).append(' ').append(job.id()).append(": ").append(job.text());
            if (job.isRecurring()) {
                sb.append("\n   Pattern: ").append(job.pattern());
            } else {
                sb.append("\n   Time: ").append(DISPLAY_FMT.format(job.fireAt()));
            }
            sb.append("\n   Next: ").append(formatDelta(Duration.between(now, reminder.nextFireAt()))).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    public List<ReminderDto> activeReminders() {
        return scheduler.listActive().stream()
                .map(a -> {
                    ReminderJob job = a.job();
                    return new ReminderDto(job.id(), job.text(), job.kind(), job.zone().getId(),
                            job.fireAt() != null ? job.fireAt().toInstant() : null,
                            job.pattern(), a.nextFireAt().toInstant(), job.createdAt());
                })
                .toList();
    }

    public String cancelReminder(String reminderId) {
        String id = reminderId != null ? reminderId.trim() : "";
        try {
            ReminderJob job = scheduler.cancel(id);
            return "✅ Cancelled: " + job.text();
        } catch (ReminderException e) {
            return "❌ " + e.getMessage();
        } catch (Exception e) {
            log.error("Failed to cancel reminder {}", id, e);
            return "❌ Failed to cancel";
        }
    }

    public String clearAllReminders() {
        int count = scheduler.clearAll();
        return "✅ Cleared " + count + " reminder(s)";
    }

    public String getCurrentTime(String timezone) {
        try {
            ZoneId zone = TimeExpressionParser.resolveZone(zoneOrDefault(timezone));
            return CURRENT_TIME_FMT.format(ZonedDateTime.now(clock).withZoneSameInstant(zone));
        } catch (ReminderException e) {
            return "❌ " + e.getMessage();
        }
    }

    private String zoneOrDefault(String timezone) {
        return timezone == null || timezone.isBlank() ? defaultTimezone : timezone;
    }

    /** 45s, 12m, 3h 5m, 2d 4h. Negative durations count as zero. */
    static String formatDelta(Duration delta) {
        long secs = Math.max(0, delta.getSeconds());
        if (secs < 60) return secs + "s";
        if (secs < 3_600) return (secs / 60) + "m";
        if (secs < 86_400) return (secs / 3_600) + "h " + ((secs % 3_600) / 60) + "m";
        return (secs / 86_400) + "d " + ((secs % 86_400) / 3_600) + "h";
    }
}
