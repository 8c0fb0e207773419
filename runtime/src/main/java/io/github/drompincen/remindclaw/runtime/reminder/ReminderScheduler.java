package io.github.drompincen.remindclaw.runtime.reminder;

import io.github.drompincen.remindclaw.protocol.api.ReminderKind;
import io.github.drompincen.remindclaw.runtime.delivery.DeliveryOutcome;
import io.github.drompincen.remindclaw.runtime.delivery.NotificationBridge;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the job table and the timer thread that fires reminders.
 *
 * <p>All table and timer mutations happen under one lock, so create, cancel, clear and the
 * post-fire cleanup see each other atomically. A fire already running when {@link #cancel}
 * is called is not interrupted; its cleanup then finds nothing to remove.
 */
@Service
public class ReminderScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReminderScheduler.class);

    private final TimeExpressionParser timeParser;
    private final RecurrenceCompiler recurrenceCompiler;
    private final NotificationBridge bridge;
    private final Clock clock;

    private final JobTable jobTable = new JobTable();
    private final Map<String, ArmedTimer> timers = new HashMap<>();
    private final AtomicLong idCounter = new AtomicLong();
    private final Object lock = new Object();
    private final ScheduledThreadPoolExecutor engine = new ScheduledThreadPoolExecutor(1, r -> {
        Thread t = new Thread(r, "reminder-timer");
        t.setDaemon(true);
        return t;
    });

    private record ArmedTimer(ScheduledFuture<?> future, ZonedDateTime fireAt) {}

    public ReminderScheduler(TimeExpressionParser timeParser,
                             RecurrenceCompiler recurrenceCompiler,
                             NotificationBridge bridge,
                             Clock clock) {
        this.timeParser = timeParser;
        this.recurrenceCompiler = recurrenceCompiler;
        this.bridge = bridge;
        this.clock = clock;
        // cancelled reminders leave the timer queue at once instead of at their fire time
        engine.setRemoveOnCancelPolicy(true);
    }

    public ScheduledReminder scheduleOnce(String text, String when, String timezone) {
        requireReady();
        requireText(text);
        ZoneId zone = TimeExpressionParser.resolveZone(timezone);
        ZonedDateTime now = timeParser.now(zone);
        ZonedDateTime fireAt = timeParser.parseInstant(when, now);
        if (!fireAt.isAfter(now)) throw ReminderException.pastInstant();

        ReminderJob job = ReminderJob.oneShot(nextId(ReminderKind.ONE_SHOT), text, zone, fireAt, now.toInstant());
        register(job, fireAt);
        log.info("Scheduled reminder {} for {}", job.id(), fireAt);
        return new ScheduledReminder(job, fireAt, Duration.between(now, fireAt));
    }

    public ScheduledReminder scheduleRecurring(String text, String pattern, String timezone) {
        requireReady();
        requireText(text);
        ZoneId zone = TimeExpressionParser.resolveZone(timezone);
        Trigger trigger = recurrenceCompiler.compile(pattern, zone);
        ZonedDateTime now = timeParser.now(zone);
        ZonedDateTime next = trigger.nextAfter(now);

        ReminderJob job = ReminderJob.recurring(nextId(ReminderKind.RECURRING), text, zone, pattern.trim(), trigger,
                now.toInstant());
        register(job, next);
        log.info("Scheduled recurring reminder {} ({}), next at {}", job.id(), trigger.describe(), next);
        return new ScheduledReminder(job, next, Duration.between(now, next));
    }

    /** Active jobs in creation order, each with the instant its live timer fires next. */
    public List<ActiveReminder> listActive() {
        synchronized (lock) {
            List<ActiveReminder> active = new ArrayList<>();
            for (ReminderJob job : jobTable.snapshot()) {
                ArmedTimer timer = timers.get(job.id());
                if (timer != null) {
                    active.add(new ActiveReminder(job, timer.fireAt()));
                }
            }
            return active;
        }
    }

    /** @throws ReminderException with {@link ReminderErrorKind#NOT_FOUND} */
    public ReminderJob cancel(String id) {
        ReminderJob job;
        synchronized (lock) {
            job = jobTable.remove(id).orElseThrow(() -> ReminderException.notFound(id));
            ArmedTimer timer = timers.remove(id);
            if (timer != null) timer.future().cancel(false);
        }
        log.info("Cancelled reminder {}", id);
        return job;
    }

    /** @return the number of jobs removed */
    public int clearAll() {
        int count;
        synchronized (lock) {
            timers.values().forEach(t -> t.future().cancel(false));
            timers.clear();
            count = jobTable.clear();
        }
        log.info("Cleared {} reminder(s)", count);
        return count;
    }

    public int activeCount() {
        return jobTable.size();
    }

    /** Timer tasks still queued in the engine, cancelled ones excluded. */
    int pendingTimers() {
        return engine.getQueue().size();
    }

    public boolean isReady() {
        return bridge.isReady();
    }

    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            timers.values().forEach(t -> t.future().cancel(false));
            timers.clear();
        }
        engine.shutdownNow();
        log.info("Reminder engine stopped");
    }

    /** Runs on the timer thread. */
    void fire(String id, ZonedDateTime scheduledFor) {
        ReminderJob job;
        synchronized (lock) {
            job = jobTable.get(id).orElse(null);
        }
        if (job == null) {
            log.debug("Reminder {} fired after cancellation, skipping", id);
            return;
        }

        try {
            DeliveryOutcome outcome = bridge.deliver(job.payload());
            if (outcome == DeliveryOutcome.DELIVERED) {
                log.info("Fired reminder {}", id);
            } else {
                log.warn("Reminder {} fired but was not delivered: {}", id, outcome);
            }
        } catch (Exception e) {
            log.error("Failed to deliver reminder {}", id, e);
        } finally {
            if (job.isRecurring()) {
                rearm(job, scheduledFor);
            } else {
                retire(id);
            }
        }
    }

    private void rearm(ReminderJob job, ZonedDateTime scheduledFor) {
        try {
            ZonedDateTime now = timeParser.now(job.zone());
            ZonedDateTime base = now.isAfter(scheduledFor) ? now : scheduledFor;
            ZonedDateTime next = job.trigger().nextAfter(base);
            synchronized (lock) {
                if (!jobTable.contains(job.id())) return;
                ArmedTimer previous = timers.put(job.id(), arm(job.id(), next));
                if (previous != null) previous.future().cancel(false);
            }
            log.debug("Re-armed recurring reminder {} for {}", job.id(), next);
        } catch (Exception e) {
            // the job stays in the table without a live timer until cancelled or cleared
            log.error("Failed to compute next fire time for recurring reminder {}", job.id(), e);
            synchronized (lock) {
                ArmedTimer spent = timers.remove(job.id());
                if (spent != null) spent.future().cancel(false);
            }
        }
    }

    private void retire(String id) {
        synchronized (lock) {
            jobTable.remove(id);
            ArmedTimer timer = timers.remove(id);
            if (timer != null) timer.future().cancel(false);
        }
    }

    private void register(ReminderJob job, ZonedDateTime fireAt) {
        synchronized (lock) {
            jobTable.insert(job);
            try {
                timers.put(job.id(), arm(job.id(), fireAt));
            } catch (RuntimeException e) {
                jobTable.remove(job.id());
                throw e;
            }
        }
    }

    private ArmedTimer arm(String id, ZonedDateTime fireAt) {
        long delayMs = Math.max(0, Duration.between(clock.instant(), fireAt.toInstant()).toMillis());
        ScheduledFuture<?> future = engine.schedule(() -> fire(id, fireAt), delayMs, TimeUnit.MILLISECONDS);
        return new ArmedTimer(future, fireAt);
    }

    private String nextId(ReminderKind kind) {
        return kind.idPrefix() + idCounter.incrementAndGet();
    }

    private void requireReady() {
        if (!bridge.isReady()) throw ReminderException.sinkNotReady();
    }

    private static void requireText(String text) {
        if (text == null || text.isBlank()) throw ReminderException.emptyText();
    }
}
