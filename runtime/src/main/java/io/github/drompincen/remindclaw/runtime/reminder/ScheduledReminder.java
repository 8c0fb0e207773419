package io.github.drompincen.remindclaw.runtime.reminder;

import java.time.Duration;
import java.time.ZonedDateTime;

public record ScheduledReminder(ReminderJob job, ZonedDateTime nextFireAt, Duration timeUntil) {}
