package io.github.drompincen.remindclaw.runtime.reminder;

import java.time.ZonedDateTime;

public record ActiveReminder(ReminderJob job, ZonedDateTime nextFireAt) {}
