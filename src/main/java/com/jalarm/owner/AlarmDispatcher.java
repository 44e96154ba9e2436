package com.jalarm.owner;

import com.jalarm.alarm.AlarmCoordinator;
import com.jalarm.config.JalarmProperties;
import com.jalarm.cron.CronEvaluator;
import com.jalarm.delivery.Notifier;
import com.jalarm.delivery.TaskRunner;
import com.jalarm.execution.ExecutionLog;
import com.jalarm.execution.ExecutionRecord;
import com.jalarm.observability.JalarmMetrics;
import com.jalarm.recurring.RecurringSchedule;
import com.jalarm.recurring.RecurringScheduleStore;
import com.jalarm.reminder.Reminder;
import com.jalarm.reminder.ReminderStore;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Processes everything that is due for one owner when its alarm fires: delivers due
 * reminders, hands due schedules to the task runner, advances their next run, prunes
 * old execution records and re-arms the alarm.
 */
public class AlarmDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlarmDispatcher.class);

    private final String ownerId;
    private final ReminderStore reminderStore;
    private final RecurringScheduleStore scheduleStore;
    private final ExecutionLog executionLog;
    private final CronEvaluator cronEvaluator;
    private final Notifier notifier;
    private final TaskRunner taskRunner;
    private final AlarmCoordinator coordinator;
    private final JalarmMetrics metrics;
    private final JalarmProperties properties;
    private final Clock clock;

    public AlarmDispatcher(String ownerId,
                           ReminderStore reminderStore,
                           RecurringScheduleStore scheduleStore,
                           ExecutionLog executionLog,
                           CronEvaluator cronEvaluator,
                           Notifier notifier,
                           TaskRunner taskRunner,
                           AlarmCoordinator coordinator,
                           JalarmMetrics metrics,
                           JalarmProperties properties,
                           Clock clock) {
        this.ownerId = ownerId;
        this.reminderStore = reminderStore;
        this.scheduleStore = scheduleStore;
        this.executionLog = executionLog;
        this.cronEvaluator = cronEvaluator;
        this.notifier = notifier;
        this.taskRunner = taskRunner;
        this.coordinator = coordinator;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Never throws. A failure of one item is recorded on that item and the rest of
     * the batch proceeds.
     */
    public void dispatch() {
        metrics.recordAlarmFired();
        Timer.Sample sample = metrics.startDispatchTimer();
        try {
            Instant now = clock.instant();
            List<Reminder> dueReminders = loadDueReminders(now);
            List<RecurringSchedule> dueSchedules = loadDueSchedules(now);
            log.info("Alarm fired: {} reminders and {} schedules due", dueReminders.size(), dueSchedules.size());

            for (Reminder reminder : dueReminders) {
                deliverReminder(reminder);
            }
            for (RecurringSchedule schedule : dueSchedules) {
                runSchedule(schedule, now);
            }
            pruneExecutions(now);
        } catch (RuntimeException e) {
            log.error("Alarm dispatch failed", e);
        } finally {
            rearm();
            metrics.stopDispatchTimer(sample);
        }
    }

    private List<Reminder> loadDueReminders(Instant now) {
        try {
            return reminderStore.dueReminders(ownerId, now);
        } catch (RuntimeException e) {
            log.error("Failed to load due reminders", e);
            return List.of();
        }
    }

    private List<RecurringSchedule> loadDueSchedules(Instant now) {
        try {
            return scheduleStore.dueSchedules(ownerId, now);
        } catch (RuntimeException e) {
            log.error("Failed to load due schedules", e);
            return List.of();
        }
    }

    private void deliverReminder(Reminder reminder) {
        Reminder.Status outcome;
        try {
            notifier.send(reminder.getDeliveryTarget(), reminder.getPayload())
                    .timeout(properties.getDelivery().getNotifierTimeout())
                    .block();
            outcome = Reminder.Status.COMPLETED;
            log.info("Reminder {} delivered via {}", reminder.getId(), notifier.channelType());
        } catch (RuntimeException e) {
            outcome = Reminder.Status.FAILED;
            log.error("Reminder {} delivery failed: {}", reminder.getId(), describe(e));
        }

        try {
            if (reminderStore.settleIfPending(ownerId, reminder.getId(), outcome)) {
                metrics.recordReminderDelivery(outcome.name().toLowerCase(Locale.ROOT));
            } else {
                log.debug("Reminder {} was settled concurrently, keeping its status", reminder.getId());
            }
        } catch (RuntimeException e) {
            log.error("Failed to record outcome of reminder {}", reminder.getId(), e);
        }
    }

    private void runSchedule(RecurringSchedule schedule, Instant now) {
        String scheduleId = schedule.getId();
        long started = clock.millis();
        ExecutionRecord.Status status;
        String error = null;
        try {
            taskRunner.run(ownerId, scheduleId, schedule.getPayload(), schedule.getBotToken())
                    .timeout(properties.getDelivery().getTaskRunnerTimeout())
                    .block();
            status = ExecutionRecord.Status.COMPLETED;
            log.info("Schedule {} executed", scheduleId);
        } catch (RuntimeException e) {
            status = ExecutionRecord.Status.FAILED;
            error = describe(e);
            log.error("Schedule {} execution failed: {}", scheduleId, error);
        }
        long durationMs = Math.max(0, clock.millis() - started);

        try {
            executionLog.append(ownerId, scheduleId, now, status, error, durationMs,
                    ExecutionRecord.Trigger.SCHEDULED);
            metrics.recordScheduleExecution(status.name().toLowerCase(Locale.ROOT), "scheduled");
        } catch (RuntimeException e) {
            log.error("Failed to record execution of schedule {}", scheduleId, e);
        }

        advance(schedule, now);
    }

    private void advance(RecurringSchedule schedule, Instant now) {
        try {
            Instant next;
            try {
                next = cronEvaluator.nextOccurrence(schedule.getCronExpression(), schedule.getTimezone(), now);
            } catch (RuntimeException e) {
                log.error("Schedule {} cron '{}' can no longer be evaluated: {}",
                        schedule.getId(), schedule.getCronExpression(), e.getMessage());
                next = null;
            }
            scheduleStore.recordRun(ownerId, schedule.getId(), next, now);
        } catch (RuntimeException e) {
            log.error("Failed to advance schedule {}", schedule.getId(), e);
        }
    }

    private void pruneExecutions(Instant now) {
        try {
            Instant cutoff = now.minus(Duration.ofDays(properties.getExecutions().getRetentionDays()));
            executionLog.pruneOlderThan(ownerId, cutoff);
        } catch (RuntimeException e) {
            log.warn("Execution pruning failed: {}", e.getMessage());
        }
    }

    private void rearm() {
        try {
            coordinator.recompute();
        } catch (RuntimeException e) {
            log.error("Failed to re-arm alarm", e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
