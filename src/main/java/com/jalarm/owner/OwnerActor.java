package com.jalarm.owner;

import com.jalarm.alarm.AlarmCoordinator;
import com.jalarm.alarm.AlarmTimerFactory;
import com.jalarm.config.JalarmProperties;
import com.jalarm.cron.CronEvaluator;
import com.jalarm.delivery.Notifier;
import com.jalarm.delivery.TaskRunner;
import com.jalarm.error.SchedulingException.NotFoundException;
import com.jalarm.error.SchedulingException.PastTriggerTimeException;
import com.jalarm.execution.ExecutionLog;
import com.jalarm.execution.ExecutionRecord;
import com.jalarm.observability.JalarmMetrics;
import com.jalarm.recurring.RecurringSchedule;
import com.jalarm.recurring.RecurringScheduleDefinition;
import com.jalarm.recurring.RecurringScheduleStore;
import com.jalarm.recurring.RecurringScheduleStore.SyncResult;
import com.jalarm.recurring.ScheduleConfig;
import com.jalarm.reminder.Reminder;
import com.jalarm.reminder.ReminderRequest;
import com.jalarm.reminder.ReminderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The single point of access to one owner's reminders and recurring schedules.
 * Operations of the same owner run one at a time, including the alarm callback;
 * different owners never contend. Every mutating operation leaves the owner's alarm
 * armed at the earliest pending instant before it returns.
 */
public class OwnerActor {

    private static final Logger log = LoggerFactory.getLogger(OwnerActor.class);
    private static final String MDC_OWNER = "ownerId";

    private final String ownerId;
    private final ReminderStore reminderStore;
    private final RecurringScheduleStore scheduleStore;
    private final ExecutionLog executionLog;
    private final TaskRunner taskRunner;
    private final JalarmMetrics metrics;
    private final JalarmProperties properties;
    private final Clock clock;
    private final AlarmCoordinator coordinator;
    private final AlarmDispatcher dispatcher;
    private final ReentrantLock lock = new ReentrantLock();

    public OwnerActor(String ownerId,
                      ReminderStore reminderStore,
                      RecurringScheduleStore scheduleStore,
                      ExecutionLog executionLog,
                      CronEvaluator cronEvaluator,
                      Notifier notifier,
                      TaskRunner taskRunner,
                      AlarmTimerFactory timerFactory,
                      JalarmMetrics metrics,
                      JalarmProperties properties,
                      Clock clock) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id is required");
        }
        this.ownerId = ownerId;
        this.reminderStore = reminderStore;
        this.scheduleStore = scheduleStore;
        this.executionLog = executionLog;
        this.taskRunner = taskRunner;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.coordinator = new AlarmCoordinator(ownerId, reminderStore, scheduleStore,
                timerFactory.create(ownerId, this::onAlarm));
        this.dispatcher = new AlarmDispatcher(ownerId, reminderStore, scheduleStore, executionLog,
                cronEvaluator, notifier, taskRunner, coordinator, metrics, properties, clock);
    }

    public String getOwnerId() { return ownerId; }

    // --- One-shot reminders ---

    /**
     * Stores a new pending reminder. A trigger time in the past but within the grace
     * period is accepted and fires on the next alarm.
     *
     * @throws PastTriggerTimeException if the trigger time is older than the grace period
     */
    public Reminder schedule(ReminderRequest request) {
        return withLock(() -> {
            request.validate();
            Instant now = clock.instant();
            if (request.triggerAt().isBefore(now.minus(properties.getScheduler().getGracePeriod()))) {
                throw new PastTriggerTimeException(request.id());
            }
            Reminder reminder = reminderStore.insertReminder(ownerId, request, now);
            metrics.recordReminderScheduled();
            log.info("Reminder scheduled: id={} triggerAt={}", reminder.getId(), reminder.getTriggerAt());
            coordinator.recompute();
            return reminder;
        });
    }

    public Reminder cancel(String id) {
        return transition(id, Reminder.Status.CANCELLED);
    }

    public Reminder complete(String id) {
        return transition(id, Reminder.Status.COMPLETED);
    }

    private Reminder transition(String id, Reminder.Status status) {
        return withLock(() -> {
            Reminder reminder = reminderStore.updateReminderStatus(ownerId, id, status);
            log.info("Reminder {} {}", id, status.name().toLowerCase(Locale.ROOT));
            coordinator.recompute();
            return reminder;
        });
    }

    /**
     * @param statusFilter null lists reminders in every status
     */
    public List<Reminder> list(Reminder.Status statusFilter) {
        return withLock(() -> reminderStore.list(ownerId, statusFilter));
    }

    public Optional<Reminder> getReminder(String id) {
        return withLock(() -> reminderStore.find(ownerId, id));
    }

    // --- Recurring schedules ---

    public SyncResult syncRecurring(List<RecurringScheduleDefinition> definitions) {
        return syncRecurring(definitions, null);
    }

    /**
     * Replaces the owner's schedule set. Runs of the synced schedules report through
     * {@code botToken}, or through the default bot when it is null.
     */
    public SyncResult syncRecurring(List<RecurringScheduleDefinition> definitions, String botToken) {
        return withLock(() -> {
            SyncResult result = scheduleStore.upsertMany(ownerId, definitions, botToken, clock.instant());
            log.info("Schedules synced: inserted={} updated={} deleted={}",
                    result.inserted(), result.updated(), result.deleted());
            coordinator.recompute();
            return result;
        });
    }

    public SyncResult syncRecurring(ScheduleConfig config) {
        return syncRecurring(config, null);
    }

    public SyncResult syncRecurring(ScheduleConfig config, String botToken) {
        if (config == null) {
            throw new IllegalArgumentException("Schedule config is required");
        }
        return syncRecurring(config.toDefinitions(), botToken);
    }

    public RecurringSchedule toggleRecurring(String id, boolean enabled) {
        return withLock(() -> {
            RecurringSchedule schedule = scheduleStore.setEnabled(ownerId, id, enabled, clock.instant());
            log.info("Schedule {} {}", id, enabled ? "enabled" : "disabled");
            coordinator.recompute();
            return schedule;
        });
    }

    public List<RecurringSchedule> listRecurring() {
        return withLock(() -> scheduleStore.list(ownerId));
    }

    public Optional<RecurringSchedule> getRecurring(String id) {
        return withLock(() -> scheduleStore.find(ownerId, id));
    }

    /**
     * @param scheduleId null lists runs of every schedule
     * @param limit null uses the configured default
     */
    public List<ExecutionRecord> listExecutions(String scheduleId, Integer limit) {
        return withLock(() -> executionLog.list(ownerId, scheduleId, limit));
    }

    /**
     * Runs a schedule immediately, outside its cron cadence. Disabled schedules can be
     * run too. The schedule's next and last run are left untouched.
     *
     * @throws NotFoundException if the schedule does not exist
     */
    public ExecutionRecord runNow(String scheduleId) {
        return withLock(() -> {
            RecurringSchedule schedule = scheduleStore.get(ownerId, scheduleId);
            Instant now = clock.instant();
            long started = clock.millis();
            ExecutionRecord.Status status = ExecutionRecord.Status.COMPLETED;
            String error = null;
            try {
                taskRunner.run(ownerId, scheduleId, schedule.getPayload(), schedule.getBotToken())
                        .timeout(properties.getDelivery().getTaskRunnerTimeout())
                        .block();
                log.info("Schedule {} run manually", scheduleId);
            } catch (RuntimeException e) {
                status = ExecutionRecord.Status.FAILED;
                error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("Manual run of schedule {} failed: {}", scheduleId, error);
            }
            ExecutionRecord record = executionLog.append(ownerId, scheduleId, now, status, error,
                    Math.max(0, clock.millis() - started), ExecutionRecord.Trigger.MANUAL);
            metrics.recordScheduleExecution(status.name().toLowerCase(Locale.ROOT), "manual");
            return record;
        });
    }

    // --- Alarm ---

    /**
     * Timer callback. Never throws.
     */
    public void onAlarm() {
        try {
            withLock(() -> {
                dispatcher.dispatch();
                return null;
            });
        } catch (RuntimeException e) {
            log.error("Alarm handling failed for owner={}", ownerId, e);
        }
    }

    /**
     * Re-derives the alarm from stored state, used after a restart.
     */
    public Optional<Instant> rehydrate() {
        return withLock(coordinator::recompute);
    }

    public Optional<Instant> armedAlarm() {
        return coordinator.armedAt();
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        String previousOwner = MDC.get(MDC_OWNER);
        MDC.put(MDC_OWNER, ownerId);
        try {
            return action.get();
        } finally {
            if (previousOwner != null) {
                MDC.put(MDC_OWNER, previousOwner);
            } else {
                MDC.remove(MDC_OWNER);
            }
            lock.unlock();
        }
    }
}
