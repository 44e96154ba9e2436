package com.jalarm.owner;

import com.jalarm.alarm.AlarmTimerFactory;
import com.jalarm.config.JalarmProperties;
import com.jalarm.cron.CronEvaluator;
import com.jalarm.delivery.Notifier;
import com.jalarm.delivery.TaskRunner;
import com.jalarm.execution.ExecutionLog;
import com.jalarm.observability.JalarmMetrics;
import com.jalarm.recurring.RecurringScheduleStore;
import com.jalarm.reminder.ReminderStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily creates exactly one {@link OwnerActor} per owner id. Callers always go
 * through {@link #actorFor(String)}; there is no other way to reach an owner's data.
 *
 * <p>Actors are never evicted, so the map holds one entry per owner touched since
 * startup. An idle actor keeps no timer future, only its lock and collaborators.
 * Removing it while a caller still holds the reference would let a second actor
 * for the same owner run concurrently with the first.
 */
@Component
public class OwnerActorRegistry {

    private final Map<String, OwnerActor> actors = new ConcurrentHashMap<>();

    private final ReminderStore reminderStore;
    private final RecurringScheduleStore scheduleStore;
    private final ExecutionLog executionLog;
    private final CronEvaluator cronEvaluator;
    private final Notifier notifier;
    private final TaskRunner taskRunner;
    private final AlarmTimerFactory timerFactory;
    private final JalarmMetrics metrics;
    private final JalarmProperties properties;
    private final Clock clock;

    public OwnerActorRegistry(ReminderStore reminderStore,
                              RecurringScheduleStore scheduleStore,
                              ExecutionLog executionLog,
                              CronEvaluator cronEvaluator,
                              Notifier notifier,
                              TaskRunner taskRunner,
                              AlarmTimerFactory timerFactory,
                              JalarmMetrics metrics,
                              JalarmProperties properties,
                              Clock clock) {
        this.reminderStore = reminderStore;
        this.scheduleStore = scheduleStore;
        this.executionLog = executionLog;
        this.cronEvaluator = cronEvaluator;
        this.notifier = notifier;
        this.taskRunner = taskRunner;
        this.timerFactory = timerFactory;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    public OwnerActor actorFor(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id is required");
        }
        return actors.computeIfAbsent(ownerId, id -> new OwnerActor(id, reminderStore, scheduleStore,
                executionLog, cronEvaluator, notifier, taskRunner, timerFactory, metrics, properties, clock));
    }

    public Set<String> knownOwners() {
        return new TreeSet<>(actors.keySet());
    }

    public long armedOwnerCount() {
        return actors.values().stream()
                .filter(actor -> actor.armedAlarm().isPresent())
                .count();
    }
}
