package com.jalarm.alarm;

import com.jalarm.observability.JalarmMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Alarm timers backed by the shared Spring {@link TaskScheduler}. Each owner holds at
 * most one {@link ScheduledFuture}; arming cancels the previous one first.
 */
@Component
public class TaskSchedulerAlarmTimerFactory implements AlarmTimerFactory {

    private static final Logger log = LoggerFactory.getLogger(TaskSchedulerAlarmTimerFactory.class);

    private final TaskScheduler taskScheduler;
    private final JalarmMetrics metrics;

    public TaskSchedulerAlarmTimerFactory(TaskScheduler taskScheduler, JalarmMetrics metrics) {
        this.taskScheduler = taskScheduler;
        this.metrics = metrics;
    }

    @Override
    public AlarmTimer create(String ownerId, Runnable onFire) {
        return new TaskSchedulerAlarmTimer(ownerId, onFire);
    }

    private final class TaskSchedulerAlarmTimer implements AlarmTimer {

        private final String ownerId;
        private final Runnable onFire;
        private ScheduledFuture<?> future;
        private Instant armedAt;
        private long generation;

        private TaskSchedulerAlarmTimer(String ownerId, Runnable onFire) {
            this.ownerId = ownerId;
            this.onFire = onFire;
        }

        @Override
        public synchronized void arm(Instant at) {
            boolean wasArmed = armedAt != null;
            cancelPending();
            long armedGeneration = ++generation;
            armedAt = at;
            future = taskScheduler.schedule(() -> fire(armedGeneration), at);
            if (!wasArmed) metrics.alarmArmed();
            log.info("Alarm set for owner={} at {}", ownerId, at);
        }

        @Override
        public synchronized void disarm() {
            if (armedAt == null) return;
            cancelPending();
            armedAt = null;
            generation++;
            metrics.alarmCleared();
            log.info("Alarm cleared for owner={}", ownerId);
        }

        @Override
        public synchronized Optional<Instant> armedAt() {
            return Optional.ofNullable(armedAt);
        }

        private void fire(long firedGeneration) {
            synchronized (this) {
                // A replaced timer that was already running still fires; dispatch is idempotent.
                if (firedGeneration == generation && armedAt != null) {
                    armedAt = null;
                    future = null;
                    metrics.alarmCleared();
                }
            }
            onFire.run();
        }

        private void cancelPending() {
            if (future != null) {
                future.cancel(false);
                future = null;
            }
        }
    }
}
