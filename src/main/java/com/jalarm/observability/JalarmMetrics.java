package com.jalarm.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized Micrometer metrics for the scheduler.
 */
@Component
public class JalarmMetrics {

    private final MeterRegistry registry;
    private final AtomicLong armedAlarms = new AtomicLong(0);

    public JalarmMetrics(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("jalarm.alarms.armed", armedAlarms);
    }

    // --- Reminder metrics ---

    public void recordReminderScheduled() {
        Counter.builder("jalarm.reminders.scheduled")
                .register(registry).increment();
    }

    public void recordReminderDelivery(String outcome) {
        Counter.builder("jalarm.reminders.delivered")
                .tag("outcome", outcome)
                .register(registry).increment();
    }

    // --- Recurring schedule metrics ---

    public void recordScheduleExecution(String outcome, String trigger) {
        Counter.builder("jalarm.schedules.executions")
                .tag("outcome", outcome)
                .tag("trigger", trigger)
                .register(registry).increment();
    }

    // --- Alarm metrics ---

    public void recordAlarmFired() {
        Counter.builder("jalarm.alarms.fired")
                .register(registry).increment();
    }

    public Timer.Sample startDispatchTimer() {
        return Timer.start(registry);
    }

    public void stopDispatchTimer(Timer.Sample sample) {
        sample.stop(Timer.builder("jalarm.alarms.dispatch")
                .register(registry));
    }

    public void alarmArmed() {
        armedAlarms.incrementAndGet();
    }

    public void alarmCleared() {
        armedAlarms.updateAndGet(v -> v > 0 ? v - 1 : 0);
    }

    public long armedAlarms() {
        return armedAlarms.get();
    }
}
