package com.jalarm.alarm;

import com.jalarm.recurring.RecurringScheduleStore;
import com.jalarm.reminder.ReminderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Keeps one owner's timer armed at the earliest instant any of its items needs
 * attention: the soonest pending reminder or the soonest enabled schedule run.
 * This is the only code path that arms or clears the timer.
 */
public class AlarmCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AlarmCoordinator.class);

    private final String ownerId;
    private final ReminderStore reminderStore;
    private final RecurringScheduleStore scheduleStore;
    private final AlarmTimer timer;

    public AlarmCoordinator(String ownerId,
                            ReminderStore reminderStore,
                            RecurringScheduleStore scheduleStore,
                            AlarmTimer timer) {
        this.ownerId = ownerId;
        this.reminderStore = reminderStore;
        this.scheduleStore = scheduleStore;
        this.timer = timer;
    }

    /**
     * Re-derives the wake-up instant from stored state and updates the timer only when
     * it changed.
     *
     * @return the instant the timer is armed at afterwards, empty if cleared
     */
    public Optional<Instant> recompute() {
        Optional<Instant> earliest = Stream.of(
                        reminderStore.soonestPending(ownerId),
                        scheduleStore.soonestEnabled(ownerId))
                .flatMap(Optional::stream)
                .min(Instant::compareTo);
        Optional<Instant> armed = timer.armedAt();

        if (earliest.isEmpty()) {
            if (armed.isPresent()) {
                timer.disarm();
            }
            return Optional.empty();
        }
        if (!earliest.equals(armed)) {
            log.debug("Alarm for owner={} moves from {} to {}", ownerId, armed.orElse(null), earliest.get());
            timer.arm(earliest.get());
        }
        return earliest;
    }

    public Optional<Instant> armedAt() {
        return timer.armedAt();
    }
}
