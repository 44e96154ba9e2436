package com.jalarm.alarm;

import com.jalarm.config.JalarmProperties;
import com.jalarm.owner.OwnerActorRegistry;
import com.jalarm.recurring.RecurringScheduleStore;
import com.jalarm.reminder.ReminderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.TreeSet;

/**
 * Timers live in memory only. On startup every owner that still has pending
 * reminders or enabled schedules gets its alarm re-armed from the stores.
 */
@Component
public class AlarmRehydrator {

    private static final Logger log = LoggerFactory.getLogger(AlarmRehydrator.class);

    private final ReminderStore reminderStore;
    private final RecurringScheduleStore scheduleStore;
    private final OwnerActorRegistry registry;
    private final JalarmProperties properties;

    public AlarmRehydrator(ReminderStore reminderStore,
                           RecurringScheduleStore scheduleStore,
                           OwnerActorRegistry registry,
                           JalarmProperties properties) {
        this.reminderStore = reminderStore;
        this.scheduleStore = scheduleStore;
        this.registry = registry;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getScheduler().isRehydrateOnStartup()) {
            log.info("Alarm rehydration disabled");
            return;
        }
        rehydrate();
    }

    /**
     * @return number of owners whose alarm is armed afterwards
     */
    public int rehydrate() {
        Set<String> owners = new TreeSet<>(reminderStore.ownersWithPendingReminders());
        owners.addAll(scheduleStore.ownersWithEnabledSchedules());

        int armed = 0;
        for (String ownerId : owners) {
            try {
                if (registry.actorFor(ownerId).rehydrate().isPresent()) armed++;
            } catch (RuntimeException e) {
                log.error("Failed to rehydrate alarm for owner={}", ownerId, e);
            }
        }
        log.info("Rehydrated alarms: owners={} armed={}", owners.size(), armed);
        return armed;
    }
}
