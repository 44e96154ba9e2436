package com.jalarm.reminder;

import com.jalarm.error.SchedulingException.DuplicateIdException;
import com.jalarm.error.SchedulingException.InvalidTransitionException;
import com.jalarm.error.SchedulingException.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Durable one-shot reminders. Every method reads or writes a single owner's rows.
 */
@Service
public class ReminderStore {

    private static final Logger log = LoggerFactory.getLogger(ReminderStore.class);

    private final ReminderRepository repository;

    public ReminderStore(ReminderRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public Reminder insertReminder(String ownerId, ReminderRequest request, Instant now) {
        if (repository.existsByOwnerIdAndId(ownerId, request.id())) {
            throw new DuplicateIdException(request.id());
        }
        Reminder reminder = new Reminder(ownerId, request.id(), request.triggerAt(),
                request.payload(), request.deliveryTarget(), now);
        Reminder saved = repository.save(reminder);
        log.debug("Reminder stored: id={} triggerAt={}", saved.getId(), saved.getTriggerAt());
        return saved;
    }

    /**
     * Moves a pending reminder to a terminal status.
     *
     * @throws NotFoundException if the reminder does not exist
     * @throws InvalidTransitionException if the reminder is already terminal
     */
    @Transactional
    public Reminder updateReminderStatus(String ownerId, String id, Reminder.Status newStatus) {
        Reminder reminder = repository.findByOwnerIdAndId(ownerId, id)
                .orElseThrow(() -> new NotFoundException("Reminder", id));
        if (reminder.getStatus().isTerminal() || !newStatus.isTerminal()) {
            throw new InvalidTransitionException(id,
                    reminder.getStatus().name().toLowerCase(Locale.ROOT), newStatus.name().toLowerCase(Locale.ROOT));
        }
        reminder.setStatus(newStatus);
        return repository.save(reminder);
    }

    /**
     * Dispatcher variant of {@link #updateReminderStatus}: settles a reminder only if it
     * is still pending, so a duplicate alarm fire cannot overwrite an earlier outcome.
     *
     * @return true if this call performed the transition
     */
    @Transactional
    public boolean settleIfPending(String ownerId, String id, Reminder.Status outcome) {
        Optional<Reminder> current = repository.findByOwnerIdAndId(ownerId, id);
        if (current.isEmpty() || !current.get().isPending()) {
            return false;
        }
        Reminder reminder = current.get();
        reminder.setStatus(outcome);
        repository.save(reminder);
        return true;
    }

    @Transactional(readOnly = true)
    public List<Reminder> dueReminders(String ownerId, Instant now) {
        return repository.findByOwnerIdAndStatusAndTriggerAtLessThanEqual(
                ownerId, Reminder.Status.PENDING, now);
    }

    @Transactional(readOnly = true)
    public Optional<Instant> soonestPending(String ownerId) {
        return repository.findFirstByOwnerIdAndStatusOrderByTriggerAtAsc(ownerId, Reminder.Status.PENDING)
                .map(Reminder::getTriggerAt);
    }

    @Transactional(readOnly = true)
    public List<Reminder> list(String ownerId, Reminder.Status statusFilter) {
        if (statusFilter == null) {
            return repository.findByOwnerIdOrderByTriggerAtAsc(ownerId);
        }
        return repository.findByOwnerIdAndStatusOrderByTriggerAtAsc(ownerId, statusFilter);
    }

    @Transactional(readOnly = true)
    public Optional<Reminder> find(String ownerId, String id) {
        return repository.findByOwnerIdAndId(ownerId, id);
    }

    @Transactional(readOnly = true)
    public List<String> ownersWithPendingReminders() {
        return repository.findOwnerIdsByStatus(Reminder.Status.PENDING);
    }
}
