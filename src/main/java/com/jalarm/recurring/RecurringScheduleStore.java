package com.jalarm.recurring;

import com.jalarm.cron.CronEvaluator;
import com.jalarm.error.SchedulingException.InvalidCronExpressionException;
import com.jalarm.error.SchedulingException.NotFoundException;
import com.jalarm.execution.ExecutionLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Durable recurring schedule definitions, one set per owner.
 * {@code nextRunAt} is non-null exactly when a schedule is enabled and its cron has a
 * future occurrence.
 */
@Service
public class RecurringScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(RecurringScheduleStore.class);

    private static final Comparator<RecurringSchedule> BY_NEXT_RUN = Comparator
            .comparing(RecurringSchedule::getNextRunAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(RecurringSchedule::getId);

    private final RecurringScheduleRepository repository;
    private final ExecutionLog executionLog;
    private final CronEvaluator cronEvaluator;

    public RecurringScheduleStore(RecurringScheduleRepository repository,
                                  ExecutionLog executionLog,
                                  CronEvaluator cronEvaluator) {
        this.repository = repository;
        this.executionLog = executionLog;
        this.cronEvaluator = cronEvaluator;
    }

    /**
     * Full replace of the owner's schedule set: matching ids are updated, new ids are
     * inserted, ids missing from {@code definitions} are deleted together with their
     * execution records. Every definition is validated before the first write.
     *
     * @param botToken bot the owner's runs report through, stored on every synced
     *                 schedule; null falls back to the default bot
     */
    @Transactional
    public SyncResult upsertMany(String ownerId, List<RecurringScheduleDefinition> definitions,
                                 String botToken, Instant now) {
        Map<String, Instant> nextRuns = validateAll(definitions, now);

        Map<String, RecurringSchedule> existing = repository.findByOwnerId(ownerId).stream()
                .collect(Collectors.toMap(RecurringSchedule::getId, Function.identity()));

        int inserted = 0;
        int updated = 0;
        for (RecurringScheduleDefinition definition : definitions) {
            RecurringSchedule schedule = existing.get(definition.id());
            if (schedule == null) {
                schedule = new RecurringSchedule(ownerId, definition.id(), now);
                inserted++;
            } else {
                updated++;
            }
            schedule.applyDefinition(definition);
            schedule.setBotToken(botToken);
            schedule.setNextRunAt(definition.enabled() ? nextRuns.get(definition.id()) : null);
            schedule.setUpdatedAt(now);
            repository.save(schedule);
        }

        Set<String> incomingIds = definitions.stream()
                .map(RecurringScheduleDefinition::id)
                .collect(Collectors.toSet());
        int deleted = 0;
        for (RecurringSchedule stale : existing.values()) {
            if (!incomingIds.contains(stale.getId())) {
                repository.delete(stale);
                long executions = executionLog.deleteForSchedule(ownerId, stale.getId());
                log.info("Schedule removed by sync: id={} executionsDeleted={}", stale.getId(), executions);
                deleted++;
            }
        }
        return new SyncResult(inserted, updated, deleted);
    }

    /**
     * Enabling computes a fresh next run from {@code now}; disabling clears it.
     */
    @Transactional
    public RecurringSchedule setEnabled(String ownerId, String id, boolean enabled, Instant now) {
        RecurringSchedule schedule = get(ownerId, id);
        Instant nextRunAt = null;
        if (enabled) {
            nextRunAt = cronEvaluator.nextOccurrence(schedule.getCronExpression(), schedule.getTimezone(), now);
            if (nextRunAt == null) {
                throw new InvalidCronExpressionException(schedule.getCronExpression(), "no future occurrence");
            }
        }
        schedule.setEnabled(enabled);
        schedule.setNextRunAt(nextRunAt);
        schedule.setUpdatedAt(now);
        return repository.save(schedule);
    }

    /**
     * Persists the outcome of an alarm-driven run. A null {@code nextRunAt} means the
     * cron has no further occurrence, which disables the schedule.
     */
    @Transactional
    public void recordRun(String ownerId, String id, Instant nextRunAt, Instant ranAt) {
        repository.findByOwnerIdAndId(ownerId, id).ifPresent(schedule -> {
            schedule.setLastRunAt(ranAt);
            schedule.setNextRunAt(nextRunAt);
            if (nextRunAt == null) {
                schedule.setEnabled(false);
                log.warn("Schedule {} has no future occurrence, disabled", id);
            }
            schedule.setUpdatedAt(ranAt);
            repository.save(schedule);
        });
    }

    @Transactional(readOnly = true)
    public List<RecurringSchedule> dueSchedules(String ownerId, Instant now) {
        return repository.findByOwnerIdAndEnabledTrueAndNextRunAtLessThanEqual(ownerId, now);
    }

    @Transactional(readOnly = true)
    public Optional<Instant> soonestEnabled(String ownerId) {
        return repository.findFirstByOwnerIdAndEnabledTrueAndNextRunAtNotNullOrderByNextRunAtAsc(ownerId)
                .map(RecurringSchedule::getNextRunAt);
    }

    /**
     * Ascending by next run; schedules without one (disabled) come last.
     */
    @Transactional(readOnly = true)
    public List<RecurringSchedule> list(String ownerId) {
        return repository.findByOwnerId(ownerId).stream()
                .sorted(BY_NEXT_RUN)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<RecurringSchedule> find(String ownerId, String id) {
        return repository.findByOwnerIdAndId(ownerId, id);
    }

    @Transactional(readOnly = true)
    public RecurringSchedule get(String ownerId, String id) {
        return repository.findByOwnerIdAndId(ownerId, id)
                .orElseThrow(() -> new NotFoundException("Schedule", id));
    }

    @Transactional(readOnly = true)
    public List<String> ownersWithEnabledSchedules() {
        return repository.findOwnerIdsWithEnabledSchedules();
    }

    private Map<String, Instant> validateAll(List<RecurringScheduleDefinition> definitions, Instant now) {
        if (definitions == null) {
            throw new IllegalArgumentException("Schedule definitions are required");
        }
        Set<String> seen = new HashSet<>();
        Map<String, Instant> nextRuns = new HashMap<>();
        for (RecurringScheduleDefinition definition : definitions) {
            if (definition.id() == null || definition.id().isBlank()) {
                throw new IllegalArgumentException("Schedule id is required");
            }
            if (!seen.add(definition.id())) {
                throw new IllegalArgumentException("Duplicate schedule id in definitions: " + definition.id());
            }
            if (definition.payload() == null || definition.payload().isBlank()) {
                throw new IllegalArgumentException("Schedule " + definition.id() + " has no payload");
            }
            Instant next = cronEvaluator.nextOccurrence(definition.cronExpression(), definition.timezone(), now);
            if (next == null) {
                throw new InvalidCronExpressionException(definition.cronExpression(), "no future occurrence");
            }
            nextRuns.put(definition.id(), next);
        }
        return nextRuns;
    }

    public record SyncResult(int inserted, int updated, int deleted) {
        public int total() { return inserted + updated; }
    }
}
