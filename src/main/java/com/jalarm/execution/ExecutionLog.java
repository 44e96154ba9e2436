package com.jalarm.execution;

import com.jalarm.config.JalarmProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Append-only audit trail of recurring schedule runs. Nothing in the scheduler
 * reads it back for correctness.
 */
@Service
public class ExecutionLog {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLog.class);
    private static final int MAX_LIST_LIMIT = 500;

    private final ExecutionRepository repository;
    private final JalarmProperties properties;

    public ExecutionLog(ExecutionRepository repository, JalarmProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @Transactional
    public ExecutionRecord append(String ownerId, String scheduleId, Instant executedAt,
                                  ExecutionRecord.Status status, String error, long durationMs,
                                  ExecutionRecord.Trigger trigger) {
        ExecutionRecord record = new ExecutionRecord(ownerId, scheduleId, executedAt,
                status, error, durationMs, trigger);
        return repository.save(record);
    }

    /**
     * Newest first. A null schedule id lists runs of every schedule of the owner;
     * a null or non-positive limit uses the configured default.
     */
    @Transactional(readOnly = true)
    public List<ExecutionRecord> list(String ownerId, String scheduleId, Integer limit) {
        int size = limit == null || limit <= 0
                ? properties.getExecutions().getListLimit()
                : Math.min(limit, MAX_LIST_LIMIT);
        PageRequest page = PageRequest.of(0, Math.max(1, size));
        if (scheduleId == null) {
            return repository.findByOwnerIdOrderByExecutedAtDesc(ownerId, page);
        }
        return repository.findByOwnerIdAndScheduleIdOrderByExecutedAtDesc(ownerId, scheduleId, page);
    }

    @Transactional
    public long pruneOlderThan(String ownerId, Instant cutoff) {
        long deleted = repository.deleteByOwnerIdAndExecutedAtBefore(ownerId, cutoff);
        if (deleted > 0) {
            log.debug("Pruned {} execution records older than {}", deleted, cutoff);
        }
        return deleted;
    }

    @Transactional
    public long deleteForSchedule(String ownerId, String scheduleId) {
        return repository.deleteByOwnerIdAndScheduleId(ownerId, scheduleId);
    }

    @Transactional
    public long purgeAllOlderThan(Instant cutoff) {
        return repository.deleteByExecutedAtBefore(cutoff);
    }
}
