package com.jalarm.execution;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "schedule_executions", indexes = {
        @Index(name = "idx_executions_owner_schedule", columnList = "owner_id, schedule_id, executed_at"),
        @Index(name = "idx_executions_executed_at", columnList = "executed_at")
})
public class ExecutionRecord {

    static final int MAX_ERROR_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false, length = 128)
    private String ownerId;

    @Column(name = "schedule_id", nullable = false, length = 128)
    private String scheduleId;

    @Column(name = "executed_at", nullable = false)
    private Instant executedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(length = MAX_ERROR_LENGTH)
    private String error;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_trigger", nullable = false, length = 16)
    private Trigger trigger = Trigger.SCHEDULED;

    public ExecutionRecord() {}

    public ExecutionRecord(String ownerId, String scheduleId, Instant executedAt,
                           Status status, String error, long durationMs, Trigger trigger) {
        this.ownerId = ownerId;
        this.scheduleId = scheduleId;
        this.executedAt = executedAt;
        this.status = status;
        this.error = error != null && error.length() > MAX_ERROR_LENGTH
                ? error.substring(0, MAX_ERROR_LENGTH) : error;
        this.durationMs = durationMs;
        this.trigger = trigger;
    }

    public UUID getId() { return id; }
    public String getOwnerId() { return ownerId; }
    public String getScheduleId() { return scheduleId; }
    public Instant getExecutedAt() { return executedAt; }
    public Status getStatus() { return status; }
    public String getError() { return error; }
    public long getDurationMs() { return durationMs; }
    public Trigger getTrigger() { return trigger; }

    public enum Status {
        COMPLETED, FAILED
    }

    /** What started the run: the owner's alarm or a manual run-now request. */
    public enum Trigger {
        SCHEDULED, MANUAL
    }
}
