package com.jalarm.recurring;

import jakarta.persistence.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

@Entity
@Table(name = "recurring_schedules", indexes = {
        @Index(name = "idx_schedules_owner_enabled_next", columnList = "owner_id, enabled, next_run_at")
})
@IdClass(RecurringSchedule.Key.class)
public class RecurringSchedule {

    @Id
    @Column(name = "owner_id", nullable = false, length = 128)
    private String ownerId;

    @Id
    @Column(name = "id", nullable = false, length = 128)
    private String id;

    @Column(nullable = false, length = 512)
    private String description;

    @Column(name = "cron_expression", nullable = false, length = 128)
    private String cronExpression;

    @Column(nullable = false, length = 64)
    private String timezone;

    @Column(nullable = false, length = 8000)
    private String payload;

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "bot_token", length = 256)
    private String botToken;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public RecurringSchedule() {}

    public RecurringSchedule(String ownerId, String id, Instant createdAt) {
        this.ownerId = ownerId;
        this.id = id;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /**
     * Copies the caller-owned fields of a definition onto this row.
     */
    public void applyDefinition(RecurringScheduleDefinition definition) {
        this.description = definition.description() != null ? definition.description() : "";
        this.cronExpression = definition.cronExpression().trim();
        this.timezone = definition.timezone().trim();
        this.payload = definition.payload();
        this.enabled = definition.enabled();
    }

    public String getOwnerId() { return ownerId; }
    public String getId() { return id; }
    public String getDescription() { return description; }
    public String getCronExpression() { return cronExpression; }
    public String getTimezone() { return timezone; }
    public String getPayload() { return payload; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getBotToken() { return botToken; }
    public void setBotToken(String botToken) { this.botToken = botToken; }
    public Instant getNextRunAt() { return nextRunAt; }
    public void setNextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; }
    public Instant getLastRunAt() { return lastRunAt; }
    public void setLastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public static class Key implements Serializable {
        private String ownerId;
        private String id;

        public Key() {}

        public Key(String ownerId, String id) {
            this.ownerId = ownerId;
            this.id = id;
        }

        public String getOwnerId() { return ownerId; }
        public String getId() { return id; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key other)) return false;
            return Objects.equals(ownerId, other.ownerId) && Objects.equals(id, other.id);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ownerId, id);
        }
    }
}
