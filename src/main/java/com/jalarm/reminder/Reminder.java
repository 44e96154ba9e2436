package com.jalarm.reminder;

import jakarta.persistence.*;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

@Entity
@Table(name = "reminders", indexes = {
        @Index(name = "idx_reminders_owner_status_trigger", columnList = "owner_id, status, trigger_at")
})
@IdClass(Reminder.Key.class)
public class Reminder {

    @Id
    @Column(name = "owner_id", nullable = false, length = 128)
    private String ownerId;

    @Id
    @Column(name = "id", nullable = false, length = 128)
    private String id;

    @Column(name = "trigger_at", nullable = false)
    private Instant triggerAt;

    @Column(nullable = false, length = 4000)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status = Status.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Embedded
    private DeliveryTarget deliveryTarget;

    public Reminder() {}

    public Reminder(String ownerId, String id, Instant triggerAt, String payload,
                    DeliveryTarget deliveryTarget, Instant createdAt) {
        this.ownerId = ownerId;
        this.id = id;
        this.triggerAt = triggerAt;
        this.payload = payload;
        this.deliveryTarget = deliveryTarget;
        this.createdAt = createdAt;
    }

    public String getOwnerId() { return ownerId; }
    public String getId() { return id; }
    public Instant getTriggerAt() { return triggerAt; }
    public String getPayload() { return payload; }
    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }
    public Instant getCreatedAt() { return createdAt; }
    public DeliveryTarget getDeliveryTarget() { return deliveryTarget; }

    public boolean isPending() { return status == Status.PENDING; }

    public enum Status {
        PENDING, CANCELLED, COMPLETED, FAILED;

        public boolean isTerminal() { return this != PENDING; }
    }

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
