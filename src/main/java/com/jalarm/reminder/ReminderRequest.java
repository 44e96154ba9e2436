package com.jalarm.reminder;

import java.time.Instant;

/**
 * Caller input for scheduling a one-shot reminder. The id is chosen by the caller
 * and must be unique per owner.
 */
public record ReminderRequest(
        String id,
        Instant triggerAt,
        String payload,
        DeliveryTarget deliveryTarget
) {
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Reminder id is required");
        }
        if (triggerAt == null) {
            throw new IllegalArgumentException("triggerAt is required for reminder " + id);
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload is required for reminder " + id);
        }
        if (deliveryTarget == null || deliveryTarget.getChatId() == null
                || deliveryTarget.getChatId().isBlank()) {
            throw new IllegalArgumentException("deliveryTarget with a chat id is required for reminder " + id);
        }
    }
}
