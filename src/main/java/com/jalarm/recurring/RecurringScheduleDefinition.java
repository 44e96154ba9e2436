package com.jalarm.recurring;

/**
 * One entry of an incoming schedule set, as handed to a full-replace sync.
 */
public record RecurringScheduleDefinition(
        String id,
        String description,
        String cronExpression,
        String timezone,
        String payload,
        boolean enabled
) {}
