package com.jalarm.recurring;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A chat's recurring schedule document: one timezone shared by every entry,
 * entries keyed by a stable id such as {@code morning-weather}.
 */
public record ScheduleConfig(
        String version,
        String timezone,
        Map<String, Entry> schedules
) {

    public record Entry(String description, String cron, boolean enabled, String prompt) {}

    public ScheduleConfig {
        schedules = schedules != null ? new LinkedHashMap<>(schedules) : null;
    }

    /**
     * @throws IllegalArgumentException naming the first structural problem found
     */
    public void validate() {
        if (version == null || version.isBlank()
                || timezone == null || timezone.isBlank()
                || schedules == null) {
            throw new IllegalArgumentException("Invalid config: missing version, timezone, or schedules");
        }
        for (Map.Entry<String, Entry> e : schedules.entrySet()) {
            Entry entry = e.getValue();
            if (entry == null || entry.cron() == null || entry.cron().isBlank()
                    || entry.prompt() == null || entry.prompt().isBlank()) {
                throw new IllegalArgumentException("Invalid schedule " + e.getKey() + ": missing cron or prompt");
            }
        }
    }

    public List<RecurringScheduleDefinition> toDefinitions() {
        validate();
        List<RecurringScheduleDefinition> definitions = new ArrayList<>(schedules.size());
        schedules.forEach((id, entry) -> definitions.add(new RecurringScheduleDefinition(
                id, entry.description(), entry.cron(), timezone, entry.prompt(), entry.enabled())));
        return definitions;
    }
}
