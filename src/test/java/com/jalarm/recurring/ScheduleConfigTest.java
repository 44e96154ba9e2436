package com.jalarm.recurring;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleConfigTest {

    @Test
    void expandsEntriesInOrderWithConfigTimezone() {
        Map<String, ScheduleConfig.Entry> entries = new LinkedHashMap<>();
        entries.put("morning-weather", new ScheduleConfig.Entry("Weather", "0 7 * * *", true, "Weather in Berlin?"));
        entries.put("weekly-review", new ScheduleConfig.Entry(null, "0 18 * * FRI", false, "Review my week"));

        List<RecurringScheduleDefinition> definitions =
                new ScheduleConfig("1", "Europe/Berlin", entries).toDefinitions();

        assertEquals(2, definitions.size());
        RecurringScheduleDefinition first = definitions.get(0);
        assertEquals("morning-weather", first.id());
        assertEquals("Europe/Berlin", first.timezone());
        assertEquals("Weather in Berlin?", first.payload());
        assertTrue(first.enabled());
        assertFalse(definitions.get(1).enabled());
    }

    @Test
    void missingTopLevelFieldsAreRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new ScheduleConfig("1", null, Map.of()).validate());
        assertEquals("Invalid config: missing version, timezone, or schedules", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> new ScheduleConfig(null, "UTC", Map.of()).validate());
        assertThrows(IllegalArgumentException.class, () -> new ScheduleConfig("1", "UTC", null).validate());
    }

    @Test
    void entryWithoutPromptIsRejected() {
        ScheduleConfig config = new ScheduleConfig("1", "UTC",
                Map.of("empty", new ScheduleConfig.Entry("x", "0 7 * * *", true, " ")));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, config::toDefinitions);
        assertEquals("Invalid schedule empty: missing cron or prompt", ex.getMessage());
    }

    @Test
    void emptyScheduleMapIsValid() {
        assertTrue(new ScheduleConfig("1", "UTC", Map.of()).toDefinitions().isEmpty());
    }
}
