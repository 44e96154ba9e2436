package com.jalarm.recurring;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleConfigReaderTest {

    private final ScheduleConfigReader reader = new ScheduleConfigReader();

    @Test
    void readsScheduleDocument() {
        String yaml = """
                version: "1.0"
                timezone: America/New_York
                schedules:
                  morning-weather:
                    description: Weather briefing
                    cron: "0 6 * * *"
                    enabled: true
                    prompt: What's the weather today?
                  weekly-review:
                    cron: "0 18 * * FRI"
                    enabled: false
                    prompt: Review my week
                    owner: ignored
                """;

        ScheduleConfig config = reader.read(yaml);

        assertEquals("1.0", config.version());
        List<RecurringScheduleDefinition> definitions = config.toDefinitions();
        assertEquals(List.of("morning-weather", "weekly-review"),
                definitions.stream().map(RecurringScheduleDefinition::id).toList());
        assertEquals("America/New_York", definitions.get(0).timezone());
        assertEquals("What's the weather today?", definitions.get(0).payload());
        assertFalse(definitions.get(1).enabled());
    }

    @Test
    void malformedYamlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> reader.read("version: [unclosed"));
        assertThrows(IllegalArgumentException.class, () -> reader.read(" "));
    }

    @Test
    void missingPromptIsRejected() {
        String yaml = """
                version: "1.0"
                timezone: UTC
                schedules:
                  broken:
                    cron: "0 6 * * *"
                    enabled: true
                """;

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> reader.read(yaml));
        assertEquals("Invalid schedule broken: missing cron or prompt", ex.getMessage());
    }

    @Test
    void writtenDocumentReadsBack() {
        ScheduleConfig config = reader.read("""
                version: "1.0"
                timezone: Europe/Berlin
                schedules:
                  standup:
                    description: Standup nudge
                    cron: "0 9 * * MON-FRI"
                    enabled: true
                    prompt: Ask for updates
                """);

        ScheduleConfig reread = reader.read(reader.write(config));

        assertEquals(config, reread);
    }
}
