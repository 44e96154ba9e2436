package com.jalarm.recurring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the YAML schedule document a chat keeps its recurring schedules in:
 * <pre>
 * version: "1.0"
 * timezone: America/New_York
 * schedules:
 *   morning-weather:
 *     description: Weather briefing
 *     cron: "0 6 * * *"
 *     enabled: true
 *     prompt: What's the weather today?
 * </pre>
 */
@Component
public class ScheduleConfigReader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * @throws IllegalArgumentException if the document is not valid YAML or misses
     *         required fields
     */
    public ScheduleConfig read(String document) {
        if (document == null || document.isBlank()) {
            throw new IllegalArgumentException("Schedule document is empty");
        }
        ScheduleConfig config;
        try {
            config = yamlMapper.readValue(document, ScheduleConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Schedule document is not valid YAML: " + e.getOriginalMessage(), e);
        }
        if (config == null) {
            throw new IllegalArgumentException("Schedule document is empty");
        }
        config.validate();
        return config;
    }

    public String write(ScheduleConfig config) {
        try {
            return yamlMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schedule config", e);
        }
    }
}
