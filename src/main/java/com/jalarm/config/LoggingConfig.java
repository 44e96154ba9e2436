package com.jalarm.config;

import com.jalarm.observability.PiiRedactionConverter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Pushes configured redaction patterns from application properties into the
 * Logback PiiRedactionConverter via its static holder. Reminder payloads and
 * delivery targets (chat ids, bot tokens) pass through scheduler log lines.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    private final JalarmProperties properties;

    public LoggingConfig(JalarmProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void configurePiiRedaction() {
        JalarmProperties.PiiProperties pii = properties.getSecurity().getPii();
        PiiRedactionConverter.setEnabled(pii.isRedactInLogs());
        if (!pii.isRedactInLogs()) {
            log.warn("Log redaction disabled");
            return;
        }
        List<String> patterns = pii.getRedactPatterns();
        if (patterns != null && !patterns.isEmpty()) {
            log.info("Configuring {} additional redaction patterns", patterns.size());
            PiiRedactionConverter.setConfiguredPatterns(patterns);
        } else {
            log.info("Using default redaction patterns (bot token, card number, email)");
        }
    }
}
