package com.jalarm.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PiiRedactionConverterTest {

    @AfterEach
    void reset() {
        PiiRedactionConverter.setEnabled(true);
        PiiRedactionConverter.setConfiguredPatterns(null);
    }

    @Test
    void redactsBotTokenAndEmail() {
        String line = PiiRedactionConverter.redact(
                "Sending with token 123456789:AAE_test-token-value-0123456789abcdef for ops@example.com");

        assertFalse(line.contains("AAE_test-token"));
        assertFalse(line.contains("ops@example.com"));
        assertTrue(line.contains("[REDACTED]"));
    }

    @Test
    void leavesChatIdsAlone() {
        assertEquals("Reminder r1 delivered to -100777",
                PiiRedactionConverter.redact("Reminder r1 delivered to -100777"));
    }

    @Test
    void appliesConfiguredPatterns() {
        PiiRedactionConverter.setConfiguredPatterns(List.of("runner-key-\\w+"));

        assertEquals("key=[REDACTED]", PiiRedactionConverter.redact("key=runner-key-abc123"));
    }

    @Test
    void disabledPassesThrough() {
        PiiRedactionConverter.setEnabled(false);

        assertEquals("ops@example.com", PiiRedactionConverter.redact("ops@example.com"));
    }
}
