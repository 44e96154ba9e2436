package com.jalarm.recurring;

import com.jalarm.config.JalarmProperties;
import com.jalarm.cron.CronEvaluator;
import com.jalarm.error.SchedulingException.InvalidCronExpressionException;
import com.jalarm.error.SchedulingException.NotFoundException;
import com.jalarm.execution.ExecutionLog;
import com.jalarm.execution.ExecutionRecord;
import com.jalarm.recurring.RecurringScheduleStore.SyncResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({RecurringScheduleStore.class, ExecutionLog.class, CronEvaluator.class, JalarmProperties.class})
class RecurringScheduleStoreTest {

    private static final String OWNER = "12345";
    // 07:00 in New York
    private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");

    @Autowired private RecurringScheduleStore store;
    @Autowired private ExecutionLog executionLog;

    private static RecurringScheduleDefinition daily(String id, String cron, boolean enabled) {
        return new RecurringScheduleDefinition(id, "Daily " + id, cron, "America/New_York",
                "Summarize the weather", enabled);
    }

    @Test
    void upsertManyComputesNextRunForEnabledOnly() {
        SyncResult result = store.upsertMany(OWNER, List.of(
                daily("morning", "0 6 * * *", true),
                daily("evening", "0 18 * * *", false)), null, NOW);

        assertEquals(2, result.inserted());
        assertEquals(0, result.updated());
        assertEquals(0, result.deleted());
        assertEquals(Instant.parse("2024-01-16T11:00:00Z"), store.get(OWNER, "morning").getNextRunAt());
        assertNull(store.get(OWNER, "evening").getNextRunAt());
        assertFalse(store.get(OWNER, "evening").isEnabled());
    }

    @Test
    void syncStoresBotTokenOnEverySchedule() {
        store.upsertMany(OWNER, List.of(daily("a", "0 6 * * *", true), daily("b", "0 7 * * *", false)),
                "987654321:AAF_second-bot", NOW);

        assertEquals("987654321:AAF_second-bot", store.get(OWNER, "a").getBotToken());
        assertEquals("987654321:AAF_second-bot", store.get(OWNER, "b").getBotToken());

        store.upsertMany(OWNER, List.of(daily("a", "0 6 * * *", true)), null, NOW);

        assertNull(store.get(OWNER, "a").getBotToken());
    }

    @Test
    void syncIsFullReplaceAndCascadesExecutions() {
        store.upsertMany(OWNER, List.of(daily("a", "0 6 * * *", true), daily("b", "0 7 * * *", true)), null, NOW);
        executionLog.append(OWNER, "b", NOW, ExecutionRecord.Status.COMPLETED, null, 12,
                ExecutionRecord.Trigger.MANUAL);

        SyncResult result = store.upsertMany(OWNER, List.of(daily("a", "30 6 * * *", true)), null, NOW);

        assertEquals(0, result.inserted());
        assertEquals(1, result.updated());
        assertEquals(1, result.deleted());
        assertTrue(store.find(OWNER, "b").isEmpty());
        assertTrue(executionLog.list(OWNER, "b", null).isEmpty());
        RecurringSchedule a = store.get(OWNER, "a");
        assertEquals("30 6 * * *", a.getCronExpression());
        assertEquals(Instant.parse("2024-01-16T11:30:00Z"), a.getNextRunAt());
    }

    @Test
    void invalidDefinitionRejectsWholeSync() {
        store.upsertMany(OWNER, List.of(daily("a", "0 6 * * *", true)), null, NOW);

        assertThrows(InvalidCronExpressionException.class, () -> store.upsertMany(OWNER, List.of(
                daily("a", "0 9 * * *", true),
                daily("broken", "every morning", true)), null, NOW));

        assertEquals("0 6 * * *", store.get(OWNER, "a").getCronExpression());
        assertTrue(store.find(OWNER, "broken").isEmpty());
    }

    @Test
    void duplicateIdsInOneSyncAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.upsertMany(OWNER, List.of(
                daily("a", "0 6 * * *", true),
                daily("a", "0 7 * * *", true)), null, NOW));
    }

    @Test
    void disablingClearsNextRunAndEnablingRecomputesFromNow() {
        store.upsertMany(OWNER, List.of(daily("a", "0 6 * * *", true)), null, NOW);

        RecurringSchedule disabled = store.setEnabled(OWNER, "a", false, NOW);
        assertFalse(disabled.isEnabled());
        assertNull(disabled.getNextRunAt());
        assertTrue(store.soonestEnabled(OWNER).isEmpty());

        Instant later = Instant.parse("2024-01-20T15:00:00Z");
        RecurringSchedule enabled = store.setEnabled(OWNER, "a", true, later);
        assertTrue(enabled.isEnabled());
        assertEquals(Instant.parse("2024-01-21T11:00:00Z"), enabled.getNextRunAt());
    }

    @Test
    void togglingUnknownScheduleIsNotFound() {
        assertThrows(NotFoundException.class, () -> store.setEnabled(OWNER, "missing", true, NOW));
    }

    @Test
    void recordRunAdvancesOrDisables() {
        store.upsertMany(OWNER, List.of(daily("a", "0 6 * * *", true)), null, NOW);
        Instant ranAt = Instant.parse("2024-01-16T11:00:00Z");

        store.recordRun(OWNER, "a", Instant.parse("2024-01-17T11:00:00Z"), ranAt);
        RecurringSchedule advanced = store.get(OWNER, "a");
        assertEquals(ranAt, advanced.getLastRunAt());
        assertEquals(Instant.parse("2024-01-17T11:00:00Z"), advanced.getNextRunAt());

        store.recordRun(OWNER, "a", null, ranAt);
        RecurringSchedule exhausted = store.get(OWNER, "a");
        assertFalse(exhausted.isEnabled());
        assertNull(exhausted.getNextRunAt());
    }

    @Test
    void dueSchedulesAndSoonestEnabled() {
        store.upsertMany(OWNER, List.of(
                daily("six", "0 6 * * *", true),
                daily("eight", "0 8 * * *", true)), null, NOW);

        // 08:00 EST today is 13:00 UTC
        assertEquals(Instant.parse("2024-01-15T13:00:00Z"), store.soonestEnabled(OWNER).orElseThrow());
        assertTrue(store.dueSchedules(OWNER, NOW).isEmpty());
        assertEquals(List.of("eight"), store.dueSchedules(OWNER, Instant.parse("2024-01-15T13:00:00Z"))
                .stream().map(RecurringSchedule::getId).toList());
    }

    @Test
    void listPutsDisabledLast() {
        store.upsertMany(OWNER, List.of(
                daily("off", "0 5 * * *", false),
                daily("six", "0 6 * * *", true),
                daily("eight", "0 8 * * *", true)), null, NOW);

        assertEquals(List.of("eight", "six", "off"),
                store.list(OWNER).stream().map(RecurringSchedule::getId).toList());
    }

    @Test
    void scheduleConfigExpandsWithSharedTimezone() {
        ScheduleConfig config = new ScheduleConfig("1", "Europe/Berlin", java.util.Map.of(
                "standup", new ScheduleConfig.Entry("Standup nudge", "0 9 * * MON-FRI", true, "Ask for updates")));

        store.upsertMany(OWNER, config.toDefinitions(), null, NOW);

        RecurringSchedule standup = store.get(OWNER, "standup");
        assertEquals("Europe/Berlin", standup.getTimezone());
        assertEquals("Ask for updates", standup.getPayload());
        // Monday 2024-01-15 09:00 CET already passed at 13:00 CET
        assertEquals(Instant.parse("2024-01-16T08:00:00Z"), standup.getNextRunAt());
    }
}
