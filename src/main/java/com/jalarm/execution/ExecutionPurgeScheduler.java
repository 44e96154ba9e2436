package com.jalarm.execution;

import com.jalarm.config.JalarmProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Daily retention sweep across all owners. Alarm fires prune their own owner's
 * records; this catches owners whose alarms no longer fire.
 */
@Component
public class ExecutionPurgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPurgeScheduler.class);

    private final ExecutionLog executionLog;
    private final JalarmProperties properties;
    private final Clock clock;

    public ExecutionPurgeScheduler(ExecutionLog executionLog, JalarmProperties properties, Clock clock) {
        this.executionLog = executionLog;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${jalarm.executions.purge-cron:0 0 4 * * *}")
    public void purgeOldExecutions() {
        int retentionDays = properties.getExecutions().getRetentionDays();
        Instant cutoff = clock.instant().minus(retentionDays, ChronoUnit.DAYS);
        try {
            long deleted = executionLog.purgeAllOlderThan(cutoff);
            if (deleted > 0) {
                log.info("Purged {} execution records older than {} days", deleted, retentionDays);
            }
        } catch (RuntimeException e) {
            log.error("Execution record purge failed (cutoff: {} days)", retentionDays, e);
        }
    }
}
