package com.jalarm.observability;

import com.jalarm.delivery.Notifier;
import com.jalarm.owner.OwnerActorRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class AlarmHealthIndicator implements HealthIndicator {

    private final OwnerActorRegistry registry;
    private final Notifier notifier;
    private final JalarmMetrics metrics;

    public AlarmHealthIndicator(OwnerActorRegistry registry, Notifier notifier, JalarmMetrics metrics) {
        this.registry = registry;
        this.notifier = notifier;
        this.metrics = metrics;
    }

    @Override
    public Health health() {
        return Health.up()
                .withDetail("notifier", notifier.channelType())
                .withDetail("owners", registry.knownOwners().size())
                .withDetail("armedOwners", registry.armedOwnerCount())
                .withDetail("armedTimers", metrics.armedAlarms())
                .build();
    }
}
