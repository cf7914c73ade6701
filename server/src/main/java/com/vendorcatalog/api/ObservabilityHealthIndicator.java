package com.vendorcatalog.api;

import com.vendorcatalog.metrics.ObservabilityManager;
import com.vendorcatalog.model.HealthSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("observability")
@RequiredArgsConstructor
public class ObservabilityHealthIndicator implements HealthIndicator {

    private final ObservabilityManager observabilityManager;

    @Override
    public Health health() {
        HealthSnapshot snapshot = observabilityManager.healthSnapshot();
        return Health.up()
                .withDetail("activeAlerts", snapshot.getActiveAlerts())
                .withDetail("windowSampleSize", snapshot.getWindowSampleSize())
                .withDetail("uptimeSeconds", snapshot.getUptimeSeconds())
                .build();
    }
}
