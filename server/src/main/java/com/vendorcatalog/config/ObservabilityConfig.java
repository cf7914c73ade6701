package com.vendorcatalog.config;

import com.vendorcatalog.metrics.ObservabilityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class ObservabilityConfig {

    @Bean
    @ConfigurationProperties(prefix = "tvendor")
    public ObservabilityProperties observabilityProperties() {
        return new ObservabilityProperties();
    }

    @Bean
    public ObservabilitySettings observabilitySettings(ObservabilityProperties properties) {
        ObservabilitySettings settings = ObservabilitySettings.from(properties);
        log.info("Observability configured: metrics={}, prometheus={} ({}), alerts={}, windowSec={}, "
                        + "minRequests={}, cooldownSec={}, statsd={} ({}:{})",
                settings.isMetricsEnabled(), settings.isPrometheusEnabled(), settings.getPrometheusPath(),
                settings.isAlertsEnabled(), settings.getAlertWindowSec(), settings.getAlertMinRequests(),
                settings.getAlertCooldownSec(), settings.isStatsdEnabled(), settings.getStatsdHost(),
                settings.getStatsdPort());
        return settings;
    }

    @Bean
    public Clock observabilityClock() {
        return MonotonicClock.systemUTC();
    }

    @Bean
    public ObservabilityManager observabilityManager(ObservabilitySettings settings, Clock observabilityClock) {
        return new ObservabilityManager(settings, observabilityClock);
    }
}
