package com.vendorcatalog.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.vendorcatalog.alert.AlertStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthSnapshot {
    boolean metricsEnabled;
    boolean prometheusEnabled;
    String prometheusPath;
    boolean statsdEnabled;
    boolean alertsEnabled;
    int alertWindowSec;
    int alertMinRequests;
    int alertCooldownSec;
    int activeAlertCount;
    List<String> activeAlerts;
    Map<String, Long> alertBreachesTotal;
    List<AlertStatus> alerts;
    int windowSampleSize;
    long statsdDroppedTotal;
    long uptimeSeconds;
}
