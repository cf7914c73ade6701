package com.vendorcatalog.alert;

import lombok.Getter;

@Getter
class AlertState {

    private final AlertKind kind;
    private boolean breached;
    private long breachCount;
    private long lastBreachLogMillis;
    private Double lastObserved;
    private Double lastThreshold;

    AlertState(AlertKind kind) {
        this.kind = kind;
    }

    boolean cooldownElapsed(long nowMillis, long cooldownMillis) {
        return (nowMillis - lastBreachLogMillis) >= cooldownMillis;
    }

    void markBreachLogged(long nowMillis) {
        breachCount++;
        lastBreachLogMillis = nowMillis;
    }

    void update(boolean breached, Double observed, Double threshold) {
        this.breached = breached;
        this.lastObserved = observed;
        this.lastThreshold = threshold;
    }

    AlertStatus toStatus() {
        return AlertStatus.builder()
                .name(kind.getAlertName())
                .active(breached)
                .breachCount(breachCount)
                .observed(lastObserved)
                .threshold(lastThreshold)
                .build();
    }
}
