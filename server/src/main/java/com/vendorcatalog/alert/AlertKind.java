package com.vendorcatalog.alert;

public enum AlertKind {

    REQUEST_P95_MS("request_p95_ms"),
    ERROR_RATE_PCT("error_rate_pct"),
    DB_AVG_MS("db_avg_ms");

    private final String alertName;

    AlertKind(String alertName) {
        this.alertName = alertName;
    }

    public String getAlertName() {
        return alertName;
    }
}
