package com.vendorcatalog.config;

import lombok.Data;

@Data
public class ObservabilityProperties {

    private Metrics metrics = new Metrics();
    private Alerts alerts = new Alerts();
    private Alert alert = new Alert();
    private Statsd statsd = new Statsd();

    @Data
    public static class Metrics {
        private boolean enabled = true;
        private boolean prometheusEnabled = true;
        private String prometheusPath = ObservabilitySettings.DEFAULT_PROMETHEUS_PATH;
        private boolean allowUnauthenticated = false;
        private String authToken = "";
    }

    @Data
    public static class Alerts {
        private boolean enabled = true;
    }

    @Data
    public static class Alert {
        private int windowSec = 300;
        private int minRequests = 20;
        private int cooldownSec = 300;
        private double requestP95Ms = 0.0;
        private double errorRatePct = 0.0;
        private double dbAvgMs = 0.0;
    }

    @Data
    public static class Statsd {
        private boolean enabled = false;
        private String host = ObservabilitySettings.DEFAULT_STATSD_HOST;
        private int port = 8125;
        private String prefix = ObservabilitySettings.DEFAULT_STATSD_PREFIX;
    }
}
