package com.vendorcatalog.config;

import lombok.Builder;
import lombok.Value;

import java.util.regex.Pattern;

@Value
@Builder
public class ObservabilitySettings {

    public static final String DEFAULT_PROMETHEUS_PATH = "/api/metrics";
    public static final String DEFAULT_STATSD_HOST = "127.0.0.1";
    public static final String DEFAULT_STATSD_PREFIX = "tvendor";

    static final int MIN_WINDOW_SEC = 10;
    static final int MIN_REQUESTS = 1;
    static final int MIN_COOLDOWN_SEC = 10;

    private static final Pattern UNSAFE_PREFIX_CHARS = Pattern.compile("[^A-Za-z0-9_.-]+");

    @Builder.Default boolean metricsEnabled = true;
    @Builder.Default boolean prometheusEnabled = true;
    @Builder.Default String prometheusPath = DEFAULT_PROMETHEUS_PATH;
    @Builder.Default boolean metricsAllowUnauthenticated = false;
    @Builder.Default String metricsAuthToken = "";

    @Builder.Default boolean alertsEnabled = true;
    @Builder.Default int alertWindowSec = 300;
    @Builder.Default int alertMinRequests = 20;
    @Builder.Default int alertCooldownSec = 300;
    @Builder.Default double alertRequestP95Ms = 0.0;
    @Builder.Default double alertErrorRatePct = 0.0;
    @Builder.Default double alertDbAvgMs = 0.0;

    @Builder.Default boolean statsdEnabled = false;
    @Builder.Default String statsdHost = DEFAULT_STATSD_HOST;
    @Builder.Default int statsdPort = 8125;
    @Builder.Default String statsdPrefix = DEFAULT_STATSD_PREFIX;

    public static ObservabilitySettings defaults() {
        return builder().build();
    }

    public static ObservabilitySettings from(ObservabilityProperties properties) {
        ObservabilityProperties.Metrics metrics = properties.getMetrics();
        ObservabilityProperties.Alert alert = properties.getAlert();
        ObservabilityProperties.Statsd statsd = properties.getStatsd();

        return builder()
                .metricsEnabled(metrics.isEnabled())
                .prometheusEnabled(metrics.isEnabled() && metrics.isPrometheusEnabled())
                .prometheusPath(normalizePath(metrics.getPrometheusPath()))
                .metricsAllowUnauthenticated(metrics.isAllowUnauthenticated())
                .metricsAuthToken(metrics.getAuthToken() == null ? "" : metrics.getAuthToken().trim())
                .alertsEnabled(properties.getAlerts().isEnabled())
                .alertWindowSec(Math.max(MIN_WINDOW_SEC, alert.getWindowSec()))
                .alertMinRequests(Math.max(MIN_REQUESTS, alert.getMinRequests()))
                .alertCooldownSec(Math.max(MIN_COOLDOWN_SEC, alert.getCooldownSec()))
                .alertRequestP95Ms(nonNegative(alert.getRequestP95Ms()))
                .alertErrorRatePct(nonNegative(alert.getErrorRatePct()))
                .alertDbAvgMs(nonNegative(alert.getDbAvgMs()))
                .statsdEnabled(statsd.isEnabled())
                .statsdHost(isBlank(statsd.getHost()) ? DEFAULT_STATSD_HOST : statsd.getHost().trim())
                .statsdPort(Math.max(1, Math.min(65535, statsd.getPort())))
                .statsdPrefix(sanitizePrefix(statsd.getPrefix()))
                .build();
    }

    static String normalizePath(String raw) {
        if (isBlank(raw)) {
            return DEFAULT_PROMETHEUS_PATH;
        }
        String path = raw.trim();
        return path.startsWith("/") ? path : "/" + path;
    }

    static String sanitizePrefix(String raw) {
        String cleaned = UNSAFE_PREFIX_CHARS.matcher(raw == null ? "" : raw).replaceAll("_");
        int start = 0;
        int end = cleaned.length();
        while (start < end && cleaned.charAt(start) == '.') {
            start++;
        }
        while (end > start && cleaned.charAt(end - 1) == '.') {
            end--;
        }
        cleaned = cleaned.substring(start, end);
        return cleaned.isEmpty() ? DEFAULT_STATSD_PREFIX : cleaned;
    }

    private static double nonNegative(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, value);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
