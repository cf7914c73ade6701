package com.vendorcatalog.metrics;

import com.vendorcatalog.alert.AlertEvaluator;
import com.vendorcatalog.alert.AlertStatus;
import com.vendorcatalog.alert.AlertWindow;
import com.vendorcatalog.alert.WindowSample;
import com.vendorcatalog.config.ObservabilitySettings;
import com.vendorcatalog.model.HealthSnapshot;
import com.vendorcatalog.model.RequestOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Request metrics, rolling alerts and StatsD forwarding behind one lock.
 * <p>
 * {@link #recordRequest} is called once per completed HTTP request and never
 * throws. {@link #renderPrometheus()} and {@link #healthSnapshot()} only hold
 * the lock while copying state; formatting happens outside it. StatsD
 * forwarding runs after the lock is released and may lose data relative to
 * the in-memory store.
 */
@Slf4j
public class ObservabilityManager implements AutoCloseable {

    private final ObservabilitySettings settings;
    private final StatsdSink statsd;
    private final Clock clock;
    private final long startedMillis;

    private final Lock lock = new ReentrantLock();
    private final MetricsStore store = new MetricsStore();
    private final AlertWindow window = new AlertWindow();
    private final AlertEvaluator evaluator;

    public ObservabilityManager(ObservabilitySettings settings, Clock clock) {
        this(settings, new StatsdSink(settings), clock);
    }

    ObservabilityManager(ObservabilitySettings settings, StatsdSink statsd, Clock clock) {
        this.settings = settings;
        this.statsd = statsd;
        this.clock = clock;
        this.startedMillis = clock.millis();
        this.evaluator = new AlertEvaluator(
                settings.getAlertWindowSec(),
                settings.getAlertMinRequests(),
                settings.getAlertCooldownSec(),
                settings.getAlertRequestP95Ms(),
                settings.getAlertErrorRatePct(),
                settings.getAlertDbAvgMs());
    }

    public void recordRequest(RequestOutcome outcome) {
        recordRequest(outcome.getMethod(), outcome.getPath(), outcome.getStatusCode(), outcome.getElapsedMs(),
                outcome.getDbCalls(), outcome.getDbTotalMs(), outcome.getDbCacheHits(), outcome.getDbErrors());
    }

    public void recordRequest(String method, String path, int statusCode, double elapsedMs,
                              long dbCalls, double dbTotalMs, long dbCacheHits, long dbErrors) {
        try {
            record(method, path, statusCode, elapsedMs, dbCalls, dbTotalMs, dbCacheHits, dbErrors);
        } catch (RuntimeException e) {
            log.error("Failed to record request metrics. method={} path={} status={}", method, path, statusCode, e);
        }
    }

    public String renderPrometheus() {
        if (!settings.isPrometheusEnabled()) {
            return "";
        }

        MetricsSnapshot snapshot;
        List<AlertStatus> alerts;
        lock.lock();
        try {
            snapshot = store.snapshot();
            alerts = evaluator.statuses();
        } finally {
            lock.unlock();
        }

        return PrometheusRenderer.render(snapshot, alerts, uptimeSeconds());
    }

    public HealthSnapshot healthSnapshot() {
        List<AlertStatus> alerts;
        int windowSize;
        lock.lock();
        try {
            alerts = evaluator.statuses();
            windowSize = window.size();
        } finally {
            lock.unlock();
        }

        List<String> activeAlerts = alerts.stream()
                .filter(AlertStatus::isActive)
                .map(AlertStatus::getName)
                .sorted()
                .toList();
        Map<String, Long> breaches = new LinkedHashMap<>();
        alerts.forEach(alert -> breaches.put(alert.getName(), alert.getBreachCount()));

        return HealthSnapshot.builder()
                .metricsEnabled(settings.isMetricsEnabled())
                .prometheusEnabled(settings.isPrometheusEnabled())
                .prometheusPath(settings.isPrometheusEnabled() ? settings.getPrometheusPath() : null)
                .statsdEnabled(statsd.isEnabled())
                .alertsEnabled(settings.isAlertsEnabled())
                .alertWindowSec(settings.getAlertWindowSec())
                .alertMinRequests(settings.getAlertMinRequests())
                .alertCooldownSec(settings.getAlertCooldownSec())
                .activeAlertCount(activeAlerts.size())
                .activeAlerts(activeAlerts)
                .alertBreachesTotal(breaches)
                .alerts(alerts)
                .windowSampleSize(windowSize)
                .statsdDroppedTotal(statsd.getDroppedCount())
                .uptimeSeconds(uptimeSeconds())
                .build();
    }

    public ObservabilitySettings getSettings() {
        return settings;
    }

    @Override
    public void close() {
        statsd.close();
    }

    private void record(String method, String path, int statusCode, double elapsedMs,
                        long dbCalls, double dbTotalMs, long dbCacheHits, long dbErrors) {
        String methodLabel = MetricLabels.method(method);
        String pathLabel = MetricLabels.path(path);
        String statusClass = MetricLabels.statusClass(statusCode);
        double totalMs = nonNegative(elapsedMs);
        long dbCallsValue = Math.max(0, dbCalls);
        double dbTotalValue = nonNegative(dbTotalMs);
        long dbCacheHitsValue = Math.max(0, dbCacheHits);
        long dbErrorsValue = Math.max(0, dbErrors);
        boolean isError = statusCode >= 500;

        if (settings.isMetricsEnabled() || settings.isAlertsEnabled()) {
            long now = clock.millis();
            lock.lock();
            try {
                if (settings.isMetricsEnabled()) {
                    MetricLabelKey routeKey = MetricLabelKey.of(methodLabel, pathLabel);
                    store.incrementCounter(MetricFamily.HTTP_REQUESTS_TOTAL,
                            MetricLabelKey.of(methodLabel, pathLabel, statusClass));
                    store.observeHistogram(MetricFamily.HTTP_REQUEST_DURATION_MS, routeKey, totalMs);
                    if (isError) {
                        store.incrementCounter(MetricFamily.HTTP_REQUEST_ERRORS_TOTAL, routeKey);
                    }
                    if (dbCallsValue > 0) {
                        store.incrementCounter(MetricFamily.DB_CALLS_TOTAL, routeKey, dbCallsValue);
                        if (dbTotalValue > 0) {
                            store.observeHistogram(MetricFamily.DB_DURATION_MS, routeKey, dbTotalValue);
                        }
                    }
                    if (dbCacheHitsValue > 0) {
                        store.incrementCounter(MetricFamily.DB_CACHE_HITS_TOTAL, routeKey, dbCacheHitsValue);
                    }
                    if (dbErrorsValue > 0) {
                        store.incrementCounter(MetricFamily.DB_ERRORS_TOTAL, routeKey, dbErrorsValue);
                    }
                }

                if (settings.isAlertsEnabled()) {
                    window.append(new WindowSample(now, totalMs, isError, dbTotalValue));
                    window.evictBefore(now - settings.getAlertWindowSec() * 1000L);
                    evaluator.evaluate(window, now);
                }
            } finally {
                lock.unlock();
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Recorded: method={}, path={}, status={}, elapsed={}ms, dbCalls={}, dbTotal={}ms",
                    methodLabel, pathLabel, statusCode, totalMs, dbCallsValue, dbTotalValue);
        }

        if (settings.isMetricsEnabled() && statsd.isEnabled()) {
            statsd.counter("http.requests_total", 1);
            statsd.counter("http.status_" + statusClass, 1);
            statsd.timingMs("http.request_duration_ms", totalMs);
            if (isError) {
                statsd.counter("http.request_errors_total", 1);
            }
            if (dbCallsValue > 0) {
                statsd.counter("db.calls_total", dbCallsValue);
                if (dbTotalValue > 0) {
                    statsd.timingMs("db.duration_ms", dbTotalValue);
                }
            }
            if (dbCacheHitsValue > 0) {
                statsd.counter("db.cache_hits_total", dbCacheHitsValue);
            }
            if (dbErrorsValue > 0) {
                statsd.counter("db.errors_total", dbErrorsValue);
            }
        }
    }

    private long uptimeSeconds() {
        return Math.max(0, (clock.millis() - startedMillis) / 1000);
    }

    private static double nonNegative(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, value);
    }
}
