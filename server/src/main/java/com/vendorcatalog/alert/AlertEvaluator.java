package com.vendorcatalog.alert;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates the rolling alerts over an {@link AlertWindow} and drives their
 * hysteresis state. A sustained breach is re-logged only once per cooldown;
 * recoveries are logged as soon as they happen. Not thread-safe.
 */
@Slf4j
public class AlertEvaluator {

    private static final double P95 = 0.95;

    private final int windowSec;
    private final int minRequests;
    private final long cooldownMillis;
    private final Map<AlertKind, Double> thresholds = new EnumMap<>(AlertKind.class);
    private final Map<AlertKind, AlertState> states = new EnumMap<>(AlertKind.class);

    public AlertEvaluator(int windowSec, int minRequests, int cooldownSec,
                          double requestP95Ms, double errorRatePct, double dbAvgMs) {
        this.windowSec = windowSec;
        this.minRequests = minRequests;
        this.cooldownMillis = cooldownSec * 1000L;
        thresholds.put(AlertKind.REQUEST_P95_MS, requestP95Ms);
        thresholds.put(AlertKind.ERROR_RATE_PCT, errorRatePct);
        thresholds.put(AlertKind.DB_AVG_MS, dbAvgMs);
        for (AlertKind kind : AlertKind.values()) {
            states.put(kind, new AlertState(kind));
        }
    }

    public List<AlertEvent> evaluate(AlertWindow window, long nowMillis) {
        List<AlertEvent> events = new ArrayList<>();
        int sampleSize = window.size();

        if (sampleSize < minRequests) {
            for (AlertKind kind : AlertKind.values()) {
                updateState(kind, false, null, null, sampleSize, nowMillis, events);
            }
            return events;
        }

        Map<AlertKind, Double> observed = aggregate(window.samples());
        for (AlertKind kind : AlertKind.values()) {
            double value = observed.get(kind);
            double threshold = thresholds.get(kind);
            boolean breached = threshold > 0 && value > threshold;
            updateState(kind, breached, value, threshold, sampleSize, nowMillis, events);
        }
        return events;
    }

    public List<AlertStatus> statuses() {
        List<AlertStatus> result = new ArrayList<>(states.size());
        states.values().forEach(state -> result.add(state.toStatus()));
        return result;
    }

    public boolean isActive(AlertKind kind) {
        return states.get(kind).isBreached();
    }

    public long breachCount(AlertKind kind) {
        return states.get(kind).getBreachCount();
    }

    static double percentile95(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int index = (int) Math.ceil(P95 * sorted.length) - 1;
        index = Math.max(0, Math.min(sorted.length - 1, index));
        return sorted[index];
    }

    private static Map<AlertKind, Double> aggregate(Collection<WindowSample> samples) {
        int n = samples.size();
        double[] requestTimes = new double[n];
        long errors = 0;
        double downstreamTotal = 0.0;
        int i = 0;
        for (WindowSample sample : samples) {
            requestTimes[i++] = sample.requestMs();
            if (sample.error()) {
                errors++;
            }
            downstreamTotal += sample.downstreamMs();
        }

        Map<AlertKind, Double> observed = new EnumMap<>(AlertKind.class);
        observed.put(AlertKind.REQUEST_P95_MS, percentile95(requestTimes));
        observed.put(AlertKind.ERROR_RATE_PCT, n == 0 ? 0.0 : errors * 100.0 / n);
        observed.put(AlertKind.DB_AVG_MS, n == 0 ? 0.0 : downstreamTotal / n);
        return observed;
    }

    private void updateState(AlertKind kind, boolean breached, Double observed, Double threshold,
                             int sampleSize, long nowMillis, List<AlertEvent> events) {
        AlertState state = states.get(kind);
        boolean wasActive = state.isBreached();
        state.update(breached, observed, threshold);

        double observedValue = orZero(observed);
        double thresholdValue = orZero(threshold);

        if (breached) {
            if (!wasActive || state.cooldownElapsed(nowMillis, cooldownMillis)) {
                state.markBreachLogged(nowMillis);
                log.warn("Performance alert breached. alert={} observed={} threshold={} window_sec={} sample_size={}",
                        kind.getAlertName(), format(observedValue), format(thresholdValue), windowSec, sampleSize);
                events.add(new AlertEvent(kind, AlertEvent.Type.BREACH, observedValue, thresholdValue, sampleSize));
            }
            return;
        }

        if (wasActive) {
            log.info("Performance alert recovered. alert={} observed={} threshold={} sample_size={}",
                    kind.getAlertName(), format(observedValue), format(thresholdValue), sampleSize);
            events.add(new AlertEvent(kind, AlertEvent.Type.RECOVERY, observedValue, thresholdValue, sampleSize));
        }
    }

    private static double orZero(Double value) {
        return value == null || !Double.isFinite(value) ? 0.0 : value;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
