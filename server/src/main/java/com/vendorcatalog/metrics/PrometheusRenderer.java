package com.vendorcatalog.metrics;

import com.vendorcatalog.alert.AlertStatus;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class PrometheusRenderer {

    static final String ALERT_BREACHES_TOTAL = "tvendor_alert_breaches_total";
    static final String ALERT_ACTIVE = "tvendor_alert_active";
    static final String UPTIME_SECONDS = "tvendor_uptime_seconds";

    private PrometheusRenderer() {
    }

    public static String render(MetricsSnapshot snapshot, List<AlertStatus> alerts, long uptimeSeconds) {
        StringBuilder sb = new StringBuilder(4096);

        for (MetricFamily family : MetricFamily.values()) {
            header(sb, family.getMetricName(), family.getHelp(), family.isHistogram() ? "histogram" : "counter");
            if (family.isHistogram()) {
                for (Map.Entry<MetricLabelKey, LatencyHistogram> entry : snapshot.histograms(family).entrySet()) {
                    appendHistogram(sb, family, entry.getKey(), entry.getValue());
                }
            } else {
                for (Map.Entry<MetricLabelKey, Long> entry : snapshot.counters(family).entrySet()) {
                    sb.append(family.getMetricName())
                            .append(labels(family.getLabelNames(), entry.getKey(), null))
                            .append(' ').append(entry.getValue()).append('\n');
                }
            }
        }

        List<AlertStatus> sortedAlerts = alerts.stream()
                .sorted(Comparator.comparing(AlertStatus::getName))
                .toList();

        header(sb, ALERT_BREACHES_TOTAL, "Total number of alert threshold breaches.", "counter");
        for (AlertStatus alert : sortedAlerts) {
            sb.append(ALERT_BREACHES_TOTAL).append(alertLabel(alert))
                    .append(' ').append(alert.getBreachCount()).append('\n');
        }

        header(sb, ALERT_ACTIVE, "Alert active state (1 active, 0 inactive).", "gauge");
        for (AlertStatus alert : sortedAlerts) {
            sb.append(ALERT_ACTIVE).append(alertLabel(alert))
                    .append(' ').append(alert.isActive() ? 1 : 0).append('\n');
        }

        header(sb, UPTIME_SECONDS, "Process uptime in seconds.", "gauge");
        sb.append(UPTIME_SECONDS).append(' ').append(Math.max(0, uptimeSeconds)).append('\n');

        return sb.toString();
    }

    public static String escapeLabelValue(String value) {
        return value
                .replace("\\", "\\\\")
                .replace("\n", "\\n")
                .replace("\"", "\\\"");
    }

    public static String formatFloat(double value) {
        if (!Double.isFinite(value)) {
            return "0";
        }
        String text = String.format(Locale.ROOT, "%.6f", value);
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '0') {
            end--;
        }
        while (end > 0 && text.charAt(end - 1) == '.') {
            end--;
        }
        return text.substring(0, end);
    }

    private static void appendHistogram(StringBuilder sb, MetricFamily family, MetricLabelKey key,
                                        LatencyHistogram histogram) {
        String name = family.getMetricName();
        List<String> labelNames = family.getLabelNames();
        double[] bounds = histogram.getBucketBounds();
        long[] cumulative = histogram.getCumulativeCounts();

        for (int i = 0; i < bounds.length; i++) {
            sb.append(name).append("_bucket")
                    .append(labels(labelNames, key, formatFloat(bounds[i])))
                    .append(' ').append(cumulative[i]).append('\n');
        }
        sb.append(name).append("_bucket")
                .append(labels(labelNames, key, "+Inf"))
                .append(' ').append(histogram.getCount()).append('\n');
        sb.append(name).append("_sum")
                .append(labels(labelNames, key, null))
                .append(' ').append(formatFloat(histogram.getSum())).append('\n');
        sb.append(name).append("_count")
                .append(labels(labelNames, key, null))
                .append(' ').append(histogram.getCount()).append('\n');
    }

    private static void header(StringBuilder sb, String name, String help, String type) {
        sb.append("# HELP ").append(name).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(name).append(' ').append(type).append('\n');
    }

    private static String labels(List<String> names, MetricLabelKey key, String le) {
        StringBuilder sb = new StringBuilder("{");
        int count = Math.min(names.size(), key.size());
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(names.get(i)).append("=\"").append(escapeLabelValue(key.get(i))).append('"');
        }
        if (le != null) {
            if (count > 0) {
                sb.append(',');
            }
            sb.append("le=\"").append(le).append('"');
        }
        return sb.append('}').toString();
    }

    private static String alertLabel(AlertStatus alert) {
        return "{alert=\"" + escapeLabelValue(alert.getName()) + "\"}";
    }
}
