package com.vendorcatalog.metrics;

import com.vendorcatalog.alert.AlertStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PrometheusRendererTest {

    private static List<AlertStatus> quietAlerts() {
        return List.of(
                AlertStatus.builder().name("request_p95_ms").build(),
                AlertStatus.builder().name("error_rate_pct").build(),
                AlertStatus.builder().name("db_avg_ms").build());
    }

    @Test
    void formatsFloatsWithoutTrailingZeros() {
        assertThat(PrometheusRenderer.formatFloat(1.0)).isEqualTo("1");
        assertThat(PrometheusRenderer.formatFloat(1.5)).isEqualTo("1.5");
        assertThat(PrometheusRenderer.formatFloat(0.0)).isEqualTo("0");
        assertThat(PrometheusRenderer.formatFloat(2500.0)).isEqualTo("2500");
        assertThat(PrometheusRenderer.formatFloat(0.1234567)).isEqualTo("0.123457");
        assertThat(PrometheusRenderer.formatFloat(Double.NaN)).isEqualTo("0");
        assertThat(PrometheusRenderer.formatFloat(Double.POSITIVE_INFINITY)).isEqualTo("0");
    }

    @Test
    void escapesLabelValues() {
        assertThat(PrometheusRenderer.escapeLabelValue("a\\b\"c\nd")).isEqualTo("a\\\\b\\\"c\\nd");
    }

    @Test
    void rendersHistogramBucketsCumulativelyWithInfAndSumCount() {
        MetricsStore store = new MetricsStore();
        MetricLabelKey key = MetricLabelKey.of("GET", "/api/vendors");
        store.observeHistogram(MetricFamily.HTTP_REQUEST_DURATION_MS, key, 3.0);
        store.observeHistogram(MetricFamily.HTTP_REQUEST_DURATION_MS, key, 42.0);
        store.observeHistogram(MetricFamily.HTTP_REQUEST_DURATION_MS, key, 20_000.0);

        String text = PrometheusRenderer.render(store.snapshot(), quietAlerts(), 5);

        String labels = "method=\"GET\",path=\"/api/vendors\"";
        assertThat(text).contains(
                "tvendor_http_request_duration_ms_bucket{" + labels + ",le=\"5\"} 1\n"
                        + "tvendor_http_request_duration_ms_bucket{" + labels + ",le=\"10\"} 1\n"
                        + "tvendor_http_request_duration_ms_bucket{" + labels + ",le=\"25\"} 1\n"
                        + "tvendor_http_request_duration_ms_bucket{" + labels + ",le=\"50\"} 2\n");
        assertThat(text).contains(
                "tvendor_http_request_duration_ms_bucket{" + labels + ",le=\"10000\"} 2\n"
                        + "tvendor_http_request_duration_ms_bucket{" + labels + ",le=\"+Inf\"} 3\n"
                        + "tvendor_http_request_duration_ms_sum{" + labels + "} 20045\n"
                        + "tvendor_http_request_duration_ms_count{" + labels + "} 3\n");
    }

    @Test
    void rendersFamiliesInFixedOrderWithHeaders() {
        String text = PrometheusRenderer.render(new MetricsStore().snapshot(), quietAlerts(), 12);

        assertThat(text).startsWith("# HELP tvendor_http_requests_total Total HTTP requests.\n"
                + "# TYPE tvendor_http_requests_total counter\n");
        assertThat(text.indexOf("# TYPE tvendor_http_request_duration_ms histogram"))
                .isGreaterThan(text.indexOf("# TYPE tvendor_http_request_errors_total counter"));
        assertThat(text.indexOf("# TYPE tvendor_db_duration_ms histogram"))
                .isGreaterThan(text.indexOf("# TYPE tvendor_db_errors_total counter"));
        assertThat(text).endsWith("# HELP tvendor_uptime_seconds Process uptime in seconds.\n"
                + "# TYPE tvendor_uptime_seconds gauge\n"
                + "tvendor_uptime_seconds 12\n");
    }

    @Test
    void rendersAlertsSortedByName() {
        List<AlertStatus> alerts = List.of(
                AlertStatus.builder().name("request_p95_ms").active(true).breachCount(2).build(),
                AlertStatus.builder().name("error_rate_pct").build(),
                AlertStatus.builder().name("db_avg_ms").breachCount(1).build());

        String text = PrometheusRenderer.render(new MetricsStore().snapshot(), alerts, 0);

        assertThat(text).contains("# TYPE tvendor_alert_breaches_total counter\n"
                + "tvendor_alert_breaches_total{alert=\"db_avg_ms\"} 1\n"
                + "tvendor_alert_breaches_total{alert=\"error_rate_pct\"} 0\n"
                + "tvendor_alert_breaches_total{alert=\"request_p95_ms\"} 2\n");
        assertThat(text).contains("# TYPE tvendor_alert_active gauge\n"
                + "tvendor_alert_active{alert=\"db_avg_ms\"} 0\n"
                + "tvendor_alert_active{alert=\"error_rate_pct\"} 0\n"
                + "tvendor_alert_active{alert=\"request_p95_ms\"} 1\n");
    }

    @Test
    void escapedLabelsKeepEachSampleOnOneLine() {
        MetricsStore store = new MetricsStore();
        store.incrementCounter(MetricFamily.HTTP_REQUEST_ERRORS_TOTAL, MetricLabelKey.of("GET", "/x\"y\\z\nw"));

        String text = PrometheusRenderer.render(store.snapshot(), quietAlerts(), 0);

        assertThat(text).contains("tvendor_http_request_errors_total{method=\"GET\",path=\"/x\\\"y\\\\z\\nw\"} 1\n");
        assertThat(text.lines().filter(line -> !line.startsWith("#")))
                .allMatch(line -> line.matches("^[a-z_]+(\\{.*})? \\S+$"));
    }
}
