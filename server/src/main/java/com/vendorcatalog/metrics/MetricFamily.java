package com.vendorcatalog.metrics;

import java.util.List;

public enum MetricFamily {

    HTTP_REQUESTS_TOTAL("tvendor_http_requests_total", "Total HTTP requests.",
            Type.COUNTER, List.of("method", "path", "status_class"), null),
    HTTP_REQUEST_ERRORS_TOTAL("tvendor_http_request_errors_total", "Total HTTP 5xx requests.",
            Type.COUNTER, List.of("method", "path"), null),
    HTTP_REQUEST_DURATION_MS("tvendor_http_request_duration_ms", "HTTP request duration in milliseconds.",
            Type.HISTOGRAM, List.of("method", "path"), LatencyHistogram.REQUEST_DURATION_BUCKETS_MS),
    DB_CALLS_TOTAL("tvendor_db_calls_total", "Total DB calls per request path.",
            Type.COUNTER, List.of("method", "path"), null),
    DB_CACHE_HITS_TOTAL("tvendor_db_cache_hits_total", "Total DB cache hits per request path.",
            Type.COUNTER, List.of("method", "path"), null),
    DB_ERRORS_TOTAL("tvendor_db_errors_total", "Total DB errors per request path.",
            Type.COUNTER, List.of("method", "path"), null),
    DB_DURATION_MS("tvendor_db_duration_ms", "Total DB duration in milliseconds per request.",
            Type.HISTOGRAM, List.of("method", "path"), LatencyHistogram.DB_DURATION_BUCKETS_MS);

    public enum Type {
        COUNTER,
        HISTOGRAM
    }

    private final String metricName;
    private final String help;
    private final Type type;
    private final List<String> labelNames;
    private final double[] bucketBounds;

    MetricFamily(String metricName, String help, Type type, List<String> labelNames, double[] bucketBounds) {
        this.metricName = metricName;
        this.help = help;
        this.type = type;
        this.labelNames = labelNames;
        this.bucketBounds = bucketBounds;
    }

    public String getMetricName() {
        return metricName;
    }

    public String getHelp() {
        return help;
    }

    public Type getType() {
        return type;
    }

    public List<String> getLabelNames() {
        return labelNames;
    }

    public double[] getBucketBounds() {
        return bucketBounds == null ? new double[0] : bucketBounds.clone();
    }

    public boolean isHistogram() {
        return type == Type.HISTOGRAM;
    }
}
