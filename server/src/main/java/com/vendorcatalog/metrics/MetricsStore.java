package com.vendorcatalog.metrics;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

public class MetricsStore {

    private final Map<MetricFamily, Map<MetricLabelKey, Long>> counters = new EnumMap<>(MetricFamily.class);
    private final Map<MetricFamily, Map<MetricLabelKey, LatencyHistogram>> histograms = new EnumMap<>(MetricFamily.class);

    public void incrementCounter(MetricFamily family, MetricLabelKey key, long amount) {
        requireType(family, MetricFamily.Type.COUNTER);
        counters.computeIfAbsent(family, f -> new HashMap<>())
                .merge(key, amount, Long::sum);
    }

    public void incrementCounter(MetricFamily family, MetricLabelKey key) {
        incrementCounter(family, key, 1);
    }

    public void observeHistogram(MetricFamily family, MetricLabelKey key, double valueMs) {
        requireType(family, MetricFamily.Type.HISTOGRAM);
        histograms.computeIfAbsent(family, f -> new HashMap<>())
                .computeIfAbsent(key, k -> new LatencyHistogram(family.getBucketBounds()))
                .record(valueMs);
    }

    public long counterValue(MetricFamily family, MetricLabelKey key) {
        return counters.getOrDefault(family, Map.of()).getOrDefault(key, 0L);
    }

    public Optional<LatencyHistogram> histogram(MetricFamily family, MetricLabelKey key) {
        LatencyHistogram histogram = histograms.getOrDefault(family, Map.of()).get(key);
        return Optional.ofNullable(histogram).map(LatencyHistogram::copy);
    }

    public MetricsSnapshot snapshot() {
        Map<MetricFamily, SortedMap<MetricLabelKey, Long>> counterCopy = new EnumMap<>(MetricFamily.class);
        Map<MetricFamily, SortedMap<MetricLabelKey, LatencyHistogram>> histogramCopy = new EnumMap<>(MetricFamily.class);

        for (MetricFamily family : MetricFamily.values()) {
            if (family.isHistogram()) {
                SortedMap<MetricLabelKey, LatencyHistogram> sorted = new TreeMap<>();
                histograms.getOrDefault(family, Map.of())
                        .forEach((key, histogram) -> sorted.put(key, histogram.copy()));
                histogramCopy.put(family, Collections.unmodifiableSortedMap(sorted));
            } else {
                SortedMap<MetricLabelKey, Long> sorted = new TreeMap<>(counters.getOrDefault(family, Map.of()));
                counterCopy.put(family, Collections.unmodifiableSortedMap(sorted));
            }
        }

        return new MetricsSnapshot(counterCopy, histogramCopy);
    }

    private static void requireType(MetricFamily family, MetricFamily.Type expected) {
        if (family.getType() != expected) {
            throw new IllegalArgumentException(family.getMetricName() + " is not a " + expected.name().toLowerCase() + " family");
        }
    }
}
