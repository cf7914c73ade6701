package com.vendorcatalog.metrics;

import lombok.Value;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

@Value
public class MetricsSnapshot {

    Map<MetricFamily, SortedMap<MetricLabelKey, Long>> counters;
    Map<MetricFamily, SortedMap<MetricLabelKey, LatencyHistogram>> histograms;

    public SortedMap<MetricLabelKey, Long> counters(MetricFamily family) {
        return counters.getOrDefault(family, new TreeMap<>());
    }

    public SortedMap<MetricLabelKey, LatencyHistogram> histograms(MetricFamily family) {
        return histograms.getOrDefault(family, new TreeMap<>());
    }
}
