package com.vendorcatalog.metrics;

import java.util.List;

public record MetricLabelKey(List<String> values) implements Comparable<MetricLabelKey> {

    public MetricLabelKey {
        values = List.copyOf(values);
    }

    public static MetricLabelKey of(String... values) {
        return new MetricLabelKey(List.of(values));
    }

    public int size() {
        return values.size();
    }

    public String get(int index) {
        return values.get(index);
    }

    @Override
    public int compareTo(MetricLabelKey other) {
        int shared = Math.min(values.size(), other.values.size());
        for (int i = 0; i < shared; i++) {
            int cmp = values.get(i).compareTo(other.values.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }
}
