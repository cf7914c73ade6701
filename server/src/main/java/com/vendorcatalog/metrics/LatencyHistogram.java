package com.vendorcatalog.metrics;

import java.util.Arrays;

/**
 * Fixed-bucket latency histogram. Slots hold non-cumulative counts; an
 * observation above every bound only shows up in {@link #getCount()}.
 * Not thread-safe, callers synchronize.
 */
public class LatencyHistogram {

    static final double[] REQUEST_DURATION_BUCKETS_MS =
            {5, 10, 25, 50, 100, 250, 500, 1000, 2500, 5000, 10000};
    static final double[] DB_DURATION_BUCKETS_MS =
            {1, 5, 10, 25, 50, 100, 250, 500, 1000, 2500};

    private final double[] bucketBounds;
    private final long[] counts;
    private long count;
    private double sum;

    public LatencyHistogram(double[] bucketBounds) {
        this.bucketBounds = Arrays.copyOf(bucketBounds, bucketBounds.length);
        Arrays.sort(this.bucketBounds);
        this.counts = new long[bucketBounds.length];
    }

    private LatencyHistogram(double[] bucketBounds, long[] counts, long count, double sum) {
        this.bucketBounds = bucketBounds;
        this.counts = counts;
        this.count = count;
        this.sum = sum;
    }

    public void record(double valueMs) {
        count++;
        sum += valueMs;
        int bucketIndex = findBucketIndex(valueMs);
        if (bucketIndex >= 0) {
            counts[bucketIndex]++;
        }
    }

    public long getCount() {
        return count;
    }

    public double getSum() {
        return sum;
    }

    public double[] getBucketBounds() {
        return Arrays.copyOf(bucketBounds, bucketBounds.length);
    }

    public long[] getCounts() {
        return Arrays.copyOf(counts, counts.length);
    }

    public long[] getCumulativeCounts() {
        long[] cumulative = new long[counts.length];
        long running = 0;
        for (int i = 0; i < counts.length; i++) {
            running += counts[i];
            cumulative[i] = running;
        }
        return cumulative;
    }

    public LatencyHistogram copy() {
        return new LatencyHistogram(bucketBounds, Arrays.copyOf(counts, counts.length), count, sum);
    }

    private int findBucketIndex(double valueMs) {
        for (int i = 0; i < bucketBounds.length; i++) {
            if (valueMs <= bucketBounds[i]) {
                return i;
            }
        }
        return -1;
    }
}
