package com.vendorcatalog.web;

import org.springframework.stereotype.Component;

@Component
public class DownstreamCallTracker {

    private final ThreadLocal<Accumulator> current = new ThreadLocal<>();

    public void begin() {
        current.set(new Accumulator());
    }

    public void end() {
        current.remove();
    }

    public boolean isActive() {
        return current.get() != null;
    }

    public void recordCall(double durationMs, boolean cacheHit, boolean error) {
        Accumulator acc = current.get();
        if (acc == null) {
            return;
        }
        double duration = Double.isFinite(durationMs) ? Math.max(0.0, durationMs) : 0.0;
        acc.calls++;
        acc.totalMs += duration;
        acc.maxMs = Math.max(acc.maxMs, duration);
        if (cacheHit) {
            acc.cacheHits++;
        }
        if (error) {
            acc.errors++;
        }
    }

    public DownstreamTotals current() {
        Accumulator acc = current.get();
        if (acc == null) {
            return DownstreamTotals.EMPTY;
        }
        return new DownstreamTotals(acc.calls, acc.totalMs, acc.maxMs, acc.cacheHits, acc.errors);
    }

    public record DownstreamTotals(long calls, double totalMs, double maxMs, long cacheHits, long errors) {
        public static final DownstreamTotals EMPTY = new DownstreamTotals(0, 0.0, 0.0, 0, 0);
    }

    private static final class Accumulator {
        long calls;
        double totalMs;
        double maxMs;
        long cacheHits;
        long errors;
    }
}
