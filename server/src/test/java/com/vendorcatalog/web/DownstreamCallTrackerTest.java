package com.vendorcatalog.web;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class DownstreamCallTrackerTest {

    private final DownstreamCallTracker tracker = new DownstreamCallTracker();

    @Test
    void accumulatesCallsWithinScope() {
        tracker.begin();
        tracker.recordCall(12.5, false, false);
        tracker.recordCall(30.0, true, false);
        tracker.recordCall(2.5, false, true);

        DownstreamCallTracker.DownstreamTotals totals = tracker.current();
        tracker.end();

        assertThat(totals.calls()).isEqualTo(3);
        assertThat(totals.totalMs()).isEqualTo(45.0);
        assertThat(totals.maxMs()).isEqualTo(30.0);
        assertThat(totals.cacheHits()).isEqualTo(1);
        assertThat(totals.errors()).isEqualTo(1);
        assertThat(tracker.isActive()).isFalse();
    }

    @Test
    void ignoresCallsOutsideScope() {
        tracker.recordCall(100.0, true, true);

        assertThat(tracker.isActive()).isFalse();
        assertThat(tracker.current()).isEqualTo(DownstreamCallTracker.DownstreamTotals.EMPTY);
    }

    @Test
    void beginResetsPreviousTotals() {
        tracker.begin();
        tracker.recordCall(5.0, false, false);
        tracker.begin();

        assertThat(tracker.current().calls()).isZero();
        tracker.end();
    }

    @Test
    void clampsInvalidDurations() {
        tracker.begin();
        tracker.recordCall(-3.0, false, false);
        tracker.recordCall(Double.NaN, false, false);

        DownstreamCallTracker.DownstreamTotals totals = tracker.current();
        tracker.end();

        assertThat(totals.calls()).isEqualTo(2);
        assertThat(totals.totalMs()).isZero();
    }

    @Test
    void scopesAreThreadConfined() throws InterruptedException {
        tracker.begin();
        tracker.recordCall(10.0, false, false);

        AtomicReference<DownstreamCallTracker.DownstreamTotals> seen = new AtomicReference<>();
        Thread other = new Thread(() -> {
            tracker.recordCall(99.0, false, false);
            seen.set(tracker.current());
        });
        other.start();
        other.join();

        assertThat(seen.get()).isEqualTo(DownstreamCallTracker.DownstreamTotals.EMPTY);
        assertThat(tracker.current().calls()).isEqualTo(1);
        tracker.end();
    }
}
