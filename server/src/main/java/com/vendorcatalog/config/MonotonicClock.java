package com.vendorcatalog.config;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.function.LongSupplier;

/**
 * Wall-clock time sampled once at construction, then advanced by
 * {@link System#nanoTime()} only. Never moves backwards when the system clock is stepped.
 */
public class MonotonicClock extends Clock {

    private final ZoneId zone;
    private final long originMillis;
    private final long originNanos;
    private final LongSupplier nanoTime;

    public static MonotonicClock systemUTC() {
        return new MonotonicClock(Clock.systemUTC(), System::nanoTime);
    }

    MonotonicClock(Clock origin, LongSupplier nanoTime) {
        this(origin.getZone(), origin.millis(), nanoTime.getAsLong(), nanoTime);
    }

    private MonotonicClock(ZoneId zone, long originMillis, long originNanos, LongSupplier nanoTime) {
        this.zone = zone;
        this.originMillis = originMillis;
        this.originNanos = originNanos;
        this.nanoTime = nanoTime;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        if (this.zone.equals(zone)) {
            return this;
        }
        return new MonotonicClock(zone, originMillis, originNanos, nanoTime);
    }

    @Override
    public long millis() {
        return originMillis + (nanoTime.getAsLong() - originNanos) / 1_000_000L;
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis());
    }
}
