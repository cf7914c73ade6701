package com.vendorcatalog.metrics;

import com.vendorcatalog.config.ObservabilitySettings;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.DatagramChannel;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * Fire-and-forget StatsD line protocol over UDP ({@code name:value|c} and
 * {@code name:value|ms}). Sends go through a lazily opened non-blocking
 * channel; any failure drops the datagram and is logged at most once a minute.
 * Nothing in here throws to the caller.
 */
@Slf4j
public class StatsdSink implements AutoCloseable {

    static final long ERROR_LOG_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(60);

    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^A-Za-z0-9_.-]+");
    private static final long NEVER = Long.MIN_VALUE;

    @FunctionalInterface
    interface ChannelOpener {
        DatagramChannel open() throws IOException;
    }

    private final boolean enabled;
    private final String host;
    private final int port;
    private final String prefix;
    private final ChannelOpener opener;
    private final LongSupplier nanoTime;

    private final Lock lock = new ReentrantLock();
    private DatagramChannel channel;
    private volatile InetSocketAddress target;

    private final AtomicLong lastErrorLogNanos = new AtomicLong(NEVER);
    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicLong failureLogCount = new AtomicLong();

    public StatsdSink(ObservabilitySettings settings) {
        this(settings, DatagramChannel::open, System::nanoTime);
    }

    StatsdSink(ObservabilitySettings settings, ChannelOpener opener, LongSupplier nanoTime) {
        this.enabled = settings.isStatsdEnabled();
        this.host = settings.getStatsdHost();
        this.port = settings.getStatsdPort();
        this.prefix = settings.getStatsdPrefix();
        this.opener = opener;
        this.nanoTime = nanoTime;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void counter(String name, long value) {
        if (value <= 0) {
            return;
        }
        send(metricName(name) + ":" + value + "|c");
    }

    public void timingMs(String name, double valueMs) {
        if (!(valueMs >= 0) || Double.isInfinite(valueMs)) {
            return;
        }
        send(metricName(name) + ":" + String.format(Locale.ROOT, "%.2f", valueMs) + "|ms");
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    long getFailureLogCount() {
        return failureLogCount.get();
    }

    String metricName(String name) {
        String cleaned = UNSAFE_NAME_CHARS.matcher(name == null ? "" : name.strip()).replaceAll("_");
        cleaned = stripEdges(cleaned);
        if (cleaned.isEmpty()) {
            cleaned = "metric";
        }
        return prefix + "." + cleaned;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (channel != null) {
                try {
                    channel.close();
                } catch (IOException e) {
                    log.debug("Failed to close StatsD channel", e);
                }
                channel = null;
            }
        } finally {
            lock.unlock();
        }
    }

    private void send(String line) {
        if (!enabled) {
            return;
        }
        try {
            DatagramChannel ch = ensureChannel();
            InetSocketAddress address = ensureTarget();
            int sent = ch.send(ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8)), address);
            if (sent == 0) {
                onFailure(null);
            }
        } catch (IOException | RuntimeException e) {
            target = null;
            onFailure(e);
        }
    }

    private DatagramChannel ensureChannel() throws IOException {
        lock.lock();
        try {
            if (channel == null || !channel.isOpen()) {
                DatagramChannel opened = opener.open();
                opened.configureBlocking(false);
                channel = opened;
            }
            return channel;
        } finally {
            lock.unlock();
        }
    }

    private InetSocketAddress ensureTarget() {
        InetSocketAddress address = target;
        if (address == null) {
            address = new InetSocketAddress(host, port);
            target = address;
        }
        return address;
    }

    private void onFailure(Exception cause) {
        droppedCount.incrementAndGet();
        long now = nanoTime.getAsLong();
        long last = lastErrorLogNanos.get();
        if ((last == NEVER || now - last >= ERROR_LOG_INTERVAL_NANOS)
                && lastErrorLogNanos.compareAndSet(last, now)) {
            failureLogCount.incrementAndGet();
            if (cause != null) {
                log.warn("Failed to emit StatsD metric. host={} port={}", host, port, cause);
            } else {
                log.warn("Failed to emit StatsD metric, send buffer full. host={} port={}", host, port);
            }
        }
    }

    private static String stripEdges(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isEdgeChar(value.charAt(start))) {
            start++;
        }
        while (end > start && isEdgeChar(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isEdgeChar(char c) {
        return c == '.' || c == '_';
    }
}
