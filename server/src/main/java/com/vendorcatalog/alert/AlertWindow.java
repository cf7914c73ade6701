package com.vendorcatalog.alert;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;

public class AlertWindow {

    private final Deque<WindowSample> samples = new ArrayDeque<>();

    public void append(WindowSample sample) {
        samples.addLast(sample);
    }

    public int evictBefore(long cutoffMillis) {
        int evicted = 0;
        while (!samples.isEmpty() && samples.peekFirst().timestampMillis() < cutoffMillis) {
            samples.pollFirst();
            evicted++;
        }
        return evicted;
    }

    public int size() {
        return samples.size();
    }

    public Collection<WindowSample> samples() {
        return Collections.unmodifiableCollection(samples);
    }
}
