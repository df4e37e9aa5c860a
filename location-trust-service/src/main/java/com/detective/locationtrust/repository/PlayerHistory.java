package com.detective.locationtrust.repository;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import com.detective.locationtrust.dto.LocationSample;

/**
 * Bounded FIFO of one player's most recent fixes. When full, appending evicts the oldest fix.
 *
 * <p>All access is synchronized on the instance.
 */
public class PlayerHistory {

    private final int capacity;
    private final Deque<LocationSample> samples;
    private Instant lastTouched;

    public PlayerHistory(int capacity, Instant createdAt) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be at least 1");
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity);
        this.lastTouched = createdAt;
    }

    public synchronized void append(LocationSample sample, Instant now) {
        if (samples.size() == capacity) {
            samples.removeFirst();
        }
        samples.addLast(sample);
        lastTouched = now;
    }

    /**
     * Returns up to {@code lookback} of the latest fixes (oldest first), then appends {@code
     * sample}, as one step.
     */
    public synchronized List<LocationSample> appendAndGetPrevious(
            LocationSample sample, int lookback, Instant now) {
        List<LocationSample> previous = recent(lookback);
        append(sample, now);
        return previous;
    }

    /** Up to {@code count} of the latest fixes, oldest first. */
    public synchronized List<LocationSample> recent(int count) {
        int take = Math.min(Math.max(count, 0), samples.size());
        List<LocationSample> result = new ArrayList<>(take);
        Iterator<LocationSample> newestFirst = samples.descendingIterator();
        for (int i = 0; i < take; i++) {
            result.add(0, newestFirst.next());
        }
        return result;
    }

    public synchronized int size() {
        return samples.size();
    }

    public synchronized Instant lastTouched() {
        return lastTouched;
    }

    public synchronized boolean isIdleSince(Instant cutoff) {
        return lastTouched.isBefore(cutoff);
    }
}
