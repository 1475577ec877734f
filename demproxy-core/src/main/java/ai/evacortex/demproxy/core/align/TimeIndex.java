/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.align;

import ai.evacortex.demproxy.core.TimeSeriesEntry;

import java.time.Instant;
import java.util.*;

/**
 * Time-ordered, immutable sequence of {@link TimeSeriesEntry} for one channel.
 *
 * <p>Entries are sorted by timestamp ascending with a stable sort, so items sharing a
 * timestamp keep the order in which they were encountered. Exact duplicates
 * (same timestamp and same handle) are collapsed to their first occurrence.</p>
 */
public final class TimeIndex<H> {

    private static final TimeIndex<?> EMPTY = new TimeIndex<>(List.of());

    private final List<TimeSeriesEntry<H>> entries;
    private final Instant[] times;

    private TimeIndex(List<TimeSeriesEntry<H>> sorted) {
        this.entries = List.copyOf(sorted);
        this.times = new Instant[sorted.size()];
        for (int i = 0; i < times.length; i++) {
            times[i] = sorted.get(i).time();
        }
    }

    public static <H> TimeIndex<H> build(Collection<TimeSeriesEntry<H>> items) {
        if (items == null || items.isEmpty()) return empty();

        List<TimeSeriesEntry<H>> sorted = new ArrayList<>(items.size());
        Set<TimeSeriesEntry<H>> seen = new HashSet<>();
        for (TimeSeriesEntry<H> item : items) {
            if (seen.add(item)) sorted.add(item);
        }
        sorted.sort(Comparator.comparing(TimeSeriesEntry::time)); // List.sort is stable
        return new TimeIndex<>(sorted);
    }

    @SuppressWarnings("unchecked")
    public static <H> TimeIndex<H> empty() {
        return (TimeIndex<H>) EMPTY;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public TimeSeriesEntry<H> get(int i) {
        return entries.get(i);
    }

    public List<TimeSeriesEntry<H>> entries() {
        return entries;
    }

    /**
     * Leftmost position at which {@code t} could be inserted while keeping the order:
     * every entry before it is strictly earlier than {@code t}.
     */
    public int insertionPoint(Instant t) {
        int lo = 0;
        int hi = times.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (times[mid].isBefore(t)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    @Override
    public String toString() {
        if (entries.isEmpty()) return "TimeIndex[]";
        return "TimeIndex[" + entries.size() + " entries, " + times[0] + " .. " + times[times.length - 1] + "]";
    }
}
