/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.align;

import ai.evacortex.demproxy.core.Channel;
import ai.evacortex.demproxy.core.MatchSet;
import ai.evacortex.demproxy.core.TimeSeriesEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Nearest-neighbour matcher across channel time series.
 *
 * <p>For every required channel the two neighbours of the reference time are considered:
 * the entry at the insertion point (the first entry at or after the reference) and the one
 * just before it. The closer one wins; on equal distance the entry at or after the reference
 * is kept. A match is returned only when every required channel has a winner within the
 * tolerance. Matching is a pure function of its inputs and may be called from any thread.</p>
 */
public final class Aligner<H> {

    private final Map<Channel, TimeIndex<H>> indices;
    private final List<Channel> required;

    public Aligner(Map<Channel, TimeIndex<H>> indices, List<Channel> required) {
        Objects.requireNonNull(indices, "indices must not be null");
        Objects.requireNonNull(required, "required channels must not be null");
        if (required.isEmpty()) {
            throw new IllegalArgumentException("At least one required channel is needed");
        }
        this.indices = Map.copyOf(indices);
        this.required = List.copyOf(required);
    }

    public TimeIndex<H> index(Channel channel) {
        TimeIndex<H> index = indices.get(channel);
        return index != null ? index : TimeIndex.empty();
    }

    /**
     * @param referenceTime the time to align on
     * @param tolerance     maximum accepted distance; a negative value behaves like zero
     * @return the complete match set, or empty if any channel is missing or out of tolerance
     */
    public Optional<MatchSet<H>> match(Instant referenceTime, Duration tolerance) {
        Objects.requireNonNull(referenceTime, "referenceTime must not be null");
        Duration limit = tolerance.isNegative() ? Duration.ZERO : tolerance;

        Map<Channel, TimeSeriesEntry<H>> matched = new LinkedHashMap<>();
        for (Channel channel : required) {
            Optional<TimeSeriesEntry<H>> nearest = nearest(index(channel), referenceTime);
            if (nearest.isEmpty()) return Optional.empty();

            TimeSeriesEntry<H> entry = nearest.get();
            if (distance(entry.time(), referenceTime).compareTo(limit) > 0) return Optional.empty();
            matched.put(channel, entry);
        }
        return Optional.of(new MatchSet<>(referenceTime, matched));
    }

    /**
     * Closest entry to {@code t}, preferring the entry at or after {@code t} on ties.
     */
    public static <H> Optional<TimeSeriesEntry<H>> nearest(TimeIndex<H> index, Instant t) {
        if (index.isEmpty()) return Optional.empty();

        int idx = index.insertionPoint(t);
        TimeSeriesEntry<H> best = null;
        Duration bestDelta = null;

        if (idx < index.size()) {
            best = index.get(idx);
            bestDelta = distance(best.time(), t);
        }
        if (idx > 0) {
            TimeSeriesEntry<H> before = index.get(idx - 1);
            Duration delta = distance(before.time(), t);
            if (best == null || delta.compareTo(bestDelta) < 0) {
                best = before;
            }
        }
        return Optional.ofNullable(best);
    }

    static Duration distance(Instant a, Instant b) {
        return Duration.between(a, b).abs();
    }
}
