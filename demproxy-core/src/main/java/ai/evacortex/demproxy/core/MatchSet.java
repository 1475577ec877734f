/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete per-channel match for one reference time. Instances only exist when every
 * required channel matched within tolerance; there is no partial form.
 */
public final class MatchSet<H> {

    private final Instant referenceTime;
    private final Map<Channel, TimeSeriesEntry<H>> matches;

    public MatchSet(Instant referenceTime, Map<Channel, TimeSeriesEntry<H>> matches) {
        this.referenceTime = referenceTime;
        this.matches = Collections.unmodifiableMap(new LinkedHashMap<>(matches));
    }

    public Instant referenceTime() {
        return referenceTime;
    }

    public Map<Channel, TimeSeriesEntry<H>> matches() {
        return matches;
    }

    public H handle(Channel channel) {
        TimeSeriesEntry<H> entry = matches.get(channel);
        if (entry == null) {
            throw new IllegalArgumentException("Channel " + channel + " is not part of this match set");
        }
        return entry.handle();
    }

    public List<Channel> channels() {
        return List.copyOf(matches.keySet());
    }

    @Override
    public String toString() {
        return "MatchSet{" + referenceTime + ", " + matches.keySet() + "}";
    }
}
