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
import java.util.Objects;

/**
 * One time-stamped item of a channel time series. The handle is opaque to the aligner.
 */
public record TimeSeriesEntry<H>(Instant time, H handle) {
    public TimeSeriesEntry {
        Objects.requireNonNull(time, "time must not be null");
        Objects.requireNonNull(handle, "handle must not be null");
    }
}
