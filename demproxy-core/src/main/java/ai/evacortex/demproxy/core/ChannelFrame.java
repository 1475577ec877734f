/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A decoded channel frame together with its exposure metadata, when the source has any.
 */
public record ChannelFrame(PixelMap map, OptionalDouble exposureSeconds) {
    public ChannelFrame {
        Objects.requireNonNull(map, "map must not be null");
        Objects.requireNonNull(exposureSeconds, "exposureSeconds must not be null");
    }

    public static ChannelFrame withoutExposure(PixelMap map) {
        return new ChannelFrame(map, OptionalDouble.empty());
    }

    public static ChannelFrame withExposure(PixelMap map, double seconds) {
        return new ChannelFrame(map, OptionalDouble.of(seconds));
    }
}
