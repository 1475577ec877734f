/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.combine;

import ai.evacortex.demproxy.core.Channel;
import ai.evacortex.demproxy.core.PixelMap;

import java.time.Instant;

public class NoOpFrameTracer implements FrameTracer {
    @Override
    public void exposure(String event, Channel channel, Instant referenceTime, double seconds) {
        // no-op
    }

    @Override
    public void combined(String event, Instant referenceTime, PixelMap map) {
        // no-op
    }
}
