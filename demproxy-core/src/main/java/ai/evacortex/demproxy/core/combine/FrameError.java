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

import java.time.Instant;

/**
 * A condition that makes a frame unusable and stops the run.
 */
public record FrameError(String event, Channel channel, Instant referenceTime, String reason) {

    public String describe() {
        return reason + " (event=" + event + ", channel=" + channel + ", t=" + referenceTime + ")";
    }
}
