/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.exceptions;

import ai.evacortex.demproxy.core.Channel;

public class InvalidRatioException extends RuntimeException {
    private final Channel channel;

    public InvalidRatioException(Channel channel, double ratio) {
        super("Invalid ratio for channel " + channel + ": " + ratio);
        this.channel = channel;
    }

    public Channel channel() {
        return channel;
    }
}
