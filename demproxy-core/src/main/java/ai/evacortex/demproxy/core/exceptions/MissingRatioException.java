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

public class MissingRatioException extends RuntimeException {
    private final Channel channel;

    public MissingRatioException(Channel channel) {
        super("Missing ratio for channel " + channel);
        this.channel = channel;
    }

    public Channel channel() {
        return channel;
    }
}
