/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.exceptions;

public class ChannelConfigurationException extends RuntimeException {
    public ChannelConfigurationException(String message) {
        super("Channel configuration: " + message);
    }

    public ChannelConfigurationException(String message, Throwable cause) {
        super("Channel configuration: " + message, cause);
    }
}
