/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.exceptions;

public class ZeroNormalizationException extends RuntimeException {
    public ZeroNormalizationException(String message) {
        super("Zero normalization: " + message);
    }

    public ZeroNormalizationException(String message, Throwable cause) {
        super("Zero normalization: " + message, cause);
    }
}
