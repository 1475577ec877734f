/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.exceptions;

public class WeightFileFormatException extends RuntimeException {
    public WeightFileFormatException(String message) {
        super("Malformed weight file: " + message);
    }

    public WeightFileFormatException(String message, Throwable cause) {
        super("Malformed weight file: " + message, cause);
    }
}
