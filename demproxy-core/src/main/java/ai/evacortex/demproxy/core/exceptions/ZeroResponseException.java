/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.exceptions;

/**
 * Thrown when the sampled response vector has zero norm, so no weight vector can reproduce it.
 */
public class ZeroResponseException extends RuntimeException {
    public ZeroResponseException(double logT) {
        super("Response vector is zero at logT=" + logT);
    }
}
