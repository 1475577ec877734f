/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.combine;

/**
 * Pre-normalization and output settings of {@link FrameCombiner}.
 */
public record CombineOptions(
        boolean normalizeExposure,      // divide each channel by its exposure time (seconds)
        double responseLogT,            // divide by the channel response at this logT; NaN disables
        boolean clipInput,              // replace non-finite and negative inputs with 0
        double outputScale              // multiplies the combined map
) {
    public CombineOptions {
        if (!Double.isFinite(outputScale)) {
            throw new IllegalArgumentException("outputScale must be finite, got " + outputScale);
        }
    }

    public static CombineOptions defaults() {
        return new CombineOptions(false, Double.NaN, false, 1.0);
    }

    public boolean divideByResponse() {
        return !Double.isNaN(responseLogT);
    }
}
