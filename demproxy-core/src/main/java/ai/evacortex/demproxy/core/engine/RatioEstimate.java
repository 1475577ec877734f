/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.engine;

import ai.evacortex.demproxy.core.Channel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Proxy bias of each channel for one trial DEM.
 *
 * @param channels    channels in evaluation order
 * @param kbar        DEM-weighted mean response per channel
 * @param kAtT0       response at the proxy temperature per channel
 * @param ratios      {@code kbar / kAtT0}, infinite where {@code kAtT0 == 0}
 * @param medianRatio median of the finite ratios, empty if there are none
 */
public record RatioEstimate(List<Channel> channels,
                            double[] kbar,
                            double[] kAtT0,
                            double[] ratios,
                            OptionalDouble medianRatio) {

    public Map<Channel, Double> asMap() {
        Map<Channel, Double> out = new LinkedHashMap<>();
        for (int j = 0; j < channels.size(); j++) out.put(channels.get(j), ratios[j]);
        return out;
    }

    /**
     * {@code (w·kbar)/(w·kAtT0)} for a weight row in channel order; infinite when the denominator is zero.
     */
    public double weightedRatio(double[] weights) {
        if (weights.length != channels.size()) {
            throw new IllegalArgumentException("Expected " + channels.size() + " weights, got " + weights.length);
        }
        double num = 0.0, den = 0.0;
        for (int j = 0; j < weights.length; j++) {
            num += weights[j] * kbar[j];
            den += weights[j] * kAtT0[j];
        }
        return den != 0.0 ? num / den : Double.POSITIVE_INFINITY;
    }
}
