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
import ai.evacortex.demproxy.core.WeightSet;
import ai.evacortex.demproxy.core.exceptions.ChannelConfigurationException;
import ai.evacortex.demproxy.core.exceptions.InvalidRatioException;
import ai.evacortex.demproxy.core.exceptions.MissingRatioException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-channel bias correction {@code w_new = w_old / ratio}.
 */
public final class RatioCorrection {

    private RatioCorrection() {}

    /**
     * Divides every row of {@code weights} by the channel ratios. The input is left untouched.
     *
     * @throws MissingRatioException if a channel of {@code weights} has no ratio
     * @throws InvalidRatioException if a ratio is not strictly positive
     */
    public static WeightSet apply(WeightSet weights, Map<Channel, Double> ratios) {
        List<Channel> channels = weights.channels();
        double[] divisors = new double[channels.size()];
        Map<Channel, Double> applied = new LinkedHashMap<>();
        for (int j = 0; j < channels.size(); j++) {
            Channel ch = channels.get(j);
            Double ratio = ratios.get(ch);
            if (ratio == null) {
                throw new MissingRatioException(ch);
            }
            if (!(ratio > 0)) {
                throw new InvalidRatioException(ch, ratio);
            }
            divisors[j] = ratio;
            applied.put(ch, ratio);
        }

        double[][] rows = new double[weights.binCount()][];
        for (int b = 0; b < rows.length; b++) {
            double[] row = weights.row(b);
            for (int j = 0; j < row.length; j++) row[j] /= divisors[j];
            rows[b] = row;
        }
        return weights.withCorrectedRows(rows, applied);
    }

    /**
     * Merges ratio sources: values read from a ratio file first, then an explicit list given in
     * channel order, which overrides the file.
     *
     * @param explicit list aligned with {@code channels}, or {@code null}
     */
    public static Map<Channel, Double> resolve(List<Channel> channels,
                                               Map<Channel, Double> fromFile,
                                               List<Double> explicit) {
        Map<Channel, Double> merged = new LinkedHashMap<>();
        if (fromFile != null) merged.putAll(fromFile);
        if (explicit != null) {
            if (explicit.size() != channels.size()) {
                throw new ChannelConfigurationException("ratio list has " + explicit.size()
                        + " values for " + channels.size() + " channels");
            }
            for (int j = 0; j < channels.size(); j++) merged.put(channels.get(j), explicit.get(j));
        }
        return merged;
    }
}
