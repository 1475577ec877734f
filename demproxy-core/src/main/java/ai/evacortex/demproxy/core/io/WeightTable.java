/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.io;

import ai.evacortex.demproxy.core.Channel;
import ai.evacortex.demproxy.core.WeightSet;
import ai.evacortex.demproxy.core.engine.WeightMode;
import ai.evacortex.demproxy.core.exceptions.WeightFileFormatException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Contents of a weight file, in whichever of the two layouts it was written.
 */
public sealed interface WeightTable permits WeightTable.SingleBin, WeightTable.MultiBin {

    List<Channel> channels();

    Map<String, String> metadata();

    WeightSet toWeightSet();

    /**
     * {@code channel,weight} rows.
     *
     * @param logT  from {@code logt=}, {@code NaN} if absent
     * @param scale from {@code scale=}, {@code NaN} if absent
     */
    record SingleBin(List<Channel> channels, double[] weights, double logT, double scale,
                     Map<String, String> metadata) implements WeightTable {
        @Override
        public WeightSet toWeightSet() {
            return WeightSet.singleBin(logT, channels, weights, scale, modeOf(metadata),
                    Boolean.parseBoolean(metadata.getOrDefault("nonneg", "false")), metadata);
        }
    }

    /**
     * {@code logT,channel,weight} rows, {@code rows[b][j]} for {@code bins[b]} and {@code channels[j]}.
     */
    record MultiBin(double[] bins, List<Channel> channels, double[][] rows,
                    Map<String, String> metadata) implements WeightTable {
        @Override
        public WeightSet toWeightSet() {
            double[] scales = new double[bins.length];
            Arrays.fill(scales, Double.NaN);
            return WeightSet.multiBin(bins, channels, rows, scales, modeOf(metadata),
                    Boolean.parseBoolean(metadata.getOrDefault("nonneg", "false")), metadata);
        }
    }

    private static WeightMode modeOf(Map<String, String> metadata) {
        if (WeightMode.GAUSSIAN_BASIS.key().equalsIgnoreCase(metadata.getOrDefault("mode", ""))) {
            return WeightMode.GAUSSIAN_BASIS;
        }
        try {
            return Double.parseDouble(metadata.getOrDefault("ridge", "0")) > 0 ? WeightMode.RIDGE : WeightMode.LINEAR;
        } catch (NumberFormatException e) {
            throw new WeightFileFormatException("ridge=" + metadata.get("ridge") + " is not a number", e);
        }
    }
}
