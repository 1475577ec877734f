/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core;

import ai.evacortex.demproxy.core.engine.WeightMode;

import java.util.*;

/**
 * Immutable per-channel weights, one row per temperature bin.
 *
 * <p>A single-temperature solve yields one row; multi-bin and Gaussian-basis solves yield one
 * row per requested bin. Ratio correction never alters an instance, it produces a new one
 * (see {@code RatioCorrection}). Free-form solver metadata travels with the weights so that a
 * weight file can be written back with the settings that produced it.</p>
 */
public final class WeightSet {

    public enum Layout { SINGLE_BIN, MULTI_BIN }

    private final List<Channel> channels;
    private final double[] bins;
    private final double[][] rows;
    private final double[] scales;
    private final WeightMode mode;
    private final boolean nonNegative;
    private final Map<String, String> metadata;
    private final Map<Channel, Double> ratios;

    private WeightSet(List<Channel> channels, double[] bins, double[][] rows, double[] scales,
                      WeightMode mode, boolean nonNegative,
                      Map<String, String> metadata, Map<Channel, Double> ratios) {
        Objects.requireNonNull(channels, "channels must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (channels.isEmpty()) {
            throw new IllegalArgumentException("WeightSet needs at least one channel");
        }
        if (new HashSet<>(channels).size() != channels.size()) {
            throw new IllegalArgumentException("Duplicate channel in " + channels);
        }
        if (bins.length == 0 || bins.length != rows.length || scales.length != rows.length) {
            throw new IllegalArgumentException("Expected one weight row and one scale per bin");
        }
        double[][] copy = new double[rows.length][];
        for (int b = 0; b < rows.length; b++) {
            if (rows[b].length != channels.size()) {
                throw new IllegalArgumentException("Row " + b + " has " + rows[b].length
                        + " weights for " + channels.size() + " channels");
            }
            copy[b] = rows[b].clone();
        }
        this.channels = List.copyOf(channels);
        this.bins = bins.clone();
        this.rows = copy;
        this.scales = scales.clone();
        this.mode = mode;
        this.nonNegative = nonNegative;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.ratios = Collections.unmodifiableMap(new LinkedHashMap<>(ratios));
    }

    public static WeightSet singleBin(double logT, List<Channel> channels, double[] weights, double scale,
                                      WeightMode mode, boolean nonNegative, Map<String, String> metadata) {
        return new WeightSet(channels, new double[]{logT}, new double[][]{weights}, new double[]{scale},
                mode, nonNegative, metadata, Map.of());
    }

    /**
     * @param scales per-bin scale, {@code NaN} where none applies (Gaussian basis)
     */
    public static WeightSet multiBin(double[] bins, List<Channel> channels, double[][] rows, double[] scales,
                                     WeightMode mode, boolean nonNegative, Map<String, String> metadata) {
        return new WeightSet(channels, bins, rows, scales, mode, nonNegative, metadata, Map.of());
    }

    /**
     * Weights for an externally supplied channel list, e.g. given on the command line.
     */
    public static WeightSet fixed(List<Channel> channels, double[] weights) {
        return new WeightSet(channels, new double[]{Double.NaN}, new double[][]{weights},
                new double[]{Double.NaN}, WeightMode.LINEAR, false, Map.of(), Map.of());
    }

    /**
     * Same weights with new rows and the ratios that produced them; everything else is kept.
     */
    public WeightSet withCorrectedRows(double[][] correctedRows, Map<Channel, Double> appliedRatios) {
        return new WeightSet(channels, bins, correctedRows, scales, mode, nonNegative, metadata, appliedRatios);
    }

    public Layout layout() {
        return (mode == WeightMode.GAUSSIAN_BASIS || bins.length > 1) ? Layout.MULTI_BIN : Layout.SINGLE_BIN;
    }

    public List<Channel> channels() {
        return channels;
    }

    public int binCount() {
        return bins.length;
    }

    public double[] bins() {
        return bins.clone();
    }

    public double bin(int b) {
        return bins[b];
    }

    public double[] row(int b) {
        return rows[b].clone();
    }

    public double scale(int b) {
        return scales[b];
    }

    /**
     * Row for the bin centred at {@code logT} (matched to 1e-9).
     */
    public double[] rowFor(double logT) {
        for (int b = 0; b < bins.length; b++) {
            if (Math.abs(bins[b] - logT) <= 1e-9) return row(b);
        }
        throw new IllegalArgumentException("No weight row for logT=" + logT + ", bins are " + Arrays.toString(bins));
    }

    /**
     * The only row of a single-bin weight set.
     */
    public double[] single() {
        if (rows.length != 1) {
            throw new IllegalStateException("WeightSet has " + rows.length + " bins; select one by logT");
        }
        return row(0);
    }

    public WeightMode mode() {
        return mode;
    }

    public boolean nonNegative() {
        return nonNegative;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public Map<Channel, Double> ratios() {
        return ratios;
    }

    public boolean ratioCorrected() {
        return !ratios.isEmpty();
    }

    @Override
    public String toString() {
        return "WeightSet[" + mode + (nonNegative ? "+nonneg" : "") + ", channels=" + channels
                + ", bins=" + Arrays.toString(bins) + "]";
    }
}
