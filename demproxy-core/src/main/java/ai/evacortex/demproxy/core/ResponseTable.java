/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core;

import ai.evacortex.demproxy.core.exceptions.ChannelConfigurationException;
import ai.evacortex.demproxy.core.exceptions.InvalidResponseTableException;
import ai.evacortex.demproxy.core.math.Interpolation;
import ai.evacortex.demproxy.core.math.Quadrature;

import java.util.*;

/**
 * Immutable instrument temperature response: {@code response[i][j]} is the sensitivity of
 * channel {@code channels[j]} to plasma at {@code logT[i]}.
 *
 * <p>The temperature axis is held in ascending order; a table supplied with an unordered axis
 * is sorted on construction with its rows permuted alongside. Instances are safe to share
 * between threads.</p>
 */
public final class ResponseTable {

    private final double[] logT;
    private final List<Channel> channels;
    private final double[][] columns;           // columns[j][i], one array per channel
    private final Map<Channel, Integer> columnIndex;

    public ResponseTable(double[] logT, List<Channel> channels, double[][] response) {
        if (logT == null || logT.length == 0) {
            throw new InvalidResponseTableException("empty logT axis");
        }
        if (channels == null || channels.isEmpty()) {
            throw new InvalidResponseTableException("no channels");
        }
        if (response == null || response.length != logT.length) {
            throw new InvalidResponseTableException("response has " + (response == null ? 0 : response.length)
                    + " rows, expected " + logT.length + " (one per logT sample)");
        }
        Map<Channel, Integer> idx = new LinkedHashMap<>();
        for (int j = 0; j < channels.size(); j++) {
            if (idx.put(channels.get(j), j) != null) {
                throw new InvalidResponseTableException("duplicate channel " + channels.get(j));
            }
        }
        for (int i = 0; i < logT.length; i++) {
            if (!Double.isFinite(logT[i])) {
                throw new InvalidResponseTableException("non-finite logT at row " + i);
            }
            if (response[i] == null || response[i].length != channels.size()) {
                throw new InvalidResponseTableException("row " + i + " has "
                        + (response[i] == null ? 0 : response[i].length) + " columns, expected " + channels.size());
            }
        }

        Integer[] order = new Integer[logT.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble(i -> logT[i]));

        this.logT = new double[logT.length];
        this.columns = new double[channels.size()][logT.length];
        for (int r = 0; r < order.length; r++) {
            int src = order[r];
            this.logT[r] = logT[src];
            for (int j = 0; j < channels.size(); j++) {
                columns[j][r] = response[src][j];
            }
        }
        this.channels = List.copyOf(channels);
        this.columnIndex = Collections.unmodifiableMap(idx);
    }

    public double[] logT() {
        return logT.clone();
    }

    public List<Channel> channels() {
        return channels;
    }

    public boolean contains(Channel channel) {
        return columnIndex.containsKey(channel);
    }

    /**
     * @throws ChannelConfigurationException if the channel has no response column
     */
    public int columnOf(Channel channel) {
        Integer j = columnIndex.get(channel);
        if (j == null) {
            throw new ChannelConfigurationException("channel " + channel + " not in response table");
        }
        return j;
    }

    public double[] column(Channel channel) {
        return columns[columnOf(channel)].clone();
    }

    public double value(int row, Channel channel) {
        return columns[columnOf(channel)][row];
    }

    /**
     * Response of {@code channel} linearly interpolated at {@code targetLogT}.
     */
    public double responseAt(Channel channel, double targetLogT) {
        return Interpolation.interp(targetLogT, logT, columns[columnOf(channel)]);
    }

    public double[] responseAt(List<Channel> selected, double targetLogT) {
        double[] r = new double[selected.size()];
        for (int j = 0; j < r.length; j++) r[j] = responseAt(selected.get(j), targetLogT);
        return r;
    }

    /**
     * Sub-matrix {@code [logT × selected]}, columns in the order given.
     */
    public double[][] select(List<Channel> selected) {
        double[][] out = new double[logT.length][selected.size()];
        for (int j = 0; j < selected.size(); j++) {
            double[] col = columns[columnOf(selected.get(j))];
            for (int i = 0; i < logT.length; i++) out[i][j] = col[i];
        }
        return out;
    }

    /**
     * Median spacing of the temperature axis, the default bin width.
     */
    public double medianSpacing() {
        if (logT.length < 2) {
            throw new InvalidResponseTableException("need at least 2 logT points to infer delta_logt");
        }
        return Quadrature.medianSpacing(logT);
    }

    /**
     * Verifies that every requested channel has a response column.
     *
     * @throws ChannelConfigurationException naming the first missing channel
     */
    public void requireChannels(Collection<Channel> requested) {
        for (Channel c : requested) columnOf(c);
    }

    /**
     * Row-major copy of the response matrix, {@code [logT][channel]}.
     */
    public double[][] toMatrix() {
        double[][] out = new double[logT.length][channels.size()];
        for (int j = 0; j < channels.size(); j++) {
            for (int i = 0; i < logT.length; i++) out[i][j] = columns[j][i];
        }
        return out;
    }

    @Override
    public String toString() {
        return "ResponseTable[" + logT.length + " logT samples " + logT[0] + ".." + logT[logT.length - 1]
                + ", channels=" + channels + "]";
    }
}
