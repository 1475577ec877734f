/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core;

import java.util.Arrays;

/**
 * Row-major 2-D array of doubles.
 */
public record PixelMap(int rows, int cols, double[] values) {

    public PixelMap {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Map dimensions must be positive: " + rows + "x" + cols);
        }
        if (values == null || values.length != rows * cols) {
            throw new IllegalArgumentException("Expected " + (rows * cols) + " values for a "
                    + rows + "x" + cols + " map");
        }
    }

    public static PixelMap filled(int rows, int cols, double value) {
        double[] v = new double[rows * cols];
        Arrays.fill(v, value);
        return new PixelMap(rows, cols, v);
    }

    public double get(int row, int col) {
        return values[row * cols + col];
    }

    public int size() {
        return values.length;
    }

    public boolean sameShape(PixelMap other) {
        return rows == other.rows && cols == other.cols;
    }

    public PixelMap scaled(double factor) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = values[i] * factor;
        return new PixelMap(rows, cols, out);
    }
}
