/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.math;

import org.apache.commons.math3.stat.descriptive.rank.Median;

public final class Quadrature {

    private Quadrature() {}

    /**
     * Trapezoidal integral of {@code y} over the ascending grid {@code x}.
     */
    public static double trapezoid(double[] y, double[] x) {
        if (y.length != x.length) {
            throw new IllegalArgumentException("y and x must have equal length");
        }
        double sum = 0.0;
        for (int i = 1; i < x.length; i++) {
            sum += 0.5 * (y[i] + y[i - 1]) * (x[i] - x[i - 1]);
        }
        return sum;
    }

    /**
     * Median of the successive differences of {@code grid}.
     *
     * @throws IllegalArgumentException if the grid has fewer than two points
     */
    public static double medianSpacing(double[] grid) {
        if (grid.length < 2) {
            throw new IllegalArgumentException("Need at least 2 logT points to infer delta_logt.");
        }
        double[] diffs = new double[grid.length - 1];
        for (int i = 1; i < grid.length; i++) diffs[i - 1] = grid[i] - grid[i - 1];
        return new Median().evaluate(diffs);
    }

    public static double dot(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Length mismatch: " + a.length + " vs " + b.length);
        }
        double s = 0.0;
        for (int i = 0; i < a.length; i++) s += a[i] * b[i];
        return s;
    }
}
