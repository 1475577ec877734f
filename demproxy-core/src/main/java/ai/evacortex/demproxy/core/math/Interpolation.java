/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.math;

/**
 * Piecewise-linear interpolation on an ascending abscissa. Queries outside the grid take the
 * value of the nearest end point.
 */
public final class Interpolation {

    private Interpolation() {}

    public static double interp(double x, double[] xp, double[] fp) {
        if (xp.length == 0 || xp.length != fp.length) {
            throw new IllegalArgumentException("xp and fp must be non-empty and of equal length");
        }
        int n = xp.length;
        if (x <= xp[0]) return fp[0];
        if (x >= xp[n - 1]) return fp[n - 1];

        // first index with xp[hi] > x
        int lo = 0;
        int hi = n - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (xp[mid] <= x) lo = mid;
            else hi = mid;
        }
        double span = xp[hi] - xp[lo];
        if (span == 0.0) return fp[hi];
        double t = (x - xp[lo]) / span;
        return fp[lo] + t * (fp[hi] - fp[lo]);
    }

    public static double[] interp(double[] x, double[] xp, double[] fp) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) out[i] = interp(x[i], xp, fp);
        return out;
    }
}
