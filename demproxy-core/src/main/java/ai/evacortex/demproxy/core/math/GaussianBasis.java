/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.math;

import java.util.ArrayList;
import java.util.List;

/**
 * Family of Gaussian temperature profiles sampled on a log-temperature grid.
 * Row {@code k} of {@link #profiles()} is the profile for the {@code k}-th (center, sigma)
 * pair, centers varying slowest.
 */
public final class GaussianBasis {

    private final double[] logT;
    private final double[][] profiles;

    private GaussianBasis(double[] logT, double[][] profiles) {
        this.logT = logT;
        this.profiles = profiles;
    }

    /**
     * @param logT          ascending temperature grid
     * @param centers       profile centers in log10(T)
     * @param sigmas        profile widths in log10(T), all positive
     * @param normalization how each profile is scaled
     * @param binMeasures   per-grid-point integration measure, used by {@link BasisNormalization#AREA}
     */
    public static GaussianBasis build(double[] logT,
                                      List<Double> centers,
                                      List<Double> sigmas,
                                      BasisNormalization normalization,
                                      double[] binMeasures) {
        if (centers.isEmpty() || sigmas.isEmpty()) {
            throw new IllegalArgumentException("Gaussian basis needs at least one center and one sigma");
        }
        List<double[]> rows = new ArrayList<>(centers.size() * sigmas.size());
        for (double mu : centers) {
            for (double sigma : sigmas) {
                rows.add(profile(logT, mu, sigma, normalization, binMeasures));
            }
        }
        return new GaussianBasis(logT.clone(), rows.toArray(new double[0][]));
    }

    public static double[] gaussian(double[] logT, double mu, double sigma) {
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("sigma must be > 0");
        }
        double[] g = new double[logT.length];
        for (int i = 0; i < logT.length; i++) {
            double z = (logT[i] - mu) / sigma;
            g[i] = Math.exp(-0.5 * z * z);
        }
        return g;
    }

    private static double[] profile(double[] logT, double mu, double sigma,
                                    BasisNormalization normalization, double[] binMeasures) {
        double[] g = gaussian(logT, mu, sigma);
        double divisor = switch (normalization) {
            case MAX -> {
                double peak = Double.NEGATIVE_INFINITY;
                for (double v : g) peak = Math.max(peak, v);
                yield peak;
            }
            case AREA -> Quadrature.dot(g, binMeasures);
            case NONE -> 1.0;
        };
        if (divisor > 0 && divisor != 1.0) {
            for (int i = 0; i < g.length; i++) g[i] /= divisor;
        }
        return g;
    }

    /**
     * Evenly spaced centers from {@code min} to {@code max} inclusive (with a 1e-6 allowance
     * at the upper end) in steps of {@code step}.
     */
    public static List<Double> centerGrid(double min, double max, double step) {
        if (!(step > 0)) {
            throw new IllegalArgumentException("Gaussian center step must be > 0");
        }
        int count = (int) Math.ceil((max + 1e-6 - min) / step);
        List<Double> centers = new ArrayList<>(Math.max(count, 0));
        for (int i = 0; i < count; i++) centers.add(min + i * step);
        return centers;
    }

    public int size() {
        return profiles.length;
    }

    public double[][] profiles() {
        return profiles;
    }

    public double[] logT() {
        return logT;
    }

    /**
     * Profile values sampled at the requested temperatures, one row per profile.
     */
    public double[][] sampleAt(double[] logTPoints) {
        double[][] out = new double[profiles.length][];
        for (int k = 0; k < profiles.length; k++) {
            out[k] = Interpolation.interp(logTPoints, logT, profiles[k]);
        }
        return out;
    }
}
