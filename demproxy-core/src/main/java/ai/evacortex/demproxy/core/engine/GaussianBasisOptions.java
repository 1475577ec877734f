/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.engine;

import ai.evacortex.demproxy.core.math.BasisNormalization;

import java.util.List;

/**
 * Gaussian-basis settings. {@code null} bounds or step mean "derive from the requested bins":
 * {@code min(bins) − 0.4}, {@code max(bins) + 0.4} and a 0.1 dex step.
 */
public record GaussianBasisOptions(
        Double centerMin,
        Double centerMax,
        Double centerStep,
        List<Double> sigmas,
        BasisNormalization normalization
) {
    public static final double DEFAULT_MARGIN = 0.4;
    public static final double DEFAULT_STEP = 0.1;
    public static final double DEFAULT_SIGMA = 0.1;

    public GaussianBasisOptions {
        if (sigmas == null || sigmas.isEmpty()) {
            throw new IllegalArgumentException("At least one Gaussian sigma is required");
        }
        for (double s : sigmas) {
            if (!(s > 0)) throw new IllegalArgumentException("Gaussian sigma must be > 0, got " + s);
        }
        if (centerStep != null && !(centerStep > 0)) {
            throw new IllegalArgumentException("Gaussian center step must be > 0, got " + centerStep);
        }
        if (normalization == null) normalization = BasisNormalization.MAX;
        sigmas = List.copyOf(sigmas);
    }

    public static GaussianBasisOptions defaults() {
        return new GaussianBasisOptions(null, null, null, List.of(DEFAULT_SIGMA), BasisNormalization.MAX);
    }

    public double resolveMin(double minBin) {
        return centerMin != null ? centerMin : minBin - DEFAULT_MARGIN;
    }

    public double resolveMax(double maxBin) {
        return centerMax != null ? centerMax : maxBin + DEFAULT_MARGIN;
    }

    public double resolveStep() {
        return centerStep != null ? centerStep : DEFAULT_STEP;
    }
}
