/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.engine;

import ai.evacortex.demproxy.core.math.DemConvention;

/**
 * Settings of one weight derivation.
 */
public record SolverOptions(
        double deltaLogT,                   // bin width in log10(T); <= 0 uses the median grid spacing
        DemConvention convention,           // DEM per logT or per T
        double ridge,                       // ridge strength, 0 disables
        boolean nonNegative,                // force w >= 0
        GaussianBasisOptions gaussian       // null for single-temperature inversion
) {
    public SolverOptions {
        if (!Double.isFinite(deltaLogT)) {
            throw new IllegalArgumentException("deltaLogT must be finite");
        }
        if (!(ridge >= 0) || !Double.isFinite(ridge)) {
            throw new IllegalArgumentException("ridge must be a finite value >= 0, got " + ridge);
        }
        if (convention == null) convention = DemConvention.PER_T;
    }

    public static SolverOptions defaults() {
        return new SolverOptions(0.0, DemConvention.PER_T, 0.0, false, null);
    }

    public WeightMode mode() {
        if (gaussian != null) return WeightMode.GAUSSIAN_BASIS;
        return ridge > 0 ? WeightMode.RIDGE : WeightMode.LINEAR;
    }

    public boolean autoDeltaLogT() {
        return deltaLogT <= 0;
    }

    public SolverOptions withRidge(double value) {
        return new SolverOptions(deltaLogT, convention, value, nonNegative, gaussian);
    }

    public SolverOptions withNonNegative(boolean value) {
        return new SolverOptions(deltaLogT, convention, ridge, value, gaussian);
    }

    public SolverOptions withGaussian(GaussianBasisOptions value) {
        return new SolverOptions(deltaLogT, convention, ridge, nonNegative, value);
    }

    public SolverOptions withDeltaLogT(double value) {
        return new SolverOptions(value, convention, ridge, nonNegative, gaussian);
    }

    public SolverOptions withConvention(DemConvention value) {
        return new SolverOptions(deltaLogT, value, ridge, nonNegative, gaussian);
    }
}
