/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.engine;

import java.util.Locale;

/**
 * Regression regime used to derive weights. Non-negativity is an independent flag that
 * applies on top of any mode (see {@link SolverOptions#nonNegative()}).
 */
public enum WeightMode {
    /** minimum-norm inversion at one temperature, renormalized so that {@code scale·(w·r) = 1} */
    LINEAR,
    /** ridge-regularized weighted normal equations at one temperature */
    RIDGE,
    /** joint regression against a family of Gaussian DEM profiles */
    GAUSSIAN_BASIS;

    public String key() {
        return switch (this) {
            case LINEAR -> "linear";
            case RIDGE -> "ridge";
            case GAUSSIAN_BASIS -> "gaussian";
        };
    }

    public static WeightMode parse(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (WeightMode m : values()) {
            if (m.key().equals(v)) return m;
        }
        throw new IllegalArgumentException("Unknown weight mode '" + value + "'");
    }
}
