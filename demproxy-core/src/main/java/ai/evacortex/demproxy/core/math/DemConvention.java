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
 * Convention of the DEM being approximated, which fixes the integration measure of a
 * temperature bin of width {@code Δ} in log10(T).
 */
public enum DemConvention {

    /** DEM per unit log10(T): a bin contributes {@code Δ}. */
    PER_LOG_T {
        @Override
        public double binMeasure(double logT, double deltaLogT) {
            return deltaLogT;
        }
    },

    /** DEM per unit T: a bin contributes {@code ln(10)·10^logT·Δ}. */
    PER_T {
        @Override
        public double binMeasure(double logT, double deltaLogT) {
            return Math.log(10.0) * Math.pow(10.0, logT) * deltaLogT;
        }
    };

    public abstract double binMeasure(double logT, double deltaLogT);

    public double[] binMeasures(double[] logT, double deltaLogT) {
        double[] out = new double[logT.length];
        for (int i = 0; i < logT.length; i++) out[i] = binMeasure(logT[i], deltaLogT);
        return out;
    }

    public static DemConvention fromPerLogT(boolean perLogT) {
        return perLogT ? PER_LOG_T : PER_T;
    }
}
