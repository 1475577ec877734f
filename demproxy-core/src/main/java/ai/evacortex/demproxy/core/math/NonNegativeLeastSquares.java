/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.math;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Ridge-regularized non-negative least squares by projected gradient descent.
 *
 * <p>Minimizes {@code ½‖A·w − y‖² + ½λ‖w‖²} subject to {@code w ≥ 0}. The iteration starts from
 * the clamped unconstrained least-squares solution and repeats
 * {@code w ← max(0, w − step·(Aᵀ(A·w − y) + λ·w))} with {@code step = 1/(‖A‖₂² + λ)}.
 * It stops once the update norm drops below {@code tol·(‖w‖ + 1e-12)} or after
 * {@code maxIterations}; reaching the limit is not reported and the last iterate is returned.
 * This is a fixed-point projected-gradient scheme, not an active-set NNLS; with a handful of
 * channels it converges quickly.</p>
 */
public final class NonNegativeLeastSquares {

    public static final int DEFAULT_MAX_ITERATIONS = 1000;
    public static final double DEFAULT_TOLERANCE = 1e-8;

    private static final double NORM_FLOOR = 1e-12;

    private NonNegativeLeastSquares() {}

    public static Solution solve(RealMatrix a, RealVector y, double lambda) {
        return solve(a, y, lambda, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    public static Solution solve(RealMatrix a, RealVector y, double lambda, int maxIterations, double tol) {
        int n = a.getColumnDimension();
        if (a.getRowDimension() == 0 || n == 0) {
            return new Solution(new ArrayRealVector(n), 0, true);
        }

        RealVector w = clamp(LinearSolvers.leastSquares(a, y));
        double lipschitz = Math.pow(LinearSolvers.spectralNorm(a), 2) + lambda;
        if (lipschitz <= 0) {
            return new Solution(w, 0, true);
        }
        double step = 1.0 / lipschitz;
        RealMatrix at = a.transpose();

        for (int it = 1; it <= maxIterations; it++) {
            RealVector grad = at.operate(a.operate(w).subtract(y)).add(w.mapMultiply(lambda));
            RealVector next = clamp(w.subtract(grad.mapMultiply(step)));
            boolean converged = next.subtract(w).getNorm() <= tol * (w.getNorm() + NORM_FLOOR);
            w = next;
            if (converged) {
                return new Solution(w, it, true);
            }
        }
        return new Solution(w, maxIterations, false);
    }

    private static RealVector clamp(RealVector v) {
        RealVector out = v.copy();
        for (int i = 0; i < out.getDimension(); i++) {
            if (!(out.getEntry(i) > 0.0)) out.setEntry(i, 0.0);
        }
        return out;
    }

    /**
     * @param weights    the last iterate, element-wise non-negative
     * @param iterations gradient steps taken
     * @param converged  whether the update-norm criterion was met before the iteration limit
     */
    public record Solution(RealVector weights, int iterations, boolean converged) {
        public double[] toArray() {
            return weights.toArray();
        }
    }
}
