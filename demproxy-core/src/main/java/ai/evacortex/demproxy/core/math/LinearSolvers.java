/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.math;

import ai.evacortex.demproxy.core.exceptions.DegenerateSystemException;
import org.apache.commons.math3.linear.*;
import org.apache.commons.math3.util.Precision;

/**
 * Dense linear solves used by the weight solver.
 */
public final class LinearSolvers {

    private LinearSolvers() {}

    /**
     * Minimum-norm least-squares solution of {@code A·X ≈ B} through the SVD pseudo-inverse.
     */
    public static RealMatrix leastSquares(RealMatrix a, RealMatrix b) {
        return new SingularValueDecomposition(a).getSolver().solve(b);
    }

    public static RealVector leastSquares(RealMatrix a, RealVector y) {
        return new SingularValueDecomposition(a).getSolver().solve(y);
    }

    /**
     * Solves {@code (G + λI)·X = B} with an LU factorization.
     *
     * @throws DegenerateSystemException if the regularized matrix is singular
     */
    public static RealMatrix solveRegularized(RealMatrix gram, double lambda, RealMatrix b) {
        try {
            return decompose(gram, lambda).getSolver().solve(b);
        } catch (SingularMatrixException e) {
            throw new DegenerateSystemException("regularized normal equations are singular (lambda=" + lambda + ")", e);
        }
    }

    public static RealVector solveRegularized(RealMatrix gram, double lambda, RealVector b) {
        try {
            return decompose(gram, lambda).getSolver().solve(b);
        } catch (SingularMatrixException e) {
            throw new DegenerateSystemException("regularized normal equations are singular (lambda=" + lambda + ")", e);
        }
    }

    /**
     * Largest singular value of {@code a}.
     */
    public static double spectralNorm(RealMatrix a) {
        return new SingularValueDecomposition(a).getNorm();
    }

    // pivot threshold relative to the matrix norm; response values are ~1e-24
    private static LUDecomposition decompose(RealMatrix gram, double lambda) {
        RealMatrix m = regularize(gram, lambda);
        double threshold = Precision.EPSILON * m.getRowDimension() * m.getNorm();
        return new LUDecomposition(m, threshold);
    }

    private static RealMatrix regularize(RealMatrix gram, double lambda) {
        if (!gram.isSquare()) {
            throw new IllegalArgumentException("Gram matrix must be square");
        }
        RealMatrix m = gram.copy();
        for (int i = 0; i < m.getRowDimension(); i++) {
            m.addToEntry(i, i, lambda);
        }
        return m;
    }
}
