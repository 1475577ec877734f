/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.math;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class NonNegativeLeastSquaresTest {

    @Test
    void testSolve_feasibleExactSolutionIsKept() {
        RealMatrix a = new Array2DRowRealMatrix(new double[][]{{1, 1}, {1, 2}, {1, 3}});
        RealVector y = a.operate(new ArrayRealVector(new double[]{2, 3}));

        NonNegativeLeastSquares.Solution s = NonNegativeLeastSquares.solve(a, y, 0.0);
        assertArrayEquals(new double[]{2, 3}, s.toArray(), 1e-9);
        assertTrue(s.converged());
    }

    @Test
    void testSolve_negativeComponentIsProjected() {
        RealMatrix a = new Array2DRowRealMatrix(new double[][]{{1, 0}, {0, 1}});
        RealVector y = new ArrayRealVector(new double[]{1, -1});

        NonNegativeLeastSquares.Solution s = NonNegativeLeastSquares.solve(a, y, 0.0);
        assertArrayEquals(new double[]{1, 0}, s.toArray(), 1e-12);
        assertTrue(s.converged());
        assertEquals(1, s.iterations());
    }

    @Test
    void testSolve_resultNeverNegative_randomized() {
        Random rnd = new Random(7);
        for (int trial = 0; trial < 50; trial++) {
            double[][] m = new double[8][3];
            double[] v = new double[8];
            for (int i = 0; i < 8; i++) {
                for (int j = 0; j < 3; j++) m[i][j] = rnd.nextGaussian();
                v[i] = rnd.nextGaussian();
            }
            NonNegativeLeastSquares.Solution s = NonNegativeLeastSquares.solve(
                    new Array2DRowRealMatrix(m), new ArrayRealVector(v), 0.1 * rnd.nextDouble());
            for (double w : s.toArray()) assertTrue(w >= 0.0, "trial " + trial);
        }
    }

    @Test
    void testSolve_iterationLimitReportedAsNotConverged() {
        RealMatrix a = new Array2DRowRealMatrix(new double[][]{{1, 0.999}, {0.999, 1}, {0.5, -0.5}});
        RealVector y = new ArrayRealVector(new double[]{1, -2, 3});
        NonNegativeLeastSquares.Solution s = NonNegativeLeastSquares.solve(a, y, 0.0, 1, 0.0);
        assertEquals(1, s.iterations());
        assertFalse(s.converged());
    }
}
