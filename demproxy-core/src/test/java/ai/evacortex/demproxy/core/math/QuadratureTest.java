/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class QuadratureTest {

    @Test
    void testTrapezoid_linearIsExact() {
        double[] x = {0.0, 0.5, 2.0};
        double[] y = {0.0, 1.0, 4.0};   // y = 2x
        assertEquals(4.0, Quadrature.trapezoid(y, x), 1e-12);
    }

    @Test
    void testMedianSpacing() {
        assertEquals(0.1, Quadrature.medianSpacing(new double[]{5.0, 5.1, 5.2, 5.5}), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> Quadrature.medianSpacing(new double[]{6.0}));
    }

    @Test
    void testDot() {
        assertEquals(32.0, Quadrature.dot(new double[]{1, 2, 3}, new double[]{4, 5, 6}));
        assertThrows(IllegalArgumentException.class, () -> Quadrature.dot(new double[1], new double[2]));
    }

    @Test
    void testBinMeasure() {
        assertEquals(0.1, DemConvention.PER_LOG_T.binMeasure(6.6, 0.1));
        assertEquals(Math.log(10) * Math.pow(10, 6.6) * 0.1, DemConvention.PER_T.binMeasure(6.6, 0.1), 1e-6);
        assertSame(DemConvention.PER_LOG_T, DemConvention.fromPerLogT(true));
    }
}
