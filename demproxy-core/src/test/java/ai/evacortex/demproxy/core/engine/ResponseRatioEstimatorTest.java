/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.engine;

import ai.evacortex.demproxy.core.Channel;
import ai.evacortex.demproxy.core.DemTestUtils;
import ai.evacortex.demproxy.core.ResponseTable;
import ai.evacortex.demproxy.core.exceptions.ZeroNormalizationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static ai.evacortex.demproxy.core.DemTestUtils.channels;
import static org.junit.jupiter.api.Assertions.*;

public class ResponseRatioEstimatorTest {

    private static double[] grid() {
        double[] logT = new double[41];
        for (int i = 0; i < logT.length; i++) logT[i] = 5.5 + 0.05 * i;
        return logT;
    }

    @Test
    void testEstimate_flatResponseGivesUnitRatio() {
        List<Channel> ch = channels(94, 171);
        ResponseTable t = DemTestUtils.constantTable(grid(), ch, 2.0, 3.0);
        RatioEstimate est = new ResponseRatioEstimator(t).estimate(6.3, 0.15, false, 6.6, ch);

        assertArrayEquals(new double[]{2.0, 3.0}, est.kbar(), 1e-12);
        assertArrayEquals(new double[]{1.0, 1.0}, est.ratios(), 1e-12);
        assertEquals(1.0, est.medianRatio().orElseThrow(), 1e-12);
        assertEquals(1.0, est.weightedRatio(new double[]{0.5, 0.5}), 1e-12);
    }

    @Test
    void testEstimate_peakedResponseAtT0IsBelowOne() {
        List<Channel> ch = channels(171);
        ResponseTable t = DemTestUtils.peakedTable(ch, 6.6);
        RatioEstimate est = new ResponseRatioEstimator(t).estimate(6.6, 0.15, false, 6.6, ch);
        double ratio = est.ratios()[0];
        assertTrue(ratio > 0 && ratio < 1, "ratio=" + ratio);
    }

    @Test
    void testEstimate_perTShiftsWeightToHotterSide() {
        List<Channel> ch = channels(94, 335);
        ResponseTable t = DemTestUtils.peakedTable(ch, 6.0, 7.0);
        ResponseRatioEstimator estimator = new ResponseRatioEstimator(t);
        RatioEstimate perLogT = estimator.estimate(6.5, 0.3, false, 6.5, ch);
        RatioEstimate perT = estimator.estimate(6.5, 0.3, true, 6.5, ch);
        assertTrue(perT.kbar()[1] > perLogT.kbar()[1]);
        assertTrue(perT.kbar()[0] < perLogT.kbar()[0]);
    }

    @Test
    void testEstimate_zeroResponseAtT0IsInfiniteAndExcludedFromMedian() {
        List<Channel> ch = channels(94, 171);
        double[] logT = grid();
        double[][] r = new double[logT.length][2];
        for (int i = 0; i < logT.length; i++) {
            r[i][0] = 1.0;
            r[i][1] = logT[i] < 6.0 ? 1.0 : 0.0;
        }
        RatioEstimate est = new ResponseRatioEstimator(new ResponseTable(logT, ch, r)).estimate(5.7, 0.1, false, 6.6, ch);
        assertTrue(Double.isInfinite(est.ratios()[1]));
        assertEquals(1.0, est.medianRatio().orElseThrow(), 1e-12);
        assertEquals(Double.POSITIVE_INFINITY, est.weightedRatio(new double[]{0.0, 1.0}));
    }

    @Test
    void testEstimate_vanishingDemThrows() {
        List<Channel> ch = channels(94);
        ResponseTable t = DemTestUtils.constantTable(grid(), ch, 1.0);
        assertThrows(ZeroNormalizationException.class,
                () -> new ResponseRatioEstimator(t).estimate(20.0, 0.1, false, 6.6, ch));
    }

    @Test
    void testAsMap_channelOrder() {
        List<Channel> ch = channels(211, 94);
        ResponseTable t = DemTestUtils.constantTable(grid(), ch, 1.0, 1.0);
        RatioEstimate est = new ResponseRatioEstimator(t).estimate(6.3, 0.15, false, 6.6, ch);
        assertEquals(ch, List.copyOf(est.asMap().keySet()));
    }
}
