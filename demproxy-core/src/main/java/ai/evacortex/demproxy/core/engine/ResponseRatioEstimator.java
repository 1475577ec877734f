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
import ai.evacortex.demproxy.core.ResponseTable;
import ai.evacortex.demproxy.core.exceptions.ZeroNormalizationException;
import ai.evacortex.demproxy.core.math.GaussianBasis;
import ai.evacortex.demproxy.core.math.Interpolation;
import ai.evacortex.demproxy.core.math.Quadrature;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Estimates how far a single-temperature proxy is biased for a Gaussian DEM.
 *
 * <p>For each channel, {@code Kbar = ∫R·DEM dlogT / ∫DEM dlogT} is compared with {@code K(T0)}, the
 * response at the proxy temperature. Integrals use the trapezoid rule on the ascending table axis.</p>
 */
public final class ResponseRatioEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseRatioEstimator.class);

    private final ResponseTable table;

    public ResponseRatioEstimator(ResponseTable table) {
        this.table = table;
    }

    /**
     * @param mu       DEM center in log10(T)
     * @param sigma    DEM width in log10(T), must be positive
     * @param perT     the Gaussian is a DEM per unit T; it is converted to per logT before integrating
     * @param logT0    proxy temperature
     * @param channels channels to evaluate
     * @throws ZeroNormalizationException if the DEM integrates to zero
     */
    public RatioEstimate estimate(double mu, double sigma, boolean perT, double logT0, List<Channel> channels) {
        table.requireChannels(channels);
        double[] logT = table.logT();
        double[] dem = GaussianBasis.gaussian(logT, mu, sigma);
        if (perT) {
            for (int i = 0; i < dem.length; i++) dem[i] *= Math.log(10.0) * Math.pow(10.0, logT[i]);
        }
        double denom = Quadrature.trapezoid(dem, logT);
        if (denom == 0.0) {
            throw new ZeroNormalizationException("DEM integral is zero for mu=" + mu + ", sigma=" + sigma);
        }

        int n = channels.size();
        double[] kbar = new double[n];
        double[] kt0 = new double[n];
        double[] ratios = new double[n];
        double[] product = new double[logT.length];
        for (int j = 0; j < n; j++) {
            double[] r = table.column(channels.get(j));
            for (int i = 0; i < logT.length; i++) product[i] = r[i] * dem[i];
            kbar[j] = Quadrature.trapezoid(product, logT) / denom;
            kt0[j] = Interpolation.interp(logT0, logT, r);
            ratios[j] = kt0[j] != 0.0 ? kbar[j] / kt0[j] : Double.POSITIVE_INFINITY;
            LOG.debug("{}: Kbar={} K(T0)={} ratio={}", channels.get(j), kbar[j], kt0[j], ratios[j]);
        }

        double[] finite = Arrays.stream(ratios).filter(Double::isFinite).toArray();
        OptionalDouble median = finite.length > 0
                ? OptionalDouble.of(new Median().evaluate(finite))
                : OptionalDouble.empty();
        return new RatioEstimate(List.copyOf(channels), kbar, kt0, ratios, median);
    }
}
