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
import ai.evacortex.demproxy.core.WeightSet;
import ai.evacortex.demproxy.core.exceptions.ChannelConfigurationException;
import ai.evacortex.demproxy.core.exceptions.ZeroNormalizationException;
import ai.evacortex.demproxy.core.exceptions.ZeroResponseException;
import ai.evacortex.demproxy.core.math.*;
import org.apache.commons.math3.linear.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Derives DEM proxy weights from a {@link ResponseTable}.
 *
 * <p>Three regimes are supported, selected by {@link SolverOptions#mode()}:</p>
 * <ul>
 *     <li><b>linear</b>: {@code w = r/(r·r)} for the response vector {@code r} sampled at the
 *     target temperature, then rescaled so that {@code scale·(w·r) = 1};</li>
 *     <li><b>ridge</b>: solves {@code (G + λI)·w = r} with the measure-weighted Gram matrix
 *     {@code G = Rᵀ·diag(quad)·R} and {@code λ = ridge·trace(G)/n}; the result is used as is,
 *     without the rescaling step of the linear regime;</li>
 *     <li><b>Gaussian basis</b>: regresses the profile values at the requested bins on the
 *     channel intensities a family of Gaussian DEMs would produce, by least squares, ridge
 *     normal equations or non-negative least squares.</li>
 * </ul>
 *
 * <p>With {@code nonNegative} set, single-temperature weights are clamped at zero and rescaled
 * to {@code scale·(w·r) = 1}. A solver is immutable; {@link #solve} may be called concurrently.</p>
 */
public final class WeightSolver {

    private static final Logger LOG = LoggerFactory.getLogger(WeightSolver.class);

    public static final List<Double> DEFAULT_MULTI_BINS = List.of(6.4, 6.6, 6.8, 7.0);

    private final ResponseTable table;
    private final SolverOptions options;

    public WeightSolver(ResponseTable table, SolverOptions options) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public SolverOptions options() {
        return options;
    }

    /**
     * Weights for every requested bin, using the regime configured in the options.
     *
     * @param channels selected channels, in output order
     * @param bins     target log10(T) values
     */
    public WeightSet solve(List<Channel> channels, List<Double> bins) {
        validate(channels, bins);
        if (options.mode() == WeightMode.GAUSSIAN_BASIS) {
            return solveGaussian(channels, bins);
        }

        List<LinearSolution> solutions = new ArrayList<>(bins.size());
        for (double logT0 : bins) {
            solutions.add(solveAt(channels, logT0));
        }
        if (solutions.size() == 1) {
            LinearSolution s = solutions.get(0);
            return WeightSet.singleBin(s.logT(), channels, s.weights(), s.scale(),
                    options.mode(), options.nonNegative(), singleBinMetadata(s));
        }
        double[] binArr = new double[solutions.size()];
        double[][] rows = new double[solutions.size()][];
        double[] scales = new double[solutions.size()];
        for (int b = 0; b < solutions.size(); b++) {
            binArr[b] = solutions.get(b).logT();
            rows[b] = solutions.get(b).weights();
            scales[b] = solutions.get(b).scale();
        }
        return WeightSet.multiBin(binArr, channels, rows, scales, options.mode(), options.nonNegative(),
                multiBinMetadata(bins, channels));
    }

    /**
     * Single-temperature weights (linear or ridge, then the optional non-negative projection).
     *
     * @throws ZeroResponseException      if the response vector at {@code logT0} is zero (linear regime)
     * @throws ZeroNormalizationException if a rescaling product is zero
     */
    public LinearSolution solveAt(List<Channel> channels, double logT0) {
        validate(channels, List.of(logT0));
        double delta = resolveDeltaLogT();
        double scale = scaleAt(logT0);
        double[] r = table.responseAt(channels, logT0);

        double[] w;
        if (options.ridge() > 0) {
            RealMatrix gram = weightedGram(channels, delta);
            double lambda = options.ridge() * gram.getTrace() / Math.max(channels.size(), 1);
            w = LinearSolvers.solveRegularized(gram, lambda, new ArrayRealVector(r)).toArray();
            LOG.debug("ridge weights at logT={} (lambda={}): {}", logT0, lambda, Arrays.toString(w));
        } else {
            double denom = Quadrature.dot(r, r);
            if (denom == 0.0) {
                throw new ZeroResponseException(logT0);
            }
            w = new double[r.length];
            for (int j = 0; j < r.length; j++) w[j] = r[j] / denom;
            w = rescale(w, r, scale, "w·r = 0 at logT=" + logT0);
        }

        if (options.nonNegative()) {
            double[] clamped = new double[w.length];
            for (int j = 0; j < w.length; j++) clamped[j] = Math.max(0.0, w[j]);
            w = rescale(clamped, r, scale, "non-negative weights collapsed to zero at logT=" + logT0);
        }
        return new LinearSolution(logT0, w, scale);
    }

    /**
     * Gaussian-basis regression, one weight row per bin in ascending bin order.
     */
    public WeightSet solveGaussian(List<Channel> channels, List<Double> bins) {
        validate(channels, bins);
        GaussianBasisOptions g = options.gaussian() != null ? options.gaussian() : GaussianBasisOptions.defaults();

        double delta = resolveDeltaLogT();
        double[] logT = table.logT();
        double[] quad = options.convention().binMeasures(logT, delta);

        List<Double> sortedBins = new ArrayList<>(bins);
        Collections.sort(sortedBins);
        double[] binArr = sortedBins.stream().mapToDouble(Double::doubleValue).toArray();

        List<Double> centers = GaussianBasis.centerGrid(
                g.resolveMin(binArr[0]), g.resolveMax(binArr[binArr.length - 1]), g.resolveStep());
        GaussianBasis basis = GaussianBasis.build(logT, centers, g.sigmas(), g.normalization(), quad);

        RealMatrix intensities = intensities(basis, channels, quad);           // profiles × channels
        RealMatrix targets = new Array2DRowRealMatrix(basis.sampleAt(binArr), false); // profiles × bins
        RealMatrix gram = intensities.transpose().multiply(intensities);
        double lambda = options.ridge() > 0
                ? options.ridge() * gram.getTrace() / Math.max(channels.size(), 1)
                : 0.0;

        LOG.debug("gaussian basis: {} profiles, centers {}..{}, lambda={}",
                basis.size(), centers.isEmpty() ? null : centers.get(0),
                centers.isEmpty() ? null : centers.get(centers.size() - 1), lambda);

        double[][] rows = new double[binArr.length][];
        if (options.nonNegative()) {
            for (int b = 0; b < binArr.length; b++) {
                NonNegativeLeastSquares.Solution s =
                        NonNegativeLeastSquares.solve(intensities, targets.getColumnVector(b), lambda);
                if (!s.converged()) {
                    LOG.warn("NNLS for logT={} stopped after {} iterations without meeting the tolerance",
                            binArr[b], s.iterations());
                }
                rows[b] = s.toArray();
            }
        } else {
            RealMatrix w = options.ridge() > 0
                    ? LinearSolvers.solveRegularized(gram, lambda, intensities.transpose().multiply(targets))
                    : LinearSolvers.leastSquares(intensities, targets);               // channels × bins
            for (int b = 0; b < binArr.length; b++) rows[b] = w.getColumn(b);
        }

        double[] scales = new double[binArr.length];
        Arrays.fill(scales, Double.NaN);
        return WeightSet.multiBin(binArr, channels, rows, scales, WeightMode.GAUSSIAN_BASIS,
                options.nonNegative(), multiBinMetadata(sortedBins, channels));
    }

    /**
     * Bin width: the configured one, or the median spacing of the response grid.
     */
    public double resolveDeltaLogT() {
        return options.autoDeltaLogT() ? table.medianSpacing() : options.deltaLogT();
    }

    /**
     * Conversion from a DEM value at {@code logT0} to the emission measure of one bin.
     */
    public double scaleAt(double logT0) {
        return options.convention().binMeasure(logT0, resolveDeltaLogT());
    }

    private RealMatrix weightedGram(List<Channel> channels, double delta) {
        RealMatrix r = new Array2DRowRealMatrix(table.select(channels), false);   // logT × channels
        double[] quad = options.convention().binMeasures(table.logT(), delta);
        RealMatrix weighted = r.copy();
        for (int i = 0; i < quad.length; i++) {
            for (int j = 0; j < weighted.getColumnDimension(); j++) {
                weighted.multiplyEntry(i, j, quad[i]);
            }
        }
        return r.transpose().multiply(weighted);
    }

    private RealMatrix intensities(GaussianBasis basis, List<Channel> channels, double[] quad) {
        double[][] response = table.select(channels);
        double[][] profiles = basis.profiles();
        double[][] out = new double[profiles.length][channels.size()];
        for (int k = 0; k < profiles.length; k++) {
            for (int j = 0; j < channels.size(); j++) {
                double s = 0.0;
                for (int i = 0; i < quad.length; i++) {
                    s += profiles[k][i] * response[i][j] * quad[i];
                }
                out[k][j] = s;
            }
        }
        return new Array2DRowRealMatrix(out, false);
    }

    private static double[] rescale(double[] w, double[] r, double scale, String context) {
        double norm = scale * Quadrature.dot(w, r);
        if (norm == 0.0) {
            throw new ZeroNormalizationException(context);
        }
        double[] out = new double[w.length];
        for (int j = 0; j < w.length; j++) out[j] = w[j] / norm;
        return out;
    }

    private void validate(List<Channel> channels, List<Double> bins) {
        if (channels == null || channels.isEmpty()) {
            throw new ChannelConfigurationException("no channels selected");
        }
        if (new HashSet<>(channels).size() != channels.size()) {
            throw new ChannelConfigurationException("duplicate channel in " + channels);
        }
        if (bins == null || bins.isEmpty()) {
            throw new IllegalArgumentException("At least one logT bin is required");
        }
        table.requireChannels(channels);
    }

    private Map<String, String> singleBinMetadata(LinearSolution s) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("logt", Double.toString(s.logT()));
        putCommon(m);
        m.put("scale", String.format(Locale.ROOT, "%.8e", s.scale()));
        return m;
    }

    private Map<String, String> multiBinMetadata(List<Double> bins, List<Channel> channels) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("logt_list", bins.stream().map(String::valueOf).collect(Collectors.joining(",")));
        putCommon(m);
        m.put("channels", channels.stream().map(Channel::toString).collect(Collectors.joining(",")));
        if (options.mode() == WeightMode.GAUSSIAN_BASIS) {
            GaussianBasisOptions g = options.gaussian() != null ? options.gaussian() : GaussianBasisOptions.defaults();
            m.put("mode", WeightMode.GAUSSIAN_BASIS.key());
            m.put("normalize", g.normalization().key());
            m.put("sigmas", g.sigmas().stream().map(String::valueOf).collect(Collectors.joining(",")));
            m.put("gauss_min", g.centerMin() != null ? g.centerMin().toString() : "");
            m.put("gauss_max", g.centerMax() != null ? g.centerMax().toString() : "");
            m.put("gauss_step", g.centerStep() != null ? g.centerStep().toString() : "");
        }
        return m;
    }

    private void putCommon(Map<String, String> m) {
        m.put("delta_logt", options.autoDeltaLogT() ? "auto" : Double.toString(options.deltaLogT()));
        m.put("dem_per_logt", Boolean.toString(options.convention() == DemConvention.PER_LOG_T));
        m.put("ridge", Double.toString(options.ridge()));
        m.put("nonneg", Boolean.toString(options.nonNegative()));
    }
}
