/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.cli;

import ai.evacortex.demproxy.core.Channel;
import ai.evacortex.demproxy.core.ResponseTable;
import ai.evacortex.demproxy.core.WeightSet;
import ai.evacortex.demproxy.core.config.DemRunConfig;
import ai.evacortex.demproxy.core.engine.*;
import ai.evacortex.demproxy.core.io.RatioFileCodec;
import ai.evacortex.demproxy.core.io.ResponseTableStore;
import ai.evacortex.demproxy.core.io.WeightFileCodec;
import ai.evacortex.demproxy.core.math.BasisNormalization;
import ai.evacortex.demproxy.core.math.DemConvention;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.*;

/**
 * {@code weights}: derives DEM proxy weights from a response table and optionally saves them.
 */
final class WeightsCommand {

    static final Set<String> SWITCHES = Set.of("multi", "gaussian", "dem-per-logt", "nonneg");

    private final PrintStream out;

    WeightsCommand(PrintStream out) {
        this.out = out;
    }

    int run(CliArgs args) {
        ResponseTable table = ResponseTableStore.load(Path.of(args.require("response")));
        List<Channel> channels = UsageException.interpret(() -> DemRunConfig.parseChannels(args.get("channels", null)));
        boolean gaussian = args.flag("gaussian");

        SolverOptions options = UsageException.interpret(() -> options(args, gaussian));

        List<Double> bins = args.getDoubles("logt-list");
        if (bins == null) {
            bins = (args.flag("multi") || gaussian)
                    ? WeightSolver.DEFAULT_MULTI_BINS
                    : List.of(args.getDouble("logt", 6.6));
        }

        WeightSet weights = new WeightSolver(table, options).solve(channels, bins);
        WeightSet original = weights;
        if (args.has("ratios") || args.has("ratio-file")) {
            Map<Channel, Double> fromFile = args.has("ratio-file")
                    ? RatioFileCodec.read(Path.of(args.get("ratio-file", null)))
                    : null;
            weights = RatioCorrection.apply(weights, RatioCorrection.resolve(channels, fromFile, args.getDoubles("ratios")));
        }

        print(options, original, weights);
        if (args.has("save")) {
            Path path = Path.of(args.get("save", null));
            WeightFileCodec.write(path, weights);
            out.println("Saved weights to " + path);
        }
        return 0;
    }

    private static SolverOptions options(CliArgs args, boolean gaussian) {
        GaussianBasisOptions basis = null;
        if (gaussian) {
            List<Double> sigmas = args.getDoubles("sigmas");
            if (sigmas == null) sigmas = List.of(GaussianBasisOptions.DEFAULT_SIGMA);
            basis = new GaussianBasisOptions(
                    args.getDoubleOrNull("gauss-min"),
                    args.getDoubleOrNull("gauss-max"),
                    args.getDoubleOrNull("gauss-step"),
                    sigmas,
                    BasisNormalization.parse(args.get("normalize", "max")));
        }
        return new SolverOptions(
                args.getDouble("delta-logt", 0.0),
                DemConvention.fromPerLogT(args.flag("dem-per-logt")),
                args.getDouble("ridge", 0.0),
                args.flag("nonneg"),
                basis);
    }

    private void print(SolverOptions options, WeightSet before, WeightSet after) {
        out.println("Channels: " + joined(after.channels()));
        out.println("delta_logT: " + (options.autoDeltaLogT() ? "auto" : options.deltaLogT()));
        out.println(options.convention() == DemConvention.PER_LOG_T ? "DEM per logT" : "DEM per T");
        if (options.ridge() > 0) out.println("Ridge: " + options.ridge());
        if (options.nonNegative()) out.println("Nonnegative weights: enabled");
        if (after.ratioCorrected()) {
            out.println("Ratio correction: w_new = w_old / ratio");
            after.ratios().forEach((ch, r) -> out.printf(Locale.ROOT, "  ratio %s: %.8e%n", ch, r));
        }
        for (int b = 0; b < after.binCount(); b++) {
            out.println("Weights logT=" + after.bin(b) + ":");
            if (!Double.isNaN(after.scale(b))) {
                out.printf(Locale.ROOT, "  scale (bin width): %.3e%n", after.scale(b));
            }
            double[] w0 = before.row(b);
            double[] w1 = after.row(b);
            for (int j = 0; j < w1.length; j++) {
                if (after.ratioCorrected()) {
                    out.printf(Locale.ROOT, "  %s: %.8e -> %.8e%n", after.channels().get(j), w0[j], w1[j]);
                } else {
                    out.printf(Locale.ROOT, "  %s: %.8e%n", after.channels().get(j), w1[j]);
                }
            }
        }
    }

    private static String joined(List<Channel> channels) {
        StringJoiner j = new StringJoiner(",");
        channels.forEach(c -> j.add(c.toString()));
        return j.toString();
    }
}
