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
import ai.evacortex.demproxy.core.engine.RatioEstimate;
import ai.evacortex.demproxy.core.engine.ResponseRatioEstimator;
import ai.evacortex.demproxy.core.io.RatioFileCodec;
import ai.evacortex.demproxy.core.io.ResponseTableStore;
import ai.evacortex.demproxy.core.io.WeightFileCodec;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.*;

/**
 * {@code ratios}: proxy bias {@code Kbar/K(T0)} per channel for a Gaussian DEM.
 */
final class RatiosCommand {

    static final Set<String> SWITCHES = Set.of("dem-per-t");

    private final PrintStream out;

    RatiosCommand(PrintStream out) {
        this.out = out;
    }

    int run(CliArgs args) {
        ResponseTable table = ResponseTableStore.load(Path.of(args.require("response")));
        List<Channel> channels = UsageException.interpret(() -> DemRunConfig.parseChannels(args.get("channels", null)));
        WeightSet weights = null;
        if (args.has("weights-file")) {
            weights = WeightFileCodec.read(Path.of(args.get("weights-file", null))).toWeightSet();
            channels = weights.channels();
        }

        double logT0 = args.getDouble("logt0", 6.6);
        double mu = args.getDouble("mu", 6.3);
        double sigma = args.getDouble("sigma", 0.15);
        boolean perT = args.flag("dem-per-t");
        RatioEstimate est = new ResponseRatioEstimator(table).estimate(mu, sigma, perT, logT0, channels);

        out.println("logT0=" + logT0 + "  mu=" + mu + "  sigma=" + sigma);
        out.println("DEM weighting: " + (perT ? "per dT" : "per dlogT"));
        for (int j = 0; j < channels.size(); j++) {
            out.printf(Locale.ROOT, "%s: Kbar=%.3e  K(T0)=%.3e  ratio=%.3e%n",
                    channels.get(j), est.kbar()[j], est.kAtT0()[j], est.ratios()[j]);
        }
        est.medianRatio().ifPresent(m -> out.printf(Locale.ROOT, "Median ratio: %.3e%n", m));

        if (args.has("save")) {
            Map<String, String> header = new LinkedHashMap<>();
            header.put("logt0", Double.toString(logT0));
            header.put("mu", Double.toString(mu));
            header.put("sigma", Double.toString(sigma));
            header.put("dem_per_t", Boolean.toString(perT));
            StringJoiner ch = new StringJoiner(",");
            channels.forEach(c -> ch.add(c.toString()));
            header.put("channels", ch.toString());
            Path path = Path.of(args.get("save", null));
            RatioFileCodec.write(path, est, header);
            out.println("Saved ratios to " + path);
        }

        if (weights != null) {
            out.println("Weighted proxy ratios (Kbar_w / Kt0_w):");
            for (int b = 0; b < weights.binCount(); b++) {
                double bin = weights.bin(b);
                out.printf(Locale.ROOT, "  logT=%s: ratio=%.3e%n",
                        Double.isNaN(bin) ? "file" : Double.toString(bin), est.weightedRatio(weights.row(b)));
            }
        }
        return 0;
    }
}
