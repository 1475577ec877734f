/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;

/**
 * Entry point: {@code demproxy <weights|maps|ratios|em> [--option value ...]}.
 */
public final class DemProxyCli {

    private static final Logger LOG = LoggerFactory.getLogger(DemProxyCli.class);

    static final String USAGE = String.join("\n",
            "Usage: demproxy <command> [options]",
            "  weights --response <table.json> [--channels 94,131,...] [--logt 6.6 | --logt-list a,b | --multi]",
            "          [--gaussian [--sigmas 0.1] [--gauss-min x] [--gauss-max x] [--gauss-step x] [--normalize max|area|none]]",
            "          [--delta-logt x] [--dem-per-logt] [--ridge x] [--nonneg] [--ratios a,b | --ratio-file f] [--save f]",
            "  maps    --input <root> --output <root> (--weights a,b,... | --weights-file f [--logt x])",
            "          [--channels ...] [--ref 94] [--tolerance 12] [--event name] [--index n] [--exposure]",
            "          [--response <table.json> --response-logt x] [--clip-input] [--scale x] [--format raw|annotated]",
            "          [--workers n] [--chunk n] [--cache n] [--show-exptime]",
            "  ratios  --response <table.json> [--channels ...] [--weights-file f] [--logt0 6.6] [--mu 6.3]",
            "          [--sigma 0.15] [--dem-per-t] [--save f]",
            "  em      --input <root> --output <root> [--volume] [--pixel-arcsec 0.6] [--trep 1e7] [--delta-logt 0.1]");

    private DemProxyCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.println(USAGE);
            return 2;
        }
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        try {
            switch (args[0]) {
                case "weights":
                    return new WeightsCommand(out).run(CliArgs.parse(rest, WeightsCommand.SWITCHES));
                case "maps":
                    return new MapsCommand(out).run(CliArgs.parse(rest, MapsCommand.SWITCHES));
                case "ratios":
                    return new RatiosCommand(out).run(CliArgs.parse(rest, RatiosCommand.SWITCHES));
                case "em":
                    return new EmCommand(out).run(CliArgs.parse(rest, EmCommand.SWITCHES));
                default:
                    err.println("Unknown command '" + args[0] + "'");
                    err.println(USAGE);
                    return 2;
            }
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 2;
        } catch (RuntimeException e) {
            LOG.error("{} failed", args[0], e);
            err.println(e.getMessage());
            return 1;
        }
    }
}
