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
import ai.evacortex.demproxy.core.combine.FrameCombiner;
import ai.evacortex.demproxy.core.combine.FrameTracer;
import ai.evacortex.demproxy.core.combine.LoggingFrameTracer;
import ai.evacortex.demproxy.core.combine.NoOpFrameTracer;
import ai.evacortex.demproxy.core.config.DemRunConfig;
import ai.evacortex.demproxy.core.exceptions.ChannelConfigurationException;
import ai.evacortex.demproxy.core.io.*;
import ai.evacortex.demproxy.core.io.codec.PixelMapCodec;
import ai.evacortex.demproxy.core.pipeline.EventOrchestrator;
import ai.evacortex.demproxy.core.pipeline.FrameSource;
import ai.evacortex.demproxy.core.pipeline.RunReport;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * {@code maps}: combines aligned channel frames into DEM proxy maps.
 */
final class MapsCommand {

    static final Set<String> SWITCHES = Set.of("exposure", "clip-input", "show-exptime");

    // option name -> configuration key
    private static final Map<String, String> KEYS = Map.ofEntries(
            Map.entry("input", "input"),
            Map.entry("output", "output"),
            Map.entry("ref", "ref"),
            Map.entry("channels", "channels"),
            Map.entry("tolerance", "tolerance"),
            Map.entry("event", "event"),
            Map.entry("index", "index"),
            Map.entry("response-logt", "response.logt"),
            Map.entry("scale", "scale"),
            Map.entry("format", "format"),
            Map.entry("workers", "workers"),
            Map.entry("chunk", "chunk"),
            Map.entry("cache", "cache.frames"));

    private final PrintStream out;

    MapsCommand(PrintStream out) {
        this.out = out;
    }

    static Properties toProperties(CliArgs args) {
        Properties props = new Properties();
        KEYS.forEach((option, key) -> {
            if (args.has(option)) props.setProperty(DemRunConfig.PREFIX + key, args.get(option, null));
        });
        if (args.flag("exposure")) props.setProperty(DemRunConfig.PREFIX + "exposure", "true");
        if (args.flag("clip-input")) props.setProperty(DemRunConfig.PREFIX + "clip", "true");
        return props;
    }

    int run(CliArgs args) {
        DemRunConfig config = UsageException.interpret(() -> DemRunConfig.fromProperties(toProperties(args)));
        WeightSet weights = loadWeights(args, config.channels());

        ResponseTable responses = null;
        if (config.combine().divideByResponse()) {
            responses = ResponseTableStore.load(Path.of(args.require("response")));
        }
        FrameTracer tracer = args.flag("show-exptime") ? new LoggingFrameTracer() : new NoOpFrameTracer();
        FrameCombiner combiner = new FrameCombiner(weights.channels(), selectRow(args, weights),
                responses, config.combine(), tracer);

        FrameSource source = config.frameCacheSize() > 0
                ? new CachedFrameSource(new DmapFrameSource(), config.frameCacheSize())
                : new DmapFrameSource();
        RunReport report = new EventOrchestrator(config,
                new EventDirectoryScanner(PixelMapCodec.EXTENSION),
                source, combiner,
                new FileMapSink(config.outputRoot(), config.format())).run();
        out.printf("Events processed: %d, skipped: %d; maps written: %d; unmatched frames: %d%n",
                report.eventsProcessed(), report.eventsSkipped(), report.framesWritten(), report.framesUnmatched());
        if (source instanceof CachedFrameSource cache) {
            out.printf("Frame cache: %d hit(s), %d miss(es)%n", cache.hitCount(), cache.missCount());
            cache.close();
        }
        return 0;
    }

    private static WeightSet loadWeights(CliArgs args, List<Channel> channels) {
        if (args.has("weights")) {
            List<Double> values = args.getDoubles("weights");
            if (values.size() != channels.size()) {
                throw new ChannelConfigurationException(values.size() + " weights for " + channels.size() + " channels");
            }
            return WeightSet.fixed(channels, values.stream().mapToDouble(Double::doubleValue).toArray());
        }
        WeightSet w = WeightFileCodec.read(Path.of(args.require("weights-file"))).toWeightSet();
        if (!w.channels().equals(channels)) {
            throw new ChannelConfigurationException("weight file covers " + w.channels() + " but --channels is " + channels);
        }
        return w;
    }

    private static double[] selectRow(CliArgs args, WeightSet weights) {
        if (weights.binCount() == 1) return weights.single();
        Double logT = args.getDoubleOrNull("logt");
        if (logT == null) {
            throw new UsageException("Weight file has " + weights.binCount() + " bins; pick one with --logt");
        }
        return weights.rowFor(logT);
    }
}
