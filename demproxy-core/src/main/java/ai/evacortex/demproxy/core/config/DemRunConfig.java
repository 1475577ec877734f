/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.config;

import ai.evacortex.demproxy.core.Channel;
import ai.evacortex.demproxy.core.combine.CombineOptions;

import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

/**
 * Settings of one map-production run. Built once, then handed to the orchestrator.
 */
public record DemRunConfig(
        Path inputRoot,                 // one directory per event
        Path outputRoot,                // receives <event>/dem_<stamp>.dmap
        Channel referenceChannel,       // its frames define the reference times
        List<Channel> channels,         // channels combined, in weight order
        Duration tolerance,             // max |t_match - t_ref|
        String event,                   // only this event; null for all
        int referenceIndex,             // only this reference frame; -1 for all
        CombineOptions combine,
        OutputFormat format,
        int workers,                    // <= 1 runs in the calling thread
        int chunkSize,                  // frames submitted per batch
        int frameCacheSize              // decoded frames kept in memory
) {
    public static final String PREFIX = "demproxy.";

    public static final List<Channel> DEFAULT_CHANNELS =
            List.of(Channel.of(94), Channel.of(131), Channel.of(171), Channel.of(193), Channel.of(211));

    public DemRunConfig {
        Objects.requireNonNull(inputRoot, "inputRoot must not be null");
        Objects.requireNonNull(outputRoot, "outputRoot must not be null");
        Objects.requireNonNull(referenceChannel, "referenceChannel must not be null");
        Objects.requireNonNull(tolerance, "tolerance must not be null");
        if (channels == null || channels.isEmpty()) {
            throw new IllegalArgumentException("At least one channel is required");
        }
        channels = List.copyOf(channels);
        if (event != null && event.isBlank()) event = null;
        if (combine == null) combine = CombineOptions.defaults();
        if (format == null) format = OutputFormat.RAW;
        if (chunkSize < 1) chunkSize = 1;
        if (frameCacheSize < 0) {
            throw new IllegalArgumentException("frameCacheSize must be >= 0");
        }
    }

    /**
     * Reads {@code demproxy.*} keys; a key missing from {@code props} falls back to the JVM
     * system property of the same name, then to the default.
     *
     * <pre>
     * demproxy.input               (required)
     * demproxy.output              (required)
     * demproxy.ref                 94
     * demproxy.channels            94,131,171,193,211
     * demproxy.tolerance           12   (seconds, fractional allowed)
     * demproxy.event               all events
     * demproxy.index               -1
     * demproxy.exposure            false
     * demproxy.response.logt       unset (no response division)
     * demproxy.clip                false
     * demproxy.scale               1.0
     * demproxy.format              raw
     * demproxy.workers             0
     * demproxy.chunk               10
     * demproxy.cache.frames        256
     * </pre>
     */
    public static DemRunConfig fromProperties(Properties props) {
        String input = get(props, "input", null);
        String output = get(props, "output", null);
        if (input == null || output == null) {
            throw new IllegalArgumentException("Both " + PREFIX + "input and " + PREFIX + "output are required");
        }
        String responseLogT = get(props, "response.logt", null);
        CombineOptions combine = new CombineOptions(
                Boolean.parseBoolean(get(props, "exposure", "false")),
                responseLogT == null || responseLogT.isBlank() ? Double.NaN : Double.parseDouble(responseLogT),
                Boolean.parseBoolean(get(props, "clip", "false")),
                Double.parseDouble(get(props, "scale", "1.0")));

        return new DemRunConfig(
                Path.of(input),
                Path.of(output),
                Channel.parse(get(props, "ref", "94")),
                parseChannels(get(props, "channels", null)),
                seconds(Double.parseDouble(get(props, "tolerance", "12"))),
                get(props, "event", null),
                Integer.parseInt(get(props, "index", "-1")),
                combine,
                OutputFormat.parse(get(props, "format", "raw")),
                Integer.parseInt(get(props, "workers", "0")),
                Integer.parseInt(get(props, "chunk", "10")),
                Integer.parseInt(get(props, "cache.frames", "256")));
    }

    public static List<Channel> parseChannels(String csv) {
        if (csv == null || csv.isBlank()) return DEFAULT_CHANNELS;
        List<Channel> out = new ArrayList<>();
        for (String part : csv.split(",")) {
            if (!part.isBlank()) out.add(Channel.parse(part));
        }
        return out;
    }

    public static Duration seconds(double seconds) {
        if (!Double.isFinite(seconds)) {
            throw new IllegalArgumentException("tolerance must be finite, got " + seconds);
        }
        return Duration.ofNanos(Math.round(seconds * 1e9));
    }

    public boolean parallel() {
        return workers > 1;
    }

    public boolean singleFrame() {
        return referenceIndex >= 0;
    }

    private static String get(Properties props, String key, String def) {
        String v = props.getProperty(PREFIX + key);
        if (v == null) v = System.getProperty(PREFIX + key);
        return v != null ? v.trim() : def;
    }
}
