/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.io;

import ai.evacortex.demproxy.core.Channel;
import ai.evacortex.demproxy.core.engine.RatioEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-channel ratio files. Two line shapes are recognized, the first one that matches wins:
 * <pre>
 * 94 Kbar=1.2e-27 K(T0)=3.4e-27 ratio=0.35   (inline)
 * 94,3.5e-01                                (pair)
 * </pre>
 * Lines starting with {@code #} and lines matching neither shape are ignored.
 */
public final class RatioFileCodec {

    private static final Logger LOG = LoggerFactory.getLogger(RatioFileCodec.class);

    private static final Pattern INLINE =
            Pattern.compile("(?<ch>\\d+).*?ratio\\s*=\\s*(?<ratio>[-+0-9.eE]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PAIR = Pattern.compile("^\\s*(\\d+)\\s*[, \\t]\\s*([-+0-9.eE]+)");

    private RatioFileCodec() {}

    public static Map<Channel, Double> read(Path path) {
        try {
            return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ratio file " + path, e);
        }
    }

    public static Map<Channel, Double> parse(List<String> lines) {
        Map<Channel, Double> ratios = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;

            Matcher m = INLINE.matcher(line);
            if (m.find()) {
                put(ratios, m.group("ch"), m.group("ratio"), line);
                continue;
            }
            m = PAIR.matcher(line);
            if (m.lookingAt()) {
                put(ratios, m.group(1), m.group(2), line);
            }
        }
        return ratios;
    }

    /**
     * Writes {@code # key=value} lines for {@code header}, then {@code channel,ratio} rows.
     */
    public static void write(Path path, RatioEstimate estimate, Map<String, String> header) {
        List<String> lines = new ArrayList<>();
        header.forEach((k, v) -> lines.add("# " + k + "=" + v));
        lines.add("# channel,ratio");
        for (int j = 0; j < estimate.channels().size(); j++) {
            double r = estimate.ratios()[j];
            lines.add(estimate.channels().get(j) + "," + (Double.isFinite(r) ? WeightFileCodec.sci(r) : "inf"));
        }
        try {
            Path parent = path.getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(path, String.join("\n", lines), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write ratio file " + path, e);
        }
    }

    private static void put(Map<Channel, Double> ratios, String channel, String value, String line) {
        try {
            ratios.put(Channel.parse(channel), Double.parseDouble(value));
        } catch (IllegalArgumentException e) {
            LOG.warn("Skipping unreadable ratio line '{}': {}", line, e.getMessage());
        }
    }
}
