/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.align;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Timestamp conventions of frame and output file names. Frame names embed
 * {@code .YYYY-MM-DDTHHMMSSZ.}; output names use the same stamp without the zone marker.
 */
public final class FrameTimestamps {

    private static final Pattern FRAME_TIME = Pattern.compile("\\.(\\d{4}-\\d{2}-\\d{2}T\\d{6})Z\\.");
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HHmmss");

    private FrameTimestamps() {}

    public static Optional<Instant> parseFromName(String fileName) {
        Matcher m = FRAME_TIME.matcher(fileName);
        if (!m.find()) return Optional.empty();
        try {
            return Optional.of(LocalDateTime.parse(m.group(1), STAMP).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static String stamp(Instant time) {
        return STAMP.format(LocalDateTime.ofInstant(time, ZoneOffset.UTC));
    }

    /**
     * Input frame name, e.g. {@code aia.2024-05-01T120000Z.dmap} for extension {@code "dmap"}.
     */
    public static String frameName(String prefix, Instant time, String extension) {
        return prefix + "." + stamp(time) + "Z." + extension;
    }

    /**
     * Output map name, e.g. {@code dem_2024-05-01T120000.dmap} for suffix {@code ".dmap"}.
     */
    public static String outputName(String prefix, Instant time, String suffix) {
        return prefix + stamp(time) + suffix;
    }
}
