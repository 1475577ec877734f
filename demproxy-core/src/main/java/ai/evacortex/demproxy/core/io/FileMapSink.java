/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.io;

import ai.evacortex.demproxy.core.ChannelFrame;
import ai.evacortex.demproxy.core.PixelMap;
import ai.evacortex.demproxy.core.align.FrameTimestamps;
import ai.evacortex.demproxy.core.config.OutputFormat;
import ai.evacortex.demproxy.core.io.codec.PixelMapCodec;
import ai.evacortex.demproxy.core.pipeline.MapSink;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Writes {@code <root>/<event>/dem_<stamp>.dmap} and, for {@link OutputFormat#ANNOTATED},
 * the provenance sidecar {@code dem_<stamp>.json}.
 */
public class FileMapSink implements MapSink {

    public static final String PREFIX = "dem_";

    private final Path root;
    private final OutputFormat format;
    private final ObjectMapper mapper = new ObjectMapper();

    public FileMapSink(Path root, OutputFormat format) {
        this.root = root;
        this.format = format;
    }

    @Override
    public Path write(String event, Instant referenceTime, PixelMap map, MapProvenance provenance) {
        Path dir = root.resolve(event);
        Path out = dir.resolve(FrameTimestamps.outputName(PREFIX, referenceTime, PixelMapCodec.EXTENSION));
        try {
            PixelMapCodec.write(out, ChannelFrame.withoutExposure(map));
            if (format == OutputFormat.ANNOTATED) {
                Path sidecar = dir.resolve(FrameTimestamps.outputName(PREFIX, referenceTime, ".json"));
                try (OutputStream os = Files.newOutputStream(sidecar, StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING)) {
                    mapper.writerWithDefaultPrettyPrinter().writeValue(os, provenance);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write map " + out, e);
        }
        return out;
    }

    public MapProvenance readProvenance(Path mapFile) {
        String name = mapFile.getFileName().toString();
        Path sidecar = mapFile.resolveSibling(name.substring(0, name.length() - PixelMapCodec.EXTENSION.length()) + ".json");
        try {
            return mapper.readValue(sidecar.toFile(), MapProvenance.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read provenance " + sidecar, e);
        }
    }
}
