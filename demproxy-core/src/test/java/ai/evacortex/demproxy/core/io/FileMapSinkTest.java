/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.io;

import ai.evacortex.demproxy.core.PixelMap;
import ai.evacortex.demproxy.core.combine.CombineOptions;
import ai.evacortex.demproxy.core.combine.FrameCombiner;
import ai.evacortex.demproxy.core.config.OutputFormat;
import ai.evacortex.demproxy.core.io.codec.PixelMapCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static ai.evacortex.demproxy.core.DemTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class FileMapSinkTest {

    private static MapProvenance provenance(CombineOptions options) {
        return MapProvenance.of(new FrameCombiner(channels(94, 171), new double[]{0.5, -0.25}, null, options, null));
    }

    @Test
    void testWrite_rawFormatHasNoSidecar(@TempDir Path root) throws IOException {
        FileMapSink sink = new FileMapSink(root, OutputFormat.RAW);
        Path out = sink.write("flare", T0, PixelMap.filled(2, 2, 3.0), provenance(CombineOptions.defaults()));

        assertEquals(root.resolve("flare/dem_2024-05-01T120000.dmap"), out);
        assertArrayEquals(new double[]{3, 3, 3, 3}, PixelMapCodec.read(out).map().values());
        assertFalse(Files.exists(root.resolve("flare/dem_2024-05-01T120000.json")));
    }

    @Test
    void testWrite_annotatedSidecar(@TempDir Path root) {
        FileMapSink sink = new FileMapSink(root, OutputFormat.ANNOTATED);
        CombineOptions opts = new CombineOptions(true, Double.NaN, true, 2.0);
        Path out = sink.write("flare", T0, PixelMap.filled(1, 1, 1.0), provenance(opts));

        MapProvenance back = sink.readProvenance(out);
        assertEquals("DN s^-1", back.units());
        assertEquals(List.of(
                "DEM proxy (fixed weights) from DemProxy",
                "WAVELENGTHS=94,171",
                "WEIGHTS=5.00000000e-01,-2.50000000e-01",
                "Normalized by EXPTIME",
                "Input clipped to finite positive values",
                "SCALE=2.0"), back.history());
    }

    @Test
    void testProvenance_units() {
        assertEquals("DN", provenance(CombineOptions.defaults()).units());
        MapProvenance p = new MapProvenance(List.of("x"), "DEM proxy");
        assertEquals("DEM proxy", p.units());
    }
}
