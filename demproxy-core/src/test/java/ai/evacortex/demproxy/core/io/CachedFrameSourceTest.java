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
import ai.evacortex.demproxy.core.pipeline.FrameSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class CachedFrameSourceTest {

    @Test
    void testLoad_decodesEachPathOnce() {
        AtomicInteger loads = new AtomicInteger();
        FrameSource counting = path -> {
            loads.incrementAndGet();
            return ChannelFrame.withoutExposure(PixelMap.filled(1, 1, path.toString().length()));
        };
        CachedFrameSource cache = new CachedFrameSource(counting, 16);

        Path a = Path.of("a.dmap");
        cache.load(a);
        cache.load(a);
        cache.load(Path.of("bb.dmap"));

        assertEquals(2, loads.get());
        assertEquals(1, cache.hitCount());
        assertEquals(2, cache.missCount());

        cache.invalidate(a);
        cache.load(a);
        assertEquals(3, loads.get());
        cache.close();
    }

    @Test
    void testLoad_propagatesDecoderFailure(@TempDir Path dir) throws IOException {
        Path corrupt = dir.resolve("bad.dmap");
        Files.write(corrupt, new byte[]{1, 2, 3});
        CachedFrameSource cache = new CachedFrameSource(new DmapFrameSource(), 4);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> cache.load(corrupt));
        assertTrue(e.getMessage().contains("bad.dmap"));
        assertThrows(UncheckedIOException.class, () -> cache.load(dir.resolve("missing.dmap")));
    }
}
