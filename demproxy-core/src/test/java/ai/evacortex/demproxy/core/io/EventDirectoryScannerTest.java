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
import ai.evacortex.demproxy.core.align.TimeIndex;
import ai.evacortex.demproxy.core.io.codec.PixelMapCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static ai.evacortex.demproxy.core.DemTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class EventDirectoryScannerTest {

    private final EventDirectoryScanner scanner = new EventDirectoryScanner(PixelMapCodec.EXTENSION);

    @Test
    void testListEvents_filtersAndSorts(@TempDir Path root) throws IOException {
        Files.createDirectories(root.resolve("flare_b/94"));
        Files.createDirectories(root.resolve("flare_a/171"));
        Files.createDirectories(root.resolve("20240501/94"));     // digit-only name
        Files.createDirectories(root.resolve("empty_event"));     // no channel directories
        Files.writeString(root.resolve("notes.txt"), "x");

        List<Path> events = scanner.listEvents(root, null);
        assertEquals(List.of(root.resolve("flare_a"), root.resolve("flare_b")), events);
        assertEquals(List.of(root.resolve("flare_b")), scanner.listEvents(root, "flare_b"));
        assertTrue(scanner.listEvents(root, "unknown").isEmpty());
    }

    @Test
    void testIndexChannels_skipsMissingDirectoriesAndForeignFiles(@TempDir Path root) throws IOException {
        Path event = root.resolve("ev");
        writeFrame(event, Channel.of(94), at(24), 1, 1, 1.0, null);
        writeFrame(event, Channel.of(94), at(0), 1, 1, 1.0, null);
        Files.writeString(event.resolve("94/readme.txt"), "x");
        Files.writeString(event.resolve("94/undated.dmap"), "x");

        Map<Channel, TimeIndex<Path>> idx = scanner.indexChannels(event, channels(94, 171));
        assertEquals(List.of(Channel.of(94)), List.copyOf(idx.keySet()));
        assertEquals(2, idx.get(Channel.of(94)).size());
        assertEquals(at(0), idx.get(Channel.of(94)).get(0).time());
    }

    @Test
    void testListFrames_extensionIsCaseInsensitive(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("aia.2024-05-01T120000Z.DMAP"), "x");
        assertEquals(1, scanner.listFrames(dir).size());
    }
}
