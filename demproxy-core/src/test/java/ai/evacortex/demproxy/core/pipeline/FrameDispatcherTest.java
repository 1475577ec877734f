/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.pipeline;

import ai.evacortex.demproxy.core.*;
import ai.evacortex.demproxy.core.combine.CombineOptions;
import ai.evacortex.demproxy.core.combine.FrameCombiner;
import ai.evacortex.demproxy.core.io.MapProvenance;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static ai.evacortex.demproxy.core.DemTestUtils.at;
import static org.junit.jupiter.api.Assertions.*;

public class FrameDispatcherTest {

    private static final Channel CH = Channel.of(171);

    /**
     * Frames whose file name starts with "noexp" carry no exposure, which fails under exposure normalization.
     */
    private static final FrameSource SOURCE = path -> path.getFileName().toString().startsWith("noexp")
            ? ChannelFrame.withoutExposure(PixelMap.filled(1, 1, 1.0))
            : ChannelFrame.withExposure(PixelMap.filled(1, 1, 1.0), 1.0);

    private static List<FrameTask> tasks(MapSink sink, String... names) {
        FrameCombiner combiner = new FrameCombiner(List.of(CH), new double[]{1.0}, null,
                new CombineOptions(true, Double.NaN, false, 1.0), null);
        MapProvenance provenance = MapProvenance.of(combiner);
        List<FrameTask> out = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            Instant t = at(i * 12L);
            MatchSet<Path> match = new MatchSet<>(t, Map.of(CH, new TimeSeriesEntry<>(t, Path.of(names[i]))));
            out.add(new FrameTask("ev", match, SOURCE, combiner, sink, provenance));
        }
        return out;
    }

    @Test
    void testSerial_stopsAtFirstFailure() {
        List<Instant> written = Collections.synchronizedList(new ArrayList<>());
        MapSink sink = (event, t, map, p) -> {
            written.add(t);
            return Path.of(event, t.toString());
        };
        try (FrameDispatcher d = new FrameDispatcher(0, 10)) {
            assertFalse(d.parallel());
            List<FrameTask.Outcome> outcomes = d.run(tasks(sink, "a", "noexp", "c"));
            assertEquals(2, outcomes.size());
            assertTrue(outcomes.get(1).failed());
            assertNull(outcomes.get(1).output());
            assertEquals(List.of(at(0)), written);
        }
    }

    @Test
    void testParallel_keepsTaskOrderAndFinishesFailingChunkOnly() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        List<Instant> written = Collections.synchronizedList(new ArrayList<>());
        MapSink sink = (event, t, map, p) -> {
            threads.add(Thread.currentThread().getName());
            written.add(t);
            return Path.of(event, t.toString());
        };
        try (FrameDispatcher d = new FrameDispatcher(3, 2)) {
            assertTrue(d.parallel());
            List<FrameTask.Outcome> outcomes = d.run(tasks(sink, "a", "b", "noexp", "d", "e", "f"));

            assertEquals(4, outcomes.size(), "third chunk must not start");
            for (int i = 0; i < outcomes.size(); i++) {
                assertEquals(at(i * 12L), outcomes.get(i).task().match().referenceTime());
            }
            assertTrue(outcomes.get(2).failed());
            assertEquals(3, written.size());
            assertTrue(threads.stream().allMatch(n -> n.startsWith("dem-frame-")), threads.toString());
        }
    }

    @Test
    void testParallel_unexpectedExceptionIsUnwrapped() {
        MapSink failing = (event, t, map, p) -> {
            throw new IllegalStateException("disk full");
        };
        try (FrameDispatcher d = new FrameDispatcher(2, 4)) {
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> d.run(tasks(failing, "a", "b")));
            assertEquals("disk full", e.getMessage());
        }
    }
}
