/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.pipeline;

import ai.evacortex.demproxy.core.Channel;
import ai.evacortex.demproxy.core.align.FrameTimestamps;
import ai.evacortex.demproxy.core.combine.CombineOptions;
import ai.evacortex.demproxy.core.combine.FrameCombiner;
import ai.evacortex.demproxy.core.config.DemRunConfig;
import ai.evacortex.demproxy.core.config.OutputFormat;
import ai.evacortex.demproxy.core.exceptions.ChannelConfigurationException;
import ai.evacortex.demproxy.core.exceptions.RunAbortedException;
import ai.evacortex.demproxy.core.io.CachedFrameSource;
import ai.evacortex.demproxy.core.io.DmapFrameSource;
import ai.evacortex.demproxy.core.io.EventDirectoryScanner;
import ai.evacortex.demproxy.core.io.FileMapSink;
import ai.evacortex.demproxy.core.io.codec.PixelMapCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static ai.evacortex.demproxy.core.DemTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class EventOrchestratorTest {

    private static final Channel C94 = Channel.of(94);
    private static final Channel C171 = Channel.of(171);

    @TempDir
    Path tmp;

    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        input = tmp.resolve("in");
        Path ev = input.resolve("flare_a");
        writeFrame(ev, C94, at(0), 2, 2, 2.0, 2.0);
        writeFrame(ev, C94, at(24), 2, 2, 2.0, 2.0);
        writeFrame(ev, C94, at(48), 2, 2, 2.0, 2.0);
        writeFrame(ev, C171, at(3), 2, 2, 4.0, 1.0);
        writeFrame(ev, C171, at(25), 2, 2, 4.0, 1.0);
        writeFrame(ev, C171, at(70), 2, 2, 4.0, 1.0);   // 22 s from the last reference

        Path onlyHot = input.resolve("flare_b");
        writeFrame(onlyHot, C171, at(0), 2, 2, 1.0, 1.0);
    }

    private DemRunConfig config(Path out, int workers, int index, CombineOptions combine) {
        return new DemRunConfig(input, out, C94, List.of(C94, C171), Duration.ofSeconds(12),
                null, index, combine, OutputFormat.RAW, workers, 1, 16);
    }

    private static EventOrchestrator orchestrator(DemRunConfig cfg) {
        FrameCombiner combiner = new FrameCombiner(cfg.channels(), new double[]{1.0, 0.5}, null, cfg.combine(), null);
        return new EventOrchestrator(cfg, new EventDirectoryScanner(PixelMapCodec.EXTENSION),
                new CachedFrameSource(new DmapFrameSource(), cfg.frameCacheSize()),
                combiner, new FileMapSink(cfg.outputRoot(), cfg.format()));
    }

    @Test
    void testRun_writesMatchedFramesAndSkipsEventWithoutReference() throws IOException {
        Path out = tmp.resolve("out");
        RunReport report = orchestrator(config(out, 0, -1, CombineOptions.defaults())).run();

        assertEquals(1, report.eventsProcessed());
        assertEquals(1, report.eventsSkipped());
        assertEquals(2, report.framesWritten());
        assertEquals(1, report.framesUnmatched());
        assertEquals(List.of(
                out.resolve("flare_a/dem_2024-05-01T120000.dmap"),
                out.resolve("flare_a/dem_2024-05-01T120024.dmap")), report.outputs());
        assertArrayEquals(new double[]{4, 4, 4, 4},
                PixelMapCodec.read(report.outputs().get(0)).map().values(), 1e-12);
        assertFalse(Files.exists(out.resolve("flare_b")));
    }

    @Test
    void testRun_parallelMatchesSerial() throws IOException {
        CombineOptions opts = new CombineOptions(true, Double.NaN, false, 1.0);
        RunReport serial = orchestrator(config(tmp.resolve("serial"), 0, -1, opts)).run();
        RunReport parallel = orchestrator(config(tmp.resolve("parallel"), 4, -1, opts)).run();

        assertEquals(serial.framesWritten(), parallel.framesWritten());
        for (int i = 0; i < serial.outputs().size(); i++) {
            assertEquals(serial.outputs().get(i).getFileName(), parallel.outputs().get(i).getFileName());
            assertArrayEquals(Files.readAllBytes(serial.outputs().get(i)),
                    Files.readAllBytes(parallel.outputs().get(i)));
        }
        // exposure normalized: 2/2 + 0.5 * 4/1
        assertArrayEquals(new double[]{3, 3, 3, 3},
                PixelMapCodec.read(parallel.outputs().get(0)).map().values(), 1e-12);
    }

    @Test
    void testRun_missingExposureAbortsRun() throws IOException {
        writeFrame(input.resolve("flare_a"), C171, at(47), 2, 2, 4.0, null);
        CombineOptions opts = new CombineOptions(true, Double.NaN, false, 1.0);

        RunAbortedException e = assertThrows(RunAbortedException.class,
                () -> orchestrator(config(tmp.resolve("out"), 0, -1, opts)).run());
        assertEquals(C171, e.error().channel());
        assertEquals(at(48), e.error().referenceTime());
        assertEquals("flare_a", e.error().event());
    }

    @Test
    void testRun_singleReferenceIndex() {
        RunReport report = orchestrator(config(tmp.resolve("out"), 0, 1, CombineOptions.defaults())).run();
        assertEquals(1, report.framesWritten());
        assertTrue(report.outputs().get(0).toString().endsWith("dem_2024-05-01T120024.dmap"));

        RunReport outOfRange = orchestrator(config(tmp.resolve("out2"), 0, 3, CombineOptions.defaults())).run();
        assertEquals(0, outOfRange.eventsProcessed());
        assertEquals(2, outOfRange.eventsSkipped());
    }

    @Test
    void testRun_eventFilter() {
        DemRunConfig cfg = new DemRunConfig(input, tmp.resolve("out"), C94, List.of(C94, C171),
                Duration.ofSeconds(12), "flare_b", -1, null, null, 0, 1, 0);
        RunReport report = orchestrator(cfg).run();
        assertEquals(0, report.eventsProcessed());
        assertEquals(1, report.eventsSkipped());
    }

    @Test
    void testPlan_duplicateReferenceTimesProduceOneTask() throws IOException {
        Path ev = input.resolve("flare_a");
        Files.copy(ev.resolve("94").resolve(FrameTimestamps.frameName("aia_94", at(0), "dmap")),
                ev.resolve("94/aia_94_copy.2024-05-01T120000Z.dmap"));

        EventOrchestrator o = orchestrator(config(tmp.resolve("out"), 0, -1, CombineOptions.defaults()));
        EventOrchestrator.EventPlan plan = o.plan("flare_a", ev).orElseThrow();
        assertEquals(3, plan.referenceFrames());
        assertEquals(2, plan.tasks().size());
    }

    @Test
    void testPlan_singleIndexCountsDuplicateReferenceFiles() throws IOException {
        Path ev = input.resolve("flare_a");
        Files.copy(ev.resolve("94").resolve(FrameTimestamps.frameName("aia_94", at(0), "dmap")),
                ev.resolve("94/aia_94_copy.2024-05-01T120000Z.dmap"));

        // files in time order: 00:00, 00:00 (copy), 00:24, 00:48
        EventOrchestrator o = orchestrator(config(tmp.resolve("out"), 0, 2, CombineOptions.defaults()));
        EventOrchestrator.EventPlan plan = o.plan("flare_a", ev).orElseThrow();
        assertEquals(1, plan.referenceFrames());
        assertEquals(at(24), plan.tasks().get(0).match().referenceTime());

        EventOrchestrator copy = orchestrator(config(tmp.resolve("out"), 0, 1, CombineOptions.defaults()));
        assertEquals(at(0), copy.plan("flare_a", ev).orElseThrow().tasks().get(0).match().referenceTime());
    }

    @Test
    void testConstructor_rejectsCombinerForOtherChannels() {
        DemRunConfig cfg = config(tmp.resolve("out"), 0, -1, CombineOptions.defaults());
        FrameCombiner other = new FrameCombiner(List.of(C171, C94), new double[]{1, 1}, null,
                CombineOptions.defaults(), null);
        assertThrows(ChannelConfigurationException.class, () -> new EventOrchestrator(cfg,
                new EventDirectoryScanner(PixelMapCodec.EXTENSION), new DmapFrameSource(), other,
                new FileMapSink(cfg.outputRoot(), cfg.format())));
    }
}
