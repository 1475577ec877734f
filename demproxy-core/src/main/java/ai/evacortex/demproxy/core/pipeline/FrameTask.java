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
import ai.evacortex.demproxy.core.ChannelFrame;
import ai.evacortex.demproxy.core.MatchSet;
import ai.evacortex.demproxy.core.combine.FrameCombiner;
import ai.evacortex.demproxy.core.combine.FrameResult;
import ai.evacortex.demproxy.core.io.MapProvenance;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Loads, combines and writes one matched reference frame. Holds only shared read-only collaborators.
 */
public record FrameTask(String event,
                        MatchSet<Path> match,
                        FrameSource source,
                        FrameCombiner combiner,
                        MapSink sink,
                        MapProvenance provenance) implements Callable<FrameTask.Outcome> {

    /**
     * @param output written map, {@code null} when the frame failed
     */
    public record Outcome(FrameTask task, FrameResult result, Path output) {
        public boolean failed() {
            return result instanceof FrameResult.Failed;
        }
    }

    @Override
    public Outcome call() {
        Map<Channel, ChannelFrame> frames = new LinkedHashMap<>();
        for (Channel ch : combiner.channels()) {
            frames.put(ch, source.load(match.handle(ch)));
        }
        FrameResult result = combiner.combine(event, match.referenceTime(), frames);
        if (result instanceof FrameResult.Combined combined) {
            Path out = sink.write(event, combined.referenceTime(), combined.map(), provenance);
            return new Outcome(this, result, out);
        }
        return new Outcome(this, result, null);
    }
}
