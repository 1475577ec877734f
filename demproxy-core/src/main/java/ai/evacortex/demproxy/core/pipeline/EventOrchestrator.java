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
import ai.evacortex.demproxy.core.MatchSet;
import ai.evacortex.demproxy.core.TimeSeriesEntry;
import ai.evacortex.demproxy.core.align.Aligner;
import ai.evacortex.demproxy.core.align.TimeIndex;
import ai.evacortex.demproxy.core.combine.FrameCombiner;
import ai.evacortex.demproxy.core.combine.FrameResult;
import ai.evacortex.demproxy.core.config.DemRunConfig;
import ai.evacortex.demproxy.core.exceptions.ChannelConfigurationException;
import ai.evacortex.demproxy.core.exceptions.RunAbortedException;
import ai.evacortex.demproxy.core.io.EventDirectoryScanner;
import ai.evacortex.demproxy.core.io.MapProvenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.*;

/**
 * Drives a run: for every event, aligns each reference frame across channels and hands
 * the complete match sets to a {@link FrameDispatcher}.
 *
 * <p>Events without the reference channel and reference frames without a complete match
 * set are skipped. A failed frame aborts the whole run with {@link RunAbortedException}.</p>
 */
public class EventOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(EventOrchestrator.class);

    private final DemRunConfig config;
    private final EventDirectoryScanner scanner;
    private final FrameSource source;
    private final FrameCombiner combiner;
    private final MapSink sink;
    private final MapProvenance provenance;

    public EventOrchestrator(DemRunConfig config,
                             EventDirectoryScanner scanner,
                             FrameSource source,
                             FrameCombiner combiner,
                             MapSink sink) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.combiner = Objects.requireNonNull(combiner, "combiner must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        if (!combiner.channels().equals(config.channels())) {
            throw new ChannelConfigurationException("weights cover " + combiner.channels()
                    + " but the run combines " + config.channels());
        }
        this.provenance = MapProvenance.of(combiner);
    }

    public RunReport run() {
        List<Path> events = scanner.listEvents(config.inputRoot(), config.event());
        LOG.info("Processing {} event(s) under {} ({} worker(s))",
                events.size(), config.inputRoot(), Math.max(1, config.workers()));

        int processed = 0, skipped = 0, written = 0, unmatched = 0;
        List<Path> outputs = new ArrayList<>();

        try (FrameDispatcher dispatcher = new FrameDispatcher(config.workers(), config.chunkSize())) {
            for (Path eventDir : events) {
                String event = eventDir.getFileName().toString();
                Optional<EventPlan> planned = plan(event, eventDir);
                if (planned.isEmpty()) {
                    skipped++;
                    continue;
                }
                EventPlan plan = planned.get();
                int missing = plan.referenceFrames() - plan.tasks().size();
                unmatched += missing;
                processed++;

                List<FrameTask.Outcome> outcomes = dispatcher.run(plan.tasks());
                for (FrameTask.Outcome o : outcomes) {
                    if (o.result() instanceof FrameResult.Failed failed) {
                        LOG.error("Aborting run: {}", failed.error().describe());
                        throw new RunAbortedException(failed.error());
                    }
                    outputs.add(o.output());
                    written++;
                }
                LOG.info("{}: wrote {} map(s), {} reference frame(s) without a complete match",
                        event, outcomes.size(), missing);
            }
        }
        return new RunReport(processed, skipped, written, unmatched, outputs);
    }

    record EventPlan(List<FrameTask> tasks, int referenceFrames) {}

    /**
     * Frame tasks of one event in reference-time order, or empty if the event is skipped.
     */
    Optional<EventPlan> plan(String event, Path eventDir) {
        Map<Channel, TimeIndex<Path>> indices = scanner.indexChannels(eventDir, channelsToIndex());
        TimeIndex<Path> reference = indices.get(config.referenceChannel());
        if (reference == null) {
            LOG.warn("{}: skipped, no directory for reference channel {}", event, config.referenceChannel());
            return Optional.empty();
        }

        List<Instant> refTimes;
        if (config.singleFrame()) {
            // the index counts reference files, duplicates of a timestamp included
            List<TimeSeriesEntry<Path>> entries = reference.entries();
            if (config.referenceIndex() >= entries.size()) {
                LOG.warn("{}: skipped, reference index {} out of range ({} frame(s))",
                        event, config.referenceIndex(), entries.size());
                return Optional.empty();
            }
            refTimes = List.of(entries.get(config.referenceIndex()).time());
        } else {
            refTimes = referenceTimes(reference);
        }

        Aligner<Path> aligner = new Aligner<>(indices, config.channels());
        List<FrameTask> tasks = new ArrayList<>();
        for (Instant t : refTimes) {
            Optional<MatchSet<Path>> match = aligner.match(t, config.tolerance());
            if (match.isEmpty()) {
                LOG.debug("{}: no complete match at {}", event, t);
                continue;
            }
            tasks.add(new FrameTask(event, match.get(), source, combiner, sink, provenance));
        }
        return Optional.of(new EventPlan(tasks, refTimes.size()));
    }

    // Reference entries sharing a timestamp would write the same output; keep the first.
    private static List<Instant> referenceTimes(TimeIndex<Path> reference) {
        LinkedHashSet<Instant> times = new LinkedHashSet<>();
        for (TimeSeriesEntry<Path> e : reference.entries()) times.add(e.time());
        return new ArrayList<>(times);
    }

    private List<Channel> channelsToIndex() {
        List<Channel> all = new ArrayList<>(config.channels());
        if (!all.contains(config.referenceChannel())) all.add(config.referenceChannel());
        return all;
    }
}
