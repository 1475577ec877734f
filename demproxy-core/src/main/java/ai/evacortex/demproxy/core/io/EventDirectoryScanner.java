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
import ai.evacortex.demproxy.core.TimeSeriesEntry;
import ai.evacortex.demproxy.core.align.FrameTimestamps;
import ai.evacortex.demproxy.core.align.TimeIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.stream.Stream;

/**
 * Walks the input layout {@code <root>/<event>/<channel>/<name>.<YYYY-MM-DD>T<HHMMSS>Z.<ext>}.
 */
public class EventDirectoryScanner {

    private static final Logger LOG = LoggerFactory.getLogger(EventDirectoryScanner.class);

    private final String extension;

    /**
     * @param extension accepted frame suffix including the dot, matched case-insensitively
     */
    public EventDirectoryScanner(String extension) {
        this.extension = extension.toLowerCase(Locale.ROOT);
    }

    /**
     * Event directories in name order. Names made only of digits and directories without any
     * sub-directory are not events.
     *
     * @param only if not {@code null}, the single event to return
     */
    public List<Path> listEvents(Path root, String only) {
        List<Path> events = new ArrayList<>();
        try (Stream<Path> children = Files.list(root)) {
            children.filter(Files::isDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .forEach(dir -> {
                        String name = dir.getFileName().toString();
                        if (name.chars().allMatch(Character::isDigit)) return;
                        if (!hasSubdirectory(dir)) return;
                        if (only != null && !only.equals(name)) return;
                        events.add(dir);
                    });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list events under " + root, e);
        }
        return events;
    }

    /**
     * One index per channel directory that exists; channels without a directory are left out.
     */
    public Map<Channel, TimeIndex<Path>> indexChannels(Path eventDir, Collection<Channel> channels) {
        Map<Channel, TimeIndex<Path>> out = new LinkedHashMap<>();
        for (Channel ch : channels) {
            Path dir = eventDir.resolve(ch.toString());
            if (!Files.isDirectory(dir)) {
                LOG.debug("{}: no directory for channel {}", eventDir.getFileName(), ch);
                continue;
            }
            out.put(ch, TimeIndex.build(listFrames(dir)));
        }
        return out;
    }

    List<TimeSeriesEntry<Path>> listFrames(Path channelDir) {
        List<TimeSeriesEntry<Path>> items = new ArrayList<>();
        try (Stream<Path> files = Files.list(channelDir)) {
            files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension))
                    .sorted()
                    .forEach(p -> {
                        Optional<Instant> t = FrameTimestamps.parseFromName(p.getFileName().toString());
                        t.ifPresent(time -> items.add(new TimeSeriesEntry<>(time, p)));
                    });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list frames in " + channelDir, e);
        }
        return items;
    }

    private static boolean hasSubdirectory(Path dir) {
        try (Stream<Path> children = Files.list(dir)) {
            return children.anyMatch(Files::isDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }
}
