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
import ai.evacortex.demproxy.core.pipeline.FrameSource;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.nio.file.Path;

/**
 * Keeps recently decoded frames so that a frame matched by neighbouring reference times is read once.
 */
public class CachedFrameSource implements FrameSource {

    private final LoadingCache<Path, ChannelFrame> cache;

    public CachedFrameSource(FrameSource delegate, int maxEntries) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .recordStats()
                .build(delegate::load);
    }

    @Override
    public ChannelFrame load(Path path) {
        return cache.get(path);
    }

    public void invalidate(Path path) {
        cache.invalidate(path);
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long missCount() {
        return cache.stats().missCount();
    }

    public void close() {
        cache.invalidateAll();
    }
}
