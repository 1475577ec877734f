/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.pipeline;

import ai.evacortex.demproxy.core.ChannelFrame;

import java.nio.file.Path;

/**
 * Loads a channel frame by path. Implementations must be safe for concurrent use.
 */
public interface FrameSource {

    /**
     * @throws java.io.UncheckedIOException if the frame cannot be read
     */
    ChannelFrame load(Path path);
}
