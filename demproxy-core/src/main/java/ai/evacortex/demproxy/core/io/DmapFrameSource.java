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
import ai.evacortex.demproxy.core.io.codec.PixelMapCodec;
import ai.evacortex.demproxy.core.pipeline.FrameSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

public class DmapFrameSource implements FrameSource {

    @Override
    public ChannelFrame load(Path path) {
        try {
            return PixelMapCodec.read(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read frame " + path, e);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Corrupt frame " + path + ": " + e.getMessage(), e);
        }
    }
}
