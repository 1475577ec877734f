/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.combine;

import ai.evacortex.demproxy.core.PixelMap;

import java.time.Instant;

/**
 * Outcome of combining one matched frame.
 */
public sealed interface FrameResult permits FrameResult.Combined, FrameResult.Failed {

    record Combined(Instant referenceTime, PixelMap map) implements FrameResult {}

    record Failed(FrameError error) implements FrameResult {}
}
