/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.pipeline;

import ai.evacortex.demproxy.core.PixelMap;
import ai.evacortex.demproxy.core.io.MapProvenance;

import java.time.Instant;
import java.nio.file.Path;

/**
 * Receives combined maps. Each (event, reference time) pair is written at most once, so
 * implementations can be called from several workers without coordination.
 */
public interface MapSink {

    Path write(String event, Instant referenceTime, PixelMap map, MapProvenance provenance);
}
