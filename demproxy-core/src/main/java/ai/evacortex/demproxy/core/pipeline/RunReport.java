/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Summary of a map-production run.
 *
 * @param outputs written maps ordered by event name, then reference time
 */
public record RunReport(int eventsProcessed,
                        int eventsSkipped,
                        int framesWritten,
                        int framesUnmatched,
                        List<Path> outputs) {
    public RunReport {
        outputs = List.copyOf(outputs);
    }
}
