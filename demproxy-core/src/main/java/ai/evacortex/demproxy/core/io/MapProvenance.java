/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.io;

import ai.evacortex.demproxy.core.combine.CombineOptions;
import ai.evacortex.demproxy.core.combine.FrameCombiner;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * History lines and units tag written next to an annotated output map.
 */
public record MapProvenance(List<String> history, String units) {
    public MapProvenance {
        history = List.copyOf(history);
    }

    /**
     * Provenance of maps produced by {@code combiner}: channel list, weights and calibration flags.
     */
    public static MapProvenance of(FrameCombiner combiner) {
        CombineOptions o = combiner.options();
        List<String> lines = new ArrayList<>();
        lines.add("DEM proxy (fixed weights) from DemProxy");
        StringJoiner ch = new StringJoiner(",", "WAVELENGTHS=", "");
        combiner.channels().forEach(c -> ch.add(c.toString()));
        lines.add(ch.toString());
        StringJoiner w = new StringJoiner(",", "WEIGHTS=", "");
        for (double v : combiner.weights()) w.add(String.format(Locale.ROOT, "%.8e", v));
        lines.add(w.toString());
        if (o.normalizeExposure()) lines.add("Normalized by EXPTIME");
        if (o.divideByResponse()) {
            lines.add("Normalized by channel response");
            lines.add("logT=" + o.responseLogT());
        }
        if (o.clipInput()) lines.add("Input clipped to finite positive values");
        if (o.outputScale() != 1.0) lines.add("SCALE=" + o.outputScale());

        String units;
        if (o.divideByResponse()) {
            units = "DEM proxy";
        } else if (o.normalizeExposure()) {
            units = "DN s^-1";
        } else {
            units = "DN";
        }
        return new MapProvenance(lines, units);
    }
}
