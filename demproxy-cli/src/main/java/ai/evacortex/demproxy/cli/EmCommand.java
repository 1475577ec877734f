/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.cli;

import ai.evacortex.demproxy.core.em.EmissionMeasureConverter;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * {@code em}: converts DEM proxy maps into emission-measure maps.
 */
final class EmCommand {

    static final Set<String> SWITCHES = Set.of("volume");

    private final PrintStream out;

    EmCommand(PrintStream out) {
        this.out = out;
    }

    int run(CliArgs args) {
        EmissionMeasureConverter converter = UsageException.interpret(() -> new EmissionMeasureConverter(
                args.getDouble("trep", EmissionMeasureConverter.DEFAULT_T_REP_K),
                args.getDouble("delta-logt", EmissionMeasureConverter.DEFAULT_DELTA_LOGT),
                args.flag("volume"),
                args.getDouble("pixel-arcsec", EmissionMeasureConverter.DEFAULT_PIXEL_ARCSEC)));
        List<Path> written = converter.convertTree(Path.of(args.require("input")), Path.of(args.require("output")));
        out.println("EM maps written: " + written.size() + " (" + converter.units() + ")");
        return 0;
    }
}
