/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.em;

import ai.evacortex.demproxy.core.ChannelFrame;
import ai.evacortex.demproxy.core.PixelMap;
import ai.evacortex.demproxy.core.io.MapProvenance;
import ai.evacortex.demproxy.core.io.codec.PixelMapCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Turns DEM proxy maps into emission-measure maps with a single representative bin:
 * {@code EM = DEM · ΔT}, {@code ΔT = ln(10)·T_rep·ΔlogT}. The volume variant also multiplies by
 * the pixel area in cm² seen at 1 AU.
 */
public class EmissionMeasureConverter {

    private static final Logger LOG = LoggerFactory.getLogger(EmissionMeasureConverter.class);

    public static final double DEFAULT_T_REP_K = 1.0e7;
    public static final double DEFAULT_DELTA_LOGT = 0.1;
    public static final double DEFAULT_PIXEL_ARCSEC = 0.6;
    public static final double AU_CM = 1.495978707e13;
    public static final double ARCSEC_TO_RAD = Math.toRadians(1.0 / 3600.0);

    public static final String COLUMN_UNITS = "cm^-5";
    public static final String VOLUME_UNITS = "cm^-3 pixel^-1";

    private final double tRep;
    private final double deltaLogT;
    private final boolean volume;
    private final double pixelArcsec;
    private final ObjectMapper mapper = new ObjectMapper();

    public EmissionMeasureConverter(double tRep, double deltaLogT, boolean volume, double pixelArcsec) {
        if (!(tRep > 0) || !(deltaLogT > 0)) {
            throw new IllegalArgumentException("T_rep and delta logT must be > 0");
        }
        if (volume && !(pixelArcsec > 0)) {
            throw new IllegalArgumentException("pixel scale must be > 0 arcsec");
        }
        this.tRep = tRep;
        this.deltaLogT = deltaLogT;
        this.volume = volume;
        this.pixelArcsec = pixelArcsec;
    }

    public static EmissionMeasureConverter column() {
        return new EmissionMeasureConverter(DEFAULT_T_REP_K, DEFAULT_DELTA_LOGT, false, DEFAULT_PIXEL_ARCSEC);
    }

    public double deltaT() {
        return Math.log(10.0) * tRep * deltaLogT;
    }

    public double pixelAreaCm2() {
        double side = ARCSEC_TO_RAD * AU_CM;
        return side * side * pixelArcsec * pixelArcsec;
    }

    public double factor() {
        return volume ? deltaT() * pixelAreaCm2() : deltaT();
    }

    public String units() {
        return volume ? VOLUME_UNITS : COLUMN_UNITS;
    }

    public PixelMap convert(PixelMap dem) {
        return dem.scaled(factor());
    }

    /**
     * Converts every {@code dem_*.dmap} under {@code <inRoot>/<event>/} into the same name under
     * {@code <outRoot>/<event>/}, each with a JSON provenance sidecar.
     */
    public List<Path> convertTree(Path inRoot, Path outRoot) {
        List<Path> written = new ArrayList<>();
        MapProvenance provenance = provenance();
        try (Stream<Path> events = Files.list(inRoot)) {
            for (Path eventDir : events.filter(Files::isDirectory).sorted().toList()) {
                Path outEvent = outRoot.resolve(eventDir.getFileName().toString());
                try (Stream<Path> maps = Files.list(eventDir)) {
                    for (Path p : maps.filter(this::isDemMap).sorted().toList()) {
                        ChannelFrame dem = PixelMapCodec.read(p);
                        Path out = outEvent.resolve(p.getFileName().toString());
                        PixelMapCodec.write(out, ChannelFrame.withoutExposure(convert(dem.map())));
                        String name = out.getFileName().toString();
                        Path sidecar = out.resolveSibling(
                                name.substring(0, name.length() - PixelMapCodec.EXTENSION.length()) + ".json");
                        mapper.writerWithDefaultPrettyPrinter().writeValue(sidecar.toFile(), provenance);
                        written.add(out);
                    }
                }
                LOG.info("{}: converted to EM ({})", eventDir.getFileName(), units());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("EM conversion failed under " + inRoot, e);
        }
        return written;
    }

    MapProvenance provenance() {
        List<String> history = new ArrayList<>();
        history.add("EM = DEM * DeltaT (single-bin approximation)");
        history.add("dlogT=" + deltaLogT);
        history.add(String.format(Locale.ROOT, "Trep=%.2eK, DeltaT=%.3eK", tRep, deltaT()));
        if (volume) {
            history.add("Converted to volume EM using pixel area (" + pixelArcsec + " arcsec/pixel)");
        }
        return new MapProvenance(history, units());
    }

    private boolean isDemMap(Path p) {
        String name = p.getFileName().toString();
        return Files.isRegularFile(p)
                && name.startsWith("dem_")
                && name.toLowerCase(Locale.ROOT).endsWith(PixelMapCodec.EXTENSION);
    }
}
