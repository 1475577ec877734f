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
import ai.evacortex.demproxy.core.engine.RatioEstimate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static ai.evacortex.demproxy.core.DemTestUtils.channels;
import static org.junit.jupiter.api.Assertions.*;

public class RatioFileCodecTest {

    @Test
    void testParse_inlineAndPairForms() {
        Map<Channel, Double> r = RatioFileCodec.parse(List.of(
                "# channel,ratio",
                "94,0.5",
                "131 1.25e0",
                "  171\t2",
                "AIA 193: Kbar=1e-25 K(T0)=2e-25 ratio = 0.75",
                "not a ratio line"));

        assertEquals(4, r.size());
        assertEquals(0.5, r.get(Channel.of(94)));
        assertEquals(1.25, r.get(Channel.of(131)));
        assertEquals(2.0, r.get(Channel.of(171)));
        assertEquals(0.75, r.get(Channel.of(193)));
    }

    @Test
    void testParse_unreadableNumberIsSkipped() {
        Map<Channel, Double> r = RatioFileCodec.parse(List.of("94,1.2.3", "171,0.9"));
        assertEquals(Map.of(Channel.of(171), 0.9), r);
    }

    @Test
    void testWrite_headerAndRows(@TempDir Path dir) throws IOException {
        RatioEstimate est = new RatioEstimate(channels(94, 171),
                new double[]{1, 1}, new double[]{2, 0}, new double[]{0.5, Double.POSITIVE_INFINITY},
                OptionalDouble.of(0.5));
        Path file = dir.resolve("ratios.csv");
        RatioFileCodec.write(file, est, Map.of("logt0", "6.6"));

        assertEquals(List.of("# logt0=6.6", "# channel,ratio", "94,5.00000000e-01", "171,inf"),
                Files.readAllLines(file));
        assertEquals(Map.of(Channel.of(94), 0.5), RatioFileCodec.read(file));
    }
}
