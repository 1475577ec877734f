/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.align;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class FrameTimestampsTest {

    @Test
    void testParseFromName() {
        assertEquals(Instant.parse("2024-05-01T12:34:56Z"),
                FrameTimestamps.parseFromName("aia.lev1_euv_12s.2024-05-01T123456Z.94.image.dmap").orElseThrow());
        assertTrue(FrameTimestamps.parseFromName("aia_2024-05-01T123456.dmap").isEmpty());
        assertTrue(FrameTimestamps.parseFromName("x.2024-13-01T123456Z.dmap").isEmpty(), "invalid month");
    }

    @Test
    void testNames() {
        Instant t = Instant.parse("2024-05-01T01:02:03Z");
        assertEquals("2024-05-01T010203", FrameTimestamps.stamp(t));
        assertEquals("dem_2024-05-01T010203.dmap", FrameTimestamps.outputName("dem_", t, ".dmap"));
        assertEquals(t, FrameTimestamps.parseFromName(FrameTimestamps.frameName("aia", t, "dmap")).orElseThrow());
    }
}
