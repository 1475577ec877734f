/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.align;

import ai.evacortex.demproxy.core.TimeSeriesEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static ai.evacortex.demproxy.core.DemTestUtils.at;
import static org.junit.jupiter.api.Assertions.*;

public class TimeIndexTest {

    @Test
    void testBuild_sortsAscending() {
        TimeIndex<String> index = TimeIndex.build(List.of(
                new TimeSeriesEntry<>(at(24), "c"),
                new TimeSeriesEntry<>(at(0), "a"),
                new TimeSeriesEntry<>(at(12), "b")));

        assertEquals(3, index.size());
        assertEquals("a", index.get(0).handle());
        assertEquals("b", index.get(1).handle());
        assertEquals("c", index.get(2).handle());
    }

    @Test
    void testBuild_equalTimestampsKeepEncounterOrder() {
        TimeIndex<String> index = TimeIndex.build(List.of(
                new TimeSeriesEntry<>(at(12), "late"),
                new TimeSeriesEntry<>(at(0), "first"),
                new TimeSeriesEntry<>(at(0), "second"),
                new TimeSeriesEntry<>(at(0), "third")));

        assertEquals(List.of("first", "second", "third", "late"),
                index.entries().stream().map(TimeSeriesEntry::handle).toList());
    }

    @Test
    void testBuild_exactDuplicatesCollapsed() {
        TimeIndex<String> index = TimeIndex.build(List.of(
                new TimeSeriesEntry<>(at(0), "a"),
                new TimeSeriesEntry<>(at(0), "a"),
                new TimeSeriesEntry<>(at(0), "b")));
        assertEquals(2, index.size(), "only the (time, handle) duplicate is dropped");
    }

    @Test
    void testBuild_emptyInput() {
        assertTrue(TimeIndex.build(List.<TimeSeriesEntry<String>>of()).isEmpty());
        assertEquals(0, TimeIndex.<String>empty().insertionPoint(at(0)));
    }

    @Test
    void testInsertionPoint_isLeftmost() {
        TimeIndex<String> index = TimeIndex.build(List.of(
                new TimeSeriesEntry<>(at(0), "a"),
                new TimeSeriesEntry<>(at(12), "b"),
                new TimeSeriesEntry<>(at(12), "c"),
                new TimeSeriesEntry<>(at(24), "d")));

        assertEquals(0, index.insertionPoint(at(-5)));
        assertEquals(0, index.insertionPoint(at(0)));
        assertEquals(1, index.insertionPoint(at(6)));
        assertEquals(1, index.insertionPoint(at(12)), "equal timestamps insert before existing entries");
        assertEquals(3, index.insertionPoint(at(13)));
        assertEquals(4, index.insertionPoint(Instant.MAX));
    }
}
