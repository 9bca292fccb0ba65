package org.tobmap.routing.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("EdgeCostFlags Tests")
class EdgeCostFlagsTest {

    @Test
    @DisplayName("Packing keeps cost and flags independent across the full cost range")
    void testPackUnpackAllFlags() {
        int[] costs = {0, 1, 5, 4095, 4096, EdgeCostFlags.MAX_COST};
        for (int cost : costs) {
            for (int flags = 0; flags < 4; flags++) {
                boolean oneWay = (flags & 1) != 0;
                boolean excluded = (flags & 2) != 0;
                short packed = EdgeCostFlags.pack(cost, oneWay, excluded);
                assertEquals(cost, EdgeCostFlags.cost(packed), "cost " + cost);
                assertEquals(oneWay, EdgeCostFlags.isOneWay(packed));
                assertEquals(excluded, EdgeCostFlags.isExcluded(packed));
                assertEquals(0, packed & EdgeCostFlags.RESERVED_BIT);
            }
        }
    }

    @Test
    @DisplayName("Bit layout: cost in bits 15..3, one-way bit 2, excluded bit 0")
    void testBitLayout() {
        assertEquals((short) 0b0000_0000_0010_1000, EdgeCostFlags.pack(5, false, false));
        assertEquals((short) 0b0000_0000_0010_1100, EdgeCostFlags.pack(5, true, false));
        assertEquals((short) 0b0000_0000_0010_1001, EdgeCostFlags.pack(5, false, true));
        assertEquals((short) 0xFFF8, EdgeCostFlags.pack(EdgeCostFlags.MAX_COST, false, false));
        assertEquals(8191, EdgeCostFlags.MAX_COST);
    }

    @Test
    @DisplayName("Reserved bit is ignored on read")
    void testReservedIgnored() {
        short packed = (short) (EdgeCostFlags.pack(77, true, false) | EdgeCostFlags.RESERVED_BIT);
        assertEquals(77, EdgeCostFlags.cost(packed));
        assertTrue(EdgeCostFlags.isOneWay(packed));
        assertFalse(EdgeCostFlags.isExcluded(packed));
    }

    @Test
    @DisplayName("Out-of-range cost is rejected by pack")
    void testPackRejectsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> EdgeCostFlags.pack(-1, false, false));
        assertThrows(IllegalArgumentException.class, () -> EdgeCostFlags.pack(8192, false, false));
    }

    @Test
    @DisplayName("Raw costs are rounded and clamped into 13 bits")
    void testClampCost() {
        assertEquals(EdgeCostFlags.MAX_COST, EdgeCostFlags.clampCost(9000.0d));
        assertEquals(EdgeCostFlags.MAX_COST, EdgeCostFlags.clampCost(Double.POSITIVE_INFINITY));
        assertEquals(0, EdgeCostFlags.clampCost(-3.0d));
        assertEquals(0, EdgeCostFlags.clampCost(Double.NaN));
        assertEquals(9, EdgeCostFlags.clampCost(9.1d));
        assertEquals(10, EdgeCostFlags.clampCost(9.5d));
    }

    @Test
    @DisplayName("One-way flag can be toggled without touching the cost")
    void testWithOneWay() {
        short packed = EdgeCostFlags.pack(300, false, false);
        short oneWay = EdgeCostFlags.withOneWay(packed, true);
        assertTrue(EdgeCostFlags.isOneWay(oneWay));
        assertEquals(300, EdgeCostFlags.cost(oneWay));
        assertEquals(packed, EdgeCostFlags.withOneWay(oneWay, false));
        assertEquals("300->", EdgeCostFlags.describe(oneWay));
        assertEquals("excluded", EdgeCostFlags.describe(EdgeCostFlags.EXCLUDED));
    }
}
