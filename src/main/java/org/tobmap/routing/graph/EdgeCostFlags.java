package org.tobmap.routing.graph;

import lombok.experimental.UtilityClass;

/**
 * Accessors for the 16-bit per-mode edge cost/flags field.
 * <p>
 * Bits are numbered LSB-0 (bit 0 is the least significant bit of the unsigned value):
 * </p>
 * <pre>
 *  15                          3    2       1          0
 * +-----------------------------+--------+----------+----------+
 * |        cost (13 bits)       | oneway | reserved | excluded |
 * +-----------------------------+--------+----------+----------+
 * </pre>
 * <ul>
 * <li>cost: travel cost in {@code [0, 8191]}.</li>
 * <li>oneway: the edge may only be traversed from its recorded {@code from} node to its {@code to} node
 * (honoured only by modes whose profile says so).</li>
 * <li>reserved: always written as 0, ignored on read.</li>
 * <li>excluded: the mode has no access to the edge; the cost bits are meaningless.</li>
 * </ul>
 */
@UtilityClass
public final class EdgeCostFlags {

    public static final int COST_BITS = 13;
    public static final int COST_SHIFT = 3;
    public static final int MAX_COST = (1 << COST_BITS) - 1;

    public static final int ONE_WAY_BIT = 1 << 2;
    public static final int RESERVED_BIT = 1 << 1;
    public static final int EXCLUDED_BIT = 1;

    /** Packed value of an excluded, two-way field. */
    public static final short EXCLUDED = (short) EXCLUDED_BIT;

    /**
     * Packs a cost and flags.
     *
     * @throws IllegalArgumentException if {@code cost} is outside {@code [0, MAX_COST]}.
     */
    public static short pack(int cost, boolean oneWay, boolean excluded) {
        if (cost < 0 || cost > MAX_COST) {
            throw new IllegalArgumentException("cost must be in [0, " + MAX_COST + "], got " + cost);
        }
        int packed = cost << COST_SHIFT;
        if (oneWay) {
            packed |= ONE_WAY_BIT;
        }
        if (excluded) {
            packed |= EXCLUDED_BIT;
        }
        return (short) packed;
    }

    public static int cost(short packed) {
        return (packed & 0xFFFF) >>> COST_SHIFT;
    }

    public static boolean isOneWay(short packed) {
        return (packed & ONE_WAY_BIT) != 0;
    }

    public static boolean isExcluded(short packed) {
        return (packed & EXCLUDED_BIT) != 0;
    }

    public static short withOneWay(short packed, boolean oneWay) {
        int value = packed & 0xFFFF;
        value = oneWay ? value | ONE_WAY_BIT : value & ~ONE_WAY_BIT;
        return (short) value;
    }

    /**
     * Rounds a raw cost and clamps it into the 13-bit range. Non-finite values clamp to the bounds.
     */
    public static int clampCost(double rawCost) {
        if (Double.isNaN(rawCost) || rawCost <= 0.0d) {
            return 0;
        }
        if (rawCost >= MAX_COST) {
            return MAX_COST;
        }
        return (int) Math.round(rawCost);
    }

    public static String describe(short packed) {
        if (isExcluded(packed)) {
            return "excluded";
        }
        return cost(packed) + (isOneWay(packed) ? "->" : "<->");
    }
}
