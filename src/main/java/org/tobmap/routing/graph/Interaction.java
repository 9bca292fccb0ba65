package org.tobmap.routing.graph;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Traffic-control semantics governing one movement through an intersection.
 * Constants are declared in increasing severity; {@link #code()} is the persisted 4-bit value.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum Interaction {
    NONE(0),
    YIELD(1),
    STOP_SIGN(2),
    TRAFFIC_LIGHT(3);

    private static final Interaction[] BY_CODE = {NONE, YIELD, STOP_SIGN, TRAFFIC_LIGHT};

    private final int code;

    public static Interaction fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            throw new IllegalArgumentException("Unknown interaction code: " + code);
        }
        return BY_CODE[code];
    }

    /**
     * Returns the more restrictive of two interactions.
     */
    public static Interaction moreSevere(Interaction a, Interaction b) {
        return a.code >= b.code ? a : b;
    }

    /**
     * Packs an (incoming, outgoing) pair into one byte: {@code incoming << 4 | outgoing}.
     */
    public static byte packPair(Interaction incoming, Interaction outgoing) {
        return (byte) ((incoming.code << 4) | outgoing.code);
    }

    public static Interaction incomingOf(byte pair) {
        return fromCode((pair >>> 4) & 0x0F);
    }

    public static Interaction outgoingOf(byte pair) {
        return fromCode(pair & 0x0F);
    }
}
