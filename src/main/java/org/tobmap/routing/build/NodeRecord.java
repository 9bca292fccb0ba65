package org.tobmap.routing.build;

import org.tobmap.routing.graph.Interaction;

import java.util.Locale;

/**
 * Raw intersection handed over by ingestion.
 *
 * @param id external node id.
 * @param lat latitude in degrees.
 * @param lng longitude in degrees.
 * @param control traffic control of the intersection, used where a way gives no approach control.
 */
public record NodeRecord(long id, double lat, double lng, Interaction control) {
    public NodeRecord {
        control = control == null ? Interaction.NONE : control;
    }

    public static NodeRecord of(long id, double lat, double lng) {
        return new NodeRecord(id, lat, lng, Interaction.NONE);
    }

    /**
     * Maps a node {@code highway} tag value to its traffic control.
     */
    public static Interaction controlFromHighwayTag(String value) {
        if (value == null) {
            return Interaction.NONE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "traffic_signals" -> Interaction.TRAFFIC_LIGHT;
            case "stop" -> Interaction.STOP_SIGN;
            case "give_way" -> Interaction.YIELD;
            default -> Interaction.NONE;
        };
    }
}
