package org.tobmap.routing.build;

import java.util.Locale;

/**
 * Functional road class, mapped from the {@code highway} tag of a way.
 */
public enum RoadClass {
    MOTORWAY,
    TRUNK,
    PRIMARY,
    SECONDARY,
    TERTIARY,
    RESIDENTIAL,
    UNCLASSIFIED,
    SERVICE,
    LIVING_STREET,
    PEDESTRIAN,
    CYCLEWAY,
    FOOTWAY,
    PATH,
    STEPS,
    OTHER;

    /**
     * Maps a raw {@code highway} tag value; {@code *_link} values share the class of their road.
     * Unknown or missing values map to {@link #OTHER}.
     */
    public static RoadClass fromHighwayTag(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("_link")) {
            normalized = normalized.substring(0, normalized.length() - "_link".length());
        }
        return switch (normalized) {
            case "motorway" -> MOTORWAY;
            case "trunk" -> TRUNK;
            case "primary" -> PRIMARY;
            case "secondary" -> SECONDARY;
            case "tertiary" -> TERTIARY;
            case "residential" -> RESIDENTIAL;
            case "unclassified" -> UNCLASSIFIED;
            case "service" -> SERVICE;
            case "living_street" -> LIVING_STREET;
            case "pedestrian" -> PEDESTRIAN;
            case "cycleway" -> CYCLEWAY;
            case "footway" -> FOOTWAY;
            case "path" -> PATH;
            case "steps" -> STEPS;
            default -> OTHER;
        };
    }
}
