package org.tobmap.routing.profile;

import lombok.Builder;
import lombok.Value;
import org.tobmap.routing.graph.Interaction;

import java.util.Objects;

/**
 * Per-mode routing knobs: turn penalties by intersection control and one-way handling.
 */
@Value
@Builder
public class ModeProfile {
    public static final String REASON_INVALID_PENALTY = "MODE_PROFILE_INVALID_PENALTY";

    TravelMode mode;

    @Builder.Default
    int yieldPenalty = 0;

    @Builder.Default
    int stopSignPenalty = 0;

    @Builder.Default
    int trafficLightPenalty = 0;

    @Builder.Default
    boolean honorsOneWay = false;

    /**
     * Penalty charged when passing through an intersection governed by {@code interaction}.
     */
    public int penalty(Interaction interaction) {
        return switch (interaction) {
            case NONE -> 0;
            case YIELD -> yieldPenalty;
            case STOP_SIGN -> stopSignPenalty;
            case TRAFFIC_LIGHT -> trafficLightPenalty;
        };
    }

    /**
     * Checks that penalties are non-negative and grow with control severity.
     *
     * @throws IllegalArgumentException when the profile breaks either rule.
     */
    public ModeProfile validate() {
        Objects.requireNonNull(mode, "mode");
        if (yieldPenalty < 0 || stopSignPenalty < 0 || trafficLightPenalty < 0) {
            throw new IllegalArgumentException(REASON_INVALID_PENALTY + ": penalties must be >= 0 for " + mode);
        }
        if (yieldPenalty > stopSignPenalty || stopSignPenalty > trafficLightPenalty) {
            throw new IllegalArgumentException(
                    REASON_INVALID_PENALTY + ": penalties must not decrease with severity for " + mode);
        }
        return this;
    }

    /**
     * Default profile for a mode. Values are in the same seconds-like unit as edge costs.
     */
    public static ModeProfile defaults(TravelMode mode) {
        Objects.requireNonNull(mode, "mode");
        return switch (mode) {
            case CAR -> ModeProfile.builder().mode(mode)
                    .yieldPenalty(3).stopSignPenalty(8).trafficLightPenalty(15)
                    .honorsOneWay(true)
                    .build();
            case BIKE -> ModeProfile.builder().mode(mode)
                    .yieldPenalty(2).stopSignPenalty(5).trafficLightPenalty(15)
                    .honorsOneWay(true)
                    .build();
            case WALK -> ModeProfile.builder().mode(mode)
                    .yieldPenalty(1).stopSignPenalty(2).trafficLightPenalty(10)
                    .build();
            case TRANSIT -> ModeProfile.builder().mode(mode).build();
        };
    }

    /**
     * Profile that charges no turn penalties, keeping the mode's one-way rule.
     */
    public static ModeProfile withoutPenalties(TravelMode mode) {
        return ModeProfile.builder().mode(mode).honorsOneWay(defaults(mode).isHonorsOneWay()).build();
    }
}
