package org.tobmap.routing.cost;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.tobmap.routing.graph.GraphStore;
import org.tobmap.routing.graph.Interaction;
import org.tobmap.routing.profile.ModeProfile;
import org.tobmap.routing.profile.TravelMode;

import java.util.Collection;
import java.util.Objects;

/**
 * Edge and turn cost composition per travel mode.
 * <p>
 * Canonical transition cost when leaving node {@code n} through edge {@code b} after
 * arriving on edge {@code a}:
 * </p>
 * <pre>
 * transition_cost = cost(b, mode) + penalty(mode, moreSevere(incoming(n, a), outgoing(n, b)))
 * </pre>
 * <p>
 * When there is no arriving edge only the outgoing interaction applies.
 * </p>
 */
@Accessors(fluent = true)
public final class CostEngine {

    /**
     * Sentinel entry when no predecessor edge is available.
     */
    public static final int NO_ENTRY = -1;

    @Getter
    private final GraphStore graph;
    private final ModeProfile[] profiles;

    /**
     * Creates an engine with the default profile of every mode.
     */
    public CostEngine(GraphStore graph) {
        this(graph, null);
    }

    /**
     * Creates an engine. Profiles not supplied fall back to {@link ModeProfile#defaults(TravelMode)}.
     *
     * @throws IllegalArgumentException if two overrides name the same mode or a profile is invalid.
     */
    public CostEngine(GraphStore graph, Collection<ModeProfile> overrides) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.profiles = new ModeProfile[TravelMode.count()];
        if (overrides != null) {
            for (ModeProfile profile : overrides) {
                ModeProfile validated = Objects.requireNonNull(profile, "profile").validate();
                int slot = validated.getMode().ordinal();
                if (profiles[slot] != null) {
                    throw new IllegalArgumentException("duplicate profile for mode " + validated.getMode());
                }
                profiles[slot] = validated;
            }
        }
        for (TravelMode mode : TravelMode.values()) {
            if (profiles[mode.ordinal()] == null) {
                profiles[mode.ordinal()] = ModeProfile.defaults(mode);
            }
        }
    }

    public ModeProfile profile(TravelMode mode) {
        return profiles[mode.ordinal()];
    }

    public int edgeCost(int edgeId, TravelMode mode) {
        return graph.cost(edgeId, mode);
    }

    /**
     * Turn penalty through a node, addressed by incidence entries of that node.
     *
     * @param incomingEntry entry of the arriving edge, or {@link #NO_ENTRY}.
     * @param outgoingEntry entry of the leaving edge.
     */
    public int turnPenalty(int incomingEntry, int outgoingEntry, TravelMode mode) {
        Interaction outgoing = graph.entryOutgoing(outgoingEntry);
        Interaction governing = incomingEntry == NO_ENTRY
                ? outgoing
                : Interaction.moreSevere(graph.entryIncoming(incomingEntry), outgoing);
        return profiles[mode.ordinal()].penalty(governing);
    }

    /**
     * Turn penalty at {@code nodeId} for the movement {@code incomingEdge -> outgoingEdge}.
     *
     * @throws IllegalArgumentException if either edge does not touch the node.
     */
    public int turnPenaltyAt(int nodeId, int incomingEdge, int outgoingEdge, TravelMode mode) {
        int outgoingEntry = requireEntry(nodeId, outgoingEdge);
        int incomingEntry = incomingEdge < 0 ? NO_ENTRY : requireEntry(nodeId, incomingEdge);
        return turnPenalty(incomingEntry, outgoingEntry, mode);
    }

    /**
     * Full cost of leaving through {@code outgoingEntry}: edge cost plus turn penalty.
     */
    public long transitionCost(int incomingEntry, int outgoingEntry, TravelMode mode) {
        int edgeId = graph.entryEdge(outgoingEntry);
        return (long) graph.cost(edgeId, mode) + turnPenalty(incomingEntry, outgoingEntry, mode);
    }

    private int requireEntry(int nodeId, int edgeId) {
        int entry = graph.findEntry(nodeId, edgeId);
        if (entry < 0) {
            throw new IllegalArgumentException("edge " + edgeId + " is not incident to node " + nodeId);
        }
        return entry;
    }
}
