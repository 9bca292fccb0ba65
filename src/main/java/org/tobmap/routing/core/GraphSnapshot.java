package org.tobmap.routing.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.tobmap.routing.cost.CostEngine;
import org.tobmap.routing.graph.GraphStore;
import org.tobmap.routing.profile.ModeProfile;
import org.tobmap.routing.snap.SnapBuckets;
import org.tobmap.routing.snap.SnapConfig;
import org.tobmap.routing.snap.SnapIndex;

import java.util.Collection;
import java.util.Objects;

/**
 * One immutable, query-ready generation of the road graph: store, snap buckets and the query
 * engines bound to them. Rebuilds produce a new snapshot instead of mutating this one.
 */
@Getter
@Accessors(fluent = true)
public final class GraphSnapshot {
    private final GraphStore graph;
    private final SnapBuckets snapBuckets;
    private final SnapIndex snapIndex;
    private final RoutePlanner planner;

    private GraphSnapshot(GraphStore graph, SnapBuckets snapBuckets, SnapIndex snapIndex, RoutePlanner planner) {
        this.graph = graph;
        this.snapBuckets = snapBuckets;
        this.snapIndex = snapIndex;
        this.planner = planner;
    }

    /**
     * Binds default profiles, default snap limits and the system-property visited-node budget.
     *
     * @throws org.tobmap.routing.snap.IndexCorruptionException if the buckets do not fit the graph.
     */
    public static GraphSnapshot of(GraphStore graph, SnapBuckets snapBuckets) {
        return of(graph, snapBuckets, SnapConfig.defaults(), null, 0);
    }

    /**
     * @param profiles mode profile overrides, or {@code null} for defaults.
     * @param maxVisitedNodes default visited-node budget; non-positive reads {@code tobmap.routing.maxVisitedNodes}.
     */
    public static GraphSnapshot of(
            GraphStore graph,
            SnapBuckets snapBuckets,
            SnapConfig snapConfig,
            Collection<ModeProfile> profiles,
            int maxVisitedNodes
    ) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(snapBuckets, "snapBuckets");
        SnapIndex snapIndex = new SnapIndex(graph, snapBuckets, snapConfig);
        CostEngine costEngine = new CostEngine(graph, profiles);
        RoutePlanner planner = maxVisitedNodes > 0
                ? new DijkstraRoutePlanner(costEngine, maxVisitedNodes)
                : new DijkstraRoutePlanner(costEngine);
        return new GraphSnapshot(graph, snapBuckets, snapIndex, planner);
    }

    @Override
    public String toString() {
        return "GraphSnapshot[" + graph + ", " + snapBuckets + "]";
    }
}
