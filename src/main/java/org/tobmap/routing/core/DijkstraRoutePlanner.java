package org.tobmap.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tobmap.routing.cost.CostEngine;
import org.tobmap.routing.graph.GraphStore;
import org.tobmap.routing.profile.ModeProfile;
import org.tobmap.routing.profile.TravelMode;
import org.tobmap.routing.search.SearchQueue;

import java.util.Arrays;
import java.util.Objects;

/**
 * Turn-aware Dijkstra over directed edge states, answering edge-to-edge queries.
 *
 * <p>Search model:</p>
 * <ul>
 * <li>A state is an edge traversed in one direction; its head is the node the traversal ends at.
 * State {@code 2 * edge} heads to {@code edgeTo(edge)}, state {@code 2 * edge + 1} to
 * {@code edgeFrom(edge)}. Labels live on states, so two approaches to the same node keep their own
 * cost and the penalty of the turn that follows each one.</li>
 * <li>The start edge is traversed in full: each direction the mode may use is seeded with
 * {@code cost(start)}.</li>
 * <li>Leaving the head {@code n} of a state on edge {@code a} over edge {@code b} costs
 * {@code cost(b) + turnPenalty(n, a, b)}.</li>
 * <li>The end edge leads only into a virtual sink state (index {@code 2 * edgeCount}); popping the
 * sink finalizes the route.</li>
 * <li>Queue ties resolve to the smaller head node index, then the smaller state index, so results
 * are deterministic.</li>
 * <li>The visited count is the number of distinct head nodes settled.</li>
 * </ul>
 */
public final class DijkstraRoutePlanner implements RoutePlanner {
    private static final Logger log = LoggerFactory.getLogger(DijkstraRoutePlanner.class);

    public static final String REASON_EDGE_OUT_OF_BOUNDS = "ROUTE_EDGE_OUT_OF_BOUNDS";
    public static final String REASON_MODE_REQUIRED = "ROUTE_MODE_REQUIRED";

    private static final long INF = Long.MAX_VALUE;
    private static final int NONE = -1;

    private final GraphStore graph;
    private final CostEngine costEngine;
    private final SearchBudget defaultBudget;
    // head node per state, nodeCount for the sink; doubles as the queue tie rank
    private final int[] stateHead;

    /**
     * Creates a planner whose default budget comes from system properties.
     */
    public DijkstraRoutePlanner(CostEngine costEngine) {
        this(costEngine, SearchBudget.defaults());
    }

    /**
     * Creates a planner with an explicit default visited-node budget (non-positive means unbounded).
     */
    public DijkstraRoutePlanner(CostEngine costEngine, int defaultMaxVisitedNodes) {
        this(costEngine, SearchBudget.of(defaultMaxVisitedNodes));
    }

    private DijkstraRoutePlanner(CostEngine costEngine, SearchBudget defaultBudget) {
        this.costEngine = Objects.requireNonNull(costEngine, "costEngine");
        this.graph = costEngine.graph();
        this.defaultBudget = defaultBudget;
        this.stateHead = headsOf(graph);
    }

    public GraphStore graph() {
        return graph;
    }

    @Override
    public RouteResult route(int startEdge, int endEdge, TravelMode mode) {
        return compute(startEdge, endEdge, mode, defaultBudget);
    }

    @Override
    public RouteResult route(int startEdge, int endEdge, TravelMode mode, int maxVisitedNodes) {
        return compute(startEdge, endEdge, mode, SearchBudget.of(maxVisitedNodes));
    }

    private RouteResult compute(int startEdge, int endEdge, TravelMode mode, SearchBudget budget) {
        if (mode == null) {
            throw new RouteCoreException(REASON_MODE_REQUIRED, "travel mode is required");
        }
        requireEdge("startEdge", startEdge);
        requireEdge("endEdge", endEdge);

        if (graph.isExcluded(startEdge, mode) || graph.isExcluded(endEdge, mode)) {
            return RouteResult.unreachable(0);
        }
        if (startEdge == endEdge) {
            return RouteResult.found(new int[]{startEdge}, graph.cost(startEdge, mode), 0);
        }

        ModeProfile profile = costEngine.profile(mode);
        boolean honorOneWay = profile.isHonorsOneWay();
        int sink = 2 * graph.edgeCount();

        long[] dist = new long[sink + 1];
        int[] predState = new int[sink + 1];
        boolean[] settled = new boolean[sink + 1];
        boolean[] nodeVisited = new boolean[graph.nodeCount()];
        Arrays.fill(dist, INF);
        Arrays.fill(predState, NONE);

        SearchQueue queue = new SearchQueue(sink, stateHead);
        long startCost = graph.cost(startEdge, mode);
        if (graph.canTraverse(startEdge, graph.edgeFrom(startEdge), mode, honorOneWay)) {
            seed(forwardState(startEdge), startCost, dist, queue);
        }
        if (graph.canTraverse(startEdge, graph.edgeTo(startEdge), mode, honorOneWay)) {
            seed(backwardState(startEdge), startCost, dist, queue);
        }

        int visited = 0;
        try {
            while (!queue.isEmpty()) {
                int state = queue.extractMin();
                if (state == sink) {
                    int[] path = reconstruct(predState[sink], endEdge, predState);
                    return RouteResult.found(path, dist[sink], visited);
                }
                settled[state] = true;
                int u = stateHead[state];
                if (!nodeVisited[u]) {
                    nodeVisited[u] = true;
                    visited++;
                    budget.checkVisitedNodes(visited);
                }

                long base = dist[state];
                int incomingEntry = graph.findEntry(u, state >>> 1);
                int end = graph.firstEntry(u + 1);
                for (int entry = graph.firstEntry(u); entry < end; entry++) {
                    int edge = graph.entryEdge(entry);
                    if (edge == startEdge || !graph.canTraverse(edge, u, mode, honorOneWay)) {
                        continue;
                    }
                    int next = edge == endEdge ? sink : stateLeaving(edge, u);
                    if (settled[next]) {
                        continue;
                    }
                    long candidate = base + costEngine.transitionCost(incomingEntry, entry, mode);
                    if (candidate < dist[next]) {
                        dist[next] = candidate;
                        predState[next] = state;
                        queue.insertOrDecrease(next, candidate);
                    }
                }
            }
        } catch (SearchBudget.BudgetExceededException ex) {
            log.debug("route {} -> {} ({}) truncated: {}", startEdge, endEdge, mode, ex.getMessage());
            return RouteResult.truncated(visited);
        }
        return RouteResult.unreachable(visited);
    }

    private static int[] headsOf(GraphStore graph) {
        int[] heads = new int[2 * graph.edgeCount() + 1];
        for (int edge = 0; edge < graph.edgeCount(); edge++) {
            heads[forwardState(edge)] = graph.edgeTo(edge);
            heads[backwardState(edge)] = graph.edgeFrom(edge);
        }
        heads[heads.length - 1] = graph.nodeCount();
        return heads;
    }

    private static int forwardState(int edge) {
        return 2 * edge;
    }

    private static int backwardState(int edge) {
        return 2 * edge + 1;
    }

    /**
     * State entered when {@code edge} is left from {@code node}. A loop edge is always forward.
     */
    private int stateLeaving(int edge, int node) {
        return graph.edgeFrom(edge) == node ? forwardState(edge) : backwardState(edge);
    }

    private static void seed(int state, long cost, long[] dist, SearchQueue queue) {
        if (cost < dist[state]) {
            dist[state] = cost;
            queue.insertOrDecrease(state, cost);
        }
    }

    /**
     * Walks predecessor states from the one that entered the end edge back to a seeded start state.
     */
    private static int[] reconstruct(int lastState, int endEdge, int[] predState) {
        IntArrayList reversed = new IntArrayList();
        reversed.add(endEdge);
        for (int state = lastState; state != NONE; state = predState[state]) {
            reversed.add(state >>> 1);
        }
        int[] path = new int[reversed.size()];
        for (int i = 0; i < path.length; i++) {
            path[i] = reversed.getInt(path.length - 1 - i);
        }
        return path;
    }

    private void requireEdge(String name, int edge) {
        if (edge < 0 || edge >= graph.edgeCount()) {
            throw new RouteCoreException(
                    REASON_EDGE_OUT_OF_BOUNDS,
                    name + " " + edge + " out of bounds [0, " + graph.edgeCount() + ")"
            );
        }
    }
}
