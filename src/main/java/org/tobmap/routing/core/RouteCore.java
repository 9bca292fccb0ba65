package org.tobmap.routing.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tobmap.routing.snap.SnapMatch;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main query entry point.
 *
 * <p>The facade holds the current {@link GraphSnapshot} and applies deterministic request
 * validation before any search starts. Execution flow:</p>
 * <ul>
 * <li>Read the current snapshot once; the whole query runs against it even if a newer one is
 * published meanwhile.</li>
 * <li>Validate the request and resolve coordinate endpoints to edges through the snap index.</li>
 * <li>Delegate to the snapshot's planner.</li>
 * <li>Wrap planner contract failures into {@link RouteCoreException} with stable reason codes.</li>
 * </ul>
 */
public final class RouteCore implements RouterService {
    private static final Logger log = LoggerFactory.getLogger(RouteCore.class);

    public static final String REASON_NO_SNAPSHOT = "NO_SNAPSHOT";
    public static final String REASON_SNAPSHOT_REQUIRED = "SNAPSHOT_REQUIRED";
    public static final String REASON_ROUTE_REQUEST_REQUIRED = "ROUTE_REQUEST_REQUIRED";
    public static final String REASON_MODE_REQUIRED = DijkstraRoutePlanner.REASON_MODE_REQUIRED;
    public static final String REASON_START_REQUIRED = "ROUTE_START_REQUIRED";
    public static final String REASON_END_REQUIRED = "ROUTE_END_REQUIRED";
    public static final String REASON_ENDPOINT_NOT_SNAPPED = "ROUTE_ENDPOINT_NOT_SNAPPED";
    public static final String REASON_INVALID_COORDINATE = "INVALID_COORDINATE";
    public static final String REASON_EDGE_OUT_OF_BOUNDS = DijkstraRoutePlanner.REASON_EDGE_OUT_OF_BOUNDS;

    private final AtomicReference<GraphSnapshot> current = new AtomicReference<>();

    /**
     * Creates a facade with no snapshot; queries fail with {@link #REASON_NO_SNAPSHOT} until
     * {@link #publish(GraphSnapshot)} is called.
     */
    public RouteCore() {
    }

    public RouteCore(GraphSnapshot initial) {
        publish(initial);
    }

    /**
     * Atomically replaces the served snapshot.
     *
     * @return the previous snapshot, or {@code null}.
     */
    public GraphSnapshot publish(GraphSnapshot snapshot) {
        if (snapshot == null) {
            throw new RouteCoreException(REASON_SNAPSHOT_REQUIRED, "snapshot must be non-null");
        }
        GraphSnapshot previous = current.getAndSet(snapshot);
        log.info("published {}", snapshot);
        return previous;
    }

    /**
     * Snapshot currently served, if any.
     */
    public Optional<GraphSnapshot> currentSnapshot() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public OptionalInt snap(double lat, double lng) {
        GraphSnapshot snapshot = requireSnapshot();
        try {
            return snapshot.snapIndex().snap(lat, lng);
        } catch (IllegalArgumentException ex) {
            throw new RouteCoreException(REASON_INVALID_COORDINATE, ex.getMessage(), ex);
        }
    }

    @Override
    public Optional<SnapMatch> nearest(double lat, double lng) {
        GraphSnapshot snapshot = requireSnapshot();
        try {
            return snapshot.snapIndex().nearest(lat, lng);
        } catch (IllegalArgumentException ex) {
            throw new RouteCoreException(REASON_INVALID_COORDINATE, ex.getMessage(), ex);
        }
    }

    /**
     * Executes one route request.
     *
     * @throws RouteCoreException when request contracts fail.
     */
    @Override
    public RouteResult route(RouteRequest request) {
        if (request == null) {
            throw new RouteCoreException(REASON_ROUTE_REQUEST_REQUIRED, "route request must be non-null");
        }
        if (request.getMode() == null) {
            throw new RouteCoreException(REASON_MODE_REQUIRED, "travel mode is required");
        }
        GraphSnapshot snapshot = requireSnapshot();
        int startEdge = resolveEndpoint(snapshot, request.getStartEdge(), request.getStartLat(),
                request.getStartLng(), REASON_START_REQUIRED, "start");
        int endEdge = resolveEndpoint(snapshot, request.getEndEdge(), request.getEndLat(),
                request.getEndLng(), REASON_END_REQUIRED, "end");

        RoutePlanner planner = snapshot.planner();
        RouteResult result = request.getMaxVisitedNodes() == null
                ? planner.route(startEdge, endEdge, request.getMode())
                : planner.route(startEdge, endEdge, request.getMode(), request.getMaxVisitedNodes());
        log.debug("route {} -> {} ({}): {}", startEdge, endEdge, request.getMode(), result.status());
        return result;
    }

    private GraphSnapshot requireSnapshot() {
        GraphSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new RouteCoreException(REASON_NO_SNAPSHOT, "no graph snapshot has been published");
        }
        return snapshot;
    }

    private static int resolveEndpoint(
            GraphSnapshot snapshot,
            Integer edge,
            Double lat,
            Double lng,
            String missingReason,
            String label
    ) {
        if (edge != null) {
            return edge;
        }
        if (lat == null || lng == null) {
            throw new RouteCoreException(missingReason, label + " edge or coordinate is required");
        }
        OptionalInt snapped;
        try {
            snapped = snapshot.snapIndex().snap(lat, lng);
        } catch (IllegalArgumentException ex) {
            throw new RouteCoreException(REASON_INVALID_COORDINATE, ex.getMessage(), ex);
        }
        if (snapped.isEmpty()) {
            throw new RouteCoreException(
                    REASON_ENDPOINT_NOT_SNAPPED,
                    label + " coordinate (" + lat + ", " + lng + ") is not near any edge"
            );
        }
        return snapped.getAsInt();
    }
}
