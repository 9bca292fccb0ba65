package org.tobmap.routing.snap;

import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tobmap.core.cell.CellIndexer;
import org.tobmap.core.geo.GeometryDistance;
import org.tobmap.routing.graph.GraphStore;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Two-level nearest-edge query engine over {@link SnapBuckets}.
 * <p>
 * Query flow:
 * </p>
 * <ol>
 * <li>Probe the query's fine cell and then rings of neighbouring fine cells. Each fine cell is
 * looked up by binary search in the bucket of its own outer cell, so rings crossing an outer
 * boundary still find their edges. After the first ring with candidates one more ring is probed.</li>
 * <li>If nothing was found, probe rings of whole outer buckets the same way.</li>
 * <li>Rank candidates by exact point-to-segment distance; ties go to the smaller edge index.</li>
 * </ol>
 * <p>
 * Immutable after construction and safe for concurrent reads; every query allocates its own
 * candidate set.
 * </p>
 */
public final class SnapIndex {
    private static final Logger log = LoggerFactory.getLogger(SnapIndex.class);

    @Getter
    @Accessors(fluent = true)
    private final GraphStore graph;
    @Getter
    @Accessors(fluent = true)
    private final SnapBuckets buckets;
    @Getter
    @Accessors(fluent = true)
    private final SnapConfig config;

    public SnapIndex(GraphStore graph, SnapBuckets buckets) {
        this(graph, buckets, SnapConfig.defaults());
    }

    /**
     * @throws IndexCorruptionException if the buckets reference edges the graph does not have.
     */
    public SnapIndex(GraphStore graph, SnapBuckets buckets, SnapConfig config) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.buckets = Objects.requireNonNull(buckets, "buckets");
        this.config = Objects.requireNonNull(config, "config").validate();
        int maxEdge = buckets.maxEdgeIndex();
        if (maxEdge >= graph.edgeCount()) {
            throw new IndexCorruptionException(
                    "snap buckets reference edge " + maxEdge + " but graph has " + graph.edgeCount() + " edges");
        }
        log.debug("snap index ready: {} over {}", buckets, graph);
    }

    /**
     * Index of the edge nearest to the point, or empty when no edge lies within reach.
     *
     * @throws IllegalArgumentException if a coordinate is not finite.
     */
    public OptionalInt snap(double lat, double lng) {
        Optional<SnapMatch> match = nearest(lat, lng);
        return match.isPresent() ? OptionalInt.of(match.get().edgeIndex()) : OptionalInt.empty();
    }

    /**
     * Nearest edge with distance and projected point, or empty when no edge lies within reach.
     *
     * @throws IllegalArgumentException if a coordinate is not finite.
     */
    public Optional<SnapMatch> nearest(double lat, double lng) {
        if (!Double.isFinite(lat) || !Double.isFinite(lng)) {
            throw new IllegalArgumentException("coordinates must be finite: (" + lat + ", " + lng + ")");
        }
        IntSortedSet candidates = new IntAVLTreeSet();
        probeFineRings(lat, lng, candidates);
        if (candidates.isEmpty()) {
            probeOuterRings(lat, lng, candidates);
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return closest(lat, lng, candidates);
    }

    /**
     * Distance in metres from the point to the geometry of {@code edgeIndex}.
     */
    public double distanceToEdge(double lat, double lng, int edgeIndex) {
        return measure(lat, lng, edgeIndex).distanceMeters();
    }

    private void probeFineRings(double lat, double lng, IntSortedSet candidates) {
        long start = CellIndexer.pointToCell(lat, lng, buckets.fineLevel());
        probeRings(start, config.getMaxFineRings(), candidates, true);
    }

    private void probeOuterRings(double lat, double lng, IntSortedSet candidates) {
        long start = CellIndexer.pointToCell(lat, lng, buckets.outerLevel());
        probeRings(start, config.getMaxOuterRings(), candidates, false);
    }

    /**
     * Breadth-first ring expansion around {@code center}: ring 0 is the cell itself, ring r+1 the
     * unseen neighbours of ring r.
     */
    private void probeRings(long center, int maxRings, IntSortedSet candidates, boolean fine) {
        LongOpenHashSet seen = new LongOpenHashSet();
        LongArrayList ring = new LongArrayList();
        ring.add(center);
        seen.add(center);
        int firstHitRing = -1;

        for (int r = 0; r <= maxRings && !ring.isEmpty(); r++) {
            for (int i = 0; i < ring.size(); i++) {
                long cell = ring.getLong(i);
                if (fine) {
                    buckets.bucketFor(cell).collectEdges(cell, candidates);
                } else {
                    buckets.bucketFor(cell).collectAllEdges(candidates);
                }
            }
            if (firstHitRing < 0 && !candidates.isEmpty()) {
                firstHitRing = r;
            } else if (firstHitRing >= 0) {
                return;
            }
            if (r == maxRings) {
                return;
            }
            LongArrayList next = new LongArrayList();
            for (int i = 0; i < ring.size(); i++) {
                for (long neighbor : CellIndexer.neighbors(ring.getLong(i))) {
                    if (seen.add(neighbor)) {
                        next.add(neighbor);
                    }
                }
            }
            ring = next;
        }
    }

    private Optional<SnapMatch> closest(double lat, double lng, IntSortedSet candidates) {
        SnapMatch best = null;
        // ascending iteration plus strict comparison keeps the smallest edge on ties
        for (int edge : candidates) {
            SnapMatch match = measure(lat, lng, edge);
            if (best == null || match.distanceMeters() < best.distanceMeters()) {
                best = match;
            }
        }
        if (best == null || best.distanceMeters() > config.getMaxDistanceMeters()) {
            return Optional.empty();
        }
        return Optional.of(best);
    }

    private SnapMatch measure(double lat, double lng, int edge) {
        int first = graph.geometryStart(edge);
        int count = graph.geometryPointCount(edge);
        double bestDistance = Double.POSITIVE_INFINITY;
        int bestSegment = 0;
        double bestT = 0.0d;
        for (int s = 0; s + 1 < count; s++) {
            int a = first + s;
            int b = a + 1;
            double d = GeometryDistance.pointToSegmentMeters(
                    lat, lng, graph.pointLat(a), graph.pointLng(a), graph.pointLat(b), graph.pointLng(b));
            if (d < bestDistance) {
                bestDistance = d;
                bestSegment = s;
                bestT = GeometryDistance.projectionFraction(
                        lat, lng, graph.pointLat(a), graph.pointLng(a), graph.pointLat(b), graph.pointLng(b));
            }
        }
        int a = first + bestSegment;
        double aLat = graph.pointLat(a);
        double aLng = graph.pointLng(a);
        double projectedLat = aLat + bestT * (graph.pointLat(a + 1) - aLat);
        double projectedLng = aLng + bestT * GeometryDistance.normalizeDeltaLongitudeDegrees(graph.pointLng(a + 1) - aLng);
        return new SnapMatch(edge, bestDistance, projectedLat, projectedLng, bestSegment);
    }
}
