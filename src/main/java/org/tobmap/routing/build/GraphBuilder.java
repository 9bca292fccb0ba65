package org.tobmap.routing.build;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.objects.Object2LongOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tobmap.core.cell.CellIndexer;
import org.tobmap.core.geo.GeometryDistance;
import org.tobmap.core.id.NodeIdMapper;
import org.tobmap.routing.graph.EdgeCostFlags;
import org.tobmap.routing.graph.GraphStore;
import org.tobmap.routing.graph.Interaction;
import org.tobmap.routing.profile.TravelMode;
import org.tobmap.routing.snap.SnapBucket;
import org.tobmap.routing.snap.SnapBuckets;
import org.tobmap.routing.snap.SnapConfig;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Offline, single-threaded construction of a {@link GraphStore} and its {@link SnapBuckets}
 * from raw ways and intersections.
 * <p>
 * Pipeline:
 * </p>
 * <ol>
 * <li>Validate every record; the first problem aborts the build with {@link MalformedInputException}.</li>
 * <li>Allocate nodes for referenced intersections plus synthetic dead ends at untagged way ends.</li>
 * <li>Split ways into edges at intersections and price each edge per mode.</li>
 * <li>Order nodes and edges by cell for locality, derive interactions and incidence lists.</li>
 * <li>Sample edge geometry into fine cells grouped by outer cell.</li>
 * </ol>
 * <p>
 * Instances hold no state between builds.
 * </p>
 */
public final class GraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final BuildConfig config;

    public GraphBuilder() {
        this(BuildConfig.defaults());
    }

    public GraphBuilder(BuildConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        config.getSnapConfig().validate();
    }

    /**
     * Runs the whole pipeline.
     *
     * @throws MalformedInputException when a way or node record is invalid.
     * @throws IllegalStateException when the assembled graph breaks its own invariants.
     */
    public BuildResult build(Collection<WayRecord> ways, Collection<NodeRecord> nodes) {
        Objects.requireNonNull(ways, "ways");
        Objects.requireNonNull(nodes, "nodes");
        log.info("building graph '{}' from {} ways and {} nodes", config.getName(), ways.size(), nodes.size());

        Long2ObjectOpenHashMap<NodeRecord> nodeTable = indexNodes(nodes);
        LongOpenHashSet wayIds = new LongOpenHashSet(ways.size());
        for (WayRecord way : ways) {
            validateWay(way, nodeTable);
            if (!wayIds.add(way.id())) {
                throw new MalformedInputException(MalformedInputException.REASON_DUPLICATE_WAY, way.id(),
                        "duplicate way id");
            }
        }

        Draft draft = new Draft(nodeTable);
        for (WayRecord way : ways) {
            draft.addWay(way);
        }
        List<String> warnings = new ArrayList<>();
        draft.priceEdges(warnings);

        GraphStore graph = assemble(draft);
        GraphStore.ValidationResult validation = graph.validate();
        if (!validation.isValid()) {
            throw new IllegalStateException("built graph is inconsistent: " + validation.errors());
        }
        for (String warning : validation.warnings()) {
            log.info("graph '{}': {}", config.getName(), warning);
        }

        SnapBuckets snapBuckets = buildSnapBuckets(graph);
        log.info("built {} and {} ({} warnings)", graph, snapBuckets, warnings.size());

        return BuildResult.builder()
                .graph(graph)
                .snapBuckets(snapBuckets)
                .warnings(List.copyOf(warnings))
                .wayEdges(draft.wayEdges)
                .build();
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private static Long2ObjectOpenHashMap<NodeRecord> indexNodes(Collection<NodeRecord> nodes) {
        Long2ObjectOpenHashMap<NodeRecord> table = new Long2ObjectOpenHashMap<>(nodes.size());
        for (NodeRecord node : nodes) {
            Objects.requireNonNull(node, "node record");
            if (!GeometryDistance.isValidCoordinate(node.lat(), node.lng())) {
                throw new MalformedInputException(MalformedInputException.REASON_INVALID_COORDINATE, node.id(),
                        "node coordinate out of range: (" + node.lat() + ", " + node.lng() + ")");
            }
            if (table.put(node.id(), node) != null) {
                throw new MalformedInputException(MalformedInputException.REASON_DUPLICATE_NODE, node.id(),
                        "duplicate node id");
            }
        }
        return table;
    }

    private static void validateWay(WayRecord way, Long2ObjectOpenHashMap<NodeRecord> nodeTable) {
        Objects.requireNonNull(way, "way record");
        if (way.points().size() < 2) {
            throw new MalformedInputException(MalformedInputException.REASON_TOO_FEW_POINTS, way.id(),
                    "way has " + way.points().size() + " points, needs at least 2");
        }
        int priority = way.tags().getPriority();
        if (priority < 0 || priority > 10) {
            throw new MalformedInputException(MalformedInputException.REASON_INVALID_PRIORITY, way.id(),
                    "priority must be in [0, 10], got " + priority);
        }
        for (WayPoint point : way.points()) {
            if (!GeometryDistance.isValidCoordinate(point.lat(), point.lng())) {
                throw new MalformedInputException(MalformedInputException.REASON_INVALID_COORDINATE, way.id(),
                        "way point out of range: (" + point.lat() + ", " + point.lng() + ")");
            }
            if (point.isIntersection() && !nodeTable.containsKey(point.nodeId())) {
                throw new MalformedInputException(MalformedInputException.REASON_MISSING_NODE, way.id(),
                        "references unknown node " + point.nodeId());
            }
        }
    }

    // ========================================================================
    // DRAFT (pre-ordering working state)
    // ========================================================================

    private record Coordinate(double lat, double lng) {}

    /**
     * Edges and nodes in creation order, keyed by external node id.
     */
    private final class Draft {
        private final Long2ObjectOpenHashMap<NodeRecord> nodeTable;
        private final Object2LongOpenHashMap<Coordinate> syntheticIds = new Object2LongOpenHashMap<>();
        private final LongArrayList nodeOrder = new LongArrayList();
        private final Long2ObjectOpenHashMap<double[]> nodeCoordinates = new Long2ObjectOpenHashMap<>();
        private long nextSyntheticId;

        private final LongArrayList edgeFromExternal = new LongArrayList();
        private final LongArrayList edgeToExternal = new LongArrayList();
        private final List<WayRecord> edgeWay = new ArrayList<>();
        private final List<double[]> edgeLats = new ArrayList<>();
        private final List<double[]> edgeLngs = new ArrayList<>();
        private final List<short[]> edgeCosts = new ArrayList<>();
        private final Long2ObjectMap<int[]> wayEdges = new Long2ObjectOpenHashMap<>();

        Draft(Long2ObjectOpenHashMap<NodeRecord> nodeTable) {
            this.nodeTable = nodeTable;
            long minId = 0L;
            for (long id : nodeTable.keySet()) {
                minId = Math.min(minId, id);
            }
            this.nextSyntheticId = minId - 1L;
        }

        void addWay(WayRecord way) {
            List<WayPoint> points = way.points();
            int last = points.size() - 1;
            IntArrayList created = new IntArrayList();

            long segmentStartNode = nodeAt(points.get(0), true);
            int segmentStart = 0;
            for (int i = 1; i <= last; i++) {
                WayPoint point = points.get(i);
                if (!point.isIntersection() && i != last) {
                    continue;
                }
                long node = nodeAt(point, i == last);
                int pointCount = i - segmentStart + 1;
                if (node != segmentStartNode || pointCount > 2) {
                    created.add(addEdge(way, segmentStartNode, node, points, segmentStart, i));
                }
                segmentStartNode = node;
                segmentStart = i;
            }
            wayEdges.put(way.id(), created.toIntArray());
        }

        private int addEdge(WayRecord way, long from, long to, List<WayPoint> points, int start, int end) {
            int count = end - start + 1;
            double[] lats = new double[count];
            double[] lngs = new double[count];
            for (int i = 0; i < count; i++) {
                WayPoint point = points.get(start + i);
                lats[i] = point.lat();
                lngs[i] = point.lng();
            }
            // geometry starts and ends exactly on the endpoint nodes
            double[] fromCoordinate = nodeCoordinates.get(from);
            double[] toCoordinate = nodeCoordinates.get(to);
            lats[0] = fromCoordinate[0];
            lngs[0] = fromCoordinate[1];
            lats[count - 1] = toCoordinate[0];
            lngs[count - 1] = toCoordinate[1];

            edgeFromExternal.add(from);
            edgeToExternal.add(to);
            edgeWay.add(way);
            edgeLats.add(lats);
            edgeLngs.add(lngs);
            return edgeWay.size() - 1;
        }

        /**
         * External id of the node at a way point: the referenced intersection, a synthetic dead end
         * for an untagged way end, or {@link WayPoint#NO_NODE} for an untagged inner point.
         */
        private long nodeAt(WayPoint point, boolean wayEnd) {
            if (point.isIntersection()) {
                long id = point.nodeId();
                if (!nodeCoordinates.containsKey(id)) {
                    NodeRecord record = nodeTable.get(id);
                    nodeCoordinates.put(id, new double[]{record.lat(), record.lng()});
                    nodeOrder.add(id);
                }
                return id;
            }
            if (!wayEnd) {
                return WayPoint.NO_NODE;
            }
            Coordinate key = new Coordinate(point.lat(), point.lng());
            if (syntheticIds.containsKey(key)) {
                return syntheticIds.getLong(key);
            }
            long id = nextSyntheticId--;
            syntheticIds.put(key, id);
            nodeCoordinates.put(id, new double[]{point.lat(), point.lng()});
            nodeOrder.add(id);
            return id;
        }

        void priceEdges(List<String> warnings) {
            EdgeCostFunction costFunction = config.getCostFunction();
            TravelMode[] modes = TravelMode.values();
            for (int e = 0; e < edgeWay.size(); e++) {
                WayRecord way = edgeWay.get(e);
                WayTags tags = way.tags();
                double[] lats = edgeLats.get(e);
                double length = GeometryDistance.polylineLengthMeters(lats, edgeLngs.get(e), 0, lats.length);
                short[] packed = new short[modes.length];
                for (TravelMode mode : modes) {
                    packed[mode.ordinal()] = priceEdge(way, tags, length, mode, costFunction, warnings);
                }
                edgeCosts.add(packed);
            }
        }

        private short priceEdge(
                WayRecord way,
                WayTags tags,
                double length,
                TravelMode mode,
                EdgeCostFunction costFunction,
                List<String> warnings
        ) {
            if (Boolean.FALSE.equals(tags.getModeAccess().get(mode))) {
                return EdgeCostFlags.pack(0, tags.isOneWay(), true);
            }
            double raw = costFunction.cost(length, tags, mode);
            if (Double.isNaN(raw) || raw < 0.0d) {
                return EdgeCostFlags.pack(0, tags.isOneWay(), true);
            }
            int cost = EdgeCostFlags.clampCost(raw);
            if (raw >= EdgeCostFlags.MAX_COST + 0.5d) {
                String warning = String.format("way %d: %s cost %.1f clamped to %d",
                        way.id(), mode, raw, EdgeCostFlags.MAX_COST);
                log.warn(warning);
                warnings.add(warning);
            }
            return EdgeCostFlags.pack(cost, tags.isOneWay(), false);
        }

        int edgeCount() {
            return edgeWay.size();
        }
    }

    // ========================================================================
    // ASSEMBLY
    // ========================================================================

    private GraphStore assemble(Draft draft) {
        long[] externalIds = orderNodes(draft);
        NodeIdMapper mapper = NodeIdMapper.createImmutable(externalIds);
        int nodeCount = externalIds.length;
        int edgeCount = draft.edgeCount();
        int modeCount = TravelMode.count();

        int[] edgeOrder = orderEdges(draft);

        int[] edgeFrom = new int[edgeCount];
        int[] edgeTo = new int[edgeCount];
        short[] edgeCosts = new short[edgeCount * modeCount];
        byte[] edgePriority = new byte[edgeCount];
        int[] edgeFirstName = new int[edgeCount + 1];
        List<String> names = new ArrayList<>();
        int[] geometryFirstPoint = new int[edgeCount + 1];
        int totalPoints = 0;
        for (int created : edgeOrder) {
            totalPoints += draft.edgeLats.get(created).length;
        }
        double[] geometryLat = new double[totalPoints];
        double[] geometryLng = new double[totalPoints];

        int[] createdToFinal = new int[edgeCount];
        int point = 0;
        for (int e = 0; e < edgeCount; e++) {
            int created = edgeOrder[e];
            createdToFinal[created] = e;
            WayTags tags = draft.edgeWay.get(created).tags();
            edgeFrom[e] = mapper.toInternal(draft.edgeFromExternal.getLong(created));
            edgeTo[e] = mapper.toInternal(draft.edgeToExternal.getLong(created));
            System.arraycopy(draft.edgeCosts.get(created), 0, edgeCosts, e * modeCount, modeCount);
            edgePriority[e] = (byte) tags.getPriority();

            names.addAll(tags.getNames());
            edgeFirstName[e + 1] = names.size();

            double[] lats = draft.edgeLats.get(created);
            double[] lngs = draft.edgeLngs.get(created);
            System.arraycopy(lats, 0, geometryLat, point, lats.length);
            System.arraycopy(lngs, 0, geometryLng, point, lngs.length);
            point += lats.length;
            geometryFirstPoint[e + 1] = point;
        }

        for (Long2ObjectMap.Entry<int[]> entry : draft.wayEdges.long2ObjectEntrySet()) {
            int[] edges = entry.getValue();
            for (int i = 0; i < edges.length; i++) {
                edges[i] = createdToFinal[edges[i]];
            }
        }

        // incidence lists in edge index order
        int[] degree = new int[nodeCount];
        for (int e = 0; e < edgeCount; e++) {
            degree[edgeFrom[e]]++;
            degree[edgeTo[e]]++;
        }
        int[] nodeFirstEntry = new int[nodeCount + 1];
        for (int n = 0; n < nodeCount; n++) {
            nodeFirstEntry[n + 1] = nodeFirstEntry[n] + degree[n];
        }
        int[] cursor = nodeFirstEntry.clone();
        int[] nodeEdges = new int[nodeFirstEntry[nodeCount]];
        byte[] nodeInteractions = new byte[nodeEdges.length];
        for (int e = 0; e < edgeCount; e++) {
            WayTags tags = draft.edgeWay.get(edgeOrder[e]).tags();
            int from = edgeFrom[e];
            int to = edgeTo[e];
            int slot = cursor[from]++;
            nodeEdges[slot] = e;
            nodeInteractions[slot] = interactionPair(draft, tags, externalIds[from]);
            slot = cursor[to]++;
            nodeEdges[slot] = e;
            nodeInteractions[slot] = interactionPair(draft, tags, externalIds[to]);
        }

        double[] nodeLat = new double[nodeCount];
        double[] nodeLng = new double[nodeCount];
        for (int n = 0; n < nodeCount; n++) {
            double[] coordinate = draft.nodeCoordinates.get(externalIds[n]);
            nodeLat[n] = coordinate[0];
            nodeLng[n] = coordinate[1];
        }

        try {
            return GraphStore.builder()
                    .name(config.getName())
                    .edgeFrom(edgeFrom)
                    .edgeTo(edgeTo)
                    .edgeCosts(edgeCosts)
                    .edgePriority(edgePriority)
                    .edgeFirstName(edgeFirstName)
                    .names(names.toArray(new String[0]))
                    .nodeFirstEntry(nodeFirstEntry)
                    .nodeEdges(nodeEdges)
                    .nodeInteractions(nodeInteractions)
                    .nodeLat(nodeLat)
                    .nodeLng(nodeLng)
                    .nodeExternalIds(externalIds)
                    .geometryFirstPoint(geometryFirstPoint)
                    .geometryLat(geometryLat)
                    .geometryLng(geometryLng)
                    .build();
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("built graph is inconsistent: " + ex.getMessage(), ex);
        }
    }

    /**
     * Approach control of the way at the node (falling back to the node's own control) and its
     * departure control (falling back to none).
     */
    private static byte interactionPair(Draft draft, WayTags tags, long externalNodeId) {
        Interaction incoming = tags.getApproachControls().get(externalNodeId);
        if (incoming == null) {
            NodeRecord record = draft.nodeTable.get(externalNodeId);
            incoming = record == null ? Interaction.NONE : record.control();
        }
        Interaction outgoing = tags.getDepartureControls().get(externalNodeId);
        return Interaction.packPair(incoming, outgoing == null ? Interaction.NONE : outgoing);
    }

    private long[] orderNodes(Draft draft) {
        long[] ids = draft.nodeOrder.toLongArray();
        if (!config.isSortNodesByCell()) {
            return ids;
        }
        long[] cells = new long[ids.length];
        for (int i = 0; i < ids.length; i++) {
            double[] coordinate = draft.nodeCoordinates.get(ids[i]);
            cells[i] = CellIndexer.pointToCell(coordinate[0], coordinate[1], CellIndexer.MAX_LEVEL);
        }
        int[] order = identity(ids.length);
        IntArrays.mergeSort(order, (a, b) -> {
            int byCell = Long.compareUnsigned(cells[a], cells[b]);
            return byCell != 0 ? byCell : Long.compare(ids[a], ids[b]);
        });
        long[] sorted = new long[ids.length];
        for (int i = 0; i < ids.length; i++) {
            sorted[i] = ids[order[i]];
        }
        return sorted;
    }

    private int[] orderEdges(Draft draft) {
        int edgeCount = draft.edgeCount();
        int[] order = identity(edgeCount);
        if (!config.isSortEdgesByCell()) {
            return order;
        }
        long[] cells = new long[edgeCount];
        for (int e = 0; e < edgeCount; e++) {
            double[] midpoint = midpoint(draft.edgeLats.get(e), draft.edgeLngs.get(e));
            cells[e] = CellIndexer.pointToCell(midpoint[0], midpoint[1], CellIndexer.MAX_LEVEL);
        }
        // stable, so equal cells keep creation order
        IntArrays.mergeSort(order, (a, b) -> Long.compareUnsigned(cells[a], cells[b]));
        return order;
    }

    /**
     * Point halfway along the polyline.
     */
    private static double[] midpoint(double[] lats, double[] lngs) {
        double half = GeometryDistance.polylineLengthMeters(lats, lngs, 0, lats.length) * 0.5d;
        double walked = 0.0d;
        for (int i = 1; i < lats.length; i++) {
            double step = GeometryDistance.greatCircleDistanceMeters(lats[i - 1], lngs[i - 1], lats[i], lngs[i]);
            if (step > 0.0d && walked + step >= half) {
                double t = (half - walked) / step;
                return new double[]{
                        lats[i - 1] + t * (lats[i] - lats[i - 1]),
                        lngs[i - 1] + t * GeometryDistance.normalizeDeltaLongitudeDegrees(lngs[i] - lngs[i - 1])
                };
            }
            walked += step;
        }
        return new double[]{lats[0], lngs[0]};
    }

    private static int[] identity(int size) {
        int[] order = new int[size];
        for (int i = 0; i < size; i++) {
            order[i] = i;
        }
        return order;
    }

    // ========================================================================
    // SNAP BUCKETS
    // ========================================================================

    private SnapBuckets buildSnapBuckets(GraphStore graph) {
        SnapConfig snapConfig = config.getSnapConfig();
        int outerLevel = snapConfig.getOuterLevel();
        int fineLevel = snapConfig.getFineLevel();
        double spacing = CellIndexer.approximateEdgeMeters(fineLevel) * 0.5d;

        Int2ObjectOpenHashMap<BucketDraft> drafts = new Int2ObjectOpenHashMap<>();
        for (int e = 0; e < graph.edgeCount(); e++) {
            int first = graph.geometryStart(e);
            int count = graph.geometryPointCount(e);
            for (int p = first; p < first + count; p++) {
                addSample(drafts, graph.pointLat(p), graph.pointLng(p), e, outerLevel, fineLevel);
                if (p + 1 < first + count) {
                    sampleSegment(drafts, graph, p, e, spacing, outerLevel, fineLevel);
                }
            }
        }

        SnapBucket[] buckets = new SnapBucket[CellIndexer.cellCount(outerLevel)];
        for (int i = 0; i < buckets.length; i++) {
            long cellId = CellIndexer.cellAtDenseIndex(i, outerLevel);
            BucketDraft draft = drafts.get(i);
            buckets[i] = draft == null ? SnapBucket.empty(cellId) : draft.seal(cellId);
        }
        return new SnapBuckets(outerLevel, fineLevel, buckets);
    }

    /**
     * Interior samples of segment {@code p -> p + 1} so that neighbouring samples are at most
     * {@code spacing} metres apart.
     */
    private static void sampleSegment(
            Int2ObjectOpenHashMap<BucketDraft> drafts,
            GraphStore graph,
            int p,
            int edge,
            double spacing,
            int outerLevel,
            int fineLevel
    ) {
        double aLat = graph.pointLat(p);
        double aLng = graph.pointLng(p);
        double bLat = graph.pointLat(p + 1);
        double bLng = graph.pointLng(p + 1);
        double length = GeometryDistance.greatCircleDistanceMeters(aLat, aLng, bLat, bLng);
        int steps = (int) Math.ceil(length / spacing);
        double dLng = GeometryDistance.normalizeDeltaLongitudeDegrees(bLng - aLng);
        for (int s = 1; s < steps; s++) {
            double t = (double) s / steps;
            double lng = aLng + t * dLng;
            if (lng > 180.0d) lng -= 360.0d;
            if (lng < -180.0d) lng += 360.0d;
            addSample(drafts, aLat + t * (bLat - aLat), lng, edge, outerLevel, fineLevel);
        }
    }

    private static void addSample(
            Int2ObjectOpenHashMap<BucketDraft> drafts,
            double lat,
            double lng,
            int edge,
            int outerLevel,
            int fineLevel
    ) {
        long fine = CellIndexer.pointToCell(lat, lng, fineLevel);
        long outer = CellIndexer.cellToAncestor(fine, outerLevel);
        int dense = CellIndexer.denseIndex(outer, outerLevel);
        BucketDraft draft = drafts.get(dense);
        if (draft == null) {
            draft = new BucketDraft();
            drafts.put(dense, draft);
        }
        draft.fineCellIds.add(fine);
        draft.edges.add(edge);
    }

    private static final class BucketDraft {
        private final LongArrayList fineCellIds = new LongArrayList();
        private final IntArrayList edges = new IntArrayList();

        /**
         * Sorts by (fine cell, edge) and drops duplicate pairs.
         */
        SnapBucket seal(long cellId) {
            long[] cells = fineCellIds.toLongArray();
            int[] edgeIds = edges.toIntArray();
            int[] order = identity(cells.length);
            IntArrays.quickSort(order, (a, b) -> {
                int byCell = Long.compareUnsigned(cells[a], cells[b]);
                return byCell != 0 ? byCell : Integer.compare(edgeIds[a], edgeIds[b]);
            });
            LongArrayList outCells = new LongArrayList(cells.length);
            IntArrayList outEdges = new IntArrayList(cells.length);
            for (int i : order) {
                int last = outCells.size() - 1;
                if (last >= 0 && outCells.getLong(last) == cells[i] && outEdges.getInt(last) == edgeIds[i]) {
                    continue;
                }
                outCells.add(cells[i]);
                outEdges.add(edgeIds[i]);
            }
            return new SnapBucket(cellId, outCells.toLongArray(), outEdges.toIntArray());
        }
    }
}
