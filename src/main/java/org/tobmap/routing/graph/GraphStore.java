package org.tobmap.routing.graph;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.tobmap.routing.profile.TravelMode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable road graph (physical layer).
 * <p>
 * Nodes and edges reference each other only through integer indices into flat arrays,
 * laid out as structure of arrays:
 * </p>
 * <ul>
 * <li>Edges: {@code edgeFrom/edgeTo} endpoint node indices (recorded direction), one packed
 * {@link EdgeCostFlags} field per {@link TravelMode} in {@code edgeCosts[edge * modeCount + mode]},
 * priority and street names.</li>
 * <li>Nodes: CSR incidence lists ({@code nodeFirstEntry}, {@code nodeEdges}) with a parallel
 * interaction pair per entry, coordinates and external ids.</li>
 * <li>Edge geometry: CSR point lists ({@code geometryFirstPoint}, {@code geometryLat/Lng}).</li>
 * </ul>
 * <p>
 * The constructor takes ownership of the arrays and checks every cross-reference, so an
 * instance that exists satisfies the graph invariants. Nothing mutates the arrays afterwards,
 * which makes the store safe for concurrent reads without locking.
 * </p>
 */
public final class GraphStore {

    @Getter
    @Accessors(fluent = true)
    private final String name;
    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;
    @Getter
    @Accessors(fluent = true)
    private final int modeCount;

    private final int[] edgeFrom;
    private final int[] edgeTo;
    private final short[] edgeCosts;
    private final byte[] edgePriority;
    private final int[] edgeFirstName;
    private final String[] names;

    private final int[] nodeFirstEntry;
    private final int[] nodeEdges;
    private final byte[] nodeInteractions;
    private final double[] nodeLat;
    private final double[] nodeLng;
    private final long[] nodeExternalIds;

    private final int[] geometryFirstPoint;
    private final double[] geometryLat;
    private final double[] geometryLng;

    /**
     * Assembles a store from its arrays. Optional arrays ({@code edgePriority},
     * {@code edgeFirstName}/{@code names}, {@code nodeExternalIds}) default to zeros/empty.
     *
     * @throws IllegalArgumentException if lengths disagree or any cross-reference is out of range.
     */
    @Builder
    public GraphStore(
            String name,
            int[] edgeFrom,
            int[] edgeTo,
            short[] edgeCosts,
            byte[] edgePriority,
            int[] edgeFirstName,
            String[] names,
            int[] nodeFirstEntry,
            int[] nodeEdges,
            byte[] nodeInteractions,
            double[] nodeLat,
            double[] nodeLng,
            long[] nodeExternalIds,
            int[] geometryFirstPoint,
            double[] geometryLat,
            double[] geometryLng
    ) {
        this.name = name == null ? "" : name;
        this.edgeFrom = Objects.requireNonNull(edgeFrom, "edgeFrom");
        this.edgeTo = Objects.requireNonNull(edgeTo, "edgeTo");
        this.edgeCosts = Objects.requireNonNull(edgeCosts, "edgeCosts");
        this.nodeFirstEntry = Objects.requireNonNull(nodeFirstEntry, "nodeFirstEntry");
        this.nodeEdges = Objects.requireNonNull(nodeEdges, "nodeEdges");
        this.nodeInteractions = Objects.requireNonNull(nodeInteractions, "nodeInteractions");
        this.nodeLat = Objects.requireNonNull(nodeLat, "nodeLat");
        this.nodeLng = Objects.requireNonNull(nodeLng, "nodeLng");
        this.geometryFirstPoint = Objects.requireNonNull(geometryFirstPoint, "geometryFirstPoint");
        this.geometryLat = Objects.requireNonNull(geometryLat, "geometryLat");
        this.geometryLng = Objects.requireNonNull(geometryLng, "geometryLng");

        this.edgeCount = edgeFrom.length;
        this.nodeCount = nodeLat.length;
        this.modeCount = TravelMode.count();

        this.edgePriority = edgePriority == null ? new byte[edgeCount] : edgePriority;
        this.edgeFirstName = edgeFirstName == null ? new int[edgeCount + 1] : edgeFirstName;
        this.names = names == null ? new String[0] : names;
        this.nodeExternalIds = nodeExternalIds == null ? defaultExternalIds(nodeCount) : nodeExternalIds;

        validateStructure();
    }

    // ========================================================================
    // EDGES
    // ========================================================================

    public int edgeFrom(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeFrom[edgeId];
    }

    public int edgeTo(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeTo[edgeId];
    }

    /**
     * Returns the endpoint opposite to {@code nodeId}. For a self-loop this is the node itself.
     */
    public int otherEndpoint(int edgeId, int nodeId) {
        int from = edgeFrom[edgeId];
        return from == nodeId ? edgeTo[edgeId] : from;
    }

    /**
     * Raw 16-bit packed cost/flags field, see {@link EdgeCostFlags}.
     */
    public short packedCost(int edgeId, TravelMode mode) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeCosts[edgeId * modeCount + mode.ordinal()];
    }

    public int cost(int edgeId, TravelMode mode) {
        return EdgeCostFlags.cost(packedCost(edgeId, mode));
    }

    public boolean isExcluded(int edgeId, TravelMode mode) {
        return EdgeCostFlags.isExcluded(packedCost(edgeId, mode));
    }

    public boolean isOneWay(int edgeId, TravelMode mode) {
        return EdgeCostFlags.isOneWay(packedCost(edgeId, mode));
    }

    /**
     * Whether {@code mode} may traverse the edge leaving from {@code fromNode}.
     *
     * @param honorOneWay whether the mode respects the one-way flag.
     */
    public boolean canTraverse(int edgeId, int fromNode, TravelMode mode, boolean honorOneWay) {
        short packed = packedCost(edgeId, mode);
        if (EdgeCostFlags.isExcluded(packed)) {
            return false;
        }
        if (fromNode != edgeFrom[edgeId] && fromNode != edgeTo[edgeId]) {
            return false;
        }
        return !honorOneWay || !EdgeCostFlags.isOneWay(packed) || fromNode == edgeFrom[edgeId];
    }

    public int priority(int edgeId) {
        return edgePriority[edgeId];
    }

    public List<String> streetNames(int edgeId) {
        int start = edgeFirstName[edgeId];
        int end = edgeFirstName[edgeId + 1];
        return List.of(Arrays.copyOfRange(names, start, end));
    }

    // ========================================================================
    // EDGE GEOMETRY
    // ========================================================================

    public int geometryPointCount(int edgeId) {
        return geometryFirstPoint[edgeId + 1] - geometryFirstPoint[edgeId];
    }

    /**
     * Index of the edge's first point in the shared point arrays.
     */
    public int geometryStart(int edgeId) {
        return geometryFirstPoint[edgeId];
    }

    public int totalGeometryPoints() {
        return geometryLat.length;
    }

    public double pointLat(int pointIndex) {
        return geometryLat[pointIndex];
    }

    public double pointLng(int pointIndex) {
        return geometryLng[pointIndex];
    }

    // ========================================================================
    // NODES
    // ========================================================================

    public int nodeDegree(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds");
        }
        return nodeFirstEntry[nodeId + 1] - nodeFirstEntry[nodeId];
    }

    /**
     * First incidence entry of a node; entries {@code [firstEntry(n), firstEntry(n + 1))} belong to it.
     */
    public int firstEntry(int nodeId) {
        return nodeFirstEntry[nodeId];
    }

    public int entryEdge(int entry) {
        return nodeEdges[entry];
    }

    public Interaction entryIncoming(int entry) {
        return Interaction.incomingOf(nodeInteractions[entry]);
    }

    public Interaction entryOutgoing(int entry) {
        return Interaction.outgoingOf(nodeInteractions[entry]);
    }

    public byte entryInteractionPair(int entry) {
        return nodeInteractions[entry];
    }

    public int totalEntries() {
        return nodeEdges.length;
    }

    /**
     * Finds the incidence entry of {@code edgeId} at {@code nodeId}, or -1.
     */
    public int findEntry(int nodeId, int edgeId) {
        int end = nodeFirstEntry[nodeId + 1];
        for (int entry = nodeFirstEntry[nodeId]; entry < end; entry++) {
            if (nodeEdges[entry] == edgeId) {
                return entry;
            }
        }
        return -1;
    }

    public double nodeLat(int nodeId) {
        return nodeLat[nodeId];
    }

    public double nodeLng(int nodeId) {
        return nodeLng[nodeId];
    }

    public long nodeExternalId(int nodeId) {
        return nodeExternalIds[nodeId];
    }

    public int nameCount() {
        return names.length;
    }

    public int firstName(int edgeId) {
        return edgeFirstName[edgeId];
    }

    public String name(int nameIndex) {
        return names[nameIndex];
    }

    // ========================================================================
    // DEBUG & VALIDATION
    // ========================================================================

    @Override
    public String toString() {
        return String.format("GraphStore[name=%s, nodes=%d, edges=%d, avgDegree=%.2f, points=%d]",
                name, nodeCount, edgeCount, nodeCount > 0 ? (double) nodeEdges.length / nodeCount : 0,
                geometryLat.length);
    }

    public String toDetailedString() {
        if (nodeCount > 50) return toString() + " (too large to detail)";
        StringBuilder sb = new StringBuilder(toString()).append("\n");
        for (int n = 0; n < nodeCount; n++) {
            sb.append(String.format("Node %d (%.6f, %.6f): [", n, nodeLat[n], nodeLng[n]));
            int end = nodeFirstEntry[n + 1];
            for (int entry = nodeFirstEntry[n]; entry < end; entry++) {
                int e = nodeEdges[entry];
                sb.append(String.format("e%d->%d(%s, %s/%s)", e, otherEndpoint(e, n),
                        EdgeCostFlags.describe(edgeCosts[e * modeCount]),
                        entryIncoming(entry), entryOutgoing(entry)));
                if (entry + 1 < end) sb.append(", ");
            }
            sb.append("]\n");
        }
        return sb.toString();
    }

    public record ValidationResult(boolean isValid, List<String> errors, List<String> warnings) {}

    /**
     * Re-checks the graph invariants and reports soft issues (isolated nodes, edges no mode can use).
     */
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (int e = 0; e < edgeCount; e++) {
            if (edgeFrom[e] < 0 || edgeFrom[e] >= nodeCount || edgeTo[e] < 0 || edgeTo[e] >= nodeCount) {
                errors.add("Edge " + e + " endpoint out of range: " + edgeFrom[e] + "-" + edgeTo[e]);
                if (errors.size() > 10) { errors.add("..."); break; }
            }
        }

        for (int n = 0; n < nodeCount && errors.size() <= 20; n++) {
            int end = nodeFirstEntry[n + 1];
            for (int entry = nodeFirstEntry[n]; entry < end; entry++) {
                int e = nodeEdges[entry];
                if (e < 0 || e >= edgeCount) {
                    errors.add("Node " + n + " references invalid edge " + e);
                } else if (edgeFrom[e] != n && edgeTo[e] != n) {
                    errors.add("Node " + n + " lists edge " + e + " which does not touch it");
                }
            }
        }
        if (nodeEdges.length != nodeInteractions.length) {
            errors.add("Incidence/interactions length mismatch: " + nodeEdges.length + " != " + nodeInteractions.length);
        }

        int isolatedNodes = 0;
        for (int n = 0; n < nodeCount; n++) {
            if (nodeDegree(n) == 0) isolatedNodes++;
        }
        if (isolatedNodes > 0) {
            warnings.add("Graph contains " + isolatedNodes + " isolated nodes (degree 0)");
        }

        int unusable = 0;
        for (int e = 0; e < edgeCount; e++) {
            boolean anyMode = false;
            for (int m = 0; m < modeCount && !anyMode; m++) {
                anyMode = !EdgeCostFlags.isExcluded(edgeCosts[e * modeCount + m]);
            }
            if (!anyMode) unusable++;
        }
        if (unusable > 0) {
            warnings.add("Graph contains " + unusable + " edges excluded for every mode");
        }

        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    private void validateStructure() {
        validateLength("edgeTo", edgeTo.length, edgeCount);
        validateLength("edgeCosts", edgeCosts.length, edgeCount * modeCount);
        validateLength("edgePriority", edgePriority.length, edgeCount);
        validateLength("edgeFirstName", edgeFirstName.length, edgeCount + 1);
        validateLength("nodeLng", nodeLng.length, nodeCount);
        validateLength("nodeExternalIds", nodeExternalIds.length, nodeCount);
        validateLength("nodeFirstEntry", nodeFirstEntry.length, nodeCount + 1);
        validateLength("nodeInteractions", nodeInteractions.length, nodeEdges.length);
        validateLength("geometryFirstPoint", geometryFirstPoint.length, edgeCount + 1);
        validateLength("geometryLng", geometryLng.length, geometryLat.length);

        validateCsr("nodeFirstEntry", nodeFirstEntry, nodeEdges.length);
        validateCsr("geometryFirstPoint", geometryFirstPoint, geometryLat.length);
        validateCsr("edgeFirstName", edgeFirstName, names.length);

        for (int e = 0; e < edgeCount; e++) {
            validateIndex("edgeFrom", e, edgeFrom[e], nodeCount);
            validateIndex("edgeTo", e, edgeTo[e], nodeCount);
            if (geometryPointCount(e) < 2) {
                throw new IllegalArgumentException("edge " + e + " geometry must have at least 2 points");
            }
            int priority = edgePriority[e];
            if (priority < 0 || priority > 10) {
                throw new IllegalArgumentException("edge " + e + " priority must be in [0, 10], got " + priority);
            }
        }
        for (int i = 0; i < nodeEdges.length; i++) {
            validateIndex("nodeEdges", i, nodeEdges[i], edgeCount);
            Interaction.incomingOf(nodeInteractions[i]);
            Interaction.outgoingOf(nodeInteractions[i]);
        }
    }

    private static void validateLength(String fieldName, int actual, int expected) {
        if (actual != expected) {
            throw new IllegalArgumentException(
                    fieldName + " length mismatch: expected " + expected + ", got " + actual);
        }
    }

    private static void validateCsr(String fieldName, int[] offsets, int total) {
        if (offsets[0] != 0) {
            throw new IllegalArgumentException("Malformed " + fieldName + ": [0] must be 0, got " + offsets[0]);
        }
        for (int i = 1; i < offsets.length; i++) {
            if (offsets[i] < offsets[i - 1]) {
                throw new IllegalArgumentException(
                        "Malformed " + fieldName + ": non-monotonic at index " + i
                                + " (" + offsets[i - 1] + " -> " + offsets[i] + ")");
            }
        }
        if (offsets[offsets.length - 1] != total) {
            throw new IllegalArgumentException(
                    "Malformed " + fieldName + ": last offset must equal " + total + ", got "
                            + offsets[offsets.length - 1]);
        }
    }

    private static void validateIndex(String fieldName, int position, int value, int bound) {
        if (value < 0 || value >= bound) {
            throw new IllegalArgumentException(
                    fieldName + "[" + position + "] out of bounds: " + value + " [0, " + bound + ")");
        }
    }

    private static long[] defaultExternalIds(int nodeCount) {
        long[] ids = new long[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            ids[i] = i;
        }
        return ids;
    }
}
