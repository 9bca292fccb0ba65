package org.tobmap.serialization.flatbuffers;

import com.google.flatbuffers.FlatBufferBuilder;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tobmap.routing.graph.GraphStore;
import org.tobmap.routing.profile.TravelMode;

import java.nio.ByteBuffer;

/**
 * Reads and writes {@link GraphStore} as a {@code GraphBlob} FlatBuffers container
 * (file identifier {@value #FILE_IDENTIFIER}).
 * <p>
 * Root table slots:
 * </p>
 * <pre>
 *  0 schema_version:uint          9 node_lat:[double]
 *  1 name:string                 10 node_lng:[double]
 *  2 mode_count:ubyte            11 node_external_ids:[long]
 *  3 edge_from:[uint]            12 geometry_first_point:[uint]
 *  4 edge_to:[uint]              13 geometry_lat:[double]
 *  5 edge_costs:[ushort]         14 geometry_lng:[double]
 *  6 node_first_entry:[uint]     15 edge_priority:[ubyte]
 *  7 node_edges:[uint]           16 edge_first_name:[uint]
 *  8 node_interactions:[ubyte]   17 names:[string]
 * </pre>
 */
@UtilityClass
public final class GraphBlobCodec {
    private static final Logger log = LoggerFactory.getLogger(GraphBlobCodec.class);

    public static final String FILE_IDENTIFIER = "TOBG";
    private static final String LOADER = "GraphBlob";

    private static final int FIELD_NAME = 1;
    private static final int FIELD_MODE_COUNT = 2;
    private static final int FIELD_EDGE_FROM = 3;
    private static final int FIELD_EDGE_TO = 4;
    private static final int FIELD_EDGE_COSTS = 5;
    private static final int FIELD_NODE_FIRST_ENTRY = 6;
    private static final int FIELD_NODE_EDGES = 7;
    private static final int FIELD_NODE_INTERACTIONS = 8;
    private static final int FIELD_NODE_LAT = 9;
    private static final int FIELD_NODE_LNG = 10;
    private static final int FIELD_NODE_EXTERNAL_IDS = 11;
    private static final int FIELD_GEOMETRY_FIRST_POINT = 12;
    private static final int FIELD_GEOMETRY_LAT = 13;
    private static final int FIELD_GEOMETRY_LNG = 14;
    private static final int FIELD_EDGE_PRIORITY = 15;
    private static final int FIELD_EDGE_FIRST_NAME = 16;
    private static final int FIELD_NAMES = 17;
    private static final int FIELD_COUNT = 18;

    // ========================================================================
    // WRITE
    // ========================================================================

    /**
     * Serializes the graph into a finished container.
     */
    public static byte[] encode(GraphStore graph) {
        int edgeCount = graph.edgeCount();
        int nodeCount = graph.nodeCount();
        int modeCount = graph.modeCount();
        TravelMode[] modes = TravelMode.values();

        int[] edgeFrom = new int[edgeCount];
        int[] edgeTo = new int[edgeCount];
        short[] edgeCosts = new short[edgeCount * modeCount];
        byte[] edgePriority = new byte[edgeCount];
        int[] edgeFirstName = new int[edgeCount + 1];
        int[] geometryFirstPoint = new int[edgeCount + 1];
        for (int e = 0; e < edgeCount; e++) {
            edgeFrom[e] = graph.edgeFrom(e);
            edgeTo[e] = graph.edgeTo(e);
            for (TravelMode mode : modes) {
                edgeCosts[e * modeCount + mode.ordinal()] = graph.packedCost(e, mode);
            }
            edgePriority[e] = (byte) graph.priority(e);
            edgeFirstName[e] = graph.firstName(e);
            geometryFirstPoint[e] = graph.geometryStart(e);
        }
        edgeFirstName[edgeCount] = graph.nameCount();
        geometryFirstPoint[edgeCount] = graph.totalGeometryPoints();

        int[] nodeFirstEntry = new int[nodeCount + 1];
        double[] nodeLat = new double[nodeCount];
        double[] nodeLng = new double[nodeCount];
        long[] externalIds = new long[nodeCount];
        for (int n = 0; n < nodeCount; n++) {
            nodeFirstEntry[n] = graph.firstEntry(n);
            nodeLat[n] = graph.nodeLat(n);
            nodeLng[n] = graph.nodeLng(n);
            externalIds[n] = graph.nodeExternalId(n);
        }
        nodeFirstEntry[nodeCount] = graph.totalEntries();

        int[] nodeEdges = new int[graph.totalEntries()];
        byte[] nodeInteractions = new byte[graph.totalEntries()];
        for (int i = 0; i < nodeEdges.length; i++) {
            nodeEdges[i] = graph.entryEdge(i);
            nodeInteractions[i] = graph.entryInteractionPair(i);
        }

        int points = graph.totalGeometryPoints();
        double[] geometryLat = new double[points];
        double[] geometryLng = new double[points];
        for (int p = 0; p < points; p++) {
            geometryLat[p] = graph.pointLat(p);
            geometryLng[p] = graph.pointLng(p);
        }

        FlatBufferBuilder builder = new FlatBufferBuilder(1024);
        int nameOffset = builder.createString(graph.name());
        int edgeFromOffset = FlatVectors.ints(builder, edgeFrom);
        int edgeToOffset = FlatVectors.ints(builder, edgeTo);
        int edgeCostsOffset = FlatVectors.shorts(builder, edgeCosts);
        int nodeFirstEntryOffset = FlatVectors.ints(builder, nodeFirstEntry);
        int nodeEdgesOffset = FlatVectors.ints(builder, nodeEdges);
        int nodeInteractionsOffset = FlatVectors.bytes(builder, nodeInteractions);
        int nodeLatOffset = FlatVectors.doubles(builder, nodeLat);
        int nodeLngOffset = FlatVectors.doubles(builder, nodeLng);
        int externalIdsOffset = FlatVectors.longs(builder, externalIds);
        int geometryFirstPointOffset = FlatVectors.ints(builder, geometryFirstPoint);
        int geometryLatOffset = FlatVectors.doubles(builder, geometryLat);
        int geometryLngOffset = FlatVectors.doubles(builder, geometryLng);
        int edgePriorityOffset = FlatVectors.bytes(builder, edgePriority);
        int edgeFirstNameOffset = FlatVectors.ints(builder, edgeFirstName);
        String[] names = new String[graph.nameCount()];
        for (int i = 0; i < names.length; i++) {
            names[i] = graph.name(i);
        }
        int namesOffset = FlatVectors.strings(builder, names);

        builder.startTable(FIELD_COUNT);
        builder.addInt(ModelContractValidator.FIELD_SCHEMA_VERSION, (int) ModelContractValidator.EXPECTED_SCHEMA_VERSION, 0);
        builder.addOffset(FIELD_NAME, nameOffset, 0);
        builder.addByte(FIELD_MODE_COUNT, (byte) modeCount, 0);
        builder.addOffset(FIELD_EDGE_FROM, edgeFromOffset, 0);
        builder.addOffset(FIELD_EDGE_TO, edgeToOffset, 0);
        builder.addOffset(FIELD_EDGE_COSTS, edgeCostsOffset, 0);
        builder.addOffset(FIELD_NODE_FIRST_ENTRY, nodeFirstEntryOffset, 0);
        builder.addOffset(FIELD_NODE_EDGES, nodeEdgesOffset, 0);
        builder.addOffset(FIELD_NODE_INTERACTIONS, nodeInteractionsOffset, 0);
        builder.addOffset(FIELD_NODE_LAT, nodeLatOffset, 0);
        builder.addOffset(FIELD_NODE_LNG, nodeLngOffset, 0);
        builder.addOffset(FIELD_NODE_EXTERNAL_IDS, externalIdsOffset, 0);
        builder.addOffset(FIELD_GEOMETRY_FIRST_POINT, geometryFirstPointOffset, 0);
        builder.addOffset(FIELD_GEOMETRY_LAT, geometryLatOffset, 0);
        builder.addOffset(FIELD_GEOMETRY_LNG, geometryLngOffset, 0);
        builder.addOffset(FIELD_EDGE_PRIORITY, edgePriorityOffset, 0);
        builder.addOffset(FIELD_EDGE_FIRST_NAME, edgeFirstNameOffset, 0);
        builder.addOffset(FIELD_NAMES, namesOffset, 0);
        int root = builder.endTable();
        builder.finish(root, FILE_IDENTIFIER);
        return builder.sizedByteArray();
    }

    // ========================================================================
    // READ
    // ========================================================================

    /**
     * Loads a graph from a container.
     *
     * @throws IllegalArgumentException if the header, schema version, vector lengths or any
     * cross-reference is invalid, or the loaded graph fails {@link GraphStore#validate()}.
     */
    public static GraphStore decode(ByteBuffer buffer) {
        ByteBuffer bb = ModelContractValidator.requireContainer(buffer, FILE_IDENTIFIER, LOADER);
        try {
            return decodeRoot(bb);
        } catch (IndexOutOfBoundsException ex) {
            throw new IllegalArgumentException(LOADER + ": truncated or corrupt container", ex);
        }
    }

    public static GraphStore decode(byte[] bytes) {
        return decode(ByteBuffer.wrap(bytes));
    }

    private static GraphStore decodeRoot(ByteBuffer bb) {
        FlatTable root = FlatTable.root(bb);
        ModelContractValidator.validateSchemaVersion(root, LOADER);

        int modeCount = root.getUnsignedByteField(FIELD_MODE_COUNT, 0);
        if (modeCount != TravelMode.count()) {
            throw new IllegalArgumentException(
                    LOADER + ": mode_count " + modeCount + " does not match " + TravelMode.count() + " travel modes");
        }

        int[] edgeFrom = FlatVectors.readInts(bb, root, FIELD_EDGE_FROM, LOADER, "edge_from");
        int edgeCount = edgeFrom.length;
        int[] edgeTo = FlatVectors.readInts(bb, root, FIELD_EDGE_TO, LOADER, "edge_to");
        ModelContractValidator.requireLength(LOADER, "edge_to", edgeTo.length, edgeCount);
        short[] edgeCosts = FlatVectors.readShorts(bb, root, FIELD_EDGE_COSTS, LOADER, "edge_costs");
        ModelContractValidator.requireLength(LOADER, "edge_costs", edgeCosts.length, edgeCount * modeCount);

        double[] nodeLat = FlatVectors.readDoubles(bb, root, FIELD_NODE_LAT, LOADER, "node_lat");
        int nodeCount = nodeLat.length;
        double[] nodeLng = FlatVectors.readDoubles(bb, root, FIELD_NODE_LNG, LOADER, "node_lng");
        ModelContractValidator.requireLength(LOADER, "node_lng", nodeLng.length, nodeCount);
        long[] externalIds = FlatVectors.readLongs(bb, root, FIELD_NODE_EXTERNAL_IDS, LOADER, "node_external_ids");
        ModelContractValidator.requireLength(LOADER, "node_external_ids", externalIds.length, nodeCount);
        int[] nodeFirstEntry = FlatVectors.readInts(bb, root, FIELD_NODE_FIRST_ENTRY, LOADER, "node_first_entry");
        ModelContractValidator.requireLength(LOADER, "node_first_entry", nodeFirstEntry.length, nodeCount + 1);
        int[] nodeEdges = FlatVectors.readInts(bb, root, FIELD_NODE_EDGES, LOADER, "node_edges");
        byte[] nodeInteractions = FlatVectors.readBytes(bb, root, FIELD_NODE_INTERACTIONS, LOADER, "node_interactions");
        ModelContractValidator.requireLength(LOADER, "node_interactions", nodeInteractions.length, nodeEdges.length);

        int[] geometryFirstPoint = FlatVectors.readInts(bb, root, FIELD_GEOMETRY_FIRST_POINT, LOADER, "geometry_first_point");
        ModelContractValidator.requireLength(LOADER, "geometry_first_point", geometryFirstPoint.length, edgeCount + 1);
        double[] geometryLat = FlatVectors.readDoubles(bb, root, FIELD_GEOMETRY_LAT, LOADER, "geometry_lat");
        double[] geometryLng = FlatVectors.readDoubles(bb, root, FIELD_GEOMETRY_LNG, LOADER, "geometry_lng");
        ModelContractValidator.requireLength(LOADER, "geometry_lng", geometryLng.length, geometryLat.length);

        byte[] edgePriority = FlatVectors.readBytes(bb, root, FIELD_EDGE_PRIORITY, LOADER, "edge_priority");
        ModelContractValidator.requireLength(LOADER, "edge_priority", edgePriority.length, edgeCount);
        int[] edgeFirstName = FlatVectors.readInts(bb, root, FIELD_EDGE_FIRST_NAME, LOADER, "edge_first_name");
        ModelContractValidator.requireLength(LOADER, "edge_first_name", edgeFirstName.length, edgeCount + 1);
        String[] names = FlatVectors.readStrings(bb, root, FIELD_NAMES, LOADER, "names");

        GraphStore graph = GraphStore.builder()
                .name(root.getStringField(FIELD_NAME))
                .edgeFrom(edgeFrom)
                .edgeTo(edgeTo)
                .edgeCosts(edgeCosts)
                .edgePriority(edgePriority)
                .edgeFirstName(edgeFirstName)
                .names(names)
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
        GraphStore.ValidationResult validation = graph.validate();
        if (!validation.isValid()) {
            throw new IllegalArgumentException(LOADER + ": inconsistent graph: " + validation.errors());
        }
        log.debug("loaded {}", graph);
        return graph;
    }
}
