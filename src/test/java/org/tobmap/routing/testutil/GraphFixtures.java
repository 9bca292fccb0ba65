package org.tobmap.routing.testutil;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2ByteOpenHashMap;
import org.tobmap.routing.build.BuildConfig;
import org.tobmap.routing.build.BuildResult;
import org.tobmap.routing.build.GraphBuilder;
import org.tobmap.routing.build.NodeRecord;
import org.tobmap.routing.build.RoadClass;
import org.tobmap.routing.build.WayPoint;
import org.tobmap.routing.build.WayRecord;
import org.tobmap.routing.build.WayTags;
import org.tobmap.routing.graph.EdgeCostFlags;
import org.tobmap.routing.graph.GraphStore;
import org.tobmap.routing.graph.Interaction;
import org.tobmap.routing.profile.TravelMode;
import org.tobmap.routing.snap.SnapConfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared graph fixtures for routing tests.
 */
public final class GraphFixtures {
    public static final double BASE_LAT = 47.0d;
    public static final double BASE_LNG = 8.0d;
    /** Longitude step between neighbouring fixture nodes, roughly 76 m at {@link #BASE_LAT}. */
    public static final double STEP = 0.001d;

    private GraphFixtures() {
    }

    public static StoreBuilder store() {
        return new StoreBuilder();
    }

    /**
     * Nodes 0-1-2 on a west-east line; E0 = 0-1 (cost 5), E1 = 1-2 (cost 7), both two-way for every mode.
     */
    public static GraphStore line() {
        return store()
                .node(BASE_LAT, BASE_LNG)
                .node(BASE_LAT, BASE_LNG + STEP)
                .node(BASE_LAT, BASE_LNG + 2 * STEP)
                .edge(0, 1, 5)
                .edge(1, 2, 7)
                .build();
    }

    /**
     * Snap config with small levels so that test buckets stay compact.
     */
    public static SnapConfig snapConfig() {
        return SnapConfig.builder().outerLevel(4).fineLevel(16).build();
    }

    public static GraphBuilder builder() {
        return new GraphBuilder(BuildConfig.builder().name("fixture").snapConfig(snapConfig()).build());
    }

    /**
     * Built road network shaped like a T:
     * <pre>
     *            4
     *            |  way 200
     *   1 ------ 2 ------ 3   way 100
     * </pre>
     * Node 2 has a stop sign.
     */
    public static TeeNetwork tee() {
        List<NodeRecord> nodes = List.of(
                NodeRecord.of(1L, BASE_LAT, BASE_LNG),
                new NodeRecord(2L, BASE_LAT, BASE_LNG + STEP, Interaction.STOP_SIGN),
                NodeRecord.of(3L, BASE_LAT, BASE_LNG + 2 * STEP),
                NodeRecord.of(4L, BASE_LAT + STEP, BASE_LNG + STEP)
        );
        List<WayRecord> ways = List.of(
                WayRecord.of(100L, WayTags.builder().roadClass(RoadClass.RESIDENTIAL).name("Main Street").build(),
                        WayPoint.node(1L, BASE_LAT, BASE_LNG),
                        WayPoint.node(2L, BASE_LAT, BASE_LNG + STEP),
                        WayPoint.node(3L, BASE_LAT, BASE_LNG + 2 * STEP)),
                WayRecord.of(200L, WayTags.of(RoadClass.RESIDENTIAL),
                        WayPoint.node(2L, BASE_LAT, BASE_LNG + STEP),
                        WayPoint.node(4L, BASE_LAT + STEP, BASE_LNG + STEP))
        );
        return new TeeNetwork(ways, nodes, builder().build(ways, nodes));
    }

    public record TeeNetwork(List<WayRecord> ways, List<NodeRecord> nodes, BuildResult result) {
        public int westEdge() {
            return result.edgesOfWay(100L)[0];
        }

        public int eastEdge() {
            return result.edgesOfWay(100L)[1];
        }

        public int northEdge() {
            return result.edgesOfWay(200L)[0];
        }
    }

    /**
     * Internal index of the node with the given external id, or -1.
     */
    public static int nodeIndex(GraphStore graph, long externalId) {
        for (int n = 0; n < graph.nodeCount(); n++) {
            if (graph.nodeExternalId(n) == externalId) {
                return n;
            }
        }
        return -1;
    }

    /**
     * Hand-assembled {@link GraphStore} with straight two-point geometry per edge.
     */
    public static final class StoreBuilder {
        private final DoubleArrayList lats = new DoubleArrayList();
        private final DoubleArrayList lngs = new DoubleArrayList();
        private final IntArrayList from = new IntArrayList();
        private final IntArrayList to = new IntArrayList();
        private final List<short[]> costs = new ArrayList<>();
        private final Long2ByteOpenHashMap interactions = new Long2ByteOpenHashMap();

        private StoreBuilder() {
        }

        public StoreBuilder node(double lat, double lng) {
            lats.add(lat);
            lngs.add(lng);
            return this;
        }

        public StoreBuilder edge(int fromNode, int toNode, int cost) {
            return edge(fromNode, toNode, uniform(EdgeCostFlags.pack(cost, false, false)));
        }

        public StoreBuilder oneWayEdge(int fromNode, int toNode, int cost) {
            return edge(fromNode, toNode, uniform(EdgeCostFlags.pack(cost, true, false)));
        }

        /**
         * Edge with one packed field per {@link TravelMode}, in ordinal order.
         */
        public StoreBuilder edge(int fromNode, int toNode, short... perMode) {
            if (perMode.length != TravelMode.count()) {
                throw new IllegalArgumentException("expected " + TravelMode.count() + " packed fields");
            }
            from.add(fromNode);
            to.add(toNode);
            costs.add(perMode.clone());
            return this;
        }

        public StoreBuilder interaction(int node, int edge, Interaction incoming, Interaction outgoing) {
            interactions.put(key(node, edge), Interaction.packPair(incoming, outgoing));
            return this;
        }

        public GraphStore build() {
            int nodeCount = lats.size();
            int edgeCount = from.size();
            int modeCount = TravelMode.count();

            short[] edgeCosts = new short[edgeCount * modeCount];
            int[] geometryFirstPoint = new int[edgeCount + 1];
            double[] geometryLat = new double[edgeCount * 2];
            double[] geometryLng = new double[edgeCount * 2];
            int[] degree = new int[nodeCount];
            for (int e = 0; e < edgeCount; e++) {
                System.arraycopy(costs.get(e), 0, edgeCosts, e * modeCount, modeCount);
                geometryFirstPoint[e + 1] = 2 * (e + 1);
                geometryLat[2 * e] = lats.getDouble(from.getInt(e));
                geometryLng[2 * e] = lngs.getDouble(from.getInt(e));
                geometryLat[2 * e + 1] = lats.getDouble(to.getInt(e));
                geometryLng[2 * e + 1] = lngs.getDouble(to.getInt(e));
                degree[from.getInt(e)]++;
                degree[to.getInt(e)]++;
            }

            int[] nodeFirstEntry = new int[nodeCount + 1];
            for (int n = 0; n < nodeCount; n++) {
                nodeFirstEntry[n + 1] = nodeFirstEntry[n] + degree[n];
            }
            int[] cursor = nodeFirstEntry.clone();
            int[] nodeEdges = new int[nodeFirstEntry[nodeCount]];
            byte[] nodeInteractions = new byte[nodeEdges.length];
            for (int e = 0; e < edgeCount; e++) {
                int a = from.getInt(e);
                int b = to.getInt(e);
                int slot = cursor[a]++;
                nodeEdges[slot] = e;
                nodeInteractions[slot] = interactions.get(key(a, e));
                slot = cursor[b]++;
                nodeEdges[slot] = e;
                nodeInteractions[slot] = interactions.get(key(b, e));
            }

            return GraphStore.builder()
                    .name("hand-built")
                    .edgeFrom(from.toIntArray())
                    .edgeTo(to.toIntArray())
                    .edgeCosts(edgeCosts)
                    .nodeFirstEntry(nodeFirstEntry)
                    .nodeEdges(nodeEdges)
                    .nodeInteractions(nodeInteractions)
                    .nodeLat(lats.toDoubleArray())
                    .nodeLng(lngs.toDoubleArray())
                    .geometryFirstPoint(geometryFirstPoint)
                    .geometryLat(geometryLat)
                    .geometryLng(geometryLng)
                    .build();
        }

        private static short[] uniform(short packed) {
            short[] perMode = new short[TravelMode.count()];
            Arrays.fill(perMode, packed);
            return perMode;
        }

        private static long key(int node, int edge) {
            return ((long) node << 32) | (edge & 0xFFFFFFFFL);
        }
    }
}
