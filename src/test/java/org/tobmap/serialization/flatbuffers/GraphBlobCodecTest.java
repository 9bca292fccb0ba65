package org.tobmap.serialization.flatbuffers;

import com.google.flatbuffers.FlatBufferBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.tobmap.routing.graph.GraphStore;
import org.tobmap.routing.graph.Interaction;
import org.tobmap.routing.profile.TravelMode;
import org.tobmap.routing.testutil.GraphFixtures;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("GraphBlobCodec Tests")
class GraphBlobCodecTest {

    @Nested
    @DisplayName("Round Trip")
    class RoundTrip {

        @Test
        @DisplayName("Built graph survives encode and decode")
        void testBuiltGraph() {
            GraphFixtures.TeeNetwork tee = GraphFixtures.tee();
            GraphStore original = tee.result().getGraph();

            GraphStore decoded = GraphBlobCodec.decode(GraphBlobCodec.encode(original));

            assertEquals("fixture", decoded.name());
            assertSameGraph(original, decoded);
            assertEquals(List.of("Main Street"), decoded.streetNames(tee.westEdge()));
            assertTrue(decoded.validate().isValid());
        }

        @Test
        @DisplayName("Hand-built graph keeps per-mode costs and interactions")
        void testHandBuiltGraph() {
            GraphStore original = GraphFixtures.store()
                    .node(GraphFixtures.BASE_LAT, GraphFixtures.BASE_LNG)
                    .node(GraphFixtures.BASE_LAT, GraphFixtures.BASE_LNG + GraphFixtures.STEP)
                    .node(GraphFixtures.BASE_LAT, GraphFixtures.BASE_LNG + 2 * GraphFixtures.STEP)
                    .oneWayEdge(0, 1, 4)
                    .edge(1, 2, 9)
                    .interaction(1, 1, Interaction.NONE,
                            Interaction.TRAFFIC_LIGHT)
                    .build();

            GraphStore decoded = GraphBlobCodec.decode(ByteBuffer.wrap(GraphBlobCodec.encode(original)));

            assertSameGraph(original, decoded);
            assertTrue(decoded.isOneWay(0, TravelMode.CAR));
            assertEquals(Interaction.TRAFFIC_LIGHT,
                    decoded.entryOutgoing(decoded.findEntry(1, 1)));
        }

        private void assertSameGraph(GraphStore expected, GraphStore actual) {
            assertEquals(expected.nodeCount(), actual.nodeCount());
            assertEquals(expected.edgeCount(), actual.edgeCount());
            assertEquals(expected.modeCount(), actual.modeCount());
            for (int e = 0; e < expected.edgeCount(); e++) {
                assertEquals(expected.edgeFrom(e), actual.edgeFrom(e));
                assertEquals(expected.edgeTo(e), actual.edgeTo(e));
                assertEquals(expected.priority(e), actual.priority(e));
                assertEquals(expected.streetNames(e), actual.streetNames(e));
                for (TravelMode mode : TravelMode.values()) {
                    assertEquals(expected.packedCost(e, mode), actual.packedCost(e, mode));
                }
                assertEquals(expected.geometryPointCount(e), actual.geometryPointCount(e));
                assertEquals(expected.geometryStart(e), actual.geometryStart(e));
            }
            for (int p = 0; p < expected.totalGeometryPoints(); p++) {
                assertEquals(expected.pointLat(p), actual.pointLat(p));
                assertEquals(expected.pointLng(p), actual.pointLng(p));
            }
            for (int n = 0; n < expected.nodeCount(); n++) {
                assertEquals(expected.nodeLat(n), actual.nodeLat(n));
                assertEquals(expected.nodeLng(n), actual.nodeLng(n));
                assertEquals(expected.nodeExternalId(n), actual.nodeExternalId(n));
                assertEquals(expected.firstEntry(n), actual.firstEntry(n));
                assertEquals(expected.nodeDegree(n), actual.nodeDegree(n));
            }
            assertEquals(expected.totalEntries(), actual.totalEntries());
            for (int entry = 0; entry < expected.totalEntries(); entry++) {
                assertEquals(expected.entryEdge(entry), actual.entryEdge(entry));
                assertEquals(expected.entryInteractionPair(entry), actual.entryInteractionPair(entry));
            }
        }
    }

    @Nested
    @DisplayName("Container Validation")
    class ContainerValidation {

        @Test
        @DisplayName("Null and tiny buffers are rejected")
        void testTooSmall() {
            assertThrows(IllegalArgumentException.class, () -> GraphBlobCodec.decode((ByteBuffer) null));
            assertThrows(IllegalArgumentException.class, () -> GraphBlobCodec.decode(new byte[4]));
        }

        @Test
        @DisplayName("Snap container is not accepted as a graph")
        void testWrongIdentifier() {
            byte[] snapBlob = SnapBucketsCodec.encode(GraphFixtures.tee().result().getSnapBuckets());

            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> GraphBlobCodec.decode(snapBlob));
            assertTrue(ex.getMessage().contains("invalid file identifier"));
        }

        @Test
        @DisplayName("Unknown schema version is rejected")
        void testWrongSchema() {
            FlatBufferBuilder builder = new FlatBufferBuilder(64);
            builder.startTable(1);
            builder.addInt(ModelContractValidator.FIELD_SCHEMA_VERSION, 2, 0);
            int root = builder.endTable();
            builder.finish(root, GraphBlobCodec.FILE_IDENTIFIER);

            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> GraphBlobCodec.decode(builder.sizedByteArray()));
            assertTrue(ex.getMessage().contains("unsupported schema_version"));
        }

        @Test
        @DisplayName("Missing mode count is rejected")
        void testMissingModeCount() {
            FlatBufferBuilder builder = new FlatBufferBuilder(64);
            builder.startTable(1);
            builder.addInt(ModelContractValidator.FIELD_SCHEMA_VERSION,
                    (int) ModelContractValidator.EXPECTED_SCHEMA_VERSION, 0);
            int root = builder.endTable();
            builder.finish(root, GraphBlobCodec.FILE_IDENTIFIER);

            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> GraphBlobCodec.decode(builder.sizedByteArray()));
            assertTrue(ex.getMessage().contains("mode_count"));
        }

        @Test
        @DisplayName("Mismatched vector lengths are rejected")
        void testLengthMismatch() {
            FlatBufferBuilder builder = new FlatBufferBuilder(128);
            int edgeFrom = FlatVectors.ints(builder, new int[]{0, 1});
            int edgeTo = FlatVectors.ints(builder, new int[]{1});
            builder.startTable(5);
            builder.addInt(ModelContractValidator.FIELD_SCHEMA_VERSION,
                    (int) ModelContractValidator.EXPECTED_SCHEMA_VERSION, 0);
            builder.addByte(2, (byte) TravelMode.count(), 0);
            builder.addOffset(3, edgeFrom, 0);
            builder.addOffset(4, edgeTo, 0);
            int root = builder.endTable();
            builder.finish(root, GraphBlobCodec.FILE_IDENTIFIER);

            assertThrows(IllegalArgumentException.class, () -> GraphBlobCodec.decode(builder.sizedByteArray()));
        }

        @Test
        @DisplayName("Incidence entry on a node the edge does not touch is rejected on load")
        void testInconsistentIncidence() {
            GraphStore broken = GraphStore.builder()
                    .edgeFrom(new int[]{0})
                    .edgeTo(new int[]{1})
                    .edgeCosts(new short[TravelMode.count()])
                    .nodeFirstEntry(new int[]{0, 1, 1, 2})
                    .nodeEdges(new int[]{0, 0})
                    .nodeInteractions(new byte[2])
                    .nodeLat(new double[]{0.0d, 0.0d, 0.0d})
                    .nodeLng(new double[]{0.0d, 0.001d, 0.002d})
                    .geometryFirstPoint(new int[]{0, 2})
                    .geometryLat(new double[]{0.0d, 0.0d})
                    .geometryLng(new double[]{0.0d, 0.001d})
                    .build();
            byte[] blob = GraphBlobCodec.encode(broken);

            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> GraphBlobCodec.decode(blob));
            assertTrue(ex.getMessage().contains("does not touch"));
        }

        @Test
        @DisplayName("Encoded graph carries its file identifier")
        void testIdentifier() {
            byte[] blob = GraphBlobCodec.encode(GraphFixtures.line());
            byte[] identifier = new byte[4];
            System.arraycopy(blob, 4, identifier, 0, 4);
            assertArrayEquals(GraphBlobCodec.FILE_IDENTIFIER.getBytes(StandardCharsets.US_ASCII),
                    identifier);
        }
    }
}
