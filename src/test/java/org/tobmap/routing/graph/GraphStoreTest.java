package org.tobmap.routing.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.tobmap.routing.profile.TravelMode;
import org.tobmap.routing.testutil.GraphFixtures;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("GraphStore Tests")
class GraphStoreTest {

    @Nested
    @DisplayName("Accessors")
    class Accessors {

        @Test
        @DisplayName("Counts, endpoints and per-mode costs of the line fixture")
        void testLineAccessors() {
            GraphStore graph = GraphFixtures.line();
            assertEquals(3, graph.nodeCount());
            assertEquals(2, graph.edgeCount());
            assertEquals(TravelMode.count(), graph.modeCount());
            assertEquals(0, graph.edgeFrom(0));
            assertEquals(1, graph.edgeTo(0));
            assertEquals(2, graph.otherEndpoint(1, 1));
            assertEquals(1, graph.otherEndpoint(1, 2));
            for (TravelMode mode : TravelMode.values()) {
                assertEquals(5, graph.cost(0, mode));
                assertEquals(7, graph.cost(1, mode));
                assertFalse(graph.isExcluded(0, mode));
            }
        }

        @Test
        @DisplayName("Incidence lists: middle node touches both edges")
        void testIncidence() {
            GraphStore graph = GraphFixtures.line();
            assertEquals(1, graph.nodeDegree(0));
            assertEquals(2, graph.nodeDegree(1));
            assertEquals(1, graph.nodeDegree(2));
            assertEquals(graph.firstEntry(1) + 1, graph.findEntry(1, 1));
            assertEquals(-1, graph.findEntry(0, 1));
            assertEquals(4, graph.totalEntries());
            assertThrows(IndexOutOfBoundsException.class, () -> graph.nodeDegree(3));
        }

        @Test
        @DisplayName("Geometry starts and ends at the edge endpoints")
        void testGeometry() {
            GraphStore graph = GraphFixtures.line();
            assertEquals(2, graph.geometryPointCount(1));
            int start = graph.geometryStart(1);
            assertEquals(graph.nodeLng(1), graph.pointLng(start), 1e-12);
            assertEquals(graph.nodeLng(2), graph.pointLng(start + 1), 1e-12);
            assertEquals(4, graph.totalGeometryPoints());
        }

        @Test
        @DisplayName("Optional arrays default to zero priority, no names and positional external ids")
        void testOptionalDefaults() {
            GraphStore graph = GraphFixtures.line();
            assertEquals(0, graph.priority(0));
            assertEquals(List.of(), graph.streetNames(0));
            assertEquals(2L, graph.nodeExternalId(2));
            assertEquals(0, graph.nameCount());
        }

        @Test
        @DisplayName("Interaction pairs are read per incidence entry")
        void testInteractions() {
            GraphStore graph = GraphFixtures.store()
                    .node(0.0d, 0.0d)
                    .node(0.0d, 0.001d)
                    .edge(0, 1, 3)
                    .interaction(1, 0, Interaction.TRAFFIC_LIGHT, Interaction.YIELD)
                    .build();
            int entry = graph.findEntry(1, 0);
            assertEquals(Interaction.TRAFFIC_LIGHT, graph.entryIncoming(entry));
            assertEquals(Interaction.YIELD, graph.entryOutgoing(entry));
            assertEquals(Interaction.NONE, graph.entryIncoming(graph.findEntry(0, 0)));
        }
    }

    @Nested
    @DisplayName("Traversal rules")
    class Traversal {

        @Test
        @DisplayName("One-way edge is only leavable from its from-node when honoured")
        void testOneWay() {
            GraphStore graph = GraphFixtures.store()
                    .node(0.0d, 0.0d)
                    .node(0.0d, 0.001d)
                    .node(0.0d, 0.002d)
                    .oneWayEdge(0, 1, 4)
                    .build();
            assertTrue(graph.isOneWay(0, TravelMode.CAR));
            assertTrue(graph.canTraverse(0, 0, TravelMode.CAR, true));
            assertFalse(graph.canTraverse(0, 1, TravelMode.CAR, true));
            assertTrue(graph.canTraverse(0, 1, TravelMode.WALK, false));
            assertFalse(graph.canTraverse(0, 2, TravelMode.WALK, false));
        }

        @Test
        @DisplayName("Excluded mode can never traverse")
        void testExcluded() {
            short open = EdgeCostFlags.pack(4, false, false);
            GraphStore graph = GraphFixtures.store()
                    .node(0.0d, 0.0d)
                    .node(0.0d, 0.001d)
                    .edge(0, 1, EdgeCostFlags.EXCLUDED, open, open, EdgeCostFlags.EXCLUDED)
                    .build();
            assertTrue(graph.isExcluded(0, TravelMode.CAR));
            assertFalse(graph.canTraverse(0, 0, TravelMode.CAR, false));
            assertTrue(graph.canTraverse(0, 0, TravelMode.BIKE, true));
        }
    }

    @Nested
    @DisplayName("Structural validation")
    class Validation {

        private GraphStore.GraphStoreBuilder valid() {
            return GraphStore.builder()
                    .edgeFrom(new int[]{0})
                    .edgeTo(new int[]{1})
                    .edgeCosts(new short[TravelMode.count()])
                    .nodeFirstEntry(new int[]{0, 1, 2})
                    .nodeEdges(new int[]{0, 0})
                    .nodeInteractions(new byte[2])
                    .nodeLat(new double[]{0.0d, 0.0d})
                    .nodeLng(new double[]{0.0d, 0.001d})
                    .geometryFirstPoint(new int[]{0, 2})
                    .geometryLat(new double[]{0.0d, 0.0d})
                    .geometryLng(new double[]{0.0d, 0.001d});
        }

        @Test
        @DisplayName("Minimal valid store builds")
        void testValid() {
            GraphStore graph = valid().build();
            assertTrue(graph.validate().isValid());
        }

        @Test
        @DisplayName("Cost table length must equal edges times modes")
        void testCostLength() {
            assertThrows(IllegalArgumentException.class, () -> valid().edgeCosts(new short[1]).build());
        }

        @Test
        @DisplayName("Endpoint outside node range is rejected")
        void testEndpointRange() {
            assertThrows(IllegalArgumentException.class, () -> valid().edgeTo(new int[]{2}).build());
        }

        @Test
        @DisplayName("Non-monotonic incidence offsets are rejected")
        void testNonMonotonicOffsets() {
            assertThrows(IllegalArgumentException.class, () -> valid().nodeFirstEntry(new int[]{0, 2, 1}).build());
        }

        @Test
        @DisplayName("Edge geometry needs at least two points")
        void testGeometryTooShort() {
            assertThrows(IllegalArgumentException.class, () -> valid()
                    .geometryFirstPoint(new int[]{0, 1})
                    .geometryLat(new double[]{0.0d})
                    .geometryLng(new double[]{0.0d})
                    .build());
        }

        @Test
        @DisplayName("Priority above 10 is rejected")
        void testPriority() {
            assertThrows(IllegalArgumentException.class, () -> valid().edgePriority(new byte[]{11}).build());
        }

        @Test
        @DisplayName("Unknown interaction code is rejected")
        void testInteractionCode() {
            assertThrows(IllegalArgumentException.class, () -> valid().nodeInteractions(new byte[]{0x05, 0}).build());
        }

        @Test
        @DisplayName("Incidence entry on a node the edge does not touch fails validate()")
        void testIncidenceMismatch() {
            GraphStore graph = valid()
                    .nodeLat(new double[]{0.0d, 0.0d, 0.0d})
                    .nodeLng(new double[]{0.0d, 0.001d, 0.002d})
                    .nodeFirstEntry(new int[]{0, 1, 1, 2})
                    .build();
            GraphStore.ValidationResult result = graph.validate();
            assertFalse(result.isValid());
            assertTrue(result.errors().get(0).contains("does not touch"));
        }

        @Test
        @DisplayName("Isolated nodes and fully excluded edges are warnings")
        void testWarnings() {
            short[] excluded = new short[TravelMode.count()];
            Arrays.fill(excluded, EdgeCostFlags.EXCLUDED);
            GraphStore graph = valid()
                    .edgeCosts(excluded)
                    .nodeLat(new double[]{0.0d, 0.0d, 1.0d})
                    .nodeLng(new double[]{0.0d, 0.001d, 1.0d})
                    .nodeFirstEntry(new int[]{0, 1, 2, 2})
                    .build();
            GraphStore.ValidationResult result = graph.validate();
            assertTrue(result.isValid());
            assertEquals(2, result.warnings().size());
        }
    }

    @Test
    @DisplayName("Concurrent readers observe identical costs")
    void testConcurrentReads() throws Exception {
        GraphStore graph = GraphFixtures.line();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    long sum = 0;
                    for (int i = 0; i < 10_000; i++) {
                        sum += graph.cost(i & 1, TravelMode.CAR);
                    }
                    return sum;
                }));
            }
            start.countDown();
            for (Future<Long> future : futures) {
                assertEquals(60_000L, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
