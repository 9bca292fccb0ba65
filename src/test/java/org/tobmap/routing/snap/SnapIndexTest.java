package org.tobmap.routing.snap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.tobmap.core.cell.CellIndexer;
import org.tobmap.routing.build.BuildResult;
import org.tobmap.routing.build.NodeRecord;
import org.tobmap.routing.build.RoadClass;
import org.tobmap.routing.build.WayPoint;
import org.tobmap.routing.build.WayRecord;
import org.tobmap.routing.build.WayTags;
import org.tobmap.routing.graph.GraphStore;
import org.tobmap.routing.testutil.GraphFixtures;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.tobmap.routing.testutil.GraphFixtures.BASE_LAT;
import static org.tobmap.routing.testutil.GraphFixtures.BASE_LNG;
import static org.tobmap.routing.testutil.GraphFixtures.STEP;

@DisplayName("SnapIndex Tests")
class SnapIndexTest {

    private static SnapIndex teeIndex(GraphFixtures.TeeNetwork tee) {
        BuildResult result = tee.result();
        return new SnapIndex(result.getGraph(), result.getSnapBuckets(), GraphFixtures.snapConfig());
    }

    @Nested
    @DisplayName("Nearest edge")
    class Nearest {

        @Test
        @DisplayName("Point on a dead-end vertex snaps to its only edge")
        void testVertexSnap() {
            GraphFixtures.TeeNetwork tee = GraphFixtures.tee();
            OptionalInt edge = teeIndex(tee).snap(BASE_LAT + STEP, BASE_LNG + STEP);
            assertEquals(OptionalInt.of(tee.northEdge()), edge);
        }

        @Test
        @DisplayName("Offset point reports distance, projection and segment")
        void testMatchDetails() {
            GraphFixtures.TeeNetwork tee = GraphFixtures.tee();
            Optional<SnapMatch> match = teeIndex(tee).nearest(BASE_LAT + 0.0001d, BASE_LNG + 0.0004d);
            assertTrue(match.isPresent());
            assertEquals(tee.westEdge(), match.get().edgeIndex());
            assertEquals(11.1d, match.get().distanceMeters(), 0.2d);
            assertEquals(BASE_LAT, match.get().lat(), 1e-7);
            assertEquals(BASE_LNG + 0.0004d, match.get().lng(), 1e-6);
            assertEquals(0, match.get().segmentIndex());
        }

        @Test
        @DisplayName("Equidistant edges resolve to the smallest edge index")
        void testTieBreak() {
            GraphFixtures.TeeNetwork tee = GraphFixtures.tee();
            int smallest = Math.min(tee.westEdge(), Math.min(tee.eastEdge(), tee.northEdge()));
            OptionalInt edge = teeIndex(tee).snap(BASE_LAT, BASE_LNG + STEP);
            assertEquals(OptionalInt.of(smallest), edge);
        }

        @Test
        @DisplayName("Distant point in the same outer cell is found through the outer fallback")
        void testOuterFallback() {
            GraphFixtures.TeeNetwork tee = GraphFixtures.tee();
            double lat = BASE_LAT - 0.05d;
            double lng = BASE_LNG + STEP;
            long queryOuter = CellIndexer.pointToCell(lat, lng, 4);
            assertEquals(CellIndexer.pointToCell(BASE_LAT, BASE_LNG, 4), queryOuter);

            Optional<SnapMatch> match = teeIndex(tee).nearest(lat, lng);
            assertTrue(match.isPresent());
            assertTrue(match.get().distanceMeters() > 5_000.0d);
        }

        @Test
        @DisplayName("Point far from every edge is a miss")
        void testMiss() {
            SnapIndex index = teeIndex(GraphFixtures.tee());
            assertFalse(index.snap(-40.0d, 100.0d).isPresent());
            assertTrue(index.nearest(-40.0d, 100.0d).isEmpty());
        }

        @Test
        @DisplayName("Matches beyond the distance limit are dropped")
        void testDistanceLimit() {
            BuildResult result = GraphFixtures.tee().result();
            SnapConfig tight = SnapConfig.builder().outerLevel(4).fineLevel(16).maxDistanceMeters(5.0d).build();
            SnapIndex index = new SnapIndex(result.getGraph(), result.getSnapBuckets(), tight);
            assertTrue(index.snap(BASE_LAT + 0.0001d, BASE_LNG + 0.0004d).isEmpty());
            assertTrue(index.snap(BASE_LAT + 0.00001d, BASE_LNG + 0.0004d).isPresent());
        }

        @Test
        @DisplayName("Distance to a specific edge is measured against its geometry")
        void testDistanceToEdge() {
            GraphFixtures.TeeNetwork tee = GraphFixtures.tee();
            SnapIndex index = teeIndex(tee);
            assertEquals(0.0d, index.distanceToEdge(BASE_LAT, BASE_LNG + 0.0005d, tee.westEdge()), 0.01d);
            assertTrue(index.distanceToEdge(BASE_LAT, BASE_LNG + 0.0005d, tee.northEdge()) > 30.0d);
        }
    }

    @Nested
    @DisplayName("Cell boundaries")
    class Boundaries {

        @Test
        @DisplayName("Fine-ring probing crosses outer cell boundaries")
        void testAcrossOuterBoundary() {
            long startOuter = CellIndexer.pointToCell(BASE_LAT, BASE_LNG, 4);
            double lng = BASE_LNG;
            for (int i = 0; i < 100_000 && CellIndexer.pointToCell(BASE_LAT, lng + 0.0005d, 4) == startOuter; i++) {
                lng += 0.0005d;
            }
            double boundaryLng = lng + 0.0005d;
            assertNotEquals(startOuter, CellIndexer.pointToCell(BASE_LAT, boundaryLng, 4));

            List<NodeRecord> nodes = List.of(
                    NodeRecord.of(1L, BASE_LAT - STEP, lng),
                    NodeRecord.of(2L, BASE_LAT, lng));
            WayRecord way = WayRecord.of(1L, WayTags.of(RoadClass.RESIDENTIAL),
                    WayPoint.node(1L, BASE_LAT - STEP, lng),
                    WayPoint.node(2L, BASE_LAT, lng));
            BuildResult result = GraphFixtures.builder().build(List.of(way), nodes);
            SnapConfig noFallback = SnapConfig.builder().outerLevel(4).fineLevel(16).maxOuterRings(0).build();
            SnapIndex index = new SnapIndex(result.getGraph(), result.getSnapBuckets(), noFallback);

            Optional<SnapMatch> match = index.nearest(BASE_LAT, boundaryLng);
            assertTrue(match.isPresent());
            assertEquals(0, match.get().edgeIndex());
            assertTrue(match.get().distanceMeters() < 60.0d);
        }

        @Test
        @DisplayName("Zero outer rings still scans the query's own outer bucket")
        void testOwnBucketOnly() {
            BuildResult result = GraphFixtures.tee().result();
            SnapConfig ownBucket = SnapConfig.builder().outerLevel(4).fineLevel(16).maxOuterRings(0).build();
            SnapIndex index = new SnapIndex(result.getGraph(), result.getSnapBuckets(), ownBucket);
            assertTrue(index.snap(BASE_LAT - 0.05d, BASE_LNG).isPresent());
            assertTrue(index.snap(-40.0d, 100.0d).isEmpty());
        }
    }

    @Nested
    @DisplayName("Contracts")
    class Contracts {

        @Test
        @DisplayName("Non-finite coordinates are rejected")
        void testNonFinite() {
            SnapIndex index = teeIndex(GraphFixtures.tee());
            assertThrows(IllegalArgumentException.class, () -> index.snap(Double.NaN, 0.0d));
            assertThrows(IllegalArgumentException.class, () -> index.nearest(0.0d, Double.NEGATIVE_INFINITY));
        }

        @Test
        @DisplayName("Buckets referencing edges the graph lacks are corrupt")
        void testEdgeOutOfRange() {
            SnapBuckets buckets = GraphFixtures.tee().result().getSnapBuckets();
            GraphStore small = GraphFixtures.line();
            assertThrows(IndexCorruptionException.class, () -> new SnapIndex(small, buckets));
        }

        @Test
        @DisplayName("Snap config validation")
        void testConfigValidation() {
            assertThrows(IllegalArgumentException.class,
                    () -> SnapConfig.builder().outerLevel(10).fineLevel(10).build().validate());
            assertThrows(IllegalArgumentException.class,
                    () -> SnapConfig.builder().outerLevel(14).fineLevel(20).build().validate());
            assertThrows(IllegalArgumentException.class,
                    () -> SnapConfig.builder().outerLevel(4).fineLevel(16).maxFineRings(-1).build().validate());
            assertThrows(IllegalArgumentException.class,
                    () -> SnapConfig.builder().outerLevel(4).fineLevel(16).maxDistanceMeters(Double.NaN).build().validate());
            SnapConfig config = GraphFixtures.snapConfig();
            assertEquals(3, config.getMaxFineRings());
            assertEquals(1, config.getMaxOuterRings());
        }

        @Test
        @DisplayName("Concurrent snaps return identical matches")
        void testConcurrentSnaps() throws Exception {
            GraphFixtures.TeeNetwork tee = GraphFixtures.tee();
            SnapIndex index = teeIndex(tee);
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Integer>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        int last = -1;
                        for (int i = 0; i < 500; i++) {
                            last = index.snap(BASE_LAT + 0.0001d, BASE_LNG + 0.0004d).orElse(-1);
                        }
                        return last;
                    }));
                }
                start.countDown();
                for (Future<Integer> future : futures) {
                    assertEquals(tee.westEdge(), future.get(10, TimeUnit.SECONDS));
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
