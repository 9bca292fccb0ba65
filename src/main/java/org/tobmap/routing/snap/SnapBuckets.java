package org.tobmap.routing.snap;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.tobmap.core.cell.CellIndexer;

import java.util.Objects;

/**
 * Dense table of {@link SnapBucket}s, one per outer cell of {@code outerLevel}, addressed by
 * {@link CellIndexer#denseIndex(long, int)}.
 * <p>
 * Construction verifies the whole contract and throws {@link IndexCorruptionException} on the
 * first violation, so a loaded instance can be queried without further checks.
 * </p>
 */
public final class SnapBuckets {

    @Getter
    @Accessors(fluent = true)
    private final int outerLevel;
    @Getter
    @Accessors(fluent = true)
    private final int fineLevel;
    private final SnapBucket[] buckets;

    /**
     * @param buckets one bucket per outer cell in dense order; taken without copying.
     * @throws IndexCorruptionException if the buckets break ordering, length or cell-id rules.
     */
    public SnapBuckets(int outerLevel, int fineLevel, SnapBucket[] buckets) {
        Objects.requireNonNull(buckets, "buckets");
        if (outerLevel < 0 || outerLevel > 13 || fineLevel <= outerLevel || fineLevel > CellIndexer.MAX_LEVEL) {
            throw new IndexCorruptionException(
                    "invalid levels: outer=" + outerLevel + ", fine=" + fineLevel);
        }
        this.outerLevel = outerLevel;
        this.fineLevel = fineLevel;
        this.buckets = buckets;
        validate();
    }

    /**
     * All-empty table.
     */
    public static SnapBuckets empty(int outerLevel, int fineLevel) {
        SnapBucket[] buckets = new SnapBucket[CellIndexer.cellCount(outerLevel)];
        for (int i = 0; i < buckets.length; i++) {
            buckets[i] = SnapBucket.empty(CellIndexer.cellAtDenseIndex(i, outerLevel));
        }
        return new SnapBuckets(outerLevel, fineLevel, buckets);
    }

    public int bucketCount() {
        return buckets.length;
    }

    public SnapBucket bucket(int denseIndex) {
        return buckets[denseIndex];
    }

    /**
     * Bucket owning {@code cellId}, which may be the outer cell itself or any descendant of it.
     */
    public SnapBucket bucketFor(long cellId) {
        long outer = CellIndexer.cellToAncestor(cellId, outerLevel);
        return buckets[CellIndexer.denseIndex(outer, outerLevel)];
    }

    /**
     * Total number of (fine cell, edge) entries across all buckets.
     */
    public long entryCount() {
        long total = 0;
        for (SnapBucket bucket : buckets) {
            total += bucket.size();
        }
        return total;
    }

    /**
     * Largest edge index referenced, or -1 when all buckets are empty.
     */
    public int maxEdgeIndex() {
        int max = -1;
        for (SnapBucket bucket : buckets) {
            for (int i = 0; i < bucket.size(); i++) {
                max = Math.max(max, bucket.edgeIndex(i));
            }
        }
        return max;
    }

    @Override
    public String toString() {
        return String.format("SnapBuckets[outerLevel=%d, fineLevel=%d, buckets=%d, entries=%d]",
                outerLevel, fineLevel, buckets.length, entryCount());
    }

    private void validate() {
        int expected = CellIndexer.cellCount(outerLevel);
        if (buckets.length != expected) {
            throw new IndexCorruptionException(
                    "bucket count mismatch: expected " + expected + " for level " + outerLevel + ", got " + buckets.length);
        }
        for (int i = 0; i < buckets.length; i++) {
            SnapBucket bucket = buckets[i];
            if (bucket == null) {
                throw new IndexCorruptionException("bucket " + i + " is null");
            }
            long expectedCell = CellIndexer.cellAtDenseIndex(i, outerLevel);
            if (bucket.cellId() != expectedCell) {
                throw new IndexCorruptionException(String.format(
                        "bucket %d cell id mismatch: expected %x, got %x", i, expectedCell, bucket.cellId()));
            }
            validateBucket(i, bucket);
        }
    }

    private void validateBucket(int index, SnapBucket bucket) {
        if (bucket.size() != bucket.edgeIndexesLength()) {
            throw new IndexCorruptionException(
                    "bucket " + index + " length mismatch: fineCellIds=" + bucket.size()
                            + ", edgeIndexes=" + bucket.edgeIndexesLength());
        }
        long[] fine = bucket.fineCellIdsArray();
        int[] edges = bucket.edgeIndexesArray();
        for (int j = 0; j < fine.length; j++) {
            if (edges[j] < 0) {
                throw new IndexCorruptionException("bucket " + index + " entry " + j + " has negative edge index");
            }
            if (!CellIndexer.isValid(fine[j]) || CellIndexer.level(fine[j]) != fineLevel
                    || CellIndexer.cellToAncestor(fine[j], outerLevel) != bucket.cellId()) {
                throw new IndexCorruptionException(String.format(
                        "bucket %d entry %d: fine cell %x is not a level-%d descendant of %x",
                        index, j, fine[j], fineLevel, bucket.cellId()));
            }
            if (j > 0) {
                int order = Long.compareUnsigned(fine[j - 1], fine[j]);
                if (order > 0 || (order == 0 && edges[j - 1] >= edges[j])) {
                    throw new IndexCorruptionException(
                            "bucket " + index + " not sorted by (fineCellId, edgeIndex) at entry " + j);
                }
            }
        }
    }
}
