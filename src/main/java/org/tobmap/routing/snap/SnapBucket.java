package org.tobmap.routing.snap;

import it.unimi.dsi.fastutil.ints.IntCollection;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Candidate edges of one outer cell, keyed by fine cell.
 * <p>
 * {@code fineCellIds} and {@code edgeIndexes} are parallel; entries are ordered by
 * {@code (fineCellId, edgeIndex)} without duplicates, so all edges of one fine cell
 * form a contiguous run found by binary search.
 * </p>
 */
public final class SnapBucket {
    private static final long[] NO_CELLS = new long[0];
    private static final int[] NO_EDGES = new int[0];

    @Getter
    @Accessors(fluent = true)
    private final long cellId;
    private final long[] fineCellIds;
    private final int[] edgeIndexes;

    /**
     * Wraps arrays without copying. Ordering is checked by {@link SnapBuckets}.
     */
    public SnapBucket(long cellId, long[] fineCellIds, int[] edgeIndexes) {
        this.cellId = cellId;
        this.fineCellIds = fineCellIds == null ? NO_CELLS : fineCellIds;
        this.edgeIndexes = edgeIndexes == null ? NO_EDGES : edgeIndexes;
    }

    public static SnapBucket empty(long cellId) {
        return new SnapBucket(cellId, NO_CELLS, NO_EDGES);
    }

    public int size() {
        return fineCellIds.length;
    }

    public boolean isEmpty() {
        return fineCellIds.length == 0;
    }

    public long fineCellId(int i) {
        return fineCellIds[i];
    }

    public int edgeIndex(int i) {
        return edgeIndexes[i];
    }

    int edgeIndexesLength() {
        return edgeIndexes.length;
    }

    /**
     * First position holding {@code fineCellId}, or -1.
     */
    public int firstIndexOf(long fineCellId) {
        int lo = 0;
        int hi = fineCellIds.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (Long.compareUnsigned(fineCellIds[mid], fineCellId) < 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo < fineCellIds.length && fineCellIds[lo] == fineCellId ? lo : -1;
    }

    /**
     * Copies the edges stored under {@code fineCellId} into {@code sink}; returns how many were found.
     */
    public int collectEdges(long fineCellId, IntCollection sink) {
        int i = firstIndexOf(fineCellId);
        if (i < 0) {
            return 0;
        }
        int found = 0;
        for (; i < fineCellIds.length && fineCellIds[i] == fineCellId; i++) {
            sink.add(edgeIndexes[i]);
            found++;
        }
        return found;
    }

    /**
     * Copies every edge of the bucket into {@code sink}.
     */
    public int collectAllEdges(IntCollection sink) {
        for (int edge : edgeIndexes) {
            sink.add(edge);
        }
        return edgeIndexes.length;
    }

    long[] fineCellIdsArray() {
        return fineCellIds;
    }

    int[] edgeIndexesArray() {
        return edgeIndexes;
    }

    @Override
    public String toString() {
        return "SnapBucket[cell=" + Long.toUnsignedString(cellId, 16) + ", entries=" + fineCellIds.length + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SnapBucket other)) return false;
        return cellId == other.cellId
                && Arrays.equals(fineCellIds, other.fineCellIds)
                && Arrays.equals(edgeIndexes, other.edgeIndexes);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Long.hashCode(cellId) + Arrays.hashCode(fineCellIds)) + Arrays.hashCode(edgeIndexes);
    }
}
