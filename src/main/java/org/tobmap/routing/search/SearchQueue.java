package org.tobmap.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Indexed min-priority queue over dense node indices for Dijkstra searches.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Primitive storage:</strong> keys and priorities live in parallel arrays, no per-entry objects.</li>
 * <li><strong>Decrease-Key Support:</strong> O(log n) priority updates through a node-to-heap-slot position array.</li>
 * <li><strong>Deterministic order:</strong> entries compare by cost, then by tie rank (when ranks are
 * supplied), then by smaller index.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. Each search owns its queue.</p>
 */
public class SearchQueue {

    // 1-based binary heap of node ids
    private final int[] heap;
    // cost of each node while it is queued, indexed by node id
    private final long[] costs;
    // positions[nodeId] = heap slot, 0 when absent
    private final int[] positions;
    // secondary ordering key per id, null to order ties by id alone
    private final int[] tieRanks;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    @Getter
    private int peakSize = 0;

    /**
     * @param maxNodeId largest node id the queue will see (inclusive). Must be non-negative.
     * @throws IllegalArgumentException if maxNodeId is negative.
     */
    public SearchQueue(int maxNodeId) {
        this(maxNodeId, null);
    }

    /**
     * Queue whose equal-cost entries are ordered by {@code tieRanks[id]} before their id.
     *
     * @param tieRanks one rank per id in {@code [0, maxNodeId]}, or {@code null}.
     * @throws IllegalArgumentException if maxNodeId is negative or tieRanks is too short.
     */
    public SearchQueue(int maxNodeId, int[] tieRanks) {
        if (maxNodeId < 0) {
            throw new IllegalArgumentException("maxNodeId must be non-negative");
        }
        if (tieRanks != null && tieRanks.length <= maxNodeId) {
            throw new IllegalArgumentException(
                    "tieRanks length " + tieRanks.length + " does not cover maxNodeId " + maxNodeId);
        }
        this.heap = new int[maxNodeId + 2];
        this.costs = new long[maxNodeId + 1];
        this.positions = new int[maxNodeId + 1];
        this.tieRanks = tieRanks;
    }

    /**
     * Inserts {@code nodeId}, or lowers its priority when it is queued with a higher cost.
     *
     * @return true when the queue changed.
     * @throws IllegalArgumentException if nodeId is out of bounds or cost is negative.
     */
    public boolean insertOrDecrease(int nodeId, long cost) {
        if (nodeId < 0 || nodeId >= positions.length) {
            throw new IllegalArgumentException("nodeId " + nodeId + " out of bounds (max: " + (positions.length - 1) + ")");
        }
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be non-negative, got " + cost);
        }

        int existing = positions[nodeId];
        if (existing > 0) {
            if (cost >= costs[nodeId]) {
                return false;
            }
            costs[nodeId] = cost;
            swim(existing);
            return true;
        }

        size++;
        heap[size] = nodeId;
        costs[nodeId] = cost;
        positions[nodeId] = size;
        swim(size);
        if (size > peakSize) {
            peakSize = size;
        }
        return true;
    }

    public boolean contains(int nodeId) {
        return nodeId >= 0 && nodeId < positions.length && positions[nodeId] > 0;
    }

    /**
     * Cost of the minimum entry without removing it.
     *
     * @throws EmptyQueueException if queue is empty.
     */
    public long peekCost() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return costs[heap[1]];
    }

    /**
     * Removes the minimum entry and returns its node id. Its cost stays readable via {@link #costOf(int)}.
     *
     * @throws EmptyQueueException if queue is empty.
     */
    public int extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        int min = heap[1];
        int last = heap[size];
        heap[size] = 0;
        size--;
        positions[min] = 0;
        if (size > 0) {
            heap[1] = last;
            positions[last] = 1;
            sink(1);
        }
        return min;
    }

    /**
     * Last cost recorded for {@code nodeId}.
     */
    public long costOf(int nodeId) {
        return costs[nodeId];
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Empties the queue so it can be reused for another search.
     */
    public void clear() {
        for (int i = 1; i <= size; i++) {
            positions[heap[i]] = 0;
            heap[i] = 0;
        }
        size = 0;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    /**
     * Returns whether heap slot {@code i} has lower priority than slot {@code j}.
     */
    private boolean greater(int i, int j) {
        int a = heap[i];
        int b = heap[j];
        long costA = costs[a];
        long costB = costs[b];
        if (costA != costB) {
            return costA > costB;
        }
        if (tieRanks != null && tieRanks[a] != tieRanks[b]) {
            return tieRanks[a] > tieRanks[b];
        }
        return a > b;
    }

    private void swap(int i, int j) {
        int a = heap[i];
        int b = heap[j];
        heap[i] = b;
        heap[j] = a;
        positions[a] = j;
        positions[b] = i;
    }
}
