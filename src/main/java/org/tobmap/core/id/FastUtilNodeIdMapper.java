package org.tobmap.core.id;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;

/**
 * Immutable {@link NodeIdMapper} backed by a fastutil primitive map.
 * <p>
 * Reverse lookups read a plain array, forward lookups avoid boxing. Safe for concurrent reads.
 * </p>
 */
public class FastUtilNodeIdMapper implements NodeIdMapper {

    private static final int MISSING = -1;

    private final Long2IntOpenHashMap forward;
    private final long[] reverse;

    /**
     * Builds the mapper from external ids listed in internal index order.
     * Rejects duplicate external ids.
     */
    public FastUtilNodeIdMapper(long[] externalIds) {
        if (externalIds == null) {
            throw new IllegalArgumentException("externalIds cannot be null");
        }
        this.reverse = externalIds.clone();
        this.forward = new Long2IntOpenHashMap(reverse.length);
        this.forward.defaultReturnValue(MISSING);

        for (int i = 0; i < reverse.length; i++) {
            int previous = forward.put(reverse[i], i);
            if (previous != MISSING) {
                throw new IllegalArgumentException(
                        "Duplicate external node id " + reverse[i] + " at indices " + previous + " and " + i
                );
            }
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(long externalId) throws UnknownNodeException {
        int id = forward.get(externalId);
        if (id == MISSING) {
            throw new UnknownNodeException("External node id not found: " + externalId);
        }
        return id;
    }

    @Override
    public long toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal node index out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(long externalId) {
        return forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
