package org.tobmap.core.id;

import lombok.experimental.StandardException;

/**
 * Bidirectional mapping contract between external intersection ids and dense internal node indices.
 */
public interface NodeIdMapper {

    /**
     * Converts an external intersection id to an internal node index.
     * @param externalId id assigned by the ingestion source.
     * @return The internal node index.
     * @throws UnknownNodeException If the id is not mapped.
     */
    int toInternal(long externalId) throws UnknownNodeException;

    /**
     * Converts an internal node index back to its external id.
     * @param internalId The internal node index.
     * @return The external id.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    long toExternal(int internalId);

    /**
     * Checks whether an external id has a mapped internal index.
     *
     * @param externalId external id to test.
     * @return true when the external id is present.
     */
    boolean containsExternal(long externalId);

    /**
     * Checks whether an internal index is within mapper bounds.
     *
     * @param internalId internal index to test.
     * @return true when the internal index is present.
     */
    boolean containsInternal(int internalId);

    /**
     * Returns number of id pairs in the mapping.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Exception thrown when an external id cannot be found in the mapping.
     */
    @StandardException
    class UnknownNodeException extends RuntimeException {
    }

    /**
     * Creates the default immutable implementation from an index-ordered id array:
     * {@code externalIds[i]} is the external id of node {@code i}.
     */
    static NodeIdMapper createImmutable(long[] externalIds) {
        return new FastUtilNodeIdMapper(externalIds);
    }
}
