package org.tobmap.routing.snap;

import lombok.experimental.StandardException;

/**
 * Thrown when snap buckets violate their structural contract (ordering, lengths, cell ids).
 * A snapshot carrying such buckets must not be published.
 */
@StandardException
public class IndexCorruptionException extends RuntimeException {
}
