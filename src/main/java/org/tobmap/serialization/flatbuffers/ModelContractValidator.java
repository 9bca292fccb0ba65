package org.tobmap.serialization.flatbuffers;

import lombok.experimental.UtilityClass;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Shared header and metadata checks for tobmap FlatBuffers containers.
 */
@UtilityClass
public final class ModelContractValidator {

    public static final long EXPECTED_SCHEMA_VERSION = 1L;

    /** Slot of {@code schema_version} in every root table. */
    static final int FIELD_SCHEMA_VERSION = 0;

    /**
     * Returns a little-endian view of the container and checks its size and file identifier.
     *
     * @param identifier expected 4-character file identifier.
     * @param loaderName logical loader name for error messages.
     */
    static ByteBuffer requireContainer(ByteBuffer buffer, String identifier, String loaderName) {
        if (buffer == null) {
            throw new IllegalArgumentException(loaderName + ": buffer cannot be null");
        }
        ByteBuffer bb = buffer.slice().order(ByteOrder.LITTLE_ENDIAN);
        if (bb.remaining() < 8) {
            throw new IllegalArgumentException(loaderName + ": buffer too small for container header");
        }
        int expected = identifierAsInt(identifier);
        int ident = bb.getInt(4);
        if (ident != expected) {
            throw new IllegalArgumentException(String.format(
                    "%s: invalid file identifier. Expected '%s' (0x%08X), got 0x%08X",
                    loaderName, identifier, expected, ident));
        }
        int root = bb.getInt(0);
        if (root < 8 || root > bb.limit() - 4) {
            throw new IllegalArgumentException(loaderName + ": root offset out of bounds: " + root);
        }
        return bb;
    }

    /**
     * Validates the schema version of a root table.
     */
    static void validateSchemaVersion(FlatTable root, String loaderName) {
        long schemaVersion = root.getIntField(FIELD_SCHEMA_VERSION, 0) & 0xFFFFFFFFL;
        if (schemaVersion != EXPECTED_SCHEMA_VERSION) {
            throw new IllegalArgumentException(
                    loaderName + ": unsupported schema_version " + schemaVersion
                            + " (expected " + EXPECTED_SCHEMA_VERSION + ")"
            );
        }
    }

    /**
     * Checks a vector length against the value implied by other fields.
     */
    static void requireLength(String loaderName, String field, int actual, int expected) {
        if (actual != expected) {
            throw new IllegalArgumentException(
                    loaderName + ": " + field + " length mismatch: expected " + expected + ", got " + actual);
        }
    }

    /**
     * Checks that a vector fits inside the buffer.
     */
    static void requireVectorInBounds(ByteBuffer bb, String loaderName, String field, int start, int length, int elementSize) {
        if (length < 0 || start < 0 || (long) start + (long) length * elementSize > bb.limit()) {
            throw new IllegalArgumentException(loaderName + ": " + field + " vector exceeds buffer bounds");
        }
    }

    static int identifierAsInt(String identifier) {
        byte[] bytes = identifier.getBytes(StandardCharsets.US_ASCII);
        if (bytes.length != 4) {
            throw new IllegalArgumentException("file identifier must be 4 ASCII characters: " + identifier);
        }
        return (bytes[0] & 0xFF) | (bytes[1] & 0xFF) << 8 | (bytes[2] & 0xFF) << 16 | (bytes[3] & 0xFF) << 24;
    }
}
