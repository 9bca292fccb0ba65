package org.tobmap.serialization.flatbuffers;

import com.google.flatbuffers.FlatBufferBuilder;
import lombok.experimental.UtilityClass;

import java.nio.ByteBuffer;

/**
 * Scalar-vector helpers for {@link FlatBufferBuilder} and {@link FlatTable}.
 * Builders prepend, so elements are added back to front.
 */
@UtilityClass
final class FlatVectors {

    // ========================================================================
    // WRITE
    // ========================================================================

    static int ints(FlatBufferBuilder builder, int[] values) {
        builder.startVector(Integer.BYTES, values.length, Integer.BYTES);
        for (int i = values.length - 1; i >= 0; i--) {
            builder.addInt(values[i]);
        }
        return builder.endVector();
    }

    static int shorts(FlatBufferBuilder builder, short[] values) {
        builder.startVector(Short.BYTES, values.length, Short.BYTES);
        for (int i = values.length - 1; i >= 0; i--) {
            builder.addShort(values[i]);
        }
        return builder.endVector();
    }

    static int bytes(FlatBufferBuilder builder, byte[] values) {
        builder.startVector(Byte.BYTES, values.length, Byte.BYTES);
        for (int i = values.length - 1; i >= 0; i--) {
            builder.addByte(values[i]);
        }
        return builder.endVector();
    }

    static int longs(FlatBufferBuilder builder, long[] values) {
        builder.startVector(Long.BYTES, values.length, Long.BYTES);
        for (int i = values.length - 1; i >= 0; i--) {
            builder.addLong(values[i]);
        }
        return builder.endVector();
    }

    static int doubles(FlatBufferBuilder builder, double[] values) {
        builder.startVector(Double.BYTES, values.length, Double.BYTES);
        for (int i = values.length - 1; i >= 0; i--) {
            builder.addDouble(values[i]);
        }
        return builder.endVector();
    }

    static int strings(FlatBufferBuilder builder, String[] values) {
        int[] offsets = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            offsets[i] = builder.createString(values[i]);
        }
        return offsetVector(builder, offsets);
    }

    /**
     * Vector of previously created tables or strings.
     */
    static int offsetVector(FlatBufferBuilder builder, int[] offsets) {
        builder.startVector(Integer.BYTES, offsets.length, Integer.BYTES);
        for (int i = offsets.length - 1; i >= 0; i--) {
            builder.addOffset(offsets[i]);
        }
        return builder.endVector();
    }

    // ========================================================================
    // READ
    // ========================================================================

    static int[] readInts(ByteBuffer bb, FlatTable table, int field, String loader, String name) {
        int start = table.getVectorStart(field);
        int length = table.getVectorLength(field);
        ModelContractValidator.requireVectorInBounds(bb, loader, name, start, length, Integer.BYTES);
        int[] values = new int[length];
        for (int i = 0; i < length; i++) {
            values[i] = bb.getInt(start + i * Integer.BYTES);
        }
        return values;
    }

    static short[] readShorts(ByteBuffer bb, FlatTable table, int field, String loader, String name) {
        int start = table.getVectorStart(field);
        int length = table.getVectorLength(field);
        ModelContractValidator.requireVectorInBounds(bb, loader, name, start, length, Short.BYTES);
        short[] values = new short[length];
        for (int i = 0; i < length; i++) {
            values[i] = bb.getShort(start + i * Short.BYTES);
        }
        return values;
    }

    static byte[] readBytes(ByteBuffer bb, FlatTable table, int field, String loader, String name) {
        int start = table.getVectorStart(field);
        int length = table.getVectorLength(field);
        ModelContractValidator.requireVectorInBounds(bb, loader, name, start, length, Byte.BYTES);
        byte[] values = new byte[length];
        for (int i = 0; i < length; i++) {
            values[i] = bb.get(start + i);
        }
        return values;
    }

    static long[] readLongs(ByteBuffer bb, FlatTable table, int field, String loader, String name) {
        int start = table.getVectorStart(field);
        int length = table.getVectorLength(field);
        ModelContractValidator.requireVectorInBounds(bb, loader, name, start, length, Long.BYTES);
        long[] values = new long[length];
        for (int i = 0; i < length; i++) {
            values[i] = bb.getLong(start + i * Long.BYTES);
        }
        return values;
    }

    static double[] readDoubles(ByteBuffer bb, FlatTable table, int field, String loader, String name) {
        int start = table.getVectorStart(field);
        int length = table.getVectorLength(field);
        ModelContractValidator.requireVectorInBounds(bb, loader, name, start, length, Double.BYTES);
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = bb.getDouble(start + i * Double.BYTES);
        }
        return values;
    }

    static String[] readStrings(ByteBuffer bb, FlatTable table, int field, String loader, String name) {
        int start = table.getVectorStart(field);
        int length = table.getVectorLength(field);
        ModelContractValidator.requireVectorInBounds(bb, loader, name, start, length, Integer.BYTES);
        String[] values = new String[length];
        for (int i = 0; i < length; i++) {
            values[i] = table.readString(start + i * Integer.BYTES);
        }
        return values;
    }
}
