package org.tobmap.serialization.flatbuffers;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Minimal FlatBuffers table reader working on absolute buffer positions.
 * <p>
 * Fields are addressed by slot index in schema order. Vector accessors return the absolute
 * position of the first element; callers read elements with the buffer's absolute getters.
 * </p>
 */
final class FlatTable {
    private final ByteBuffer bb;
    private int pos;
    private int vtablePos;
    private int vtableLen;

    FlatTable(ByteBuffer bb, int pos) {
        this.bb = bb;
        setPos(pos);
    }

    /**
     * Reader for the root table of a finished buffer.
     */
    static FlatTable root(ByteBuffer bb) {
        int start = bb.position();
        return new FlatTable(bb, start + bb.getInt(start));
    }

    void setPos(int pos) {
        this.pos = pos;
        if (pos == 0) {
            this.vtablePos = 0;
            this.vtableLen = 0;
        } else {
            this.vtablePos = pos - bb.getInt(pos);
            this.vtableLen = bb.getShort(vtablePos);
        }
    }

    boolean has(int fieldIndex) {
        return getOffset(fieldIndex) != 0;
    }

    int getOffset(int fieldIndex) {
        int vtableOffset = 4 + (fieldIndex * 2);
        return (vtableOffset < vtableLen) ? bb.getShort(vtablePos + vtableOffset) : 0;
    }

    int getIntField(int fieldIndex, int defaultValue) {
        int offset = getOffset(fieldIndex);
        return (offset != 0) ? bb.getInt(pos + offset) : defaultValue;
    }

    long getLongField(int fieldIndex, long defaultValue) {
        int offset = getOffset(fieldIndex);
        return (offset != 0) ? bb.getLong(pos + offset) : defaultValue;
    }

    int getUnsignedByteField(int fieldIndex, int defaultValue) {
        int offset = getOffset(fieldIndex);
        return (offset != 0) ? bb.get(pos + offset) & 0xFF : defaultValue;
    }

    String getStringField(int fieldIndex) {
        int offset = getOffset(fieldIndex);
        if (offset == 0) {
            return null;
        }
        return readString(pos + offset);
    }

    int getVectorStart(int fieldIndex) {
        int offset = getOffset(fieldIndex);
        return (offset != 0) ? pos + offset + bb.getInt(pos + offset) + 4 : 0;
    }

    int getVectorLength(int fieldIndex) {
        int offset = getOffset(fieldIndex);
        return (offset != 0) ? bb.getInt(pos + offset + bb.getInt(pos + offset)) : 0;
    }

    /**
     * Reads the string referenced by the offset stored at {@code offsetPos}.
     */
    String readString(int offsetPos) {
        int stringPos = offsetPos + bb.getInt(offsetPos);
        int length = bb.getInt(stringPos);
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = bb.get(stringPos + 4 + i);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Position of the table referenced by element {@code index} of a vector of tables.
     */
    int tableAt(int vectorStart, int index) {
        int elementPos = vectorStart + index * 4;
        return elementPos + bb.getInt(elementPos);
    }
}
