package org.tobmap.serialization.flatbuffers;

import com.google.flatbuffers.FlatBufferBuilder;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tobmap.routing.snap.IndexCorruptionException;
import org.tobmap.routing.snap.SnapBucket;
import org.tobmap.routing.snap.SnapBuckets;

import java.nio.ByteBuffer;

/**
 * Reads and writes {@link SnapBuckets} as a {@code SnapBucketsBlob} FlatBuffers container
 * (file identifier {@value #FILE_IDENTIFIER}).
 * <pre>
 * SnapBucketsBlob: 0 schema_version:uint, 1 outer_level:ubyte, 2 fine_level:ubyte, 3 buckets:[SnapBucket]
 * SnapBucket:      0 cell_id:ulong, 1 fine_cell_ids:[ulong], 2 edge_indexes:[uint]
 * </pre>
 * Header problems are {@link IllegalArgumentException}s; bucket contents that break ordering or
 * cell-id rules surface as {@link IndexCorruptionException}.
 */
@UtilityClass
public final class SnapBucketsCodec {
    private static final Logger log = LoggerFactory.getLogger(SnapBucketsCodec.class);

    public static final String FILE_IDENTIFIER = "TOBS";
    private static final String LOADER = "SnapBucketsBlob";

    private static final int FIELD_OUTER_LEVEL = 1;
    private static final int FIELD_FINE_LEVEL = 2;
    private static final int FIELD_BUCKETS = 3;
    private static final int FIELD_COUNT = 4;

    private static final int BUCKET_FIELD_CELL_ID = 0;
    private static final int BUCKET_FIELD_FINE_CELL_IDS = 1;
    private static final int BUCKET_FIELD_EDGE_INDEXES = 2;
    private static final int BUCKET_FIELD_COUNT = 3;

    public static byte[] encode(SnapBuckets snapBuckets) {
        FlatBufferBuilder builder = new FlatBufferBuilder(1024);
        int[] bucketOffsets = new int[snapBuckets.bucketCount()];
        for (int i = 0; i < bucketOffsets.length; i++) {
            bucketOffsets[i] = writeBucket(builder, snapBuckets.bucket(i));
        }
        int bucketsOffset = FlatVectors.offsetVector(builder, bucketOffsets);

        builder.startTable(FIELD_COUNT);
        builder.addInt(ModelContractValidator.FIELD_SCHEMA_VERSION, (int) ModelContractValidator.EXPECTED_SCHEMA_VERSION, 0);
        builder.addByte(FIELD_OUTER_LEVEL, (byte) snapBuckets.outerLevel(), -1);
        builder.addByte(FIELD_FINE_LEVEL, (byte) snapBuckets.fineLevel(), -1);
        builder.addOffset(FIELD_BUCKETS, bucketsOffset, 0);
        int root = builder.endTable();
        builder.finish(root, FILE_IDENTIFIER);
        return builder.sizedByteArray();
    }

    private static int writeBucket(FlatBufferBuilder builder, SnapBucket bucket) {
        long[] fineCellIds = new long[bucket.size()];
        int[] edgeIndexes = new int[bucket.size()];
        for (int i = 0; i < fineCellIds.length; i++) {
            fineCellIds[i] = bucket.fineCellId(i);
            edgeIndexes[i] = bucket.edgeIndex(i);
        }
        int fineOffset = FlatVectors.longs(builder, fineCellIds);
        int edgesOffset = FlatVectors.ints(builder, edgeIndexes);
        builder.startTable(BUCKET_FIELD_COUNT);
        builder.addLong(BUCKET_FIELD_CELL_ID, bucket.cellId(), 0L);
        builder.addOffset(BUCKET_FIELD_FINE_CELL_IDS, fineOffset, 0);
        builder.addOffset(BUCKET_FIELD_EDGE_INDEXES, edgesOffset, 0);
        return builder.endTable();
    }

    /**
     * Loads and verifies snap buckets.
     *
     * @throws IllegalArgumentException if the header or schema version is invalid.
     * @throws IndexCorruptionException if bucket contents break their contract.
     */
    public static SnapBuckets decode(ByteBuffer buffer) {
        ByteBuffer bb = ModelContractValidator.requireContainer(buffer, FILE_IDENTIFIER, LOADER);
        try {
            return decodeRoot(bb);
        } catch (IndexOutOfBoundsException ex) {
            throw new IllegalArgumentException(LOADER + ": truncated or corrupt container", ex);
        }
    }

    public static SnapBuckets decode(byte[] bytes) {
        return decode(ByteBuffer.wrap(bytes));
    }

    private static SnapBuckets decodeRoot(ByteBuffer bb) {
        FlatTable root = FlatTable.root(bb);
        ModelContractValidator.validateSchemaVersion(root, LOADER);
        int outerLevel = root.getUnsignedByteField(FIELD_OUTER_LEVEL, -1);
        int fineLevel = root.getUnsignedByteField(FIELD_FINE_LEVEL, -1);
        if (outerLevel < 0 || fineLevel < 0) {
            throw new IllegalArgumentException(LOADER + ": outer_level and fine_level are required");
        }

        int vectorStart = root.getVectorStart(FIELD_BUCKETS);
        int bucketCount = root.getVectorLength(FIELD_BUCKETS);
        ModelContractValidator.requireVectorInBounds(bb, LOADER, "buckets", vectorStart, bucketCount, Integer.BYTES);

        SnapBucket[] buckets = new SnapBucket[bucketCount];
        FlatTable cursor = new FlatTable(bb, 0);
        for (int i = 0; i < bucketCount; i++) {
            cursor.setPos(cursor.tableAt(vectorStart, i));
            long cellId = cursor.getLongField(BUCKET_FIELD_CELL_ID, 0L);
            long[] fineCellIds = FlatVectors.readLongs(bb, cursor, BUCKET_FIELD_FINE_CELL_IDS, LOADER, "fine_cell_ids");
            int[] edgeIndexes = FlatVectors.readInts(bb, cursor, BUCKET_FIELD_EDGE_INDEXES, LOADER, "edge_indexes");
            buckets[i] = new SnapBucket(cellId, fineCellIds, edgeIndexes);
        }

        SnapBuckets snapBuckets = new SnapBuckets(outerLevel, fineLevel, buckets);
        log.debug("loaded {}", snapBuckets);
        return snapBuckets;
    }
}
