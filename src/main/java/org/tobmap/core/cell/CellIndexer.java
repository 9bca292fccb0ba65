package org.tobmap.core.cell;

import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2LatLng;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Coordinate to cell-id mapping over the S2 hierarchical cube-face subdivision.
 * <p>
 * Six base faces (level 0) are quad-subdivided down to level 30. Cell ids are the raw
 * 64-bit S2 ids, so sorting ids keeps cells of one parent contiguous.
 * </p>
 * <p>
 * Besides the raw hierarchy this class provides a dense numbering of all cells of a
 * level ({@code [0, 6 * 4^level)}), which the snap index uses to address its outer
 * buckets directly.
 * </p>
 * Levels outside {@code [0, 30]} are caller contract violations and are only asserted.
 */
@UtilityClass
public final class CellIndexer {

    public static final int MAX_LEVEL = S2CellId.MAX_LEVEL;
    public static final int FACE_COUNT = 6;

    /**
     * Returns the id of the level-{@code level} cell containing the point.
     */
    public static long pointToCell(double latDegrees, double lngDegrees, int level) {
        assert level >= 0 && level <= MAX_LEVEL : "level " + level + " out of range";
        S2CellId leaf = S2CellId.fromLatLng(S2LatLng.fromDegrees(latDegrees, lngDegrees));
        return level == MAX_LEVEL ? leaf.id() : leaf.parent(level).id();
    }

    public static int level(long cellId) {
        return new S2CellId(cellId).level();
    }

    /**
     * Returns the parent one level up. Face cells have no parent.
     */
    public static long cellToParent(long cellId) {
        S2CellId cell = new S2CellId(cellId);
        assert !cell.isFace() : "face cells have no parent";
        return cell.parent().id();
    }

    /**
     * Returns the ancestor at {@code level}, which must not be finer than the cell itself.
     */
    public static long cellToAncestor(long cellId, int level) {
        S2CellId cell = new S2CellId(cellId);
        assert level <= cell.level() : "ancestor level " + level + " finer than " + cell.level();
        return cell.level() == level ? cellId : cell.parent(level).id();
    }

    /**
     * Returns the four children in curve order. Leaf cells have no children.
     */
    public static long[] cellToChildren(long cellId) {
        S2CellId cell = new S2CellId(cellId);
        assert !cell.isLeaf() : "leaf cells have no children";
        long[] children = new long[4];
        S2CellId child = cell.childBegin();
        for (int i = 0; i < 4; i++) {
            children[i] = child.id();
            child = child.next();
        }
        return children;
    }

    /**
     * Number of distinct cells at {@code level}.
     */
    public static int cellCount(int level) {
        assert level >= 0 && level <= 13 : "dense numbering limited to level 13, got " + level;
        return FACE_COUNT << (2 * level);
    }

    /**
     * Maps a cell to its position in the dense numbering of its own level.
     * <p>
     * Id layout is {@code face(3) | position(2 * level) | 1 | 0...}, so dropping the
     * trailing marker bit and zeros leaves {@code face * 4^level + position}.
     * </p>
     */
    public static int denseIndex(long cellId, int level) {
        assert level(cellId) == level : "cell level " + level(cellId) + " != " + level;
        return (int) (cellId >>> (2 * (MAX_LEVEL - level) + 1));
    }

    /**
     * Inverse of {@link #denseIndex(long, int)}.
     */
    public static long cellAtDenseIndex(int index, int level) {
        assert index >= 0 && index < cellCount(level) : "dense index " + index + " out of range";
        int shift = 2 * (MAX_LEVEL - level);
        return ((long) index << (shift + 1)) | (1L << shift);
    }

    /**
     * Returns every cell of the same level that shares an edge or a vertex with this cell.
     * Cells adjacent across a cube-face boundary are included.
     */
    public static long[] neighbors(long cellId) {
        S2CellId cell = new S2CellId(cellId);
        List<S2CellId> out = new ArrayList<>(8);
        cell.getAllNeighbors(cell.level(), out);
        long[] ids = new long[out.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = out.get(i).id();
        }
        return ids;
    }

    public static double centerLatDegrees(long cellId) {
        return new S2CellId(cellId).toLatLng().latDegrees();
    }

    public static double centerLngDegrees(long cellId) {
        return new S2CellId(cellId).toLatLng().lngDegrees();
    }

    /**
     * Approximate edge length in metres of a cell at {@code level} (average over the sphere).
     */
    public static double approximateEdgeMeters(int level) {
        // level 0 face edge is a quarter of the great circle
        return (Math.PI * 0.5d * 6_371_008.8d) / (1L << level);
    }

    public static boolean isValid(long cellId) {
        return new S2CellId(cellId).isValid();
    }
}
