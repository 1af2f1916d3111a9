package org.hivemind.runtime.spatial;

/**
 * Packs two signed grid coordinates into a single {@code long} key.
 * <p>
 * The upper 32 bits hold x, the lower 32 bits hold y. Used for every cell-keyed map in the
 * engine: the spatial grid, the search lattices and the flow fields.
 */
public final class GridKeys {

    private GridKeys() {
    }

    public static long pack(int gx, int gy) {
        return ((long) gx << 32) | (gy & 0xffffffffL);
    }

    public static int unpackX(long key) {
        return (int) (key >> 32);
    }

    public static int unpackY(long key) {
        return (int) key;
    }

    /**
     * Maps a world coordinate to the index of the cell containing it.
     *
     * @param value The coordinate.
     * @param cellSize The cell size, positive.
     * @return {@code floor(value / cellSize)}.
     */
    public static int quantize(double value, double cellSize) {
        return (int) Math.floor(value / cellSize);
    }
}
