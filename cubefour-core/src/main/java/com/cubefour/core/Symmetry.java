package com.cubefour.core;

/**
 * Utility providing the eight symmetries of the cube that keep gravity intact: the rotations and
 * reflections of the 4x4 column grid, applied to every layer alike. Symmetries are represented
 * as permutations of the 64 cell indices.
 */
public final class Symmetry {

    public static final int SYMMETRY_COUNT = 8;
    public static final int IDENTITY = 0;

    /**
     * Precomputed permutation table. The first index selects the symmetry, the second
     * index specifies the original cell, and the stored value is the mapped cell index.
     */
    public static final int[][] PERMUTATIONS = new int[SYMMETRY_COUNT][Board.CELL_COUNT];

    private static final int[][] COLUMN_PERMUTATIONS = new int[SYMMETRY_COUNT][Board.COLUMN_COUNT];
    private static final int[][] INVERSE_COLUMN_PERMUTATIONS = new int[SYMMETRY_COUNT][Board.COLUMN_COUNT];

    static {
        int max = Board.SIZE - 1;
        for (int column = 0; column < Board.COLUMN_COUNT; column++) {
            int x = column % Board.SIZE;
            int y = column / Board.SIZE;
            int[][] images = {
                    {x, y},             // identity
                    {max - y, x},       // rotation 90°
                    {max - x, max - y}, // rotation 180°
                    {y, max - x},       // rotation 270°
                    {max - x, y},       // mirror across the y axis
                    {x, max - y},       // mirror across the x axis
                    {y, x},             // main diagonal
                    {max - y, max - x}  // anti-diagonal
            };
            for (int s = 0; s < SYMMETRY_COUNT; s++) {
                int mapped = Board.columnIndex(images[s][0], images[s][1]);
                COLUMN_PERMUTATIONS[s][column] = mapped;
                INVERSE_COLUMN_PERMUTATIONS[s][mapped] = column;
            }
        }

        for (int cell = 0; cell < Board.CELL_COUNT; cell++) {
            int column = cell % Board.COLUMN_COUNT;
            int layer = cell / Board.COLUMN_COUNT;
            for (int s = 0; s < SYMMETRY_COUNT; s++) {
                PERMUTATIONS[s][cell] = COLUMN_PERMUTATIONS[s][column] + layer * Board.COLUMN_COUNT;
            }
        }
    }

    private Symmetry() {
    }

    /**
     * Applies the specified symmetry permutation to the provided stone mask.
     */
    public static long apply(long stones, int symmetry) {
        checkSymmetry(symmetry);
        if (symmetry == IDENTITY) {
            return stones;
        }
        long result = 0L;
        long remaining = stones;
        int[] permutation = PERMUTATIONS[symmetry];
        while (remaining != 0L) {
            int bit = Long.numberOfTrailingZeros(remaining);
            remaining &= remaining - 1;
            result |= 1L << permutation[bit];
        }
        return result;
    }

    /**
     * Maps a column index into the frame of the given symmetry.
     */
    public static int mapColumn(int column, int symmetry) {
        checkSymmetry(symmetry);
        return COLUMN_PERMUTATIONS[symmetry][column];
    }

    /**
     * Inverse of {@link #mapColumn(int, int)}.
     */
    public static int unmapColumn(int column, int symmetry) {
        checkSymmetry(symmetry);
        return INVERSE_COLUMN_PERMUTATIONS[symmetry][column];
    }

    private static void checkSymmetry(int symmetry) {
        if (symmetry < 0 || symmetry >= SYMMETRY_COUNT) {
            throw new IllegalArgumentException("Symmetry index out of range: " + symmetry);
        }
    }
}
