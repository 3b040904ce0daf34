package com.cubefour.core;

/**
 * A single cell of the cube, addressed by column {@code (x, y)} and height {@code z}.
 */
public record Coordinate(int x, int y, int z) {

    /**
     * Returns the coordinate stored at the provided cell index.
     */
    public static Coordinate ofIndex(int index) {
        if (index < 0 || index >= Board.CELL_COUNT) {
            throw new IllegalArgumentException("Cell index out of range: " + index);
        }
        return new Coordinate(index % Board.SIZE, (index / Board.SIZE) % Board.SIZE,
                index / Board.COLUMN_COUNT);
    }

    /**
     * Returns {@code true} if all three components address a cell inside the cube.
     */
    public boolean isOnBoard() {
        return Board.isInRange(x) && Board.isInRange(y) && Board.isInRange(z);
    }

    /**
     * Returns the bit index of this cell ({@code x + 4y + 16z}).
     */
    public int index() {
        if (!isOnBoard()) {
            throw new IllegalStateException("Coordinate is outside the board: " + this);
        }
        return Board.cellIndex(x, y, z);
    }

    /**
     * Returns the column this cell belongs to.
     */
    public Move column() {
        return new Move(x, y);
    }
}
