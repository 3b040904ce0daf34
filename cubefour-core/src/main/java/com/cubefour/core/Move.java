package com.cubefour.core;

/**
 * Column chosen for the next drop. The landing height is resolved by the {@link Board}.
 */
public record Move(int x, int y) {

    /**
     * Returns the move for the provided column index ({@code x + 4y}).
     */
    public static Move ofColumn(int column) {
        if (column < 0 || column >= Board.COLUMN_COUNT) {
            throw new IllegalArgumentException("Column index out of range: " + column);
        }
        return new Move(column % Board.SIZE, column / Board.SIZE);
    }

    public boolean isOnBoard() {
        return Board.isInRange(x) && Board.isInRange(y);
    }

    /**
     * Returns the column index ({@code x + 4y}).
     */
    public int column() {
        if (!isOnBoard()) {
            throw new IllegalStateException("Move is outside the board: " + this);
        }
        return Board.columnIndex(x, y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
