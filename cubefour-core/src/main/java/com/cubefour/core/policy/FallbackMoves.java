package com.cubefour.core.policy;

import com.cubefour.core.Board;
import com.cubefour.core.Move;

/**
 * Last-resort move selection over a fixed column priority list.
 */
public final class FallbackMoves {

    /**
     * Columns in order of preference: the four central columns, the corners, then the edges.
     */
    static final int[] PRIORITY = {5, 6, 9, 10, 0, 3, 12, 15, 1, 2, 4, 7, 8, 11, 13, 14};

    private FallbackMoves() {
    }

    /**
     * Returns the first legal column of the priority list that does not hand the opponent a win
     * directly above it, else the first legal column, else {@code null} on a full board.
     */
    public static Move choose(Board board, int player) {
        Move firstLegal = null;
        for (int column : PRIORITY) {
            if (board.dropHeight(column) == Board.COLUMN_FULL) {
                continue;
            }
            if (!ThreatDetector.givesAwayWin(board, column, player)) {
                return Move.ofColumn(column);
            }
            if (firstLegal == null) {
                firstLegal = Move.ofColumn(column);
            }
        }
        return firstLegal;
    }

    /**
     * Picks a column straight from a host grid that could not be turned into a {@link Board}.
     * A column counts as open when its top cell reads {@code 0}; anything unreadable is skipped.
     * Returns {@code null} if no column qualifies.
     */
    public static Move chooseFromGrid(int[][][] grid) {
        if (grid == null || grid.length < Board.SIZE) {
            return null;
        }
        int[][] topLayer = grid[Board.SIZE - 1];
        if (topLayer == null) {
            return null;
        }
        for (int column : PRIORITY) {
            int x = column % Board.SIZE;
            int y = column / Board.SIZE;
            if (y < topLayer.length && topLayer[y] != null && x < topLayer[y].length && topLayer[y][x] == Board.EMPTY) {
                return Move.ofColumn(column);
            }
        }
        return null;
    }
}
