package com.cubefour.core.policy;

import com.cubefour.core.Board;

/**
 * Tactical pattern checks used before the full search: immediate wins, gifts to the opponent and
 * double threats. The double-threat checks are heuristic; they recognise two simultaneous winning
 * columns and a winning cell stacked directly above another one, nothing deeper.
 */
public final class ThreatDetector {

    private ThreatDetector() {
    }

    /**
     * Returns the first column, in {@link FallbackMoves#PRIORITY} order, where {@code player} wins at
     * once, or {@code -1}.
     */
    public static int winningColumn(Board board, int player) {
        for (int column : FallbackMoves.PRIORITY) {
            if (isWinningColumn(board, column, player)) {
                return column;
            }
        }
        return -1;
    }

    public static int countWinningColumns(Board board, int player) {
        int count = 0;
        for (int column = 0; column < Board.COLUMN_COUNT; column++) {
            if (isWinningColumn(board, column, player)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns {@code true} if dropping into {@code column} lets the opponent win in the cell just
     * above the new stone.
     */
    public static boolean givesAwayWin(Board board, int column, int player) {
        int height = board.dropHeight(column);
        if (height == Board.COLUMN_FULL || height + 1 >= Board.SIZE) {
            return false;
        }
        int above = column + (height + 1) * Board.COLUMN_COUNT;
        return board.completesLine(above, Board.opponent(player));
    }

    /**
     * Returns a column that leaves {@code player} with a threat the opponent cannot parry, or
     * {@code -1}. The board is restored before returning.
     */
    public static int doubleThreatColumn(Board board, int player) {
        int opponent = Board.opponent(player);
        for (int column : FallbackMoves.PRIORITY) {
            int height = board.dropHeight(column);
            if (height == Board.COLUMN_FULL) {
                continue;
            }
            int x = column % Board.SIZE;
            int y = column / Board.SIZE;
            board.applyMove(x, y, player);
            try {
                if (winningColumn(board, opponent) < 0 && hasUnstoppableThreat(board, player)) {
                    return column;
                }
            } finally {
                board.undoMove(x, y, height);
            }
        }
        return -1;
    }

    /**
     * Returns a column that leaves the opponent without a double threat and without an immediate
     * gift, or {@code -1} if the opponent has no double threat or none can be prevented. The
     * opponent's own forking column is tried first.
     */
    public static int blockDoubleThreatColumn(Board board, int player) {
        int opponent = Board.opponent(player);
        int fork = doubleThreatColumn(board, opponent);
        if (fork < 0) {
            return -1;
        }
        if (!givesAwayWin(board, fork, player) && !stillForks(board, fork, player)) {
            return fork;
        }
        for (int column : FallbackMoves.PRIORITY) {
            if (column == fork || board.dropHeight(column) == Board.COLUMN_FULL) {
                continue;
            }
            if (!givesAwayWin(board, column, player) && !stillForks(board, column, player)) {
                return column;
            }
        }
        return -1;
    }

    // Two winning columns, or a winning cell whose blocking stone opens a second winning cell above.
    private static boolean hasUnstoppableThreat(Board board, int player) {
        int winning = 0;
        for (int column = 0; column < Board.COLUMN_COUNT; column++) {
            int height = board.dropHeight(column);
            if (height == Board.COLUMN_FULL) {
                continue;
            }
            int cell = column + height * Board.COLUMN_COUNT;
            if (!board.completesLine(cell, player)) {
                continue;
            }
            winning++;
            if (winning >= 2) {
                return true;
            }
            if (height + 1 < Board.SIZE && board.completesLine(cell + Board.COLUMN_COUNT, player)) {
                return true;
            }
        }
        return false;
    }

    private static boolean stillForks(Board board, int column, int player) {
        int height = board.dropHeight(column);
        int x = column % Board.SIZE;
        int y = column / Board.SIZE;
        board.applyMove(x, y, player);
        try {
            return doubleThreatColumn(board, Board.opponent(player)) >= 0;
        } finally {
            board.undoMove(x, y, height);
        }
    }

    private static boolean isWinningColumn(Board board, int column, int player) {
        int height = board.dropHeight(column);
        return height != Board.COLUMN_FULL && board.completesLine(column + height * Board.COLUMN_COUNT, player);
    }
}
