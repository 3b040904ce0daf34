package com.cubefour.core.policy;

import com.cubefour.core.Board;
import com.cubefour.core.Coordinate;
import com.cubefour.core.Move;

/**
 * Small opening book for the first few stones: take the central columns, answering a central
 * stone from the diagonally opposite central column, then the corners.
 */
public final class OpeningBook {

    private static final Move[] CENTRAL = {new Move(1, 1), new Move(2, 2), new Move(1, 2), new Move(2, 1)};
    private static final Move[] CORNERS = {new Move(0, 0), new Move(3, 3), new Move(0, 3), new Move(3, 0)};

    private OpeningBook() {
    }

    /**
     * Returns a book move, or {@code null} once {@code moveLimit} stones are on the board or no
     * book column is available.
     */
    public static Move pick(Board board, int player, Coordinate lastMove, int moveLimit) {
        if (board.moveCount() >= moveLimit) {
            return null;
        }
        if (lastMove != null && isCentral(lastMove.x(), lastMove.y())) {
            Move reply = new Move(Board.SIZE - 1 - lastMove.x(), Board.SIZE - 1 - lastMove.y());
            if (isPlayable(board, reply, player)) {
                return reply;
            }
        }
        for (Move move : CENTRAL) {
            if (isPlayable(board, move, player)) {
                return move;
            }
        }
        for (Move move : CORNERS) {
            if (isPlayable(board, move, player)) {
                return move;
            }
        }
        return null;
    }

    static boolean isCentral(int x, int y) {
        return (x == 1 || x == 2) && (y == 1 || y == 2);
    }

    private static boolean isPlayable(Board board, Move move, int player) {
        return board.isLegal(move) && !ThreatDetector.givesAwayWin(board, move.column(), player);
    }
}
