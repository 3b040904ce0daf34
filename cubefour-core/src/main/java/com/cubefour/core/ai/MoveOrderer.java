package com.cubefour.core.ai;

import com.cubefour.core.Board;
import com.cubefour.core.Move;
import java.util.ArrayList;
import java.util.List;

/**
 * Ranks the legal columns of a position so that alpha-beta sees the strongest candidates first.
 * Ordering never removes a legal column.
 */
public final class MoveOrderer {

    /**
     * Static column preference: the four central columns, then the corners, then the edges.
     */
    static final int[] COLUMN_PRIORITY = {5, 6, 9, 10, 0, 3, 12, 15, 1, 2, 4, 7, 8, 11, 13, 14};

    private static final int WIN_PRIORITY = 2_000_000;
    private static final int BLOCK_PRIORITY = 1_000_000;

    /** Lifts quiet central columns above every quiet outer column. Evaluator scores stay far below it. */
    private static final int CENTRAL_GROUP_BONUS = 500_000;

    private MoveOrderer() {
    }

    /**
     * Returns every legal column: immediate wins, then immediate blocks, then the central columns
     * before the outer ones, each group ranked by a one-ply score for {@code player}.
     */
    public static List<Move> orderedMoves(Board board, int player) {
        int[] columns = new int[Board.COLUMN_COUNT];
        int[] scores = new int[Board.COLUMN_COUNT];
        int count = order(board, player, -1, true, columns, scores, 0);
        List<Move> moves = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            moves.add(Move.ofColumn(columns[i]));
        }
        return moves;
    }

    /**
     * Writes the ordered legal columns into {@code columns[offset..]} and returns how many were
     * written. When {@code scoreMoves} is set each column is tried for one ply and ranked by
     * immediate win, immediate block, central group, then {@link Evaluator#score} within a group.
     * A legal {@code hintColumn} is always placed first.
     */
    public static int order(Board board, int player, int hintColumn, boolean scoreMoves, int[] columns,
            int[] scores, int offset) {
        int opponent = Board.opponent(player);
        int count = 0;
        for (int column : COLUMN_PRIORITY) {
            int height = board.dropHeight(column);
            if (height == Board.COLUMN_FULL) {
                continue;
            }
            int score = 0;
            if (scoreMoves) {
                int cell = column + height * Board.COLUMN_COUNT;
                if (board.completesLine(cell, player)) {
                    score = WIN_PRIORITY;
                } else if (board.completesLine(cell, opponent)) {
                    score = BLOCK_PRIORITY;
                } else {
                    int x = column % Board.SIZE;
                    int y = column / Board.SIZE;
                    board.applyMove(x, y, player);
                    score = Evaluator.score(board, player);
                    board.undoMove(x, y, height);
                    if (isCentral(column)) {
                        score += CENTRAL_GROUP_BONUS;
                    }
                }
            }
            // Stable insertion keeps the static priority among equal scores.
            int position = offset + count;
            while (position > offset && scores[position - 1] < score) {
                columns[position] = columns[position - 1];
                scores[position] = scores[position - 1];
                position--;
            }
            columns[position] = column;
            scores[position] = score;
            count++;
        }

        if (hintColumn >= 0) {
            promote(columns, scores, offset, count, hintColumn);
        }
        return count;
    }

    static boolean isCentral(int column) {
        int x = column % Board.SIZE;
        int y = column / Board.SIZE;
        return x >= 1 && x <= 2 && y >= 1 && y <= 2;
    }

    private static void promote(int[] columns, int[] scores, int offset, int count, int column) {
        for (int i = offset; i < offset + count; i++) {
            if (columns[i] != column) {
                continue;
            }
            int score = scores[i];
            for (int j = i; j > offset; j--) {
                columns[j] = columns[j - 1];
                scores[j] = scores[j - 1];
            }
            columns[offset] = column;
            scores[offset] = score;
            return;
        }
    }
}
