package com.cubefour.core.ai.mcts;

import com.cubefour.core.Board;
import com.cubefour.core.Outcome;
import java.util.Objects;
import java.util.Random;

/**
 * Light-weight rollout policy: win if possible, otherwise block, otherwise prefer a random central
 * column, otherwise a uniformly random legal column.
 */
final class PlayoutPolicy {

    private static final int[] CENTRAL_COLUMNS = {5, 6, 9, 10};

    private final Random random;
    private final int[] candidates = new int[Board.COLUMN_COUNT];
    private final int[] centralCandidates = new int[CENTRAL_COLUMNS.length];

    PlayoutPolicy(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Plays the board out to the end, mutating it, and returns the outcome. The playout length is
     * capped at the number of cells.
     */
    Outcome playOut(Board board, int playerToMove) {
        Outcome initial = board.winner();
        if (initial.isTerminal()) {
            return initial;
        }
        int player = playerToMove;
        for (int ply = 0; ply < Board.CELL_COUNT; ply++) {
            int column = chooseColumn(board, player);
            if (column < 0) {
                return Outcome.DRAW;
            }
            int x = column % Board.SIZE;
            int y = column / Board.SIZE;
            int height = board.applyMove(x, y, player);
            if (board.completesLine(Board.cellIndex(x, y, height), player)) {
                return Outcome.wonBy(player);
            }
            if (board.isFull()) {
                return Outcome.DRAW;
            }
            player = Board.opponent(player);
        }
        return Outcome.DRAW;
    }

    int chooseColumn(Board board, int player) {
        int opponent = Board.opponent(player);
        int blocking = -1;
        int legal = 0;
        for (int column = 0; column < Board.COLUMN_COUNT; column++) {
            int height = board.dropHeight(column);
            if (height == Board.COLUMN_FULL) {
                continue;
            }
            int cell = column + height * Board.COLUMN_COUNT;
            if (board.completesLine(cell, player)) {
                return column;
            }
            if (blocking < 0 && board.completesLine(cell, opponent)) {
                blocking = column;
            }
            candidates[legal++] = column;
        }
        if (blocking >= 0) {
            return blocking;
        }
        if (legal == 0) {
            return -1;
        }

        int central = 0;
        for (int column : CENTRAL_COLUMNS) {
            if (board.dropHeight(column) != Board.COLUMN_FULL) {
                centralCandidates[central++] = column;
            }
        }
        if (central > 0) {
            return centralCandidates[random.nextInt(central)];
        }
        return candidates[random.nextInt(legal)];
    }
}
