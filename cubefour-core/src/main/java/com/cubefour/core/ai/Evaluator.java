package com.cubefour.core.ai;

import com.cubefour.core.Board;
import com.cubefour.core.LineCatalog;

/**
 * Static evaluation of a position from one player's point of view, summed over all winning lines
 * plus center and height control terms.
 */
public final class Evaluator {

    /**
     * Magnitude reported for a completed line.
     */
    public static final int WIN_WEIGHT = 100_000;

    /**
     * Weight of a three-stone line whose empty cell cannot be played on the next move.
     */
    public static final int UNREACHABLE_THREAT_WEIGHT = 100;

    public static final int HEIGHT_CONTROL_WEIGHT = 2;

    private static final int[] LINE_WEIGHTS = {0, 5, 50, 500};
    private static final int[] CENTER_HEIGHT_WEIGHTS = {2, 4, 4, 2};
    private static final long[] LINE_MASKS = LineCatalog.lineMasks();
    private static final long[] CENTER_LAYER_MASKS = new long[Board.SIZE];

    static {
        for (int z = 0; z < Board.SIZE; z++) {
            long mask = 0L;
            for (int y = 1; y <= 2; y++) {
                for (int x = 1; x <= 2; x++) {
                    mask |= 1L << Board.cellIndex(x, y, z);
                }
            }
            CENTER_LAYER_MASKS[z] = mask;
        }
    }

    private Evaluator() {
    }

    /**
     * Returns the weight of a line holding {@code stones} stones of a single player.
     */
    public static int lineWeight(int stones) {
        if (stones < 0 || stones > Board.SIZE) {
            throw new IllegalArgumentException("Stone count out of range: " + stones);
        }
        return stones == Board.SIZE ? WIN_WEIGHT : LINE_WEIGHTS[stones];
    }

    /**
     * Scores the board for {@code perspective}. Positive values favour that player.
     */
    public static int score(Board board, int perspective) {
        int opponent = Board.opponent(perspective);
        long own = board.stones(perspective);
        long theirs = board.stones(opponent);

        int score = 0;
        for (long mask : LINE_MASKS) {
            int ownCount = Long.bitCount(own & mask);
            int theirCount = Long.bitCount(theirs & mask);
            if (ownCount > 0 && theirCount > 0) {
                continue;
            }
            if (ownCount > 0) {
                score += lineValue(board, ownCount, mask & ~own);
            } else if (theirCount > 0) {
                score -= lineValue(board, theirCount, mask & ~theirs);
            }
        }
        score += centerControl(own) - centerControl(theirs);
        score += heightControl(board, perspective);
        return score;
    }

    private static int lineValue(Board board, int count, long emptyCells) {
        if (count == Board.SIZE - 1) {
            int cell = Long.numberOfTrailingZeros(emptyCells);
            return isPlayableNext(board, cell) ? LINE_WEIGHTS[count] : UNREACHABLE_THREAT_WEIGHT;
        }
        return lineWeight(count);
    }

    /**
     * Returns {@code true} if the cell is the current drop position of its column.
     */
    static boolean isPlayableNext(Board board, int cell) {
        int column = cell % Board.COLUMN_COUNT;
        return board.dropHeight(column) == cell / Board.COLUMN_COUNT;
    }

    private static int centerControl(long stones) {
        int score = 0;
        for (int z = 0; z < Board.SIZE; z++) {
            score += Long.bitCount(stones & CENTER_LAYER_MASKS[z]) * CENTER_HEIGHT_WEIGHTS[z];
        }
        return score;
    }

    // The owner of the top stone decides what lands next to it.
    private static int heightControl(Board board, int perspective) {
        int score = 0;
        for (int column = 0; column < Board.COLUMN_COUNT; column++) {
            int height = board.columnHeight(column);
            if (height == 0) {
                continue;
            }
            int owner = board.cell(column + (height - 1) * Board.COLUMN_COUNT);
            score += owner == perspective ? HEIGHT_CONTROL_WEIGHT : -HEIGHT_CONTROL_WEIGHT;
        }
        return score;
    }
}
