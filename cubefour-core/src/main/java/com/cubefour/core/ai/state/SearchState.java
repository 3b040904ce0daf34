package com.cubefour.core.ai.state;

import com.cubefour.core.Board;
import com.cubefour.core.ai.Evaluator;
import com.cubefour.core.ai.MoveOrderer;
import java.util.Objects;

/**
 * Mutable search buffers that allow tree explorations without per-node allocations. Moves are
 * applied to a private copy of the root board and undone on {@link #pop()}.
 */
public final class SearchState {

    private static final int SLICE_LENGTH = Board.COLUMN_COUNT;
    private static final int MAX_PLY = Board.CELL_COUNT;

    private final int[] sideToMove = new int[MAX_PLY + 1];
    private final int[] playedColumns = new int[MAX_PLY + 1];
    private final int[] playedHeights = new int[MAX_PLY + 1];

    private final int[] moveCounts = new int[MAX_PLY + 1];
    private final int[] moves = new int[(MAX_PLY + 1) * SLICE_LENGTH];
    private final int[] moveScores = new int[(MAX_PLY + 1) * SLICE_LENGTH];

    private Board board = new Board();
    private int ply;

    /**
     * Resets this state to a copy of {@code root} with {@code player} to move.
     */
    public void reset(Board root, int player) {
        Objects.requireNonNull(root, "root");
        Board.checkPlayer(player);
        board = root.copy();
        ply = 0;
        sideToMove[0] = player;
        moveCounts[0] = 0;
    }

    public int ply() {
        return ply;
    }

    /**
     * Returns the working board. Callers must leave it as they found it.
     */
    public Board board() {
        return board;
    }

    public int sideToMove() {
        return sideToMove[ply];
    }

    /**
     * Returns {@code true} if the move that led to the current ply completed a line.
     */
    public boolean lastMoveWon() {
        if (ply == 0) {
            return false;
        }
        int mover = sideToMove[ply - 1];
        int cell = playedColumns[ply - 1] + playedHeights[ply - 1] * Board.COLUMN_COUNT;
        return board.completesLine(cell, mover);
    }

    public boolean isBoardFull() {
        return board.isFull();
    }

    /**
     * Orders the legal columns of the current ply into this ply's slice and returns their count.
     */
    public int generateMoves(int hintColumn, boolean scoreMoves) {
        int count = MoveOrderer.order(board, sideToMove[ply], hintColumn, scoreMoves, moves, moveScores,
                ply * SLICE_LENGTH);
        moveCounts[ply] = count;
        return count;
    }

    public int moveAt(int depth, int index) {
        return moves[depth * SLICE_LENGTH + index];
    }

    public int moveCount(int depth) {
        return moveCounts[depth];
    }

    public void pushGenerated(int depth, int index) {
        push(moves[depth * SLICE_LENGTH + index]);
    }

    public void push(int column) {
        int player = sideToMove[ply];
        int height = board.applyMove(column % Board.SIZE, column / Board.SIZE, player);
        playedColumns[ply] = column;
        playedHeights[ply] = height;
        ply++;
        sideToMove[ply] = Board.opponent(player);
        moveCounts[ply] = 0;
    }

    public void pop() {
        if (ply == 0) {
            throw new IllegalStateException("Cannot pop root state");
        }
        ply--;
        int column = playedColumns[ply];
        board.undoMove(column % Board.SIZE, column / Board.SIZE, playedHeights[ply]);
    }

    /**
     * Scores the current position for the side to move.
     */
    public int evaluateCurrent() {
        return Evaluator.score(board, sideToMove[ply]);
    }
}
