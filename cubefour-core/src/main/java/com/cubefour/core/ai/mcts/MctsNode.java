package com.cubefour.core.ai.mcts;

import com.cubefour.core.Board;
import com.cubefour.core.Move;
import com.cubefour.core.Outcome;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the Monte Carlo search tree. A node owns its board snapshot and its children; the parent
 * reference is only followed during backpropagation.
 */
final class MctsNode {

    private final MctsNode parent;
    private final Board board;
    private final Move move;
    private final int playerJustMoved;
    private final Outcome outcome;
    private final List<MctsNode> children = new ArrayList<>();
    private final List<Move> untriedMoves;

    private int visits;
    private double wins;

    MctsNode(MctsNode parent, Board board, Move move, int playerJustMoved) {
        this.parent = parent;
        this.board = board;
        this.move = move;
        this.playerJustMoved = playerJustMoved;
        this.outcome = board.winner();
        this.untriedMoves = outcome.isTerminal() ? new ArrayList<>() : board.legalMoves();
    }

    static MctsNode root(Board board, int playerToMove) {
        return new MctsNode(null, board.copy(), null, Board.opponent(playerToMove));
    }

    MctsNode parent() {
        return parent;
    }

    Board board() {
        return board;
    }

    Move move() {
        return move;
    }

    int playerJustMoved() {
        return playerJustMoved;
    }

    int playerToMove() {
        return Board.opponent(playerJustMoved);
    }

    Outcome outcome() {
        return outcome;
    }

    boolean isTerminal() {
        return outcome.isTerminal();
    }

    boolean isFullyExpanded() {
        return untriedMoves.isEmpty();
    }

    List<MctsNode> children() {
        return Collections.unmodifiableList(children);
    }

    int visits() {
        return visits;
    }

    double wins() {
        return wins;
    }

    double winRate() {
        return visits == 0 ? 0.0 : wins / visits;
    }

    /**
     * Removes the untried move at {@code index} and materialises the corresponding child.
     */
    MctsNode expand(int index) {
        Move next = untriedMoves.remove(index);
        Board childBoard = board.copy();
        int mover = playerToMove();
        childBoard.applyMove(next, mover);
        MctsNode child = new MctsNode(this, childBoard, next, mover);
        children.add(child);
        return child;
    }

    int untriedCount() {
        return untriedMoves.size();
    }

    void record(double reward) {
        visits++;
        wins += reward;
    }

    int depth() {
        int maxChildDepth = 0;
        for (MctsNode child : children) {
            maxChildDepth = Math.max(maxChildDepth, child.depth() + 1);
        }
        return maxChildDepth;
    }
}
