package com.cubefour.core.policy;

import com.cubefour.core.Coordinate;
import com.cubefour.core.Move;

/**
 * Contract offered to the game host: pick the column to play for one turn.
 */
@FunctionalInterface
public interface MoveDecider {

    /**
     * Chooses the next column. Implementations must not modify {@code grid}.
     *
     * @param grid the board indexed {@code [z][y][x]}, cells {@code 0} (empty), {@code 1} or {@code 2}
     * @param player the player to move, {@code 1} or {@code 2}
     * @param lastMove the most recently played cell, or {@code null} on the first move of the game
     * @return a column with room for a stone
     */
    Move decide(int[][][] grid, int player, Coordinate lastMove);
}
