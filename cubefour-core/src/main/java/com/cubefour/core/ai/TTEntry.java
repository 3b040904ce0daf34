package com.cubefour.core.ai;

/**
 * Entry stored inside the transposition table.
 *
 * @param value        the evaluated value from the perspective of the side to move
 * @param depth        the remaining depth for which the value is valid
 * @param flag         the alpha-beta bound classification for the stored value
 * @param bestMove     the column that produced {@link #value()} in canonical orientation, or {@code -1}
 * @param firstStones  canonical stone mask of the first player, used to verify the key
 * @param secondStones canonical stone mask of the second player, used to verify the key
 * @param sideToMove   the player to move in the stored position
 */
public record TTEntry(int value, int depth, TTFlag flag, int bestMove, long firstStones, long secondStones,
        int sideToMove) {

    public boolean matches(long first, long second, int side) {
        return firstStones == first && secondStones == second && sideToMove == side;
    }
}
