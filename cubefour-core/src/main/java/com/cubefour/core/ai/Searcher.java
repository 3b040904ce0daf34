package com.cubefour.core.ai;

import com.cubefour.core.Board;

/**
 * Generic interface for game tree search implementations.
 */
public interface Searcher {

    /**
     * Executes a search for the best column for {@code player} on the provided {@link Board} under
     * the supplied {@link SearchConstraints}. The board is left unchanged.
     *
     * @param board the starting position to analyse
     * @param player the player to move
     * @param constraints the limits guiding the search execution
     * @return the result of the search; {@link SearchResult#hasMove()} is {@code false} if no
     *         decision could be made in time
     */
    SearchResult search(Board board, int player, SearchConstraints constraints);
}
