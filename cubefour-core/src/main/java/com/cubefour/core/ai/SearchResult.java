package com.cubefour.core.ai;

import com.cubefour.core.Move;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param move           the chosen column, or {@code null} if no decision was reached
 * @param score          the value of {@link #move()} for the searching player, searcher specific
 * @param depthEvaluated the deepest completed iteration (negamax) or tree depth (MCTS)
 * @param visitedNodes   nodes (negamax) or playouts (MCTS) performed
 * @param timedOut       whether the budget ran out before the search finished on its own
 * @param telemetry      per-iteration instrumentation
 */
public record SearchResult(Move move, int score, int depthEvaluated, long visitedNodes, boolean timedOut,
        SearchTelemetry telemetry) {

    public SearchResult {
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }

    public static SearchResult noDecision(long visitedNodes, boolean timedOut) {
        return new SearchResult(null, 0, 0, visitedNodes, timedOut, SearchTelemetry.empty());
    }

    public boolean hasMove() {
        return move != null;
    }
}
