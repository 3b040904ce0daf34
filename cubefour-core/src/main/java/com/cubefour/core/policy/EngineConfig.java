package com.cubefour.core.policy;

import com.cubefour.core.Board;
import com.cubefour.core.ai.NegamaxSearcher;
import com.cubefour.core.ai.TranspositionTable;
import com.cubefour.core.ai.mcts.MonteCarloSearcher;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable engine configuration.
 *
 * @param timeLimit             wall-clock budget for one decision
 * @param maxDepth              hard cap on the negamax iterative deepening depth
 * @param algorithm             search back end
 * @param transpositionCapacity number of entries after which the transposition table is cleared
 * @param openingMoveLimit      the opening book is consulted while fewer stones than this are on the board
 * @param explorationConstant   UCB1 exploration constant for MCTS
 * @param randomSeed            seed of the MCTS random source
 * @param safetyMargin          part of the budget kept back for the stages that follow the search
 */
public record EngineConfig(
        Duration timeLimit,
        int maxDepth,
        SearchAlgorithm algorithm,
        int transpositionCapacity,
        int openingMoveLimit,
        double explorationConstant,
        long randomSeed,
        Duration safetyMargin) {

    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofMillis(900);
    public static final Duration DEFAULT_SAFETY_MARGIN = Duration.ofMillis(50);
    public static final int DEFAULT_OPENING_MOVE_LIMIT = 4;
    public static final long DEFAULT_RANDOM_SEED = 20_240_404L;

    public EngineConfig {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(safetyMargin, "safetyMargin");
        if (timeLimit.isNegative() || timeLimit.isZero()) {
            throw new IllegalArgumentException("timeLimit must be positive");
        }
        if (maxDepth < 1 || maxDepth > Board.CELL_COUNT) {
            throw new IllegalArgumentException("maxDepth must be between 1 and " + Board.CELL_COUNT);
        }
        if (transpositionCapacity < 1) {
            throw new IllegalArgumentException("transpositionCapacity must be at least 1");
        }
        if (openingMoveLimit < 0) {
            throw new IllegalArgumentException("openingMoveLimit must not be negative");
        }
        if (!(explorationConstant >= 0.0) || Double.isInfinite(explorationConstant)) {
            throw new IllegalArgumentException("explorationConstant must be a non-negative number");
        }
        if (safetyMargin.isNegative() || safetyMargin.compareTo(timeLimit) >= 0) {
            throw new IllegalArgumentException("safetyMargin must be non-negative and shorter than timeLimit");
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_TIME_LIMIT, NegamaxSearcher.DEFAULT_MAX_DEPTH, SearchAlgorithm.NEGAMAX,
                TranspositionTable.DEFAULT_CAPACITY, DEFAULT_OPENING_MOVE_LIMIT,
                MonteCarloSearcher.DEFAULT_EXPLORATION, DEFAULT_RANDOM_SEED, DEFAULT_SAFETY_MARGIN);
    }

    public EngineConfig withTimeLimit(Duration limit) {
        Duration margin = safetyMargin.compareTo(limit) < 0 ? safetyMargin : Duration.ZERO;
        return new EngineConfig(limit, maxDepth, algorithm, transpositionCapacity, openingMoveLimit,
                explorationConstant, randomSeed, margin);
    }

    public EngineConfig withMaxDepth(int depth) {
        return new EngineConfig(timeLimit, depth, algorithm, transpositionCapacity, openingMoveLimit,
                explorationConstant, randomSeed, safetyMargin);
    }

    public EngineConfig withAlgorithm(SearchAlgorithm searchAlgorithm) {
        return new EngineConfig(timeLimit, maxDepth, searchAlgorithm, transpositionCapacity, openingMoveLimit,
                explorationConstant, randomSeed, safetyMargin);
    }

    public EngineConfig withExplorationConstant(double constant) {
        return new EngineConfig(timeLimit, maxDepth, algorithm, transpositionCapacity, openingMoveLimit, constant,
                randomSeed, safetyMargin);
    }

    public EngineConfig withTranspositionCapacity(int capacity) {
        return new EngineConfig(timeLimit, maxDepth, algorithm, capacity, openingMoveLimit,
                explorationConstant, randomSeed, safetyMargin);
    }

    public EngineConfig withOpeningMoveLimit(int limit) {
        return new EngineConfig(timeLimit, maxDepth, algorithm, transpositionCapacity, limit,
                explorationConstant, randomSeed, safetyMargin);
    }

    public EngineConfig withRandomSeed(long seed) {
        return new EngineConfig(timeLimit, maxDepth, algorithm, transpositionCapacity, openingMoveLimit,
                explorationConstant, seed, safetyMargin);
    }

    public EngineConfig withSafetyMargin(Duration margin) {
        return new EngineConfig(timeLimit, maxDepth, algorithm, transpositionCapacity, openingMoveLimit,
                explorationConstant, randomSeed, margin);
    }
}
