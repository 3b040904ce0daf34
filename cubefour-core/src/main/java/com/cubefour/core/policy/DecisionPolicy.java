package com.cubefour.core.policy;

import com.cubefour.core.Board;
import com.cubefour.core.Coordinate;
import com.cubefour.core.Move;
import com.cubefour.core.ai.NegamaxSearcher;
import com.cubefour.core.ai.SearchConstraints;
import com.cubefour.core.ai.SearchResult;
import com.cubefour.core.ai.Searcher;
import com.cubefour.core.ai.TranspositionTable;
import com.cubefour.core.ai.mcts.MonteCarloSearcher;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turn-level orchestrator. Tactical stages are tried in order and the first one that yields a
 * column wins; otherwise the configured {@link Searcher} runs on the remaining budget, and a fixed
 * priority list guarantees a legal answer whenever one exists.
 */
public final class DecisionPolicy implements MoveDecider {

    private static final Logger LOGGER = Logger.getLogger(DecisionPolicy.class.getName());

    private final EngineConfig config;
    private final Searcher searcher;

    public DecisionPolicy() {
        this(EngineConfig.defaults());
    }

    public DecisionPolicy(EngineConfig config) {
        this(config, createSearcher(config));
    }

    public DecisionPolicy(EngineConfig config, Searcher searcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.searcher = Objects.requireNonNull(searcher, "searcher");
    }

    /**
     * Builds the search back end described by the configuration.
     */
    public static Searcher createSearcher(EngineConfig config) {
        Objects.requireNonNull(config, "config");
        switch (config.algorithm()) {
            case MCTS:
                return new MonteCarloSearcher(config.explorationConstant(), config.randomSeed());
            case NEGAMAX:
            default:
                return new NegamaxSearcher(config.maxDepth(), new TranspositionTable(config.transpositionCapacity()));
        }
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Malformed grids are answered from the raw grid. Any failure inside the decision stages is
     * logged and replaced by the fallback move.
     *
     * @throws IllegalStateException if no column has room
     */
    @Override
    public Move decide(int[][][] grid, int player, Coordinate lastMove) {
        long start = System.nanoTime();
        Board board;
        try {
            Board.checkPlayer(player);
            board = Board.fromGrid(grid);
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Rejected malformed input, answering from the raw grid", ex);
            Move move = FallbackMoves.chooseFromGrid(grid);
            if (move == null) {
                throw new IllegalStateException("No column has room", ex);
            }
            return move;
        }
        return decide(board, player, lastMove, start).move();
    }

    /**
     * Decides on a copy of {@code board}; the board itself is not modified.
     *
     * @throws IllegalStateException if the board is full
     */
    public Decision decide(Board board, int player, Coordinate lastMove) {
        return decide(board, player, lastMove, System.nanoTime());
    }

    private Decision decide(Board board, int player, Coordinate lastMove, long start) {
        Objects.requireNonNull(board, "board");
        Board.checkPlayer(player);
        if (board.isFull()) {
            throw new IllegalStateException("Board is full, no move exists");
        }

        Board working = board.copy();
        Decision decision;
        try {
            decision = runStages(working, player, lastMove, start);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Decision stages failed, using fallback move", ex);
            decision = fallback(board, player);
        }

        if (!board.isLegal(decision.move())) {
            final Decision rejected = decision;
            LOGGER.warning(() -> "Stage " + rejected.stage() + " proposed a full column " + rejected.move());
            decision = fallback(board, player);
        }

        final Decision chosen = decision;
        final long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();
        LOGGER.fine(() -> String.format("Player %d plays %s via %s after %d ms", player, chosen.move(),
                chosen.stage(), elapsedMillis));
        return decision;
    }

    private Decision runStages(Board board, int player, Coordinate lastMove, long start) {
        int opponent = Board.opponent(player);

        int column = ThreatDetector.winningColumn(board, player);
        if (column >= 0) {
            return new Decision(Move.ofColumn(column), Decision.Stage.IMMEDIATE_WIN);
        }

        column = ThreatDetector.winningColumn(board, opponent);
        if (column >= 0) {
            return new Decision(Move.ofColumn(column), Decision.Stage.BLOCK_WIN);
        }

        Move book = OpeningBook.pick(board, player, lastMove, config.openingMoveLimit());
        if (book != null) {
            return new Decision(book, Decision.Stage.OPENING_BOOK);
        }

        column = ThreatDetector.doubleThreatColumn(board, player);
        if (column >= 0) {
            return new Decision(Move.ofColumn(column), Decision.Stage.DOUBLE_THREAT);
        }

        column = ThreatDetector.blockDoubleThreatColumn(board, player);
        if (column >= 0) {
            return new Decision(Move.ofColumn(column), Decision.Stage.BLOCK_DOUBLE_THREAT);
        }

        Duration remaining = remainingBudget(start);
        if (!remaining.isZero()) {
            SearchConstraints constraints = new SearchConstraints(config.maxDepth(), remaining, 0L);
            SearchResult result = searcher.search(board, player, constraints);
            if (result.hasMove() && board.isLegal(result.move())) {
                return new Decision(result.move(), Decision.Stage.SEARCH);
            }
            LOGGER.fine(() -> "Search returned no usable move, falling back");
        } else {
            LOGGER.fine(() -> "No budget left for search, falling back");
        }
        return fallback(board, player);
    }

    private Duration remainingBudget(long start) {
        long elapsed = System.nanoTime() - start;
        long budget = config.timeLimit().minus(config.safetyMargin()).toNanos() - elapsed;
        return budget <= 0L ? Duration.ZERO : Duration.ofNanos(budget);
    }

    private static Decision fallback(Board board, int player) {
        Move move = FallbackMoves.choose(board, player);
        if (move == null) {
            throw new IllegalStateException("Board is full, no move exists");
        }
        return new Decision(move, Decision.Stage.FALLBACK);
    }
}
