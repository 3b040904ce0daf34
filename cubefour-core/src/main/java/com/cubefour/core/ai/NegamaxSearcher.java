package com.cubefour.core.ai;

import com.cubefour.core.Board;
import com.cubefour.core.Move;
import com.cubefour.core.ai.state.SearchState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Negamax searcher with alpha-beta pruning, iterative deepening, a transposition table and
 * depth and time controls.
 */
public final class NegamaxSearcher implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(NegamaxSearcher.class.getName());

    /**
     * Base value of a decided game. Wins score {@code WIN_SCORE + remainingDepth} so that faster
     * wins and slower losses are preferred.
     */
    public static final int WIN_SCORE = 1_000_000;

    public static final int DEFAULT_MAX_DEPTH = 20;

    private static final int INFINITY = Integer.MAX_VALUE / 2;
    private static final int HEURISTIC_ORDERING_MIN_DEPTH = 2;

    private final int maxDepth;
    private final SearchState searchState;
    private final TranspositionTable transpositionTable;

    private long lastVisitedNodes;
    private boolean lastTimedOut;
    private long visitedNodes;
    private long cutoffs;
    private long transpositionHits;
    private long transpositionStores;
    private boolean timedOut;
    private long deadline;
    private long nodeBudget;

    public NegamaxSearcher() {
        this(DEFAULT_MAX_DEPTH, new TranspositionTable());
    }

    public NegamaxSearcher(int maxDepth) {
        this(maxDepth, new TranspositionTable());
    }

    public NegamaxSearcher(int maxDepth, TranspositionTable table) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Depth must be at least 1");
        }
        this.maxDepth = maxDepth;
        this.searchState = new SearchState();
        this.transpositionTable = Objects.requireNonNull(table, "table");
    }

    /**
     * Returns {@code true} if the score proves a win for the searching side.
     */
    public static boolean isWinScore(int score) {
        return score >= WIN_SCORE;
    }

    public static boolean isLossScore(int score) {
        return score <= -WIN_SCORE;
    }

    public Move findBestMove(Board board, int player, Duration timeLimit) {
        return search(board, player, SearchConstraints.ofTime(timeLimit).withDepthLimit(maxDepth)).move();
    }

    public long getLastVisitedNodeCount() {
        return lastVisitedNodes;
    }

    public boolean wasLastSearchTimedOut() {
        return lastTimedOut;
    }

    public TranspositionTable getTranspositionTable() {
        return transpositionTable;
    }

    @Override
    public SearchResult search(Board board, int player, SearchConstraints constraints) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(constraints, "constraints");
        Board.checkPlayer(player);

        if (board.winner().isTerminal()) {
            throw new IllegalStateException("Cannot search moves in a terminal position");
        }

        int remainingMoves = Board.CELL_COUNT - board.moveCount();
        int boundedDepth = Math.min(maxDepth, constraints.depthLimit());
        boundedDepth = Math.max(1, Math.min(boundedDepth, remainingMoves));

        long searchStart = System.nanoTime();
        long deadlineNanos = constraints.deadlineFrom(searchStart);

        SearchResult result = iterativeDeepening(board, player, boundedDepth, deadlineNanos,
                constraints.iterationLimit());

        lastVisitedNodes = result.visitedNodes();
        lastTimedOut = result.timedOut();
        return result;
    }

    /**
     * Runs a single full-width pass to {@code depth} without deadline or node budget and returns
     * the root score.
     */
    int scoreAtDepth(Board board, int player, int depth) {
        return runIteration(board, player, depth, Long.MAX_VALUE, Long.MAX_VALUE, -1).score;
    }

    /**
     * Returns {@code true} if a root move fully searched in a pass cut short by the deadline should
     * replace the best move of the last completed pass.
     */
    static boolean replacesPreviousBest(int previousBest, int previousBestScore, boolean previousBestCompleted,
            int candidate, int candidateScore) {
        return previousBestCompleted && candidate != previousBest && candidateScore > previousBestScore;
    }

    private SearchResult iterativeDeepening(Board board, int player, int boundedDepthLimit, long deadlineNanos,
            long nodeLimit) {
        long totalVisited = 0L;
        IterationResult best = null;
        boolean timedOutSearch = false;
        List<SearchTelemetry.Iteration> iterations = new ArrayList<>();

        for (int depth = 1; depth <= boundedDepthLimit; depth++) {
            long iterationStart = System.nanoTime();
            int previousBest = best != null ? best.move : -1;
            long remainingNodes = nodeLimit == 0L ? Long.MAX_VALUE : Math.max(0L, nodeLimit - totalVisited);
            IterationResult iteration = runIteration(board, player, depth, deadlineNanos, remainingNodes,
                    previousBest);
            totalVisited += iteration.visitedNodes;

            List<Move> principalVariation = iteration.timedOut ? List.of() : principalVariation(board, player, depth);
            iterations.add(new SearchTelemetry.Iteration(depth, iteration.visitedNodes, cutoffs, transpositionHits,
                    transpositionStores, System.nanoTime() - iterationStart, iteration.score, !iteration.timedOut,
                    principalVariation));

            if (iteration.timedOut) {
                timedOutSearch = true;
                if (best == null) {
                    best = new IterationResult(iteration.move, iteration.score, depth - 1, iteration.visitedNodes,
                            true, false);
                } else if (iteration.improvesOnPrevious) {
                    best = new IterationResult(iteration.move, iteration.score, best.depth, iteration.visitedNodes,
                            true, true);
                }
                break;
            }

            best = iteration;
            final int completedDepth = depth;
            final IterationResult completed = iteration;
            LOGGER.fine(() -> String.format("Depth %d complete: best=%s score=%d nodes=%d", completedDepth,
                    Move.ofColumn(completed.move), completed.score, completed.visitedNodes));

            if (isWinScore(iteration.score) || isLossScore(iteration.score)) {
                break;
            }
            boolean outOfTime = deadlineNanos != Long.MAX_VALUE && System.nanoTime() >= deadlineNanos;
            boolean outOfNodes = nodeLimit != 0L && totalVisited >= nodeLimit;
            if ((outOfTime || outOfNodes) && depth < boundedDepthLimit) {
                timedOutSearch = true;
                break;
            }
        }

        if (best == null || best.move < 0) {
            throw new IllegalStateException("Search did not evaluate any moves");
        }

        final IterationResult finalResult = best;
        final long visited = totalVisited;
        final boolean timed = timedOutSearch;
        final SearchTelemetry telemetry = new SearchTelemetry(iterations);
        LOGGER.info(() -> String.format(
                "Negamax explored %d nodes (depth=%d, move=%s, score=%d, timedOut=%b, cutoffs=%d, ttHits=%d, "
                        + "ttStores=%d)",
                visited, finalResult.depth, Move.ofColumn(finalResult.move), finalResult.score, timed,
                telemetry.totalCutoffs(), telemetry.totalTranspositionHits(), telemetry.totalTranspositionStores()));

        return new SearchResult(Move.ofColumn(finalResult.move), finalResult.score, finalResult.depth, totalVisited,
                timedOutSearch, telemetry);
    }

    private IterationResult runIteration(Board board, int player, int depthLimit, long deadlineNanos,
            long nodeAllowance, int previousBest) {
        searchState.reset(board, player);
        visitedNodes = 0L;
        cutoffs = 0L;
        transpositionHits = 0L;
        transpositionStores = 0L;
        timedOut = false;
        deadline = deadlineNanos;
        nodeBudget = nodeAllowance;

        Board root = searchState.board();
        int hint = previousBest >= 0 ? previousBest
                : TranspositionTable.bestColumnFor(transpositionTable.probe(root, player), root);

        int bestMove = -1;
        int bestScore = -INFINITY;
        int alpha = -INFINITY;
        int beta = INFINITY;
        int previousBestScore = -INFINITY;
        boolean previousBestCompleted = false;

        int rootDepth = searchState.ply();
        int moveCount = searchState.generateMoves(hint, true);

        for (int i = 0; i < moveCount; i++) {
            if (isDeadlineExceeded()) {
                timedOut = true;
                break;
            }

            int move = searchState.moveAt(rootDepth, i);
            searchState.pushGenerated(rootDepth, i);
            int score = -negamax(depthLimit - 1, -beta, -alpha);
            searchState.pop();

            // A subtree cut short by the deadline is not trusted.
            if (timedOut) {
                break;
            }

            if (move == previousBest) {
                previousBestScore = score;
                previousBestCompleted = true;
            }
            if (score > bestScore) {
                bestScore = score;
                bestMove = move;
            }
            if (score > alpha) {
                alpha = score;
            }
        }

        if (bestMove < 0) {
            if (moveCount == 0) {
                throw new IllegalStateException("No legal moves available");
            }
            bestMove = searchState.moveAt(rootDepth, 0);
            bestScore = searchState.evaluateCurrent();
        }

        if (!timedOut) {
            transpositionTable.store(root, player, bestScore, depthLimit, TTFlag.EXACT, bestMove);
            transpositionStores++;
        }

        boolean improves = timedOut
                && replacesPreviousBest(previousBest, previousBestScore, previousBestCompleted, bestMove, bestScore);
        return new IterationResult(bestMove, bestScore, depthLimit, visitedNodes, timedOut, improves);
    }

    private int negamax(int depth, int alpha, int beta) {
        if (isDeadlineExceeded()) {
            timedOut = true;
            return searchState.evaluateCurrent();
        }

        visitedNodes++;

        Board board = searchState.board();
        int side = searchState.sideToMove();
        int originalAlpha = alpha;
        TTEntry cached = transpositionTable.probe(board, side);
        int ttBestMove = TranspositionTable.bestColumnFor(cached, board);
        if (cached != null && cached.depth() >= depth) {
            transpositionHits++;
            switch (cached.flag()) {
                case EXACT:
                    return cached.value();
                case LOWER_BOUND:
                    alpha = Math.max(alpha, cached.value());
                    break;
                case UPPER_BOUND:
                    beta = Math.min(beta, cached.value());
                    break;
                default:
                    break;
            }
            if (alpha >= beta) {
                return cached.value();
            }
        }

        if (searchState.lastMoveWon()) {
            return -(WIN_SCORE + depth);
        }
        if (searchState.isBoardFull()) {
            return 0;
        }

        if (depth <= 0) {
            int evaluation = searchState.evaluateCurrent();
            if (!timedOut) {
                transpositionTable.store(board, side, evaluation, 0, TTFlag.EXACT, -1);
                transpositionStores++;
            }
            return evaluation;
        }

        int currentPly = searchState.ply();
        int moveCount = searchState.generateMoves(ttBestMove, depth >= HEURISTIC_ORDERING_MIN_DEPTH);

        int bestValue = -INFINITY;
        int bestMove = -1;

        for (int i = 0; i < moveCount; i++) {
            int move = searchState.moveAt(currentPly, i);
            searchState.pushGenerated(currentPly, i);
            int score = -negamax(depth - 1, -beta, -alpha);
            searchState.pop();

            if (score > bestValue) {
                bestValue = score;
                bestMove = move;
            }
            if (timedOut) {
                return bestValue;
            }

            if (score > alpha) {
                alpha = score;
            }
            if (alpha >= beta) {
                cutoffs++;
                break;
            }
        }

        TTFlag flag;
        if (bestValue <= originalAlpha) {
            flag = TTFlag.UPPER_BOUND;
        } else if (bestValue >= beta) {
            flag = TTFlag.LOWER_BOUND;
        } else {
            flag = TTFlag.EXACT;
        }
        transpositionTable.store(board, side, bestValue, depth, flag, bestMove);
        transpositionStores++;
        return bestValue;
    }

    /**
     * Follows the best moves recorded in the transposition table from the root.
     */
    private List<Move> principalVariation(Board board, int player, int depth) {
        Board line = board.copy();
        int side = player;
        List<Move> moves = new ArrayList<>(depth);
        for (int ply = 0; ply < depth; ply++) {
            int column = TranspositionTable.bestColumnFor(transpositionTable.probe(line, side), line);
            if (column < 0 || line.dropHeight(column) == Board.COLUMN_FULL) {
                break;
            }
            Move move = Move.ofColumn(column);
            line.applyMove(move, side);
            moves.add(move);
            if (line.winner().isTerminal()) {
                break;
            }
            side = Board.opponent(side);
        }
        return moves;
    }

    // An exhausted node budget ends the pass the same way the deadline does.
    private boolean isDeadlineExceeded() {
        return timedOut || visitedNodes >= nodeBudget
                || (deadline != Long.MAX_VALUE && System.nanoTime() >= deadline);
    }

    private record IterationResult(int move, int score, int depth, long visitedNodes, boolean timedOut,
            boolean improvesOnPrevious) {
    }
}
