package com.cubefour.core.ai.mcts;

import com.cubefour.core.Board;
import com.cubefour.core.Outcome;
import com.cubefour.core.ai.SearchConstraints;
import com.cubefour.core.ai.SearchResult;
import com.cubefour.core.ai.Searcher;
import com.cubefour.core.ai.SearchTelemetry;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Monte Carlo Tree Search with UCB1 selection. Each iteration selects a leaf, expands one child,
 * plays it out with {@link PlayoutPolicy} and backs the result up to the root. Rewards are kept
 * from the root player's point of view.
 */
public final class MonteCarloSearcher implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(MonteCarloSearcher.class.getName());

    public static final double DEFAULT_EXPLORATION = Math.sqrt(2.0);

    static final double WIN_REWARD = 1.0;
    static final double DRAW_REWARD = 0.5;
    static final double LOSS_REWARD = 0.0;

    private final double exploration;
    private final Random random;
    private final PlayoutPolicy playoutPolicy;

    public MonteCarloSearcher() {
        this(DEFAULT_EXPLORATION, new Random());
    }

    public MonteCarloSearcher(double exploration, long seed) {
        this(exploration, new Random(seed));
    }

    public MonteCarloSearcher(double exploration, Random random) {
        if (!(exploration >= 0.0) || Double.isInfinite(exploration)) {
            throw new IllegalArgumentException("Exploration constant must be a non-negative number");
        }
        this.exploration = exploration;
        this.random = Objects.requireNonNull(random, "random");
        this.playoutPolicy = new PlayoutPolicy(random);
    }

    @Override
    public SearchResult search(Board board, int player, SearchConstraints constraints) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(constraints, "constraints");
        Board.checkPlayer(player);

        if (board.winner().isTerminal()) {
            throw new IllegalStateException("Cannot search moves in a terminal position");
        }

        long start = System.nanoTime();
        long deadline = constraints.deadlineFrom(start);
        long iterationLimit = constraints.iterationLimit();

        MctsNode root = MctsNode.root(board, player);
        long iterations = 0L;
        boolean timedOut = false;
        while (iterationLimit == 0L || iterations < iterationLimit) {
            if (deadline != Long.MAX_VALUE && System.nanoTime() >= deadline) {
                timedOut = true;
                break;
            }
            runIteration(root, player);
            iterations++;
        }

        MctsNode best = bestChild(root);
        long elapsed = System.nanoTime() - start;
        if (best == null) {
            LOGGER.info(() -> "MCTS finished without completing an iteration");
            return SearchResult.noDecision(iterations, timedOut);
        }

        int treeDepth = root.depth();
        final long playouts = iterations;
        LOGGER.info(() -> String.format("MCTS ran %d playouts (depth=%d, move=%s, winRate=%.3f, visits=%d)",
                playouts, treeDepth, best.move(), best.winRate(), best.visits()));

        int score = (int) Math.round(best.winRate() * 1000);
        SearchTelemetry.Iteration summary = new SearchTelemetry.Iteration(treeDepth, iterations, 0L, 0L, 0L, elapsed,
                score, !timedOut, List.of(best.move()));
        return new SearchResult(best.move(), score, treeDepth, iterations, timedOut,
                new SearchTelemetry(List.of(summary)));
    }

    void runIteration(MctsNode root, int rootPlayer) {
        MctsNode node = root;
        while (!node.isTerminal() && node.isFullyExpanded()) {
            node = selectChild(node, rootPlayer);
        }

        if (!node.isTerminal() && !node.isFullyExpanded()) {
            node = node.expand(random.nextInt(node.untriedCount()));
        }

        Outcome outcome;
        if (node.isTerminal()) {
            outcome = node.outcome();
        } else {
            outcome = playoutPolicy.playOut(node.board().copy(), node.playerToMove());
        }

        double reward = rewardFor(outcome, rootPlayer);
        for (MctsNode current = node; current != null; current = current.parent()) {
            current.record(reward);
        }
    }

    /**
     * UCB1 over the children of {@code node}. Unvisited children are taken first; where the root
     * player's opponent chooses, the exploitation term is inverted.
     */
    MctsNode selectChild(MctsNode node, int rootPlayer) {
        boolean rootChooses = node.playerToMove() == rootPlayer;
        double logParentVisits = Math.log(Math.max(1, node.visits()));
        MctsNode best = null;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (MctsNode child : node.children()) {
            if (child.visits() == 0) {
                return child;
            }
            double exploitation = rootChooses ? child.winRate() : 1.0 - child.winRate();
            double value = exploitation + exploration * Math.sqrt(logParentVisits / child.visits());
            if (value > bestValue) {
                bestValue = value;
                best = child;
            }
        }
        return best;
    }

    /**
     * Returns the visited root child with the highest win rate, ties going to the more visited one.
     */
    static MctsNode bestChild(MctsNode root) {
        MctsNode best = null;
        double bestRate = Double.NEGATIVE_INFINITY;
        for (MctsNode child : root.children()) {
            if (child.visits() == 0) {
                continue;
            }
            double rate = child.winRate();
            if (rate > bestRate || (rate == bestRate && child.visits() > best.visits())) {
                bestRate = rate;
                best = child;
            }
        }
        return best;
    }

    static double rewardFor(Outcome outcome, int rootPlayer) {
        if (outcome == Outcome.DRAW || outcome == Outcome.IN_PROGRESS) {
            return DRAW_REWARD;
        }
        return outcome.winner() == rootPlayer ? WIN_REWARD : LOSS_REWARD;
    }
}
