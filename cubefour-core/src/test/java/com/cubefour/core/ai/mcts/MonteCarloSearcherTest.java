package com.cubefour.core.ai.mcts;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cubefour.core.Board;
import com.cubefour.core.Boards;
import com.cubefour.core.Move;
import com.cubefour.core.Outcome;
import com.cubefour.core.ai.SearchConstraints;
import com.cubefour.core.ai.SearchResult;
import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

class MonteCarloSearcherTest {

    @Test
    void returnsNoDecisionWithoutBudget() {
        MonteCarloSearcher searcher = new MonteCarloSearcher(MonteCarloSearcher.DEFAULT_EXPLORATION, 1L);

        SearchResult result = searcher.search(new Board(), Board.PLAYER_ONE,
                new SearchConstraints(1, Duration.ofNanos(1), 0L));

        assertFalse(result.hasMove(), "No playout fits in the budget so no move can be chosen");
        assertTrue(result.timedOut());
    }

    @Test
    void returnsLegalMoveWithinIterationLimit() {
        MonteCarloSearcher searcher = new MonteCarloSearcher(MonteCarloSearcher.DEFAULT_EXPLORATION, 2L);
        Board board = Boards.randomPosition(new Random(4L), 30);

        SearchResult result = searcher.search(board, Board.PLAYER_ONE,
                SearchConstraints.ofTime(Duration.ZERO).withIterationLimit(300));

        assertTrue(result.hasMove());
        assertTrue(board.isLegal(result.move()));
        assertEquals(300L, result.visitedNodes());
        assertFalse(result.timedOut());
    }

    @Test
    void findsImmediateWin() {
        MonteCarloSearcher searcher = new MonteCarloSearcher(MonteCarloSearcher.DEFAULT_EXPLORATION, 3L);
        Board board = new Board();
        Boards.drop(board, Board.PLAYER_TWO, new int[] {0, 1}, new int[] {1, 1}, new int[] {2, 1});
        Boards.drop(board, Board.PLAYER_ONE, new int[] {0, 3}, new int[] {3, 0}, new int[] {3, 3});

        SearchResult result = searcher.search(board, Board.PLAYER_TWO,
                SearchConstraints.ofTime(Duration.ZERO).withIterationLimit(3_000));

        assertEquals(new Move(3, 1), result.move());
    }

    @Test
    void leavesCallerBoardUntouched() {
        Board board = Boards.randomPosition(new Random(8L), 20);
        Board snapshot = board.copy();

        new MonteCarloSearcher(1.0, 9L).search(board, Board.PLAYER_TWO,
                SearchConstraints.ofTime(Duration.ZERO).withIterationLimit(100));

        assertEquals(snapshot, board);
    }

    @Test
    void selectsUnvisitedChildrenFirst() {
        MonteCarloSearcher searcher = new MonteCarloSearcher(MonteCarloSearcher.DEFAULT_EXPLORATION, 5L);
        MctsNode root = MctsNode.root(new Board(), Board.PLAYER_ONE);
        MctsNode visited = root.expand(0);
        MctsNode fresh = root.expand(0);
        visited.record(1.0);
        root.record(1.0);

        assertSame(fresh, searcher.selectChild(root, Board.PLAYER_ONE));
    }

    @Test
    void invertsWinRateWhereOpponentChooses() {
        MonteCarloSearcher searcher = new MonteCarloSearcher(0.0, 6L);
        MctsNode root = MctsNode.root(new Board(), Board.PLAYER_ONE);
        MctsNode good = root.expand(0);
        MctsNode bad = root.expand(0);
        for (int i = 0; i < 4; i++) {
            good.record(MonteCarloSearcher.WIN_REWARD);
            bad.record(MonteCarloSearcher.LOSS_REWARD);
            root.record(MonteCarloSearcher.WIN_REWARD);
            root.record(MonteCarloSearcher.LOSS_REWARD);
        }

        assertSame(good, searcher.selectChild(root, Board.PLAYER_ONE), "The root player picks its best child");
        assertSame(bad, searcher.selectChild(root, Board.PLAYER_TWO), "The opponent picks the root player's worst");
    }

    @Test
    void scoresOutcomesForRootPlayer() {
        assertEquals(1.0, MonteCarloSearcher.rewardFor(Outcome.PLAYER_TWO, Board.PLAYER_TWO));
        assertEquals(0.0, MonteCarloSearcher.rewardFor(Outcome.PLAYER_ONE, Board.PLAYER_TWO));
        assertEquals(0.5, MonteCarloSearcher.rewardFor(Outcome.DRAW, Board.PLAYER_ONE));
    }

    @Test
    void bestChildIgnoresUnvisitedChildren() {
        MctsNode root = MctsNode.root(new Board(), Board.PLAYER_ONE);
        assertNull(MonteCarloSearcher.bestChild(root));

        root.expand(0);
        MctsNode visited = root.expand(0);
        visited.record(0.5);

        assertNotNull(MonteCarloSearcher.bestChild(root));
        assertSame(visited, MonteCarloSearcher.bestChild(root));
    }

    @Test
    void rejectsInvalidExploration() {
        assertThrows(IllegalArgumentException.class, () -> new MonteCarloSearcher(-1.0, 1L));
        assertThrows(IllegalArgumentException.class, () -> new MonteCarloSearcher(Double.NaN, 1L));
    }
}
