package com.cubefour.core.ai;

import static com.cubefour.core.ai.NegamaxSearcher.WIN_SCORE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cubefour.core.Board;
import com.cubefour.core.Boards;
import com.cubefour.core.Move;
import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

class NegamaxSearcherTest {

    @Test
    void takesImmediateWin() {
        NegamaxSearcher searcher = new NegamaxSearcher(4);
        Board board = new Board();
        Boards.drop(board, Board.PLAYER_ONE, new int[] {0, 0}, new int[] {1, 0}, new int[] {2, 0});
        Boards.drop(board, Board.PLAYER_TWO, new int[] {0, 1}, new int[] {1, 2}, new int[] {3, 3});

        SearchResult result = searcher.search(board, Board.PLAYER_ONE, SearchConstraints.ofTime(Duration.ofSeconds(5)));

        assertEquals(new Move(3, 0), result.move());
        assertTrue(NegamaxSearcher.isWinScore(result.score()), "A won position should carry a win score");
    }

    @Test
    void blocksOpponentWin() {
        NegamaxSearcher searcher = new NegamaxSearcher(4);
        Board board = new Board();
        Boards.drop(board, Board.PLAYER_TWO, new int[] {0, 3}, new int[] {1, 3}, new int[] {2, 3});
        Boards.drop(board, Board.PLAYER_ONE, new int[] {0, 0}, new int[] {1, 1}, new int[] {2, 1});

        Move move = searcher.findBestMove(board, Board.PLAYER_ONE, Duration.ofSeconds(5));

        assertEquals(new Move(3, 3), move, "The only move that avoids a loss is the block");
    }

    @Test
    void prefersImmediateWinOverSlowerForcedWin() {
        Board forkOnly = forkPosition();
        SearchResult slower = new NegamaxSearcher(4).search(forkOnly, Board.PLAYER_ONE,
                SearchConstraints.ofTime(Duration.ofSeconds(5)));

        assertEquals(WIN_SCORE, slower.score(), "The fork wins on the third ply");
        assertEquals(3, slower.depthEvaluated());

        Board both = forkPosition();
        Boards.drop(both, Board.PLAYER_ONE, new int[] {2, 1}, new int[] {2, 1}, new int[] {2, 1});
        SearchResult faster = new NegamaxSearcher(4).search(both, Board.PLAYER_ONE,
                SearchConstraints.ofTime(Duration.ofSeconds(5)));

        assertEquals(new Move(2, 1), faster.move(), "Completing the stack wins at once");
        assertEquals(WIN_SCORE, faster.score());
        assertEquals(1, faster.depthEvaluated(), "A proven win stops the deepening");
    }

    @Test
    void scoresFasterWinsHigherAtFixedDepth() {
        Board forkOnly = forkPosition();
        Board both = forkPosition();
        Boards.drop(both, Board.PLAYER_ONE, new int[] {2, 1}, new int[] {2, 1}, new int[] {2, 1});

        int slower = new NegamaxSearcher(3).scoreAtDepth(forkOnly, Board.PLAYER_ONE, 3);
        int faster = new NegamaxSearcher(3).scoreAtDepth(both, Board.PLAYER_ONE, 3);

        assertEquals(WIN_SCORE, slower, "A win on the last ply keeps no bonus");
        assertEquals(WIN_SCORE + 2, faster, "A win on the first ply keeps the two plies left as a bonus");
    }

    @Test
    void reportsLastCompletedDepthWhenBudgetRunsOutMidPass() {
        Board board = Boards.play(new int[] {1, 1}, new int[] {2, 2}, new int[] {1, 2});
        SearchConstraints unbounded = new SearchConstraints(3, Duration.ZERO, 0L);
        SearchResult full = new NegamaxSearcher(3).search(board, Board.PLAYER_TWO, unbounded);
        assertEquals(3, full.telemetry().iterations().size());
        long firstTwo = full.telemetry().iterations().get(0).nodes() + full.telemetry().iterations().get(1).nodes();
        long third = full.telemetry().iterations().get(2).nodes();

        SearchResult cut = new NegamaxSearcher(3).search(board, Board.PLAYER_TWO,
                unbounded.withIterationLimit(firstTwo + third / 2));

        assertTrue(cut.timedOut());
        assertEquals(2, cut.depthEvaluated(), "The interrupted pass does not count as evaluated");
        assertEquals(3, cut.telemetry().iterations().size());
        assertFalse(cut.telemetry().latest().completed());
        SearchTelemetry.Iteration completed = cut.telemetry().iterations().get(1);
        if (cut.move().equals(completed.principalVariation().get(0))) {
            assertEquals(completed.bestScore(), cut.score());
        } else {
            assertEquals(cut.telemetry().latest().bestScore(), cut.score(),
                    "Only a better fully searched move from the interrupted pass may replace the previous best");
        }
    }

    @Test
    void replacesPreviousBestOnlyWithBetterFullySearchedMove() {
        assertTrue(NegamaxSearcher.replacesPreviousBest(5, 10, true, 6, 11));
        assertFalse(NegamaxSearcher.replacesPreviousBest(5, 10, true, 6, 10), "Ties keep the previous best");
        assertFalse(NegamaxSearcher.replacesPreviousBest(5, 10, false, 6, 50),
                "The previous best must have been searched again");
        assertFalse(NegamaxSearcher.replacesPreviousBest(5, 10, true, 5, 20));
    }

    @Test
    void summarizesTranspositionActivity() {
        SearchResult result = new NegamaxSearcher(4).search(new Board(), Board.PLAYER_ONE,
                SearchConstraints.ofTime(Duration.ofSeconds(5)));
        SearchTelemetry telemetry = result.telemetry();

        assertTrue(telemetry.totalTranspositionStores() > 0);
        assertTrue(telemetry.totalCutoffs() > 0, "Alpha-beta should prune on a four ply search");
        assertTrue(telemetry.totalTranspositionHits() > 0, "Mirrored central openings share table entries");
        assertEquals(telemetry.iterations().stream().mapToLong(SearchTelemetry.Iteration::transpositionStores).sum(),
                telemetry.totalTranspositionStores());
    }

    @Test
    void recordsVisitedNodesAndTelemetry() {
        NegamaxSearcher searcher = new NegamaxSearcher(3);

        SearchResult result = searcher.search(new Board(), Board.PLAYER_ONE,
                SearchConstraints.ofTime(Duration.ofSeconds(5)));

        assertTrue(searcher.getLastVisitedNodeCount() > 0, "The search should inspect at least one node");
        assertEquals(searcher.getLastVisitedNodeCount(), result.visitedNodes());
        assertEquals(3, result.depthEvaluated());
        assertFalse(result.timedOut());
        assertEquals(3, result.telemetry().iterations().size());
        assertTrue(result.telemetry().latest().completed());
        assertEquals(result.visitedNodes(), result.telemetry().totalNodes());
        assertTrue(searcher.getTranspositionTable().size() > 0);
    }

    @Test
    void returnsLegalMoveOnTimeout() {
        NegamaxSearcher searcher = new NegamaxSearcher(20);
        Board board = Boards.play(new int[] {1, 1}, new int[] {2, 2}, new int[] {1, 2});

        Move move = searcher.findBestMove(board, Board.PLAYER_TWO, Duration.ofNanos(1));

        assertTrue(board.isLegal(move), "A move must be returned even when time runs out");
        assertTrue(searcher.wasLastSearchTimedOut(), "Search should report the timeout condition");
    }

    @Test
    void leavesCallerBoardUntouched() {
        Board board = Boards.randomPosition(new Random(3L), 24);
        Board snapshot = board.copy();

        new NegamaxSearcher(3).findBestMove(board, Board.PLAYER_ONE, Duration.ofMillis(200));

        assertEquals(snapshot, board);
        assertEquals(snapshot.canonicalHash(), board.canonicalHash());
    }

    @Test
    void alwaysReturnsLegalMoves() {
        Random random = new Random(19L);
        NegamaxSearcher searcher = new NegamaxSearcher(3);
        for (int i = 0; i < 10; i++) {
            Board board = Boards.randomPosition(random, random.nextInt(50));
            if (board.winner().isTerminal()) {
                continue;
            }
            int player = board.moveCount() % 2 == 0 ? Board.PLAYER_ONE : Board.PLAYER_TWO;

            Move move = searcher.findBestMove(board, player, Duration.ofMillis(100));

            assertTrue(board.isLegal(move), "Illegal move " + move + " for\n" + board);
        }
    }

    @Test
    void rejectsTerminalPositions() {
        Board board = new Board();
        Boards.drop(board, Board.PLAYER_ONE, new int[] {0, 0}, new int[] {0, 0}, new int[] {0, 0}, new int[] {0, 0});
        NegamaxSearcher searcher = new NegamaxSearcher(2);

        assertThrows(IllegalStateException.class,
                () -> searcher.findBestMove(board, Board.PLAYER_TWO, Duration.ofMillis(10)));
    }

    @Test
    void rejectsInvalidDepth() {
        assertThrows(IllegalArgumentException.class, () -> new NegamaxSearcher(0));
    }

    private static Board forkPosition() {
        Board board = new Board();
        Boards.drop(board, Board.PLAYER_ONE, new int[] {1, 0}, new int[] {2, 0}, new int[] {0, 1}, new int[] {0, 2});
        Boards.drop(board, Board.PLAYER_TWO, new int[] {3, 3}, new int[] {2, 2}, new int[] {3, 2}, new int[] {1, 3});
        return board;
    }
}
