package com.cubefour.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cubefour.core.Board;
import com.cubefour.core.Boards;
import java.util.Random;
import org.junit.jupiter.api.Test;

class EvaluatorTest {

    @Test
    void emptyBoardIsBalanced() {
        assertEquals(0, Evaluator.score(new Board(), Board.PLAYER_ONE));
        assertEquals(0, Evaluator.score(new Board(), Board.PLAYER_TWO));
    }

    @Test
    void usesIncreasingLineWeights() {
        assertEquals(0, Evaluator.lineWeight(0));
        assertEquals(5, Evaluator.lineWeight(1));
        assertEquals(50, Evaluator.lineWeight(2));
        assertEquals(500, Evaluator.lineWeight(3));
        assertEquals(Evaluator.WIN_WEIGHT, Evaluator.lineWeight(4));
        assertThrows(IllegalArgumentException.class, () -> Evaluator.lineWeight(5));
    }

    @Test
    void scoresAreApproximatelyAntisymmetric() {
        Random random = new Random(11L);
        for (int i = 0; i < 50; i++) {
            Board board = Boards.randomPosition(random, random.nextInt(40));
            int first = Evaluator.score(board, Board.PLAYER_ONE);
            int second = Evaluator.score(board, Board.PLAYER_TWO);

            assertTrue(Math.abs(first + second) <= Evaluator.HEIGHT_CONTROL_WEIGHT * Board.COLUMN_COUNT,
                    "Scores for the two players should mirror each other: " + first + " vs " + second);
        }
    }

    @Test
    void favoursThePlayerWithMoreMaterialInOpenLines() {
        Board board = new Board();
        Boards.drop(board, Board.PLAYER_ONE, new int[] {1, 1}, new int[] {2, 2});
        Boards.drop(board, Board.PLAYER_TWO, new int[] {0, 3});

        assertTrue(Evaluator.score(board, Board.PLAYER_ONE) > 0);
        assertTrue(Evaluator.score(board, Board.PLAYER_TWO) < 0);
    }

    @Test
    void discountsThreatsThatCannotBePlayedNext() {
        // Three stones of player one on layer 1 above player two's row; only the first board has
        // a stone under the missing cell.
        Board reachable = new Board();
        Boards.drop(reachable, Board.PLAYER_TWO, new int[] {0, 0}, new int[] {1, 0}, new int[] {2, 0});
        Boards.drop(reachable, Board.PLAYER_ONE, new int[] {0, 0}, new int[] {1, 0}, new int[] {2, 0});
        Board unreachable = reachable.copy();
        reachable.applyMove(3, 0, Board.PLAYER_ONE);

        assertTrue(Evaluator.isPlayableNext(reachable, Board.cellIndex(3, 0, 1)));
        assertFalse(Evaluator.isPlayableNext(unreachable, Board.cellIndex(3, 0, 1)));
        assertTrue(Evaluator.score(reachable, Board.PLAYER_ONE) > Evaluator.score(unreachable, Board.PLAYER_ONE),
                "A threat on the next drop cell should be worth more");
    }

    @Test
    void completedLineDominatesTheScore() {
        Board board = new Board();
        Boards.drop(board, Board.PLAYER_TWO, new int[] {0, 1}, new int[] {1, 1}, new int[] {2, 1}, new int[] {3, 1});

        assertTrue(Evaluator.score(board, Board.PLAYER_TWO) >= Evaluator.WIN_WEIGHT);
        assertTrue(Evaluator.score(board, Board.PLAYER_ONE) <= -Evaluator.WIN_WEIGHT);
    }
}
