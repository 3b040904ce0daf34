package com.cubefour.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SymmetryTest {

    private static final int[][] MOVES = {{0, 0}, {1, 0}, {0, 1}, {2, 3}, {0, 0}, {3, 2}};

    @Test
    void permutationsAreBijectionsThatKeepLayers() {
        for (int s = 0; s < Symmetry.SYMMETRY_COUNT; s++) {
            BitSet seen = new BitSet(Board.CELL_COUNT);
            for (int cell = 0; cell < Board.CELL_COUNT; cell++) {
                int mapped = Symmetry.PERMUTATIONS[s][cell];
                assertEquals(cell / Board.COLUMN_COUNT, mapped / Board.COLUMN_COUNT,
                        "Symmetry " + s + " must not move stones between layers");
                seen.set(mapped);
            }
            assertEquals(Board.CELL_COUNT, seen.cardinality(), "Symmetry " + s + " must be a bijection");
        }
    }

    @Test
    void unmapInvertsMap() {
        for (int s = 0; s < Symmetry.SYMMETRY_COUNT; s++) {
            for (int column = 0; column < Board.COLUMN_COUNT; column++) {
                assertEquals(column, Symmetry.unmapColumn(Symmetry.mapColumn(column, s), s));
            }
        }
    }

    @Test
    void mapsWinningLinesOntoWinningLines() {
        Set<Long> masks = new HashSet<>();
        for (long mask : LineCatalog.lineMasks()) {
            masks.add(mask);
        }
        for (int s = 0; s < Symmetry.SYMMETRY_COUNT; s++) {
            for (long mask : LineCatalog.lineMasks()) {
                assertTrue(masks.contains(Symmetry.apply(mask, s)), "Symmetry " + s + " must preserve lines");
            }
        }
    }

    @Test
    void mirroredPositionsShareCanonicalKey() {
        Board original = Boards.play(MOVES);
        for (int s = 1; s < Symmetry.SYMMETRY_COUNT; s++) {
            Board mirrored = new Board();
            int player = Board.PLAYER_ONE;
            for (int[] move : MOVES) {
                int column = Symmetry.mapColumn(Board.columnIndex(move[0], move[1]), s);
                mirrored.applyMove(Move.ofColumn(column), player);
                player = Board.opponent(player);
            }

            assertEquals(Symmetry.apply(original.stones(Board.PLAYER_ONE), s), mirrored.stones(Board.PLAYER_ONE));
            assertEquals(original.canonicalHash(), mirrored.canonicalHash(), "Symmetry " + s);
            assertEquals(original.canonicalStones(Board.PLAYER_ONE), mirrored.canonicalStones(Board.PLAYER_ONE));
            assertEquals(original.canonicalStones(Board.PLAYER_TWO), mirrored.canonicalStones(Board.PLAYER_TWO));
        }
    }

    @Test
    void differentPositionsHaveDifferentKeys() {
        Board first = Boards.play(new int[] {0, 0}, new int[] {1, 1});
        Board second = Boards.play(new int[] {1, 1}, new int[] {0, 0});

        assertNotEquals(first.canonicalHash(), second.canonicalHash());
    }

    @Test
    void rejectsUnknownSymmetry() {
        assertThrows(IllegalArgumentException.class, () -> Symmetry.apply(1L, Symmetry.SYMMETRY_COUNT));
        assertThrows(IllegalArgumentException.class, () -> Symmetry.mapColumn(0, -1));
    }
}
