package com.cubefour.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Mutable bitboard representation of the 4x4x4 gravity board.
 * Each cell corresponds to a bit in a 64-bit mask per player, indexed {@code x + 4y + 16z}.
 * The board also maintains one Zobrist hash per {@link Symmetry} so that the canonical key of a
 * position is available after every move without rescanning the cells.
 */
public final class Board {

    public static final int SIZE = 4;
    public static final int COLUMN_COUNT = SIZE * SIZE;
    public static final int CELL_COUNT = COLUMN_COUNT * SIZE;

    public static final int EMPTY = 0;
    public static final int PLAYER_ONE = 1;
    public static final int PLAYER_TWO = 2;

    /**
     * Drop height reported for a full (or non-existent) column.
     */
    public static final int COLUMN_FULL = -1;

    private static final long[][] ZOBRIST_KEYS = new long[2][CELL_COUNT];

    static {
        Random random = new Random(0x43554245L);
        for (int player = 0; player < 2; player++) {
            for (int cell = 0; cell < CELL_COUNT; cell++) {
                ZOBRIST_KEYS[player][cell] = random.nextLong();
            }
        }
    }

    private final long[] stones = new long[2];
    private final int[] heights = new int[COLUMN_COUNT];
    private final long[] hashes = new long[Symmetry.SYMMETRY_COUNT];

    /**
     * Creates an empty board.
     */
    public Board() {
    }

    private Board(Board other) {
        System.arraycopy(other.stones, 0, stones, 0, stones.length);
        System.arraycopy(other.heights, 0, heights, 0, heights.length);
        System.arraycopy(other.hashes, 0, hashes, 0, hashes.length);
    }

    /**
     * Builds a board from a grid indexed {@code [z][y][x]} holding {@code 0}, {@code 1} or {@code 2}.
     *
     * @throws IllegalArgumentException if the grid has the wrong shape, holds unknown values, or
     *         contains a stone above an empty cell
     */
    public static Board fromGrid(int[][][] grid) {
        if (grid == null || grid.length != SIZE) {
            throw new IllegalArgumentException("Grid must have " + SIZE + " layers");
        }
        for (int z = 0; z < SIZE; z++) {
            if (grid[z] == null || grid[z].length != SIZE) {
                throw new IllegalArgumentException("Layer " + z + " must have " + SIZE + " rows");
            }
            for (int y = 0; y < SIZE; y++) {
                if (grid[z][y] == null || grid[z][y].length != SIZE) {
                    throw new IllegalArgumentException("Row " + y + " of layer " + z + " must have " + SIZE + " cells");
                }
            }
        }

        Board board = new Board();
        for (int y = 0; y < SIZE; y++) {
            for (int x = 0; x < SIZE; x++) {
                boolean gap = false;
                for (int z = 0; z < SIZE; z++) {
                    int value = grid[z][y][x];
                    if (value == EMPTY) {
                        gap = true;
                        continue;
                    }
                    if (value != PLAYER_ONE && value != PLAYER_TWO) {
                        throw new IllegalArgumentException("Unknown cell value " + value + " at " + new Coordinate(x, y, z));
                    }
                    if (gap) {
                        throw new IllegalArgumentException("Stone floating above an empty cell at " + new Coordinate(x, y, z));
                    }
                    board.applyMove(x, y, value);
                }
            }
        }
        return board;
    }

    /**
     * Returns a new grid indexed {@code [z][y][x]} mirroring this board.
     */
    public int[][][] toGrid() {
        int[][][] grid = new int[SIZE][SIZE][SIZE];
        for (int z = 0; z < SIZE; z++) {
            for (int y = 0; y < SIZE; y++) {
                for (int x = 0; x < SIZE; x++) {
                    grid[z][y][x] = cell(x, y, z);
                }
            }
        }
        return grid;
    }

    public Board copy() {
        return new Board(this);
    }

    /**
     * Returns the lowest empty height of column {@code (x, y)}, or {@link #COLUMN_FULL} if the
     * column is full or lies outside the board.
     */
    public int dropHeight(int x, int y) {
        if (!isInRange(x) || !isInRange(y)) {
            return COLUMN_FULL;
        }
        return dropHeight(columnIndex(x, y));
    }

    public int dropHeight(int column) {
        if (column < 0 || column >= COLUMN_COUNT) {
            return COLUMN_FULL;
        }
        int height = heights[column];
        return height < SIZE ? height : COLUMN_FULL;
    }

    /**
     * Returns the number of stones stacked in the column.
     */
    public int columnHeight(int column) {
        if (column < 0 || column >= COLUMN_COUNT) {
            throw new IllegalArgumentException("Column index out of range: " + column);
        }
        return heights[column];
    }

    public boolean isLegal(int x, int y) {
        return dropHeight(x, y) != COLUMN_FULL;
    }

    public boolean isLegal(Move move) {
        return move != null && isLegal(move.x(), move.y());
    }

    /**
     * Drops a stone for {@code player} into column {@code (x, y)} and returns its landing height.
     *
     * @throws IllegalArgumentException if the column is full or outside the board, or the player is unknown
     */
    public int applyMove(int x, int y, int player) {
        checkPlayer(player);
        int height = dropHeight(x, y);
        if (height == COLUMN_FULL) {
            throw new IllegalArgumentException("Column " + new Move(x, y) + " has no room");
        }
        int column = columnIndex(x, y);
        toggle(player, column + height * COLUMN_COUNT);
        heights[column] = height + 1;
        return height;
    }

    public int applyMove(Move move, int player) {
        return applyMove(move.x(), move.y(), player);
    }

    /**
     * Removes the stone at {@code (x, y, height)}, which must be the topmost stone of its column.
     *
     * @throws IllegalStateException if the cell is not the top of the column
     */
    public void undoMove(int x, int y, int height) {
        if (!isInRange(x) || !isInRange(y) || !isInRange(height)) {
            throw new IllegalStateException("Cannot undo outside the board: " + new Coordinate(x, y, height));
        }
        int column = columnIndex(x, y);
        if (heights[column] != height + 1) {
            throw new IllegalStateException("Cell " + new Coordinate(x, y, height) + " is not the top of its column");
        }
        int cell = column + height * COLUMN_COUNT;
        int owner = cellOwner(cell);
        toggle(owner, cell);
        heights[column] = height;
    }

    /**
     * Returns the value of the cell: {@link #EMPTY}, {@link #PLAYER_ONE} or {@link #PLAYER_TWO}.
     */
    public int cell(int x, int y, int z) {
        if (!isInRange(x) || !isInRange(y) || !isInRange(z)) {
            throw new IllegalArgumentException("Cell out of range: " + new Coordinate(x, y, z));
        }
        return cellOwner(cellIndex(x, y, z));
    }

    public int cell(int index) {
        if (index < 0 || index >= CELL_COUNT) {
            throw new IllegalArgumentException("Cell index out of range: " + index);
        }
        return cellOwner(index);
    }

    /**
     * Returns the stone mask of the provided player.
     */
    public long stones(int player) {
        checkPlayer(player);
        return stones[player - 1];
    }

    public long occupied() {
        return stones[0] | stones[1];
    }

    public int moveCount() {
        return Long.bitCount(occupied());
    }

    public boolean isFull() {
        return moveCount() == CELL_COUNT;
    }

    public boolean isEmpty() {
        return occupied() == 0L;
    }

    /**
     * Returns the legal columns in column-index order.
     */
    public List<Move> legalMoves() {
        List<Move> moves = new ArrayList<>(COLUMN_COUNT);
        for (int column = 0; column < COLUMN_COUNT; column++) {
            if (heights[column] < SIZE) {
                moves.add(Move.ofColumn(column));
            }
        }
        return moves;
    }

    /**
     * Returns the owner of {@code line} if all four of its cells hold the same stone, otherwise
     * {@link #EMPTY}.
     */
    public int winnerAt(Line line) {
        long mask = line.mask();
        if ((stones[0] & mask) == mask) {
            return PLAYER_ONE;
        }
        if ((stones[1] & mask) == mask) {
            return PLAYER_TWO;
        }
        return EMPTY;
    }

    /**
     * Scans all winning lines and reports the state of the game.
     */
    public Outcome winner() {
        for (int line = 0; line < LineCatalog.LINE_COUNT; line++) {
            long mask = LineCatalog.maskOf(line);
            if ((stones[0] & mask) == mask) {
                return Outcome.PLAYER_ONE;
            }
            if ((stones[1] & mask) == mask) {
                return Outcome.PLAYER_TWO;
            }
        }
        return isFull() ? Outcome.DRAW : Outcome.IN_PROGRESS;
    }

    public boolean hasWon(int player) {
        long own = stones(player);
        for (int line = 0; line < LineCatalog.LINE_COUNT; line++) {
            long mask = LineCatalog.maskOf(line);
            if ((own & mask) == mask) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code true} if dropping a stone for {@code player} into column {@code (x, y)}
     * would complete a line. The board is not modified.
     */
    public boolean isWinningDrop(int x, int y, int player) {
        int height = dropHeight(x, y);
        if (height == COLUMN_FULL) {
            return false;
        }
        return completesLine(cellIndex(x, y, height), player);
    }

    /**
     * Returns {@code true} if {@code player} owning the provided (empty or not) cell would
     * complete a line through it.
     */
    public boolean completesLine(int cellIndex, int player) {
        long own = stones(player) | (1L << cellIndex);
        for (int line : LineCatalog.linesThroughUnsafe(cellIndex)) {
            long mask = LineCatalog.maskOf(line);
            if ((own & mask) == mask) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the hash of the position as seen through the given symmetry.
     */
    public long hash(int symmetry) {
        return hashes[symmetry];
    }

    /**
     * Returns the smallest of the symmetric hashes, identical for all mirrored or rotated copies of
     * this position.
     */
    public long canonicalHash() {
        return hashes[canonicalSymmetry()];
    }

    /**
     * Returns the stones of {@code player} seen through the canonical symmetry.
     */
    public long canonicalStones(int player) {
        return Symmetry.apply(stones(player), canonicalSymmetry());
    }

    /**
     * Returns the symmetry whose hash is the canonical one. Ties resolve to the lowest index.
     */
    public int canonicalSymmetry() {
        int best = 0;
        for (int s = 1; s < Symmetry.SYMMETRY_COUNT; s++) {
            if (hashes[s] < hashes[best]) {
                best = s;
            }
        }
        return best;
    }

    public static int opponent(int player) {
        checkPlayer(player);
        return PLAYER_ONE + PLAYER_TWO - player;
    }

    public static boolean isInRange(int coordinate) {
        return coordinate >= 0 && coordinate < SIZE;
    }

    public static int columnIndex(int x, int y) {
        return x + y * SIZE;
    }

    public static int cellIndex(int x, int y, int z) {
        return columnIndex(x, y) + z * COLUMN_COUNT;
    }

    /**
     * Rejects anything other than {@link #PLAYER_ONE} or {@link #PLAYER_TWO}.
     */
    public static void checkPlayer(int player) {
        if (player != PLAYER_ONE && player != PLAYER_TWO) {
            throw new IllegalArgumentException("Unknown player: " + player);
        }
    }

    private int cellOwner(int cell) {
        long bit = 1L << cell;
        if ((stones[0] & bit) != 0) {
            return PLAYER_ONE;
        }
        if ((stones[1] & bit) != 0) {
            return PLAYER_TWO;
        }
        return EMPTY;
    }

    private void toggle(int player, int cell) {
        int side = player - 1;
        stones[side] ^= 1L << cell;
        long[] keys = ZOBRIST_KEYS[side];
        for (int s = 0; s < Symmetry.SYMMETRY_COUNT; s++) {
            hashes[s] ^= keys[Symmetry.PERMUTATIONS[s][cell]];
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Board)) {
            return false;
        }
        Board board = (Board) other;
        return Arrays.equals(stones, board.stones);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(stones);
    }

    @Override
    public String toString() {
        return "Board{moves=" + moveCount() + ", first=" + Long.toHexString(stones[0])
                + ", second=" + Long.toHexString(stones[1]) + "}";
    }
}
