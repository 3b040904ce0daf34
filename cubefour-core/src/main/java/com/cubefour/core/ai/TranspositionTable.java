package com.cubefour.core.ai;

import com.cubefour.core.Board;
import com.cubefour.core.Symmetry;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Bounded transposition table keyed by the canonical position hash. Entries carry the canonical
 * stone masks so that a hash collision is detected on probe and reported as a miss. Once the
 * table reaches its capacity it is cleared wholesale before the next insertion.
 */
public final class TranspositionTable {

    private static final Logger LOGGER = Logger.getLogger(TranspositionTable.class.getName());

    public static final int DEFAULT_CAPACITY = 10_000;

    private static final long SECOND_PLAYER_KEY = 0x9E3779B97F4A7C15L;

    private final Map<Long, TTEntry> entries = new HashMap<>();
    private final int capacity;
    private long clearCount;

    public TranspositionTable() {
        this(DEFAULT_CAPACITY);
    }

    public TranspositionTable(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.capacity = capacity;
    }

    /**
     * Returns the key under which the position with {@code sideToMove} to play is stored.
     */
    public static long keyOf(Board board, int sideToMove) {
        long key = board.canonicalHash();
        return sideToMove == Board.PLAYER_TWO ? key ^ SECOND_PLAYER_KEY : key;
    }

    /**
     * Returns the verified entry for the position, or {@code null} on a miss or a collision.
     */
    public TTEntry probe(Board board, int sideToMove) {
        TTEntry entry = entries.get(keyOf(board, sideToMove));
        if (entry == null) {
            return null;
        }
        return entry.matches(board.canonicalStones(Board.PLAYER_ONE), board.canonicalStones(Board.PLAYER_TWO),
                sideToMove) ? entry : null;
    }

    /**
     * Stores a search result for the position. {@code bestColumn} is given in the board's own
     * orientation, or {@code -1} if unknown.
     */
    public void store(Board board, int sideToMove, int value, int depth, TTFlag flag, int bestColumn) {
        Objects.requireNonNull(flag, "flag");
        int canonicalMove = bestColumn < 0 ? -1 : Symmetry.mapColumn(bestColumn, board.canonicalSymmetry());
        TTEntry entry = new TTEntry(value, depth, flag, canonicalMove, board.canonicalStones(Board.PLAYER_ONE),
                board.canonicalStones(Board.PLAYER_TWO), sideToMove);
        put(keyOf(board, sideToMove), entry);
    }

    /**
     * Maps the best move of an entry probed for {@code board} back into the board's orientation.
     */
    public static int bestColumnFor(TTEntry entry, Board board) {
        if (entry == null || entry.bestMove() < 0) {
            return -1;
        }
        return Symmetry.unmapColumn(entry.bestMove(), board.canonicalSymmetry());
    }

    TTEntry get(long key) {
        return entries.get(key);
    }

    /**
     * Inserts the entry unless an existing entry for the same key was searched deeper.
     */
    void put(long key, TTEntry entry) {
        Objects.requireNonNull(entry, "entry");
        TTEntry existing = entries.get(key);
        if (existing != null) {
            if (existing.depth() <= entry.depth()) {
                entries.put(key, entry);
            }
            return;
        }
        if (entries.size() >= capacity) {
            int dropped = entries.size();
            entries.clear();
            clearCount++;
            LOGGER.fine(() -> String.format("Transposition table reached %d entries, cleared %d", capacity, dropped));
        }
        entries.put(key, entry);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Returns how many times the table was cleared because it reached its capacity.
     */
    public long clearCount() {
        return clearCount;
    }
}
