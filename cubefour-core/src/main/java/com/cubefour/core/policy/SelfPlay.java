package com.cubefour.core.policy;

import com.cubefour.core.Board;
import com.cubefour.core.Coordinate;
import com.cubefour.core.Move;
import com.cubefour.core.Outcome;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Plays complete games between two {@link MoveDecider}s and keeps a running tally of the results.
 * Every move is checked against the board before it is applied.
 */
public final class SelfPlay {

    private static final Logger LOGGER = Logger.getLogger(SelfPlay.class.getName());

    private final MoveDecider first;
    private final MoveDecider second;

    private int gamesPlayed;
    private int firstWins;
    private int secondWins;
    private int draws;

    public SelfPlay(MoveDecider first, MoveDecider second) {
        this.first = Objects.requireNonNull(first, "first");
        this.second = Objects.requireNonNull(second, "second");
    }

    public List<GameRecord> playGames(int gameCount) {
        if (gameCount < 1) {
            throw new IllegalArgumentException("Game count must be at least 1");
        }
        List<GameRecord> records = new ArrayList<>(gameCount);
        for (int i = 0; i < gameCount; i++) {
            records.add(playGame());
        }
        return records;
    }

    public GameRecord playGame() {
        long start = System.nanoTime();
        Board board = new Board();
        List<Move> moves = new ArrayList<>();
        int player = Board.PLAYER_ONE;
        Coordinate lastMove = null;

        while (!board.winner().isTerminal()) {
            MoveDecider decider = player == Board.PLAYER_ONE ? first : second;
            Move move = decider.decide(board.toGrid(), player, lastMove);
            if (!board.isLegal(move)) {
                throw new IllegalStateException("Player " + player + " chose unplayable column " + move);
            }
            int height = board.applyMove(move, player);
            lastMove = new Coordinate(move.x(), move.y(), height);
            moves.add(move);
            player = Board.opponent(player);
        }

        Outcome outcome = board.winner();
        gamesPlayed++;
        switch (outcome) {
            case PLAYER_ONE:
                firstWins++;
                break;
            case PLAYER_TWO:
                secondWins++;
                break;
            default:
                draws++;
                break;
        }

        GameRecord record = new GameRecord(outcome, moves, Duration.ofNanos(System.nanoTime() - start));
        final int gameNumber = gamesPlayed;
        LOGGER.info(() -> String.format("Completed game %d (%s after %d moves, %d ms) tally %d-%d-%d", gameNumber,
                outcome, record.moves().size(), record.elapsed().toMillis(), firstWins, secondWins, draws));
        return record;
    }

    public int getGamesPlayed() {
        return gamesPlayed;
    }

    public int getFirstWins() {
        return firstWins;
    }

    public int getSecondWins() {
        return secondWins;
    }

    public int getDraws() {
        return draws;
    }

    /**
     * Summary of one finished game.
     */
    public record GameRecord(Outcome outcome, List<Move> moves, Duration elapsed) {

        public GameRecord {
            Objects.requireNonNull(outcome, "outcome");
            Objects.requireNonNull(elapsed, "elapsed");
            moves = List.copyOf(moves);
        }
    }
}
