package com.cubefour.core;

/**
 * Result of inspecting a board for a finished game.
 */
public enum Outcome {
    PLAYER_ONE(Board.PLAYER_ONE),
    PLAYER_TWO(Board.PLAYER_TWO),
    DRAW(Board.EMPTY),
    IN_PROGRESS(Board.EMPTY);

    private final int winner;

    Outcome(int winner) {
        this.winner = winner;
    }

    /**
     * Returns the winning player id, or {@link Board#EMPTY} if nobody has won.
     */
    public int winner() {
        return winner;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    public static Outcome wonBy(int player) {
        Board.checkPlayer(player);
        return player == Board.PLAYER_ONE ? PLAYER_ONE : PLAYER_TWO;
    }
}
