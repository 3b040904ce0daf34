package com.cubefour.core.policy;

import com.cubefour.core.Move;
import java.util.Objects;

/**
 * Move chosen by {@link DecisionPolicy} together with the stage that produced it.
 */
public record Decision(Move move, Stage stage) {

    public Decision {
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(stage, "stage");
    }

    /**
     * Decision stages in the order they are tried.
     */
    public enum Stage {
        IMMEDIATE_WIN,
        BLOCK_WIN,
        OPENING_BOOK,
        DOUBLE_THREAT,
        BLOCK_DOUBLE_THREAT,
        SEARCH,
        FALLBACK
    }
}
