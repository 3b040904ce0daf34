package com.cubefour.core.policy;

/**
 * Search back end used once the tactical stages of {@link DecisionPolicy} have passed.
 */
public enum SearchAlgorithm {
    NEGAMAX,
    MCTS
}
