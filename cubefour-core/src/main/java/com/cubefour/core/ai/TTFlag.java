package com.cubefour.core.ai;

/**
 * Flag used to describe the type of value stored in the transposition table.
 */
public enum TTFlag {
    EXACT,
    LOWER_BOUND,
    UPPER_BOUND
}
