package com.cubefour.core.ai;

import com.cubefour.core.Board;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable search configuration passed to {@link Searcher} implementations.
 *
 * @param depthLimit     maximum depth for depth-first searchers
 * @param timeLimit      wall-clock budget, {@link Duration#ZERO} for none
 * @param iterationLimit maximum number of playouts for sampling searchers or of visited nodes for
 *                       depth-first searchers, {@code 0} for none
 */
public record SearchConstraints(int depthLimit, Duration timeLimit, long iterationLimit) {

    public SearchConstraints {
        Objects.requireNonNull(timeLimit, "timeLimit");
        if (depthLimit < 1) {
            throw new IllegalArgumentException("depthLimit must be at least 1");
        }
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
        if (iterationLimit < 0) {
            throw new IllegalArgumentException("iterationLimit must not be negative");
        }
    }

    /**
     * Constraints bounded only by time.
     */
    public static SearchConstraints ofTime(Duration timeLimit) {
        return new SearchConstraints(Board.CELL_COUNT, timeLimit, 0L);
    }

    public SearchConstraints withDepthLimit(int depth) {
        return new SearchConstraints(depth, timeLimit, iterationLimit);
    }

    public SearchConstraints withIterationLimit(long iterations) {
        return new SearchConstraints(depthLimit, timeLimit, iterations);
    }

    /**
     * Converts the time limit into nanoseconds, {@link Long#MAX_VALUE} meaning unbounded.
     */
    public long timeLimitNanos() {
        long nanos = timeLimit.isZero() ? Long.MAX_VALUE : timeLimit.toNanos();
        return nanos <= 0L ? 1L : nanos;
    }

    /**
     * Returns the absolute deadline for a search starting at {@code startNanos}.
     */
    public long deadlineFrom(long startNanos) {
        long limit = timeLimitNanos();
        if (limit == Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        long result = startNanos + limit;
        if (((startNanos ^ result) & (limit ^ result)) < 0) {
            return Long.MAX_VALUE;
        }
        return result;
    }
}
