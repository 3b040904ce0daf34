package com.cubefour.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SearchConstraintsTest {

    @Test
    void treatsZeroTimeAsUnbounded() {
        SearchConstraints constraints = SearchConstraints.ofTime(Duration.ZERO);

        assertEquals(Long.MAX_VALUE, constraints.timeLimitNanos());
        assertEquals(Long.MAX_VALUE, constraints.deadlineFrom(System.nanoTime()));
    }

    @Test
    void saturatesDeadlineOnOverflow() {
        SearchConstraints constraints = SearchConstraints.ofTime(Duration.ofSeconds(10));

        assertEquals(Long.MAX_VALUE, constraints.deadlineFrom(Long.MAX_VALUE - 5));
        assertEquals(1_000L + 10_000_000_000L, constraints.deadlineFrom(1_000L));
    }

    @Test
    void validatesLimits() {
        assertThrows(IllegalArgumentException.class, () -> new SearchConstraints(0, Duration.ZERO, 0L));
        assertThrows(IllegalArgumentException.class, () -> new SearchConstraints(1, Duration.ofMillis(-1), 0L));
        assertThrows(IllegalArgumentException.class, () -> new SearchConstraints(1, Duration.ZERO, -1L));
        assertThrows(NullPointerException.class, () -> new SearchConstraints(1, null, 0L));
    }
}
