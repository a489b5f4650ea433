package com.paxkun.magpie.service.search;

import com.paxkun.magpie.exception.ExhaustedRetriesException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded attempt counter plus the causes collected along the way.
 * Not thread-safe; one instance per search.
 */
final class SearchAttempts {

    private final int maxAttempts;
    private final List<RuntimeException> causes = new ArrayList<>();
    private int started;
    private Duration lastDelay = Duration.ZERO;

    SearchAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
    }

    boolean hasRemaining() {
        return started < maxAttempts;
    }

    /**
     * @return zero-based index of the attempt being started
     */
    int begin() {
        if (!hasRemaining()) {
            throw new IllegalStateException("No attempts left");
        }
        return started++;
    }

    void fail(RuntimeException cause) {
        causes.add(cause);
    }

    Duration lastDelay() {
        return lastDelay;
    }

    void recordDelay(Duration delay) {
        this.lastDelay = delay;
    }

    int maxAttempts() {
        return maxAttempts;
    }

    ExhaustedRetriesException exhausted() {
        return new ExhaustedRetriesException(started, causes);
    }
}
