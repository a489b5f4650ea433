package com.paxkun.magpie.service.search;

import java.time.Duration;

/**
 * Blocking pause used for pacing and backoff; swapped for a recorder in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
