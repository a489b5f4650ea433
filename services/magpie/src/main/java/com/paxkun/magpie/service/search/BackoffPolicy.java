package com.paxkun.magpie.service.search;

import com.paxkun.magpie.config.MagpieProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Wait between failed search attempts: {@code base + attempt * step + jitter}.
 * A delay is never shorter than the one before it, so jitter cannot make a later
 * wait shorter than an earlier one.
 */
@Component
public class BackoffPolicy {

    private final Duration base;
    private final Duration step;
    private final Duration maxJitter;
    private final DoubleSupplier jitterSource;

    @Autowired
    public BackoffPolicy(MagpieProperties properties) {
        this(properties.getSearch().getBackoffBase(),
                properties.getSearch().getBackoffStep(),
                properties.getSearch().getBackoffJitter(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffPolicy(Duration base, Duration step, Duration maxJitter, DoubleSupplier jitterSource) {
        this.base = base;
        this.step = step;
        this.maxJitter = maxJitter;
        this.jitterSource = jitterSource;
    }

    /**
     * @param attempt  zero-based index of the attempt that just failed
     * @param previous delay used before this attempt, {@link Duration#ZERO} for none
     */
    public Duration delayAfter(int attempt, Duration previous) {
        long jitter = (long) (jitterSource.getAsDouble() * maxJitter.toMillis());
        Duration drawn = base.plus(step.multipliedBy(attempt)).plusMillis(jitter);
        return drawn.compareTo(previous) < 0 ? previous : drawn;
    }
}
