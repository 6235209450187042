package com.tempodemo.echoservice.domain;

import java.time.Duration;
import java.util.random.RandomGenerator;

/**
 * Picks a random pause in whole 100 ms steps between zero and a maximum, inclusive.
 *
 * <p>The pause simulates upstream latency so traces show varied durations.
 */
public class ResponseDelay {

    public static final Duration STEP = Duration.ofMillis(100);

    private final int maxSteps;
    private final RandomGenerator random;

    public ResponseDelay(Duration maxDelay, RandomGenerator random) {
        this.maxSteps = (int) (maxDelay.toMillis() / STEP.toMillis());
        this.random = random;
    }

    public Duration next() {
        if (maxSteps <= 0) {
            return Duration.ZERO;
        }
        return STEP.multipliedBy(random.nextInt(maxSteps + 1));
    }

    /** Sleeps for {@link #next()} and returns the pause taken. */
    public Duration pause() throws InterruptedException {
        Duration delay = next();
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
        return delay;
    }
}
