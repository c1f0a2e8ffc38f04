package com.krickert.yappy.watch.view;

import java.time.Duration;

/**
 * Doubles the wait on every attempt, capped at {@code maxBackoff}. {@code attempts <= 0} retries
 * forever.
 */
public class ExponentialRetryPolicy implements RetryPolicy {

    private final int attempts;
    private final Duration backoff;
    private final Duration maxBackoff;

    public ExponentialRetryPolicy(int attempts, Duration backoff, Duration maxBackoff) {
        this.attempts = attempts;
        this.backoff = backoff;
        this.maxBackoff = maxBackoff;
    }

    public static ExponentialRetryPolicy defaults() {
        return new ExponentialRetryPolicy(12, Duration.ofMillis(250), Duration.ofMinutes(1));
    }

    @Override
    public Decision next(int attempt) {
        if (attempts > 0 && attempt >= attempts) {
            return Decision.giveUp();
        }
        Duration sleep = attempt >= 30 ? maxBackoff : backoff.multipliedBy(1L << attempt);
        if (!maxBackoff.isZero() && sleep.compareTo(maxBackoff) > 0) {
            sleep = maxBackoff;
        }
        return Decision.after(sleep);
    }
}
