package com.krickert.yappy.watch.view;

import java.time.Duration;

/**
 * Decides whether a failed fetch is retried and how long to wait first.
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * @param attempt number of retries already made for the current failure streak, starting at 0
     */
    Decision next(int attempt);

    record Decision(boolean retry, Duration sleep) {

        public static Decision giveUp() {
            return new Decision(false, Duration.ZERO);
        }

        public static Decision after(Duration sleep) {
            return new Decision(true, sleep);
        }
    }
}
