package com.krickert.yappy.watch.view;

import java.time.Duration;

/**
 * Callbacks from a {@link DependencyView}'s poll loop. Invoked on the poll thread.
 */
public interface ViewListener<T> {

    void onData(String dependencyId, T data);

    void onError(String dependencyId, Throwable error);

    default void onRetry(String dependencyId, int attempt, Duration sleep, Throwable error) {
    }

    static <T> ViewListener<T> noop() {
        return new ViewListener<>() {
            @Override
            public void onData(String dependencyId, T data) {
            }

            @Override
            public void onError(String dependencyId, Throwable error) {
            }
        };
    }
}
