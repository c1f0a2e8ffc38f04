package com.krickert.yappy.watch.dependency;

import com.krickert.yappy.watch.exception.DependencyFetchException;
import com.krickert.yappy.watch.exception.DependencyStoppedException;
import com.krickert.yappy.watch.exception.LeaseExpiredException;
import com.krickert.yappy.watch.exception.MalformedResponseException;

/**
 * A pollable, cancellable view of one remote (or local) value.
 * <p>
 * Contract:
 * <ul>
 *     <li>{@link #fetch(Clients)} checks the stop signal first and raises
 *     {@link DependencyStoppedException} without any I/O once stopped.</li>
 *     <li>{@code fetch} can be called again with a newer wait index from
 *     {@link #setOptions(QueryOptions)}; it blocks until the backend changes (or the wait time
 *     elapses) and returns the same data if polled with a stale index.</li>
 *     <li>Every suspension point inside {@code fetch} races the stop signal, so {@link #stop()}
 *     unblocks it promptly.</li>
 *     <li>Only one {@code fetch} may be in flight per instance.</li>
 * </ul>
 * Failures: {@link DependencyStoppedException}, {@link LeaseExpiredException},
 * {@link DependencyFetchException} (transport, retryable), {@link MalformedResponseException}.
 *
 * @param <T> the type of value this dependency produces
 */
public interface Dependency<T> {

    FetchResult<T> fetch(Clients clients);

    /**
     * Stops the dependency. Idempotent.
     */
    void stop();

    boolean isStopped();

    /**
     * Stable, human-friendly identity used for caching, sharing and error messages.
     */
    String id();

    /**
     * Whether one fetched instance may be shared between several consumers. Fixed per kind.
     */
    boolean canShare();

    /**
     * Options the next fetch merges with its own defaults. Kinds that take no options ignore this.
     */
    void setOptions(QueryOptions options);

    /**
     * Whether an empty result means "nothing to report yet" rather than new data.
     */
    default boolean isBlockingQuery() {
        return false;
    }
}
