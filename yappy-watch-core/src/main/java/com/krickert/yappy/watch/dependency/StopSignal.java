package com.krickert.yappy.watch.dependency;

import com.krickert.yappy.watch.exception.DependencyException;
import com.krickert.yappy.watch.exception.DependencyFetchException;
import com.krickert.yappy.watch.exception.DependencyStoppedException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal owned by a single dependency.
 * <p>
 * {@link #stop()} may be called any number of times; only the first call has an effect.
 * Subscribers that arrive after the stop observe it immediately.
 */
public final class StopSignal {

    private final Sinks.Empty<Void> sink = Sinks.empty();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    /**
     * @return {@code true} if this call performed the stop, {@code false} if it was already stopped
     */
    public boolean stop() {
        if (!stopped.compareAndSet(false, true)) {
            return false;
        }
        sink.tryEmitEmpty();
        return true;
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * Completes (empty) once the signal is stopped.
     */
    public Mono<Void> asMono() {
        return sink.asMono();
    }

    /**
     * Runs a blocking call on the bounded-elastic scheduler and races it against this signal.
     *
     * @see #race(String, Callable, Scheduler)
     */
    public <T> T race(String dependencyId, Callable<T> call) {
        return race(dependencyId, call, Schedulers.boundedElastic());
    }

    /**
     * Runs {@code call} on {@code scheduler} and waits for whichever comes first: its result or
     * the stop.
     *
     * @see #await(String, Mono)
     */
    public <T> T race(String dependencyId, Callable<T> call, Scheduler scheduler) {
        return await(dependencyId, Mono.fromCallable(call).subscribeOn(scheduler));
    }

    /**
     * Subscribes to {@code work} and blocks until it signals or this signal stops. A stop cancels
     * the subscription and raises {@link DependencyStoppedException}; an empty {@code work} yields
     * {@code null}. Failures that are not already {@link DependencyException}s are wrapped in a
     * {@link DependencyFetchException} carrying {@code dependencyId}.
     */
    public <T> T await(String dependencyId, Mono<T> work) {
        if (isStopped()) {
            throw new DependencyStoppedException(dependencyId);
        }
        Mono<Outcome<T>> result = work.map(Outcome::ofValue)
                .defaultIfEmpty(Outcome.ofValue(null));
        Mono<Outcome<T>> stop = asMono().then(Mono.fromSupplier(() -> Outcome.<T>ofStop()));

        Outcome<T> outcome;
        try {
            outcome = Mono.firstWithSignal(result, stop).block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof DependencyException) {
                throw (DependencyException) cause;
            }
            throw new DependencyFetchException(dependencyId, cause);
        }
        if (outcome == null || outcome.stopped()) {
            throw new DependencyStoppedException(dependencyId);
        }
        return outcome.value();
    }

    private record Outcome<T>(T value, boolean stopped) {
        static <T> Outcome<T> ofValue(T value) {
            return new Outcome<>(value, false);
        }

        static <T> Outcome<T> ofStop() {
            return new Outcome<>(null, true);
        }
    }
}
