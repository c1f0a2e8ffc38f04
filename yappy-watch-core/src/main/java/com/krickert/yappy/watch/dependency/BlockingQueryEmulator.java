package com.krickert.yappy.watch.dependency;

import com.krickert.yappy.watch.exception.DependencyStoppedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Gives backends without a native wait-index a blocking-query shape: the first poll returns at
 * once, later polls sleep first. The sleep races the dependency's {@link StopSignal}.
 * <p>
 * These backends cannot report "unchanged", so every poll after the sleep is treated as a
 * potential change.
 */
public class BlockingQueryEmulator {

    private static final Logger LOG = LoggerFactory.getLogger(BlockingQueryEmulator.class);

    private final Scheduler scheduler;

    public BlockingQueryEmulator() {
        this(Schedulers.parallel());
    }

    public BlockingQueryEmulator(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Sleeps for {@code duration} unless {@code stopSignal} fires first.
     *
     * @throws DependencyStoppedException if the signal fired before the timer
     */
    public void pause(String dependencyId, Duration duration, StopSignal stopSignal) {
        if (stopSignal.isStopped()) {
            throw new DependencyStoppedException(dependencyId);
        }
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        LOG.trace("{}: sleeping {} before next poll", dependencyId, duration);
        Mono<Boolean> timer = Mono.delay(duration, scheduler).thenReturn(Boolean.TRUE);
        Mono<Boolean> stop = stopSignal.asMono().thenReturn(Boolean.FALSE);
        Boolean timerFired = Mono.firstWithSignal(timer, stop).block();
        if (!Boolean.TRUE.equals(timerFired)) {
            throw new DependencyStoppedException(dependencyId);
        }
    }

    /**
     * Sleeps only when the caller has already seen a result, i.e. {@code options.waitIndex() != 0}.
     */
    public void pauseIfPolled(String dependencyId, QueryOptions options, Duration duration, StopSignal stopSignal) {
        if (options.isBlocking()) {
            pause(dependencyId, duration, stopSignal);
        }
    }
}
