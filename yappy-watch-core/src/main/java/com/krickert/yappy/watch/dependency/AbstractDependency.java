package com.krickert.yappy.watch.dependency;

import com.krickert.yappy.watch.exception.DependencyStoppedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Shared plumbing: the stop signal, the caller-supplied options and the identity-based
 * {@code toString}.
 */
public abstract class AbstractDependency<T> implements Dependency<T> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractDependency.class);

    protected final StopSignal stopSignal = new StopSignal();
    protected final Clock clock;
    protected volatile QueryOptions options = QueryOptions.EMPTY;

    protected AbstractDependency() {
        this(Clock.systemUTC());
    }

    protected AbstractDependency(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void stop() {
        if (!stopSignal.stop()) {
            LOG.warn("{}: stop() called on an already stopped dependency", id());
            return;
        }
        LOG.debug("{}: stopped", id());
    }

    @Override
    public boolean isStopped() {
        return stopSignal.isStopped();
    }

    @Override
    public void setOptions(QueryOptions options) {
        this.options = options == null ? QueryOptions.EMPTY : options;
    }

    protected QueryOptions options() {
        return options;
    }

    protected void checkStopped() {
        if (stopSignal.isStopped()) {
            throw new DependencyStoppedException(id());
        }
    }

    @Override
    public String toString() {
        return id();
    }
}
