package com.krickert.yappy.watch.view;

import com.krickert.yappy.watch.dependency.BlockingQueryEmulator;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.Dependency;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.dependency.QueryOptions;
import com.krickert.yappy.watch.dependency.StopSignal;
import com.krickert.yappy.watch.exception.BackendResponseException;
import com.krickert.yappy.watch.exception.DependencyStoppedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ConnectException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls one dependency on its own thread and keeps the latest value.
 * <p>
 * Each fetch carries the last seen index, so blocking backends only answer on change. A result
 * is ignored when its index is unchanged, when the index went backwards (the stored index resets
 * to 0), when the data equals what is stored, or when a blocking query returned nothing.
 * Updates are spaced at least {@link #MIN_DELAY_BETWEEN_UPDATES} apart. Failures are retried
 * according to the {@link RetryPolicy}; a failed fetch never replaces the stored value.
 */
public class DependencyView<T> {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyView.class);

    static final Duration MIN_DELAY_BETWEEN_UPDATES = Duration.ofMillis(100);
    private static final long MAX_DITHER_NANOS = Duration.ofMillis(20).toNanos();

    private final Dependency<T> dependency;
    private final Clients clients;
    private final ViewListener<T> listener;
    private final RetryPolicy retryPolicy;
    private final Duration blockWaitTime;
    private final Duration maxStale;
    private final Duration defaultLease;
    private final BlockingQueryEmulator sleeper;
    private final StopSignal stopSignal = new StopSignal();
    private final AtomicBoolean polling = new AtomicBoolean(false);

    private final Object lock = new Object();
    private T data;
    private boolean receivedData;
    private long lastIndex;

    private DependencyView(Builder<T> builder) {
        this.dependency = Objects.requireNonNull(builder.dependency, "dependency");
        this.clients = Objects.requireNonNull(builder.clients, "clients");
        this.listener = builder.listener;
        this.retryPolicy = builder.retryPolicy;
        this.blockWaitTime = builder.blockWaitTime;
        this.maxStale = builder.maxStale;
        this.defaultLease = builder.defaultLease;
        this.sleeper = builder.sleeper;
    }

    public static <T> Builder<T> builder(Dependency<T> dependency, Clients clients) {
        return new Builder<>(dependency, clients);
    }

    /**
     * Starts polling on {@code executor}. A view that is already polling is left alone.
     */
    public void start(ExecutorService executor) {
        if (!polling.compareAndSet(false, true)) {
            LOG.debug("{}: already polling", id());
            return;
        }
        executor.execute(() -> {
            try {
                poll();
            } finally {
                polling.set(false);
            }
        });
    }

    /**
     * Stops the dependency and the poll loop. The stored value stays readable.
     */
    public void stop() {
        dependency.stop();
        stopSignal.stop();
    }

    public String id() {
        return dependency.id();
    }

    public Dependency<T> dependency() {
        return dependency;
    }

    public T data() {
        synchronized (lock) {
            return data;
        }
    }

    public boolean hasData() {
        synchronized (lock) {
            return receivedData;
        }
    }

    public long lastIndex() {
        synchronized (lock) {
            return lastIndex;
        }
    }

    public boolean isPolling() {
        return polling.get();
    }

    void poll() {
        int retries = 0;
        while (!stopSignal.isStopped()) {
            try {
                T value = fetchUntilChanged();
                retries = 0;
                listener.onData(id(), value);
            } catch (DependencyStoppedException e) {
                LOG.debug("{}: stopped", id());
                return;
            } catch (RuntimeException e) {
                if (stopSignal.isStopped()) {
                    return;
                }
                if (isConnectionRefused(e)) {
                    synchronized (lock) {
                        lastIndex = 0;
                    }
                }
                if (retryPolicy != null && !isBadRequest(e)) {
                    RetryPolicy.Decision decision = retryPolicy.next(retries);
                    if (decision.retry()) {
                        LOG.warn("{}: fetch failed (attempt {}), retrying in {}: {}",
                                id(), retries + 1, decision.sleep(), e.getMessage());
                        listener.onRetry(id(), retries + 1, decision.sleep(), e);
                        try {
                            sleeper.pause(id(), decision.sleep(), stopSignal);
                        } catch (DependencyStoppedException stopped) {
                            return;
                        }
                        retries++;
                        continue;
                    }
                    LOG.error("{}: giving up after {} retries", id(), retries, e);
                } else {
                    LOG.error("{}: fetch failed", id(), e);
                }
                listener.onError(id(), e);
                return;
            }
        }
    }

    /**
     * Fetches until a result worth reporting arrives, stores it and returns it.
     */
    T fetchUntilChanged() {
        boolean allowStale = !maxStale.isZero();
        while (true) {
            if (stopSignal.isStopped()) {
                throw new DependencyStoppedException(id());
            }
            long start = System.nanoTime();
            dependency.setOptions(QueryOptions.builder()
                    .allowStale(allowStale)
                    .waitTime(blockWaitTime)
                    .waitIndex(lastIndex())
                    .defaultLease(defaultLease)
                    .build());

            LOG.trace("{}: fetching", id());
            FetchResult<T> result = dependency.fetch(clients);
            long index = result.metadata().lastIndex();

            if (allowStale && result.metadata().lastContact().compareTo(maxStale) > 0) {
                LOG.debug("{}: stale data (last contact {}), retrying against the leader",
                        id(), result.metadata().lastContact());
                allowStale = false;
                continue;
            }
            allowStale = !maxStale.isZero();

            rateLimit(start);

            synchronized (lock) {
                if (index == lastIndex) {
                    LOG.trace("{}: same index, no new data", id());
                    continue;
                }
                if (Long.compareUnsigned(index, lastIndex) < 0) {
                    LOG.debug("{}: index went from {} to {}, resetting", id(), lastIndex, index);
                    lastIndex = 0;
                    continue;
                }
                lastIndex = index;

                T value = result.value();
                if (receivedData && Objects.equals(value, data)) {
                    LOG.trace("{}: no new data", id());
                    continue;
                }
                if (dependency.isBlockingQuery() && isEmpty(value)) {
                    LOG.trace("{}: nothing yet, waiting", id());
                    continue;
                }
                data = value;
                receivedData = true;
                LOG.debug("{}: new data at index {}", id(), index);
                return value;
            }
        }
    }

    private void rateLimit(long startNanos) {
        long remaining = MIN_DELAY_BETWEEN_UPDATES.toNanos() - (System.nanoTime() - startNanos);
        if (remaining > 0) {
            long dither = ThreadLocalRandom.current().nextLong(MAX_DITHER_NANOS);
            sleeper.pause(id(), Duration.ofNanos(remaining + dither), stopSignal);
        }
    }

    private static boolean isEmpty(Object value) {
        return value == null || (value instanceof Optional && ((Optional<?>) value).isEmpty());
    }

    static boolean isBadRequest(Throwable error) {
        for (Throwable t = error; t != null && t.getCause() != t; t = t.getCause()) {
            if (t instanceof BackendResponseException && ((BackendResponseException) t).isBadRequest()) {
                return true;
            }
        }
        return false;
    }

    static boolean isConnectionRefused(Throwable error) {
        for (Throwable t = error; t != null && t.getCause() != t; t = t.getCause()) {
            if (t instanceof ConnectException) {
                return true;
            }
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("connection refused")) {
                return true;
            }
        }
        return false;
    }

    public static final class Builder<T> {
        private final Dependency<T> dependency;
        private final Clients clients;
        private ViewListener<T> listener = ViewListener.noop();
        private RetryPolicy retryPolicy;
        private Duration blockWaitTime = Duration.ofMinutes(1);
        private Duration maxStale = Duration.ZERO;
        private Duration defaultLease = Duration.ofMinutes(5);
        private BlockingQueryEmulator sleeper = new BlockingQueryEmulator();

        private Builder(Dependency<T> dependency, Clients clients) {
            this.dependency = dependency;
            this.clients = clients;
        }

        public Builder<T> listener(ViewListener<T> listener) {
            this.listener = listener == null ? ViewListener.noop() : listener;
            return this;
        }

        /**
         * {@code null} disables retries: the first failure is reported and polling ends.
         */
        public Builder<T> retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder<T> blockWaitTime(Duration blockWaitTime) {
            this.blockWaitTime = blockWaitTime;
            return this;
        }

        /**
         * Longest acceptable staleness of a non-leader read. Zero disables stale reads.
         */
        public Builder<T> maxStale(Duration maxStale) {
            this.maxStale = maxStale;
            return this;
        }

        public Builder<T> defaultLease(Duration defaultLease) {
            this.defaultLease = defaultLease;
            return this;
        }

        public Builder<T> sleeper(BlockingQueryEmulator sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public DependencyView<T> build() {
            return new DependencyView<>(this);
        }
    }
}
