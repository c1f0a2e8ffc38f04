package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.exception.NoLeaderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * Blocks until the discovery cluster reports a leader.
 * <p>
 * The wait between attempts starts at one second and doubles; once the next wait would exceed
 * the ceiling the wait gives up with {@link NoLeaderException}. I/O failures other than timeouts
 * are permanent and rethrown at once; any other failure is retried.
 */
public class LeaderWait {

    private static final Logger LOG = LoggerFactory.getLogger(LeaderWait.class);

    static final Duration INITIAL_RETRY = Duration.ofSeconds(1);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Sleeper sleeper;

    public LeaderWait() {
        this(duration -> Thread.sleep(duration.toMillis()));
    }

    public LeaderWait(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public void await(DiscoveryClient client, Duration ceiling) {
        Duration retry = INITIAL_RETRY;
        while (true) {
            String leader = "";
            try {
                leader = client.leaderStatus();
            } catch (RuntimeException e) {
                if (isPermanent(e)) {
                    throw e;
                }
                LOG.debug("Leader lookup failed, will retry: {}", e.getMessage());
            }
            if (leader != null && !leader.isEmpty()) {
                LOG.debug("Consul leader is {}", leader);
                return;
            }
            retry = retry.multipliedBy(2);
            if (retry.compareTo(ceiling) > 0) {
                throw new NoLeaderException("no consul leader detected");
            }
            LOG.info("No consul leader yet, retrying in {}", retry);
            try {
                sleeper.sleep(retry);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NoLeaderException("interrupted while waiting for a consul leader", e);
            }
        }
    }

    static boolean isPermanent(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException) {
                return false;
            }
            if (t instanceof IOException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
