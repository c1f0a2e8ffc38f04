package com.krickert.yappy.watch.vault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Works out how long a vault dependency should wait before it next touches its secret.
 * <p>
 * The base lease comes from the secret's shape:
 * <ol>
 *     <li>the lease duration, or the auth lease duration when that is positive;</li>
 *     <li>for a certificate without a lease id, {@code expiration - now};</li>
 *     <li>for an AppRole {@code secret_id} without a lease id, {@code secret_id_ttl + 1} when positive;</li>
 *     <li>for a secret with a {@code rotation_period} and no lease id, {@code ttl + 1} when positive.
 *     Such a secret is rotating.</li>
 * </ol>
 * Renewable secrets wait a third of the base, stretched by up to half again. Other secrets wait
 * 85-95% of the base, except rotating ones which wait exactly the base. With jitter disabled no
 * randomness is applied.
 */
public class LeaseWaitCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(LeaseWaitCalculator.class);

    private final Clock clock;
    private final DoubleSupplier random;
    private final boolean jitter;

    /**
     * @param random source of uniform values in {@code [0, 1)}
     * @param jitter whether to randomise waits
     */
    public LeaseWaitCalculator(Clock clock, DoubleSupplier random, boolean jitter) {
        this.clock = clock;
        this.random = random;
        this.jitter = jitter;
    }

    public static LeaseWaitCalculator withJitter(Clock clock) {
        return new LeaseWaitCalculator(clock, () -> ThreadLocalRandom.current().nextDouble(), true);
    }

    public static LeaseWaitCalculator withoutJitter(Clock clock) {
        return new LeaseWaitCalculator(clock, () -> 0.0, false);
    }

    public Duration leaseCheckWait(VaultSecret secret) {
        Lease lease = classify(secret);
        double sleepSeconds = lease.baseSeconds();
        if (secret.isEffectivelyRenewable()) {
            sleepSeconds = sleepSeconds / 3.0;
            if (jitter) {
                sleepSeconds = sleepSeconds * (1.0 + random.getAsDouble() * 0.5);
            }
        } else if (!lease.rotating() && jitter) {
            sleepSeconds = sleepSeconds * (0.85 + random.getAsDouble() * 0.1);
        }
        return Duration.ofNanos((long) (sleepSeconds * 1_000_000_000L));
    }

    Lease classify(VaultSecret secret) {
        long base = secret.getLeaseDuration();
        if (secret.getAuth() != null && secret.getAuth().getLeaseDuration() > 0) {
            base = secret.getAuth().getLeaseDuration();
        }

        Map<String, Object> data = secret.getData() == null ? Map.of() : secret.getData();
        boolean noLease = !secret.hasLeaseId();

        if (noLease && data.containsKey("certificate")) {
            Long expiration = asLong(data.get("expiration"));
            if (expiration != null) {
                base = expiration - clock.instant().getEpochSecond();
            }
        }

        if (noLease && data.containsKey("secret_id")) {
            Long ttl = asLong(data.get("secret_id_ttl"));
            if (ttl != null && ttl > 0) {
                base = ttl + 1;
                LOG.debug("Found approle secret_id with secret_id_ttl, using a lease of {} seconds", base);
            }
        }

        boolean rotating = false;
        if (noLease && data.containsKey("rotation_period")) {
            Long ttl = asLong(data.get("ttl"));
            if (ttl != null && ttl > 0) {
                base = ttl + 1;
                rotating = true;
            }
        }
        return new Lease(base, rotating);
    }

    private static Long asLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return new BigDecimal(((String) value).trim()).longValue();
            } catch (NumberFormatException e) {
                LOG.debug("Ignoring non-numeric lease field value '{}'", value);
                return null;
            }
        }
        return null;
    }

    record Lease(long baseSeconds, boolean rotating) {
    }
}
