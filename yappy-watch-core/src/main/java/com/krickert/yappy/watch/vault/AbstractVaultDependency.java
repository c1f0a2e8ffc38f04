package com.krickert.yappy.watch.vault;

import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.BlockingQueryEmulator;
import com.krickert.yappy.watch.dependency.Clients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Secret-holding dependencies: the stored secret, its raw counterpart handed to the renewer,
 * and the wait that one fetch schedules for the next.
 * <p>
 * A fetch runs, in order: the scheduled wait, the renewal loop when the stored secret is
 * renewable, the actual read or write, and finally scheduling the next wait for secrets that
 * cannot be renewed.
 */
public abstract class AbstractVaultDependency<T> extends AbstractDependency<T> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractVaultDependency.class);

    protected final LeaseWaitCalculator leaseWait;
    protected final BlockingQueryEmulator emulator;
    protected final LeaseRenewalLoop renewalLoop;

    protected VaultSecret secret;
    protected VaultSecret rawSecret;
    private Duration pendingSleep;

    protected AbstractVaultDependency(LeaseWaitCalculator leaseWait, BlockingQueryEmulator emulator,
                                      LeaseRenewalLoop renewalLoop, Clock clock) {
        super(clock);
        this.leaseWait = leaseWait;
        this.emulator = emulator;
        this.renewalLoop = renewalLoop;
    }

    protected void sleepIfScheduled() {
        Duration sleep = pendingSleep;
        pendingSleep = null;
        if (sleep != null) {
            emulator.pause(id(), sleep, stopSignal);
        }
    }

    protected void renewIfRenewable(Clients clients) {
        if (secret != null && secret.isEffectivelyRenewable()) {
            renewalLoop.renew(id(), clients.vault(), rawSecret, secret, stopSignal);
        }
    }

    protected void scheduleNextSleep() {
        if (secret != null && !secret.isEffectivelyRenewable()) {
            pendingSleep = leaseWait.leaseCheckWait(secret);
            LOG.debug("{}: next fetch in {}", id(), pendingSleep);
        }
    }

    protected void store(VaultSecret raw) {
        this.rawSecret = raw;
        this.secret = VaultSecret.transform(raw, options().defaultLease());
    }

    /**
     * Mount metadata for {@code path} when it is on a KV v2 mount. Lookup failures are treated as
     * "not v2".
     */
    protected Optional<MountInfo> kvV2Mount(VaultClient vault, String path) {
        try {
            return stopSignal.race(id(), () -> vault.mountInfo(path))
                    .filter(MountInfo::isKvV2);
        } catch (RuntimeException e) {
            if (isStopped()) {
                throw e;
            }
            LOG.debug("{}: mount lookup for {} failed, assuming KV v1: {}", id(), path, e.getMessage());
            return Optional.empty();
        }
    }

    Duration pendingSleep() {
        return pendingSleep;
    }

    public VaultSecret secret() {
        return secret;
    }
}
