package com.krickert.yappy.watch.vault;

import com.krickert.yappy.watch.dependency.StopSignal;
import com.krickert.yappy.watch.exception.DependencyStoppedException;
import com.krickert.yappy.watch.exception.LeaseExpiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps a renewable secret alive until its lease can no longer be extended.
 * <p>
 * Each renewal response is merged into the stored secret. The loop returns normally when the
 * renewal stream completes or fails after at least one successful renewal, so the caller can
 * fetch a fresh secret. A {@link LeaseExpiredException} before any renewal went through is
 * rethrown. A stop cancels the renewer.
 */
public class LeaseRenewalLoop {

    private static final Logger LOG = LoggerFactory.getLogger(LeaseRenewalLoop.class);

    public void renew(String dependencyId, VaultClient vault, VaultSecret rawSecret,
                      VaultSecret storedSecret, StopSignal stopSignal) {
        if (stopSignal.isStopped()) {
            throw new DependencyStoppedException(dependencyId);
        }
        AtomicInteger renewed = new AtomicInteger();
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Mono<Boolean> renewing = vault.renewals(rawSecret)
                .doOnNext(renewal -> {
                    storedSecret.mergeFrom(renewal);
                    renewed.incrementAndGet();
                    LOG.debug("{}: lease renewed for {}s", dependencyId, renewal.getAuth() != null
                            ? renewal.getAuth().getLeaseDuration() : renewal.getLeaseDuration());
                })
                .then(Mono.just(Boolean.TRUE))
                .onErrorResume(e -> {
                    failure.set(e);
                    return Mono.just(Boolean.TRUE);
                });
        Mono<Boolean> stopped = stopSignal.asMono().thenReturn(Boolean.FALSE);

        Boolean finished = Mono.firstWithSignal(renewing, stopped).block();
        if (!Boolean.TRUE.equals(finished)) {
            throw new DependencyStoppedException(dependencyId);
        }

        Throwable error = failure.get();
        if (error == null) {
            LOG.debug("{}: renewal finished after {} renewals", dependencyId, renewed.get());
            return;
        }
        if (error instanceof LeaseExpiredException && renewed.get() == 0) {
            throw (LeaseExpiredException) error;
        }
        LOG.debug("{}: renewal ended after {} renewals: {}", dependencyId, renewed.get(), error.getMessage());
    }
}
