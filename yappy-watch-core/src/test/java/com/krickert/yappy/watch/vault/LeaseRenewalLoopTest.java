package com.krickert.yappy.watch.vault;

import com.krickert.yappy.watch.dependency.StopSignal;
import com.krickert.yappy.watch.exception.BackendResponseException;
import com.krickert.yappy.watch.exception.DependencyStoppedException;
import com.krickert.yappy.watch.exception.LeaseExpiredException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeaseRenewalLoopTest {

    private static final String ID = "vault.read(database/creds/app)";

    @Mock
    private VaultClient vault;

    private final LeaseRenewalLoop loop = new LeaseRenewalLoop();
    private final StopSignal stopSignal = new StopSignal();

    private static VaultSecret lease(int seconds) {
        VaultSecret secret = new VaultSecret();
        secret.setLeaseId("database/creds/app/1");
        secret.setLeaseDuration(seconds);
        secret.setRenewable(true);
        return secret;
    }

    @Test
    void mergesEveryRenewalIntoTheStoredSecret() {
        VaultSecret raw = lease(60);
        VaultSecret stored = lease(60);
        when(vault.renewals(raw)).thenReturn(Flux.just(lease(50), lease(40)));

        loop.renew(ID, vault, raw, stored, stopSignal);

        assertEquals(40, stored.getLeaseDuration());
        assertEquals("database/creds/app/1", stored.getLeaseId());
    }

    @Test
    void leaseExpiryBeforeAnyRenewalIsRethrown() {
        VaultSecret raw = lease(60);
        when(vault.renewals(raw)).thenReturn(Flux.error(new LeaseExpiredException("lease expired or not renewable")));

        assertThrows(LeaseExpiredException.class, () -> loop.renew(ID, vault, raw, lease(60), stopSignal));
    }

    @Test
    void failureAfterARenewalEndsTheLoopQuietly() {
        VaultSecret raw = lease(60);
        VaultSecret stored = lease(60);
        when(vault.renewals(raw)).thenReturn(Flux.concat(
                Flux.just(lease(30)),
                Flux.error(new LeaseExpiredException("lease expired or not renewable"))));

        assertDoesNotThrow(() -> loop.renew(ID, vault, raw, stored, stopSignal));
        assertEquals(30, stored.getLeaseDuration());
    }

    @Test
    void otherFailuresAreNotRethrown() {
        VaultSecret raw = lease(60);
        when(vault.renewals(raw)).thenReturn(Flux.error(new BackendResponseException(503, "sealed")));

        assertDoesNotThrow(() -> loop.renew(ID, vault, raw, lease(60), stopSignal));
    }

    @Test
    void stopCancelsTheRenewer() {
        VaultSecret raw = lease(60);
        AtomicBoolean subscribed = new AtomicBoolean();
        AtomicBoolean cancelled = new AtomicBoolean();
        when(vault.renewals(raw)).thenReturn(Flux.<VaultSecret>never()
                .doOnSubscribe(s -> subscribed.set(true))
                .doOnCancel(() -> cancelled.set(true)));

        CompletableFuture<Void> running = CompletableFuture.runAsync(
                () -> loop.renew(ID, vault, raw, lease(60), stopSignal));
        await().atMost(Duration.ofSeconds(5)).untilTrue(subscribed);
        stopSignal.stop();

        ExecutionException e = assertThrows(ExecutionException.class, () -> running.get(5, TimeUnit.SECONDS));
        assertInstanceOf(DependencyStoppedException.class, e.getCause());
        assertTrue(cancelled.get());
    }

    @Test
    void alreadyStoppedNeverStartsRenewing() {
        stopSignal.stop();

        assertThrows(DependencyStoppedException.class, () -> loop.renew(ID, vault, lease(60), lease(60), stopSignal));
        verifyNoInteractions(vault);
    }
}
