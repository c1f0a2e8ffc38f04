package com.krickert.yappy.watch.vault;

import com.krickert.yappy.watch.dependency.BlockingQueryEmulator;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.exception.LeaseExpiredException;

import java.time.Clock;
import java.time.Duration;

/**
 * Keeps the client's own token alive. A fetch renews for as long as the store allows and then
 * fails with {@link LeaseExpiredException}; it never produces a value.
 * <p>
 * The token's TTL is unknown up front, so renewals leave the increment to the server.
 */
public class VaultTokenQuery extends AbstractVaultDependency<Void> {

    public VaultTokenQuery(String token) {
        this(token, new LeaseRenewalLoop());
    }

    public VaultTokenQuery(String token, LeaseRenewalLoop renewalLoop) {
        super(LeaseWaitCalculator.withJitter(Clock.systemUTC()), new BlockingQueryEmulator(), renewalLoop,
                Clock.systemUTC());
        SecretAuth auth = new SecretAuth();
        auth.setClientToken(token);
        auth.setRenewable(true);
        VaultSecret raw = new VaultSecret();
        raw.setAuth(auth);
        this.rawSecret = raw;
        this.secret = VaultSecret.transform(raw, Duration.ZERO);
    }

    @Override
    public FetchResult<Void> fetch(Clients clients) {
        checkStopped();
        renewIfRenewable(clients);
        throw new LeaseExpiredException(id() + ": lease expired");
    }

    @Override
    public String id() {
        return "vault.token";
    }

    @Override
    public boolean canShare() {
        return false;
    }
}
