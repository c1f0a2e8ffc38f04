package com.krickert.yappy.watch.vault;

import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The secret-store operations dependencies need. Calls throw unchecked exceptions on transport
 * failures; "nothing at this path" is a {@code null} secret.
 */
public interface VaultClient extends AutoCloseable {

    VaultSecret read(String path, Map<String, List<String>> query);

    VaultSecret write(String path, Map<String, Object> data);

    VaultSecret list(String path);

    /**
     * Renews {@code secret} repeatedly, emitting each renewal response, until the lease can no
     * longer be extended. Emits {@link com.krickert.yappy.watch.exception.LeaseExpiredException}
     * when the store reports the lease as unknown or not renewable. Cancelling the subscription
     * stops renewing.
     */
    Flux<VaultSecret> renewals(VaultSecret secret);

    /**
     * Mount metadata for {@code path}, or empty when the store does not expose it (old servers,
     * anonymous access).
     */
    Optional<MountInfo> mountInfo(String path);

    String token();

    void setToken(String token);

    /**
     * Exchanges a response-wrapping token for the secret it wraps.
     */
    VaultSecret unwrap(String wrappingToken);

    @Override
    void close();
}
