package com.krickert.yappy.watch.vault;

import com.krickert.yappy.watch.dependency.BlockingQueryEmulator;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.exception.DependencyFetchException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Writes data to a secret path and yields the secret the store answers with (dynamic credentials,
 * signed certificates). When the store answers with nothing, the previous secret is returned.
 * <p>
 * The id includes a short hash of the data so different writes to one path are distinct.
 */
public class VaultWriteQuery extends AbstractVaultDependency<VaultSecret> {

    private final String path;
    private final Map<String, Object> data;
    private final String dataHash;

    public VaultWriteQuery(String path, Map<String, Object> data) {
        this(path, data, LeaseWaitCalculator.withJitter(Clock.systemUTC()), new BlockingQueryEmulator(),
                new LeaseRenewalLoop(), Clock.systemUTC());
    }

    public VaultWriteQuery(String path, Map<String, Object> data, LeaseWaitCalculator leaseWait,
                           BlockingQueryEmulator emulator, LeaseRenewalLoop renewalLoop, Clock clock) {
        super(leaseWait, emulator, renewalLoop, clock);
        this.path = VaultReadQuery.trimPath(path, "vault.write");
        this.data = data == null ? Map.of() : new HashMap<>(data);
        this.dataHash = sha1Prefix(this.data);
    }

    @Override
    public FetchResult<VaultSecret> fetch(Clients clients) {
        checkStopped();
        sleepIfScheduled();
        renewIfRenewable(clients);

        VaultClient vault = clients.vault();
        Optional<MountInfo> mount = kvV2Mount(vault, path);
        String writePath = mount.map(m -> KvV2Paths.normalize(path, m.path(), KvV2Purpose.DATA)).orElse(path);
        Map<String, Object> body = mount.isPresent() ? Map.of("data", data) : data;

        VaultSecret raw = stopSignal.race(id(), () -> vault.write(writePath, body));
        if (raw == null) {
            if (mount.isPresent()) {
                throw new DependencyFetchException(id(), "no secret exists at " + writePath);
            }
            return FetchResult.synthetic(secret, clock);
        }
        store(raw);
        scheduleNextSleep();
        return FetchResult.synthetic(secret, clock);
    }

    @Override
    public String id() {
        return "vault.write(" + path + " -> " + dataHash + ")";
    }

    @Override
    public boolean canShare() {
        return false;
    }

    /**
     * First four bytes, hex encoded, of the SHA-1 over the entries sorted by key.
     */
    static String sha1Prefix(Map<String, Object> data) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
        new TreeMap<>(data).forEach((k, v) ->
                digest.update((k + "=" + quote(String.valueOf(v))).getBytes(StandardCharsets.UTF_8)));
        byte[] hash = digest.digest();
        StringBuilder hex = new StringBuilder();
        for (int i = 0; i < 4; i++) {
            hex.append(String.format("%02x", hash[i]));
        }
        return hex.toString();
    }

    private static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
