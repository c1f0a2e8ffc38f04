package com.krickert.yappy.watch.vault;

import com.krickert.yappy.watch.dependency.BlockingQueryEmulator;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.exception.DependencyFetchException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a secret. The path may carry a query string, e.g. {@code secret/app?version=3}.
 * <p>
 * KV v2 mounts are detected on the first fetch and the path is rewritten under {@code data/}.
 * A missing or deleted secret is a fetch failure.
 */
public class VaultReadQuery extends AbstractVaultDependency<VaultSecret> {

    private final String rawPath;
    private final Map<String, List<String>> queryValues;
    private String secretPath;

    public VaultReadQuery(String path) {
        this(path, LeaseWaitCalculator.withJitter(Clock.systemUTC()), new BlockingQueryEmulator(),
                new LeaseRenewalLoop(), Clock.systemUTC());
    }

    public VaultReadQuery(String path, LeaseWaitCalculator leaseWait, BlockingQueryEmulator emulator,
                          LeaseRenewalLoop renewalLoop, Clock clock) {
        super(leaseWait, emulator, renewalLoop, clock);
        String trimmed = trimPath(path, "vault.read");
        int q = trimmed.indexOf('?');
        this.rawPath = q < 0 ? trimmed : trimmed.substring(0, q);
        this.queryValues = q < 0 ? Map.of() : parseQuery(trimmed.substring(q + 1));
    }

    @Override
    public FetchResult<VaultSecret> fetch(Clients clients) {
        checkStopped();
        sleepIfScheduled();
        renewIfRenewable(clients);

        VaultClient vault = clients.vault();
        if (secretPath == null) {
            Optional<MountInfo> mount = kvV2Mount(vault, rawPath);
            secretPath = mount.map(m -> KvV2Paths.normalize(rawPath, m.path(), KvV2Purpose.DATA))
                    .orElse(rawPath);
        }

        VaultSecret raw = stopSignal.race(id(), () -> vault.read(secretPath, queryValues));
        if (raw == null || isDeletedKvV2(raw)) {
            throw new DependencyFetchException(id(), "no secret exists at " + secretPath);
        }
        store(raw);
        scheduleNextSleep();
        return FetchResult.synthetic(secret, clock);
    }

    @Override
    public String id() {
        List<String> version = queryValues.get("version");
        if (version != null && !version.isEmpty()) {
            return "vault.read(" + rawPath + ".v" + version.get(0) + ")";
        }
        return "vault.read(" + rawPath + ")";
    }

    @Override
    public boolean canShare() {
        return false;
    }

    String secretPath() {
        return secretPath;
    }

    @SuppressWarnings("unchecked")
    static boolean isDeletedKvV2(VaultSecret secret) {
        if (secret.getData() == null || !(secret.getData().get("metadata") instanceof Map)) {
            return false;
        }
        Object deletionTime = ((Map<String, Object>) secret.getData().get("metadata")).get("deletion_time");
        return deletionTime instanceof String && !((String) deletionTime).isEmpty();
    }

    static String trimPath(String path, String kind) {
        String s = path == null ? "" : path.trim();
        while (s.startsWith("/")) {
            s = s.substring(1);
        }
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        if (s.isEmpty()) {
            throw new IllegalArgumentException(kind + ": invalid format: \"" + path + "\"");
        }
        return s;
    }

    private static Map<String, List<String>> parseQuery(String query) {
        Map<String, List<String>> values = new LinkedHashMap<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            values.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }
        return values;
    }
}
