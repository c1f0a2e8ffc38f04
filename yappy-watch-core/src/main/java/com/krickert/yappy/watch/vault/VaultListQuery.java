package com.krickert.yappy.watch.vault;

import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.BlockingQueryEmulator;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.exception.MalformedResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lists the keys under a secret path, sorted. Repeat polls wait the default lease first.
 */
public class VaultListQuery extends AbstractDependency<List<String>> {

    private static final Logger LOG = LoggerFactory.getLogger(VaultListQuery.class);

    private final String path;
    private final BlockingQueryEmulator emulator;

    public VaultListQuery(String path) {
        this(path, new BlockingQueryEmulator(), Clock.systemUTC());
    }

    public VaultListQuery(String path, BlockingQueryEmulator emulator, Clock clock) {
        super(clock);
        this.path = VaultReadQuery.trimPath(path, "vault.list");
        this.emulator = emulator;
    }

    @Override
    public FetchResult<List<String>> fetch(Clients clients) {
        checkStopped();
        emulator.pauseIfPolled(id(), options(), options().defaultLease(), stopSignal);

        VaultClient vault = clients.vault();
        String listPath = path;
        Optional<MountInfo> mount = mountInfo(vault);
        if (mount.isPresent() && mount.get().isKvV2()) {
            listPath = KvV2Paths.normalize(path, mount.get().path(), KvV2Purpose.METADATA);
        }
        String target = listPath;
        VaultSecret listed = stopSignal.race(id(), () -> vault.list(target));
        return FetchResult.synthetic(keysOf(listed), clock);
    }

    private Optional<MountInfo> mountInfo(VaultClient vault) {
        try {
            return stopSignal.race(id(), () -> vault.mountInfo(path));
        } catch (RuntimeException e) {
            if (isStopped()) {
                throw e;
            }
            LOG.debug("{}: mount lookup failed, listing {} as KV v1: {}", id(), path, e.getMessage());
            return Optional.empty();
        }
    }

    private List<String> keysOf(VaultSecret listed) {
        if (listed == null || listed.getData() == null || !listed.getData().containsKey("keys")) {
            return List.of();
        }
        Object keys = listed.getData().get("keys");
        if (!(keys instanceof List)) {
            throw new MalformedResponseException(id(), "unexpected response");
        }
        List<String> result = new ArrayList<>();
        for (Object key : (List<?>) keys) {
            if (!(key instanceof String)) {
                throw new MalformedResponseException(id(), "non-string in list");
            }
            result.add((String) key);
        }
        result.sort(null);
        return List.copyOf(result);
    }

    @Override
    public String id() {
        return "vault.list(" + path + ")";
    }

    @Override
    public boolean canShare() {
        return false;
    }
}
