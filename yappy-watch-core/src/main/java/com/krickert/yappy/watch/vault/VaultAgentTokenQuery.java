package com.krickert.yappy.watch.vault;

import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.exception.DependencyFetchException;
import com.krickert.yappy.watch.file.FileChangeWatcher;
import com.krickert.yappy.watch.file.FileSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Watches the token file written by a vault agent and installs every new token on the vault
 * client. The fetched value is always the empty string.
 */
public class VaultAgentTokenQuery extends AbstractDependency<String> {

    private static final Logger LOG = LoggerFactory.getLogger(VaultAgentTokenQuery.class);

    public static final Duration POLL_INTERVAL = Duration.ofSeconds(15);

    private final FileChangeWatcher watcher;
    private FileSnapshot lastSnapshot;

    public VaultAgentTokenQuery(Path tokenFile) {
        this(new FileChangeWatcher(tokenFile, POLL_INTERVAL), Clock.systemUTC());
    }

    public VaultAgentTokenQuery(FileChangeWatcher watcher, Clock clock) {
        super(clock);
        this.watcher = watcher;
    }

    @Override
    public FetchResult<String> fetch(Clients clients) {
        checkStopped();
        FileSnapshot snapshot = watcher.awaitChange(id(), lastSnapshot, stopSignal);
        String token;
        try {
            token = new String(Files.readAllBytes(watcher.path()), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new DependencyFetchException(id(), e);
        }
        lastSnapshot = snapshot;
        clients.vault().setToken(token);
        LOG.info("{}: vault token updated from {}", id(), watcher.path());
        return FetchResult.synthetic("", clock);
    }

    @Override
    public String id() {
        return "vault-agent.token";
    }

    @Override
    public boolean canShare() {
        return false;
    }
}
