package com.krickert.yappy.watch.clients;

import com.krickert.yappy.watch.consul.DiscoveryClient;
import com.krickert.yappy.watch.consul.LeaderWait;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.vault.VaultClient;
import com.krickert.yappy.watch.vault.VaultSecret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The Consul and Vault clients shared by every dependency.
 * <p>
 * Clients are created on demand from a {@link CreateClientInput}; creating one again replaces the
 * previous one. Reads take the read lock so many dependencies can fetch concurrently while a
 * client is swapped under the write lock.
 */
public class ClientSet implements Clients {

    private static final Logger LOG = LoggerFactory.getLogger(ClientSet.class);

    static final Duration LEADER_WAIT_CEILING = Duration.ofMinutes(1);

    private final BackendConnector connector;
    private final LeaderWait leaderWait;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private DiscoveryClient discovery;
    private VaultClient vault;

    public ClientSet(BackendConnector connector) {
        this(connector, new LeaderWait());
    }

    public ClientSet(BackendConnector connector, LeaderWait leaderWait) {
        this.connector = connector;
        this.leaderWait = leaderWait;
    }

    /**
     * Creates the Consul client and blocks until the cluster has a leader.
     *
     * @throws com.krickert.yappy.watch.exception.NoLeaderException when no leader shows up in time
     */
    public void createConsulClient(CreateClientInput input) {
        DiscoveryClient client;
        try {
            client = connector.connectConsul(input);
        } catch (RuntimeException e) {
            throw new ClientSetupException("client set: consul: " + e.getMessage(), e);
        }
        try {
            leaderWait.await(client, LEADER_WAIT_CEILING);
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }

        DiscoveryClient previous;
        lock.writeLock().lock();
        try {
            previous = discovery;
            discovery = client;
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null) {
            previous.close();
        }
        LOG.info("Consul client ready: {}", input);
    }

    /**
     * Creates the Vault client, exchanging a wrapped token first when the input asks for it.
     */
    public void createVaultClient(CreateClientInput input) {
        VaultClient client;
        try {
            client = connector.connectVault(input);
        } catch (RuntimeException e) {
            throw new ClientSetupException("client set: vault: " + e.getMessage(), e);
        }
        try {
            if (!input.token().isEmpty()) {
                client.setToken(input.token());
                if (input.unwrapToken()) {
                    client.setToken(unwrap(client, input.token()));
                }
            }
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }

        VaultClient previous;
        lock.writeLock().lock();
        try {
            previous = vault;
            vault = client;
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null) {
            previous.close();
        }
        LOG.info("Vault client ready: {}", input);
    }

    @Override
    public DiscoveryClient discovery() {
        lock.readLock().lock();
        try {
            if (discovery == null) {
                throw new IllegalStateException("client set: consul client has not been created");
            }
            return discovery;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public VaultClient vault() {
        lock.readLock().lock();
        try {
            if (vault == null) {
                throw new IllegalStateException("client set: vault client has not been created");
            }
            return vault;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Closes both clients. Safe to call more than once.
     */
    public void stop() {
        DiscoveryClient oldDiscovery;
        VaultClient oldVault;
        lock.writeLock().lock();
        try {
            oldDiscovery = discovery;
            oldVault = vault;
            discovery = null;
            vault = null;
        } finally {
            lock.writeLock().unlock();
        }
        if (oldDiscovery != null) {
            oldDiscovery.close();
        }
        if (oldVault != null) {
            oldVault.close();
        }
        LOG.debug("Client set stopped");
    }

    private static String unwrap(VaultClient client, String wrappingToken) {
        VaultSecret secret;
        try {
            secret = client.unwrap(wrappingToken);
        } catch (RuntimeException e) {
            throw new ClientSetupException("client set: vault unwrap: " + e.getMessage(), e);
        }
        if (secret == null) {
            throw new ClientSetupException("client set: vault unwrap: no secret");
        }
        if (secret.getAuth() == null) {
            throw new ClientSetupException("client set: vault unwrap: no secret auth");
        }
        String token = secret.getAuth().getClientToken();
        if (token == null || token.isEmpty()) {
            throw new ClientSetupException("client set: vault unwrap: no token returned");
        }
        return token;
    }
}
