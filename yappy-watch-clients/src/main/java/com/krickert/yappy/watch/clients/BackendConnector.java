package com.krickert.yappy.watch.clients;

import com.krickert.yappy.watch.consul.DiscoveryClient;
import com.krickert.yappy.watch.vault.VaultClient;

/**
 * Opens backend clients for a {@link CreateClientInput}. Connection only; authentication and
 * leader checks are done by {@link ClientSet}.
 */
public interface BackendConnector {

    DiscoveryClient connectConsul(CreateClientInput input);

    VaultClient connectVault(CreateClientInput input);
}
