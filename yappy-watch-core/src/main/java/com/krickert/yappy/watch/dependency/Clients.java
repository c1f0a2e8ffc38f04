package com.krickert.yappy.watch.dependency;

import com.krickert.yappy.watch.consul.DiscoveryClient;
import com.krickert.yappy.watch.vault.VaultClient;

/**
 * The backend clients a dependency fetches with. Implementations must tolerate concurrent
 * reads from many dependencies.
 */
public interface Clients {

    DiscoveryClient discovery();

    VaultClient vault();
}
