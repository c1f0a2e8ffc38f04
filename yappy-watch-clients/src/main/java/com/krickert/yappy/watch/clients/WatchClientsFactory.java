package com.krickert.yappy.watch.clients;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.krickert.yappy.watch.codec.FetchResultCodec;
import com.krickert.yappy.watch.codec.ResultTypeRegistry;
import com.krickert.yappy.watch.dependency.BlockingQueryEmulator;
import com.krickert.yappy.watch.vault.LeaseRenewalLoop;
import com.krickert.yappy.watch.vault.LeaseWaitCalculator;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

@Factory
@Requires(property = "yappy.watch.clients.enabled", value = "true", defaultValue = "true")
public class WatchClientsFactory {

    private static final Logger LOG = LoggerFactory.getLogger(WatchClientsFactory.class);

    private static final long DEFAULT_READ_TIMEOUT_SECONDS = 120L;

    @Bean
    @Singleton
    public BackendConnector backendConnector(
            @Client HttpClient httpClient,
            ObjectMapper objectMapper,
            @Value("${yappy.watch.consul.read-timeout-seconds:" + DEFAULT_READ_TIMEOUT_SECONDS + "}") long readTimeoutSeconds) {
        LOG.debug("Consul read timeout: {}s", readTimeoutSeconds);
        return new HttpBackendConnector(httpClient, objectMapper, Duration.ofSeconds(readTimeoutSeconds));
    }

    /**
     * The shared client set. Clients whose address is configured are created eagerly; the Consul
     * client creation waits for a cluster leader.
     */
    @Bean(preDestroy = "stop")
    @Singleton
    public ClientSet clientSet(
            BackendConnector connector,
            @Value("${yappy.watch.consul.address:}") String consulAddress,
            @Value("${yappy.watch.consul.token:}") String consulToken,
            @Value("${yappy.watch.consul.ssl:false}") boolean consulSsl,
            @Value("${yappy.watch.vault.address:}") String vaultAddress,
            @Value("${yappy.watch.vault.token:}") String vaultToken,
            @Value("${yappy.watch.vault.namespace:}") String vaultNamespace,
            @Value("${yappy.watch.vault.unwrap-token:false}") boolean unwrapToken,
            @Value("${yappy.watch.vault.ssl:false}") boolean vaultSsl) {
        ClientSet clients = new ClientSet(connector);
        if (!consulAddress.isBlank()) {
            clients.createConsulClient(CreateClientInput.builder()
                    .address(consulAddress)
                    .token(consulToken)
                    .ssl(consulSsl)
                    .build());
        }
        if (!vaultAddress.isBlank()) {
            clients.createVaultClient(CreateClientInput.builder()
                    .address(vaultAddress)
                    .token(vaultToken)
                    .namespace(vaultNamespace)
                    .unwrapToken(unwrapToken)
                    .ssl(vaultSsl)
                    .build());
        }
        return clients;
    }

    @Bean
    @Singleton
    public LeaseWaitCalculator leaseWaitCalculator(@Value("${yappy.watch.vault.lease-jitter:true}") boolean jitter) {
        return jitter ? LeaseWaitCalculator.withJitter(Clock.systemUTC())
                : LeaseWaitCalculator.withoutJitter(Clock.systemUTC());
    }

    @Bean
    @Singleton
    public LeaseRenewalLoop leaseRenewalLoop() {
        return new LeaseRenewalLoop();
    }

    @Bean
    @Singleton
    public BlockingQueryEmulator blockingQueryEmulator() {
        return new BlockingQueryEmulator();
    }

    @Bean
    @Singleton
    public ResultTypeRegistry resultTypeRegistry() {
        return ResultTypeRegistry.defaults();
    }

    @Bean
    @Singleton
    public FetchResultCodec fetchResultCodec(ResultTypeRegistry registry) {
        return new FetchResultCodec(registry);
    }
}
