package com.krickert.yappy.watch.clients;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.krickert.yappy.watch.consul.DiscoveryClient;
import com.krickert.yappy.watch.vault.VaultClient;
import io.micronaut.http.client.HttpClient;
import org.kiwiproject.consul.Consul;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Builds kiwiproject Consul clients and Micronaut-backed Vault clients that share one
 * {@link HttpClient}.
 */
public class HttpBackendConnector implements BackendConnector {

    private static final Logger LOG = LoggerFactory.getLogger(HttpBackendConnector.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration readTimeout;

    /**
     * @param readTimeout socket read timeout of the Consul client; must exceed the longest blocking-query wait
     */
    public HttpBackendConnector(HttpClient httpClient, ObjectMapper objectMapper, Duration readTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.readTimeout = readTimeout;
    }

    @Override
    public DiscoveryClient connectConsul(CreateClientInput input) {
        LOG.info("Creating Consul client for {}", input.baseUrl());
        Consul.Builder builder = Consul.builder()
                .withUrl(input.baseUrl())
                .withReadTimeoutMillis(readTimeout.toMillis())
                .withPing(false);
        if (!input.token().isEmpty()) {
            builder.withAclToken(input.token());
        }
        if (input.basicAuthEnabled()) {
            builder.withBasicAuth(input.basicAuthUsername(), input.basicAuthPassword());
        }
        return new KiwiprojectDiscoveryClient(builder.build(), new ConsulHttpApi(httpClient, objectMapper, input));
    }

    @Override
    public VaultClient connectVault(CreateClientInput input) {
        LOG.info("Creating Vault client for {}", input.baseUrl());
        return new MicronautVaultClient(httpClient, objectMapper, input);
    }
}
