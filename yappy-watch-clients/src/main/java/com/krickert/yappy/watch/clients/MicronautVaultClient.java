package com.krickert.yappy.watch.clients;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.krickert.yappy.watch.exception.BackendResponseException;
import com.krickert.yappy.watch.exception.LeaseExpiredException;
import com.krickert.yappy.watch.vault.MountInfo;
import com.krickert.yappy.watch.vault.VaultClient;
import com.krickert.yappy.watch.vault.VaultSecret;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.MutableHttpRequest;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.http.uri.UriBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link VaultClient} over the Micronaut HTTP client. Requests carry {@code X-Vault-Token} and,
 * when a namespace is configured, {@code X-Vault-Namespace}.
 */
public class MicronautVaultClient implements VaultClient {

    private static final Logger LOG = LoggerFactory.getLogger(MicronautVaultClient.class);

    static final String TOKEN_HEADER = "X-Vault-Token";
    static final String NAMESPACE_HEADER = "X-Vault-Namespace";
    static final Duration MIN_RENEW_DELAY = Duration.ofSeconds(2);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CreateClientInput input;
    private final String baseUrl;
    private volatile String token;

    public MicronautVaultClient(HttpClient httpClient, ObjectMapper objectMapper, CreateClientInput input) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.input = input;
        this.baseUrl = input.baseUrl();
        this.token = input.token();
        LOG.info("Vault client configured for {}", baseUrl);
    }

    @Override
    public VaultSecret read(String path, Map<String, List<String>> query) {
        String uri = uri(path, query);
        try {
            return toSecret(exchange(HttpRequest.GET(uri), token));
        } catch (BackendResponseException e) {
            if (e.getStatusCode() == 404) {
                return deletedSecretOrNull(e);
            }
            throw e;
        }
    }

    @Override
    public VaultSecret write(String path, Map<String, Object> data) {
        String body = toJson(data == null ? Map.of() : data);
        return toSecret(exchange(HttpRequest.PUT(uri(path, Map.of()), body)
                .contentType(MediaType.APPLICATION_JSON_TYPE), token));
    }

    @Override
    public VaultSecret list(String path) {
        try {
            return toSecret(exchange(HttpRequest.GET(uri(path, Map.of("list", List.of("true")))), token));
        } catch (BackendResponseException e) {
            if (e.getStatusCode() == 404) {
                return null;
            }
            throw e;
        }
    }

    /**
     * Renews at two thirds of each granted lease. The requested increment is the secret's own
     * lease; a secret without one (a bare token) sends no increment and gets the server's default
     * TTL. The stream completes once the server caps the lease below the increment or grants a
     * lease too short to renew again.
     */
    @Override
    public Flux<VaultSecret> renewals(VaultSecret secret) {
        if (secret == null || !secret.isEffectivelyRenewable()) {
            return Flux.error(new LeaseExpiredException("secret is not renewable"));
        }
        int increment = leaseSeconds(secret);
        return renewOnce(secret, increment).expand(renewed -> {
            int lease = leaseSeconds(renewed);
            if (!renewed.isEffectivelyRenewable() || lease <= 0) {
                return Mono.empty();
            }
            Duration grace = Duration.ofMillis(lease * 2000L / 3);
            if (grace.compareTo(MIN_RENEW_DELAY) < 0) {
                LOG.debug("Lease of {}s is too short to keep renewing", lease);
                return Mono.delay(MIN_RENEW_DELAY).then(Mono.<VaultSecret>empty());
            }
            if (increment > 0 && lease < increment) {
                // capped by the max TTL; the caller refetches once this lease is nearly used up
                return Mono.delay(grace).then(Mono.<VaultSecret>empty());
            }
            return Mono.delay(grace).then(renewOnce(secret, increment));
        });
    }

    @Override
    public Optional<MountInfo> mountInfo(String path) {
        String body;
        try {
            body = exchange(HttpRequest.GET(uri("sys/internal/ui/mounts/" + path, Map.of())), token);
        } catch (BackendResponseException e) {
            if (e.getStatusCode() == 404 || token.isEmpty()) {
                LOG.debug("No mount metadata for {}: {}", path, e.getMessage());
                return Optional.empty();
            }
            throw e;
        }
        if (body == null) {
            return Optional.empty();
        }
        JsonNode data = readTree(body).path("data");
        if (data.isMissingNode() || data.isNull()) {
            return Optional.empty();
        }
        return Optional.of(new MountInfo(
                data.path("path").asText(""),
                data.path("type").asText(""),
                data.path("options").path("version").asText("")));
    }

    @Override
    public String token() {
        return token;
    }

    @Override
    public void setToken(String token) {
        this.token = token == null ? "" : token;
    }

    @Override
    public VaultSecret unwrap(String wrappingToken) {
        return toSecret(exchange(HttpRequest.PUT(uri("sys/wrapping/unwrap", Map.of()), "{}")
                .contentType(MediaType.APPLICATION_JSON_TYPE), wrappingToken));
    }

    @Override
    public void close() {
        LOG.debug("Vault client for {} closed", baseUrl);
    }

    private Mono<VaultSecret> renewOnce(VaultSecret secret, int increment) {
        return Mono.fromCallable(() -> renew(secret, increment)).subscribeOn(Schedulers.boundedElastic());
    }

    VaultSecret renew(VaultSecret secret, int increment) {
        MutableHttpRequest<String> request;
        String requestToken = token;
        String clientToken = secret.getAuth() == null ? null : secret.getAuth().getClientToken();
        Map<String, Object> body = new LinkedHashMap<>();
        if (clientToken != null && !clientToken.isEmpty()) {
            putIncrement(body, increment);
            request = HttpRequest.PUT(uri("auth/token/renew-self", Map.of()), toJson(body));
            requestToken = clientToken;
        } else if (secret.hasLeaseId()) {
            body.put("lease_id", secret.getLeaseId());
            putIncrement(body, increment);
            request = HttpRequest.PUT(uri("sys/leases/renew", Map.of()), toJson(body));
        } else {
            throw new LeaseExpiredException("secret has no lease to renew");
        }
        try {
            VaultSecret renewed = toSecret(exchange(request.contentType(MediaType.APPLICATION_JSON_TYPE), requestToken));
            if (renewed == null) {
                throw new LeaseExpiredException("renewal returned no secret");
            }
            return renewed;
        } catch (BackendResponseException e) {
            if (e.isBadRequest()) {
                throw new LeaseExpiredException("lease expired or not renewable", e);
            }
            throw e;
        }
    }

    private static void putIncrement(Map<String, Object> body, int increment) {
        if (increment > 0) {
            body.put("increment", increment);
        }
    }

    private String exchange(MutableHttpRequest<?> request, String requestToken) {
        request.accept(MediaType.APPLICATION_JSON_TYPE);
        if (requestToken != null && !requestToken.isEmpty()) {
            request.header(TOKEN_HEADER, requestToken);
        }
        if (!input.namespace().isEmpty()) {
            request.header(NAMESPACE_HEADER, input.namespace());
        }
        if (input.basicAuthEnabled()) {
            request.basicAuth(input.basicAuthUsername(), input.basicAuthPassword());
        }
        LOG.debug("{} {}", request.getMethodName(), request.getPath());
        try {
            HttpResponse<String> response = httpClient.toBlocking().exchange(request, String.class);
            return response.getBody().filter(body -> !body.isBlank()).orElse(null);
        } catch (HttpClientResponseException e) {
            String body = e.getResponse().getBody(String.class).orElse(e.getMessage());
            throw new BackendResponseException(e.getStatus().getCode(), body, e);
        }
    }

    private VaultSecret deletedSecretOrNull(BackendResponseException notFound) {
        Throwable cause = notFound.getCause();
        if (!(cause instanceof HttpClientResponseException responseException)) {
            return null;
        }
        Optional<String> body = responseException.getResponse().getBody(String.class);
        if (body.isEmpty() || body.get().isBlank()) {
            return null;
        }
        JsonNode tree = readTree(body.get());
        if (!tree.hasNonNull("data")) {
            return null;
        }
        // a KV v2 secret that was deleted still answers 404 together with its metadata
        return toSecret(body.get());
    }

    private String uri(String path, Map<String, List<String>> query) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        UriBuilder builder = UriBuilder.of(baseUrl).path("/v1/" + trimmed);
        if (query != null) {
            query.forEach((name, values) -> builder.queryParam(name, values.toArray()));
        }
        return builder.build().toString();
    }

    private VaultSecret toSecret(String body) {
        if (body == null) {
            return null;
        }
        try {
            return objectMapper.readValue(body, VaultSecret.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to decode Vault response", e);
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to decode Vault response", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode Vault request", e);
        }
    }

    private static int leaseSeconds(VaultSecret secret) {
        if (secret.getAuth() != null && secret.getAuth().getLeaseDuration() > 0) {
            return secret.getAuth().getLeaseDuration();
        }
        return secret.getLeaseDuration();
    }
}
