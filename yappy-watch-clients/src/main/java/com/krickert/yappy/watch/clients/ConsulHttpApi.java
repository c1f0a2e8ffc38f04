package com.krickert.yappy.watch.clients;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.krickert.yappy.watch.consul.IndexedResponse;
import com.krickert.yappy.watch.dependency.QueryOptions;
import com.krickert.yappy.watch.exception.BackendResponseException;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.MutableHttpRequest;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.http.uri.UriBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blocking GETs against the Consul HTTP API for the endpoints the kiwiproject client does not
 * model faithfully. Carries the token and basic-auth settings of one {@link CreateClientInput}
 * and surfaces the {@code X-Consul-Index} / {@code X-Consul-LastContact} headers.
 */
class ConsulHttpApi {

    private static final Logger LOG = LoggerFactory.getLogger(ConsulHttpApi.class);

    static final String INDEX_HEADER = "X-Consul-Index";
    static final String LAST_CONTACT_HEADER = "X-Consul-LastContact";
    static final String TOKEN_HEADER = "X-Consul-Token";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CreateClientInput input;
    private final String baseUrl;

    ConsulHttpApi(HttpClient httpClient, ObjectMapper objectMapper, CreateClientInput input) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.input = input;
        this.baseUrl = input.baseUrl();
    }

    <T> IndexedResponse<T> get(String path, Map<String, List<String>> params, QueryOptions options, TypeReference<T> type) {
        URI uri = buildUri(path, params, options);
        MutableHttpRequest<?> request = HttpRequest.GET(uri).accept(MediaType.APPLICATION_JSON_TYPE);
        if (!input.token().isEmpty()) {
            request.header(TOKEN_HEADER, input.token());
        }
        if (input.basicAuthEnabled()) {
            request.basicAuth(input.basicAuthUsername(), input.basicAuthPassword());
        }
        LOG.debug("GET {}", uri);

        HttpResponse<String> response;
        try {
            response = httpClient.toBlocking().exchange(request, String.class);
        } catch (HttpClientResponseException e) {
            String body = e.getResponse().getBody(String.class).orElse(e.getMessage());
            throw new BackendResponseException(e.getStatus().getCode(), body, e);
        }

        long index = parseIndex(response.getHeaders().get(INDEX_HEADER));
        Duration lastContact = Duration.ofMillis(parseLong(response.getHeaders().get(LAST_CONTACT_HEADER)));
        String body = response.getBody().orElse(null);
        if (body == null || body.isBlank()) {
            return new IndexedResponse<>(null, index, lastContact);
        }
        try {
            return new IndexedResponse<>(objectMapper.readValue(body, type), index, lastContact);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to decode Consul response from " + path, e);
        }
    }

    URI buildUri(String path, Map<String, List<String>> params, QueryOptions options) {
        UriBuilder builder = UriBuilder.of(baseUrl).path(path);
        Map<String, List<String>> all = new LinkedHashMap<>(params);
        queryParams(options).forEach((name, value) -> all.put(name, List.of(value)));
        all.forEach((name, values) -> builder.queryParam(name, values.toArray()));
        return builder.build();
    }

    static Map<String, String> queryParams(QueryOptions options) {
        Map<String, String> params = new LinkedHashMap<>();
        if (options.allowStale()) {
            params.put("stale", "");
        }
        if (options.requireConsistent()) {
            params.put("consistent", "");
        }
        if (!options.datacenter().isEmpty()) {
            params.put("dc", options.datacenter());
        }
        if (!options.namespace().isEmpty()) {
            params.put("ns", options.namespace());
        }
        if (!options.near().isEmpty()) {
            params.put("near", options.near());
        }
        if (!options.filter().isEmpty()) {
            params.put("filter", options.filter());
        }
        if (options.waitIndex() != 0) {
            params.put("index", Long.toUnsignedString(options.waitIndex()));
        }
        if (!options.waitTime().isZero()) {
            params.put("wait", options.waitTime().toMillis() + "ms");
        }
        return params;
    }

    static long parseIndex(String header) {
        if (header == null || header.isBlank()) {
            return 0;
        }
        try {
            return Long.parseUnsignedLong(header.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring malformed {} header: {}", INDEX_HEADER, header);
            return 0;
        }
    }

    private static long parseLong(String header) {
        if (header == null || header.isBlank()) {
            return 0;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring malformed {} header: {}", LAST_CONTACT_HEADER, header);
            return 0;
        }
    }
}
