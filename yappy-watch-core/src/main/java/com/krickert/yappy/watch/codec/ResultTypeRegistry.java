package com.krickert.yappy.watch.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.krickert.yappy.watch.consul.model.CaRoot;
import com.krickert.yappy.watch.consul.model.CatalogNode;
import com.krickert.yappy.watch.consul.model.CatalogServiceEntry;
import com.krickert.yappy.watch.consul.model.CatalogSnippet;
import com.krickert.yappy.watch.consul.model.HealthService;
import com.krickert.yappy.watch.consul.model.KeyPair;
import com.krickert.yappy.watch.consul.model.LeafCert;
import com.krickert.yappy.watch.consul.model.Node;
import com.krickert.yappy.watch.vault.VaultSecret;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed set of result types {@link FetchResultCodec} will read and write, keyed by the kind
 * prefix of a dependency id ({@code kv.get(foo)} has kind {@code kv.get}).
 * <p>
 * Types are kept as {@link TypeReference}s and resolved against the reading mapper's
 * {@link TypeFactory}, so modules registered on that mapper (such as {@code Optional} support)
 * apply to them.
 */
public final class ResultTypeRegistry {

    private final Map<String, TypeReference<?>> types;

    private ResultTypeRegistry(Map<String, TypeReference<?>> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Every result type produced by the built-in dependency kinds.
     */
    public static ResultTypeRegistry defaults() {
        return builder()
                .register("catalog.node", new TypeReference<CatalogNode>() { })
                .register("catalog.nodes", new TypeReference<List<Node>>() { })
                .register("catalog.service", new TypeReference<List<CatalogServiceEntry>>() { })
                .register("catalog.services", new TypeReference<List<CatalogSnippet>>() { })
                .register("catalog.datacenters", new TypeReference<List<String>>() { })
                .register("health.service", new TypeReference<List<HealthService>>() { })
                .register("kv.get", new TypeReference<Optional<String>>() { })
                .register("kv.exists", new TypeReference<Boolean>() { })
                .register("kv.exists.get", new TypeReference<KeyPair>() { })
                .register("kv.list", new TypeReference<List<KeyPair>>() { })
                .register("kv.keys", new TypeReference<List<String>>() { })
                .register("connect.caroots", new TypeReference<List<CaRoot>>() { })
                .register("connect.caleaf", new TypeReference<LeafCert>() { })
                .register("vault.read", new TypeReference<VaultSecret>() { })
                .register("vault.write", new TypeReference<VaultSecret>() { })
                .register("vault.list", new TypeReference<List<String>>() { })
                .register("vault-agent.token", new TypeReference<String>() { })
                .register("file", new TypeReference<String>() { })
                .build();
    }

    public boolean isRegistered(String kind) {
        return types.containsKey(kind);
    }

    /**
     * @throws IllegalArgumentException for a kind that was never registered
     */
    public JavaType typeOf(String kind, TypeFactory typeFactory) {
        TypeReference<?> type = types.get(kind);
        if (type == null) {
            throw new IllegalArgumentException("No result type registered for '" + kind + "'");
        }
        return typeFactory.constructType(type);
    }

    public Set<String> kinds() {
        return types.keySet();
    }

    /**
     * Kind of a dependency id: everything before the first {@code (}.
     */
    public static String kindOf(String dependencyId) {
        int paren = dependencyId.indexOf('(');
        return paren < 0 ? dependencyId : dependencyId.substring(0, paren);
    }

    public static final class Builder {
        private final Map<String, TypeReference<?>> types = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String kind, TypeReference<?> type) {
            if (types.putIfAbsent(kind, type) != null) {
                throw new IllegalArgumentException("Result type for '" + kind + "' already registered");
            }
            return this;
        }

        public ResultTypeRegistry build() {
            return new ResultTypeRegistry(types);
        }
    }
}
