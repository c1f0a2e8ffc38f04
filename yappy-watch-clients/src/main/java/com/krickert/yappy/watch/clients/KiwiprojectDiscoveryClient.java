package com.krickert.yappy.watch.clients;

import com.fasterxml.jackson.core.type.TypeReference;
import com.krickert.yappy.watch.consul.DiscoveryClient;
import com.krickert.yappy.watch.consul.IndexedResponse;
import com.krickert.yappy.watch.consul.model.CaRoot;
import com.krickert.yappy.watch.consul.model.CatalogNode;
import com.krickert.yappy.watch.consul.model.CatalogServiceEntry;
import com.krickert.yappy.watch.consul.model.HealthEntry;
import com.krickert.yappy.watch.consul.model.KeyPair;
import com.krickert.yappy.watch.consul.model.LeafCert;
import com.krickert.yappy.watch.consul.model.Node;
import com.krickert.yappy.watch.dependency.QueryOptions;
import com.krickert.yappy.watch.exception.BackendResponseException;
import org.kiwiproject.consul.Consul;
import org.kiwiproject.consul.ConsulException;
import org.kiwiproject.consul.model.ConsulResponse;
import org.kiwiproject.consul.model.kv.Value;
import org.kiwiproject.consul.option.ConsistencyMode;
import org.kiwiproject.consul.option.ImmutableQueryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link DiscoveryClient} over the kiwiproject Consul client. Key/value reads, datacenters, the
 * leader and the agent's node name go through {@link Consul}; catalog, health and connect
 * endpoints go through {@link ConsulHttpApi} so every field and header the dependencies need
 * survives.
 */
public class KiwiprojectDiscoveryClient implements DiscoveryClient {

    private static final Logger LOG = LoggerFactory.getLogger(KiwiprojectDiscoveryClient.class);

    private static final TypeReference<ConsulJson.CatalogNodeJson> CATALOG_NODE = new TypeReference<>() {
    };
    private static final TypeReference<List<ConsulJson.NodeJson>> NODES = new TypeReference<>() {
    };
    private static final TypeReference<List<ConsulJson.CatalogServiceJson>> CATALOG_SERVICE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, List<String>>> CATALOG_SERVICES = new TypeReference<>() {
    };
    private static final TypeReference<List<ConsulJson.HealthEntryJson>> HEALTH = new TypeReference<>() {
    };
    private static final TypeReference<ConsulJson.CaRootsJson> CA_ROOTS = new TypeReference<>() {
    };
    private static final TypeReference<LeafCert> CA_LEAF = new TypeReference<>() {
    };

    private final Consul consul;
    private final ConsulHttpApi httpApi;

    KiwiprojectDiscoveryClient(Consul consul, ConsulHttpApi httpApi) {
        this.consul = consul;
        this.httpApi = httpApi;
    }

    @Override
    public IndexedResponse<Optional<KeyPair>> kvGet(String key, QueryOptions options) {
        // The recursive read keeps the index header on a missing key; keep only the exact match.
        IndexedResponse<List<KeyPair>> all = kvList(key, options);
        Optional<KeyPair> match = all.value().stream()
                .filter(pair -> pair.path().equals(key))
                .findFirst();
        return new IndexedResponse<>(match, all.index(), all.lastContact());
    }

    @Override
    public IndexedResponse<List<KeyPair>> kvList(String prefix, QueryOptions options) {
        ConsulResponse<List<Value>> response = call("kv list " + prefix,
                () -> consul.keyValueClient().getConsulResponseWithValues(prefix, toConsulOptions(options)));
        List<Value> values = response.getResponse() == null ? List.of() : response.getResponse();
        List<KeyPair> pairs = values.stream().map(KiwiprojectDiscoveryClient::toKeyPair).toList();
        return new IndexedResponse<>(pairs, index(response), Duration.ofMillis(response.getLastContact()));
    }

    @Override
    public IndexedResponse<List<String>> kvKeys(String prefix, QueryOptions options) {
        IndexedResponse<List<KeyPair>> all = kvList(prefix, options);
        List<String> keys = all.value().stream().map(KeyPair::path).toList();
        return new IndexedResponse<>(keys, all.index(), all.lastContact());
    }

    @Override
    public IndexedResponse<Optional<CatalogNode>> catalogNode(String name, QueryOptions options) {
        IndexedResponse<ConsulJson.CatalogNodeJson> response =
                httpApi.get("/v1/catalog/node/" + name, Map.of(), options, CATALOG_NODE);
        Optional<CatalogNode> node = Optional.ofNullable(response.value())
                .filter(json -> json.node() != null)
                .map(ConsulJson.CatalogNodeJson::toModel);
        return new IndexedResponse<>(node, response.index(), response.lastContact());
    }

    @Override
    public IndexedResponse<List<Node>> catalogNodes(QueryOptions options) {
        IndexedResponse<List<ConsulJson.NodeJson>> response = httpApi.get("/v1/catalog/nodes", Map.of(), options, NODES);
        List<Node> nodes = response.value() == null ? List.of()
                : response.value().stream().map(ConsulJson.NodeJson::toModel).toList();
        return new IndexedResponse<>(nodes, response.index(), response.lastContact());
    }

    @Override
    public IndexedResponse<List<CatalogServiceEntry>> catalogService(String name, String tag, QueryOptions options) {
        Map<String, List<String>> params = tag == null || tag.isEmpty() ? Map.of() : Map.of("tag", List.of(tag));
        IndexedResponse<List<ConsulJson.CatalogServiceJson>> response =
                httpApi.get("/v1/catalog/service/" + name, params, options, CATALOG_SERVICE);
        List<CatalogServiceEntry> entries = response.value() == null ? List.of()
                : response.value().stream().map(ConsulJson.CatalogServiceJson::toModel).toList();
        return new IndexedResponse<>(entries, response.index(), response.lastContact());
    }

    @Override
    public IndexedResponse<Map<String, List<String>>> catalogServices(Map<String, String> nodeMeta, QueryOptions options) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        if (nodeMeta != null && !nodeMeta.isEmpty()) {
            params.put("node-meta", nodeMeta.entrySet().stream()
                    .map(e -> e.getKey() + ":" + e.getValue())
                    .sorted()
                    .toList());
        }
        IndexedResponse<Map<String, List<String>>> response =
                httpApi.get("/v1/catalog/services", params, options, CATALOG_SERVICES);
        Map<String, List<String>> services = response.value() == null ? Map.of() : response.value();
        return new IndexedResponse<>(services, response.index(), response.lastContact());
    }

    @Override
    public List<String> catalogDatacenters() {
        return call("catalog datacenters", () -> consul.catalogClient().getDatacenters());
    }

    @Override
    public IndexedResponse<List<HealthEntry>> healthService(String name, String tag, boolean passingOnly,
                                                            boolean connect, QueryOptions options) {
        Map<String, List<String>> params = new LinkedHashMap<>();
        if (tag != null && !tag.isEmpty()) {
            params.put("tag", List.of(tag));
        }
        if (passingOnly) {
            params.put("passing", List.of("1"));
        }
        String path = (connect ? "/v1/health/connect/" : "/v1/health/service/") + name;
        IndexedResponse<List<ConsulJson.HealthEntryJson>> response = httpApi.get(path, params, options, HEALTH);
        List<HealthEntry> entries = response.value() == null ? List.of()
                : response.value().stream().map(ConsulJson.HealthEntryJson::toModel).toList();
        return new IndexedResponse<>(entries, response.index(), response.lastContact());
    }

    @Override
    public String agentNodeName() {
        return call("agent self", () -> consul.agentClient().getAgent().getConfig().getNodeName());
    }

    @Override
    public String leaderStatus() {
        String leader = call("status leader", () -> consul.statusClient().getLeader());
        return leader == null ? "" : leader;
    }

    @Override
    public IndexedResponse<List<CaRoot>> connectCaRoots(QueryOptions options) {
        IndexedResponse<ConsulJson.CaRootsJson> response =
                httpApi.get("/v1/agent/connect/ca/roots", Map.of(), options, CA_ROOTS);
        List<CaRoot> roots = response.value() == null || response.value().roots() == null
                ? List.of() : response.value().roots();
        return new IndexedResponse<>(roots, response.index(), response.lastContact());
    }

    @Override
    public IndexedResponse<LeafCert> connectCaLeaf(String service, QueryOptions options) {
        return httpApi.get("/v1/agent/connect/ca/leaf/" + service, Map.of(), options, CA_LEAF);
    }

    @Override
    public void close() {
        if (!consul.isDestroyed()) {
            LOG.info("Closing Consul client");
            consul.destroy();
        }
    }

    static org.kiwiproject.consul.option.QueryOptions toConsulOptions(QueryOptions options) {
        ImmutableQueryOptions.Builder builder = options.waitIndex() != 0 && !options.waitTime().isZero()
                ? org.kiwiproject.consul.option.QueryOptions.blockSeconds(
                        (int) Math.max(1, options.waitTime().toSeconds()),
                        new BigInteger(Long.toUnsignedString(options.waitIndex())))
                : ImmutableQueryOptions.builder();
        if (!options.datacenter().isEmpty()) {
            builder.datacenter(options.datacenter());
        }
        if (!options.namespace().isEmpty()) {
            builder.namespace(options.namespace());
        }
        if (options.requireConsistent()) {
            builder.consistencyMode(ConsistencyMode.CONSISTENT);
        } else if (options.allowStale()) {
            builder.consistencyMode(ConsistencyMode.STALE);
        }
        return builder.build();
    }

    private static KeyPair toKeyPair(Value value) {
        return new KeyPair(
                value.getKey(),
                value.getKey(),
                value.getValueAsString().orElse(""),
                true,
                value.getCreateIndex(),
                value.getModifyIndex(),
                value.getLockIndex(),
                value.getFlags(),
                value.getSession().orElse(""));
    }

    private static long index(ConsulResponse<?> response) {
        BigInteger index = response.getIndex();
        return index == null ? 0 : index.longValue();
    }

    private static <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (ConsulException e) {
            if (e.getCode() > 0) {
                throw new BackendResponseException(e.getCode(), operation + ": " + e.getMessage(), e);
            }
            throw e;
        }
    }
}
