package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.KeyPair;
import com.krickert.yappy.watch.dependency.QueryOptions;

import java.util.Optional;

/**
 * A single-key lookup shared by the kv-get, kv-exists and kv-exists-get dependencies.
 *
 * @param key        key without a leading slash
 * @param datacenter datacenter to read from, empty for the agent's own
 * @param namespace  namespace to read from, empty for the default
 */
public record KvLookup(String key, String datacenter, String namespace) {

    public KvLookup {
        String k = key == null ? "" : key;
        while (k.startsWith("/")) {
            k = k.substring(1);
        }
        if (k.isEmpty()) {
            throw new IllegalArgumentException("kv: key required");
        }
        key = k;
        datacenter = datacenter == null ? "" : datacenter;
        namespace = namespace == null ? "" : namespace;
    }

    public static KvLookup of(String key) {
        return new KvLookup(key, "", "");
    }

    public KvLookup inDatacenter(String datacenter) {
        return new KvLookup(key, datacenter, namespace);
    }

    public KvLookup inNamespace(String namespace) {
        return new KvLookup(key, datacenter, namespace);
    }

    /**
     * Reads the key with the caller's options narrowed to this lookup's datacenter and namespace.
     */
    public IndexedResponse<Optional<KeyPair>> get(DiscoveryClient client, QueryOptions callerOptions) {
        QueryOptions scope = QueryOptions.builder()
                .datacenter(datacenter)
                .namespace(namespace)
                .build();
        return client.kvGet(key, callerOptions.merge(scope));
    }

    /**
     * {@code key} or {@code key@dc}.
     */
    public String keyAtDatacenter() {
        return datacenter.isEmpty() ? key : key + "@" + datacenter;
    }
}
