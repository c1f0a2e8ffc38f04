package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.CaRoot;
import com.krickert.yappy.watch.consul.model.CatalogNode;
import com.krickert.yappy.watch.consul.model.CatalogServiceEntry;
import com.krickert.yappy.watch.consul.model.HealthEntry;
import com.krickert.yappy.watch.consul.model.KeyPair;
import com.krickert.yappy.watch.consul.model.LeafCert;
import com.krickert.yappy.watch.consul.model.Node;
import com.krickert.yappy.watch.dependency.QueryOptions;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The service-discovery operations dependencies need. Every indexed call honours
 * {@link QueryOptions#waitIndex()} / {@link QueryOptions#waitTime()} as a blocking query,
 * except {@link #catalogDatacenters()} which has no index.
 * <p>
 * Implementations throw unchecked exceptions on transport failures.
 */
public interface DiscoveryClient extends AutoCloseable {

    IndexedResponse<Optional<KeyPair>> kvGet(String key, QueryOptions options);

    IndexedResponse<List<KeyPair>> kvList(String prefix, QueryOptions options);

    IndexedResponse<List<String>> kvKeys(String prefix, QueryOptions options);

    IndexedResponse<Optional<CatalogNode>> catalogNode(String name, QueryOptions options);

    IndexedResponse<List<Node>> catalogNodes(QueryOptions options);

    IndexedResponse<List<CatalogServiceEntry>> catalogService(String name, String tag, QueryOptions options);

    IndexedResponse<Map<String, List<String>>> catalogServices(Map<String, String> nodeMeta, QueryOptions options);

    List<String> catalogDatacenters();

    /**
     * Health entries for a service.
     *
     * @param tag         optional tag filter, empty for none
     * @param passingOnly only return instances whose checks all pass
     * @param connect     query connect-capable instances (sidecar proxies) instead of the service
     */
    IndexedResponse<List<HealthEntry>> healthService(String name, String tag, boolean passingOnly,
                                                     boolean connect, QueryOptions options);

    /**
     * Name of the node the local agent runs on.
     */
    String agentNodeName();

    /**
     * Address of the current cluster leader, or an empty string when there is none.
     */
    String leaderStatus();

    IndexedResponse<List<CaRoot>> connectCaRoots(QueryOptions options);

    IndexedResponse<LeafCert> connectCaLeaf(String service, QueryOptions options);

    @Override
    void close();
}
