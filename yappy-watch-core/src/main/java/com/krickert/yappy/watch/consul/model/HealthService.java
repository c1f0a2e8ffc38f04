package com.krickert.yappy.watch.consul.model;

import java.util.List;
import java.util.Map;

/**
 * A service instance with its aggregated health {@code status}. {@code address} falls back to the
 * node address when the service registered none.
 */
public record HealthService(
        String node,
        String nodeId,
        String kind,
        String nodeAddress,
        String nodeDatacenter,
        Map<String, String> nodeTaggedAddresses,
        Map<String, String> nodeMeta,
        Map<String, String> serviceMeta,
        String address,
        String id,
        String name,
        List<String> tags,
        String status,
        List<HealthCheck> checks,
        int port,
        Map<String, Integer> weights,
        String namespace
) {
    public HealthService {
        nodeTaggedAddresses = nodeTaggedAddresses == null ? Map.of() : Map.copyOf(nodeTaggedAddresses);
        nodeMeta = nodeMeta == null ? Map.of() : Map.copyOf(nodeMeta);
        serviceMeta = serviceMeta == null ? Map.of() : Map.copyOf(serviceMeta);
        tags = Tags.sortedCopy(tags);
        checks = checks == null ? List.of() : List.copyOf(checks);
        weights = weights == null ? Map.of() : Map.copyOf(weights);
    }
}
