package com.krickert.yappy.watch.consul.model;

import java.util.List;
import java.util.Map;

public record CatalogServiceEntry(
        String id,
        String node,
        String address,
        String datacenter,
        Map<String, String> taggedAddresses,
        Map<String, String> nodeMeta,
        String serviceId,
        String serviceName,
        String serviceAddress,
        List<String> serviceTags,
        Map<String, String> serviceMeta,
        int servicePort,
        String namespace
) {
    public CatalogServiceEntry {
        taggedAddresses = taggedAddresses == null ? Map.of() : Map.copyOf(taggedAddresses);
        nodeMeta = nodeMeta == null ? Map.of() : Map.copyOf(nodeMeta);
        serviceTags = Tags.sortedCopy(serviceTags);
        serviceMeta = serviceMeta == null ? Map.of() : Map.copyOf(serviceMeta);
    }
}
