package com.krickert.yappy.watch.consul.model;

import java.util.List;

/**
 * A node and its services. {@link #empty()} (null node, no services) means the node is unknown.
 */
public record CatalogNode(Node node, List<CatalogNodeService> services) {

    public CatalogNode {
        services = services == null ? List.of() : List.copyOf(services);
    }

    public static CatalogNode empty() {
        return new CatalogNode(null, List.of());
    }
}
