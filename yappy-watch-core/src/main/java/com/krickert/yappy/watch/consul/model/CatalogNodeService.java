package com.krickert.yappy.watch.consul.model;

import java.util.List;
import java.util.Map;

/**
 * A service registered on a node, as listed by a catalog node lookup. Tags are sorted.
 */
public record CatalogNodeService(
        String id,
        String service,
        List<String> tags,
        Map<String, String> meta,
        int port,
        String address,
        boolean enableTagOverride
) {
    public CatalogNodeService {
        tags = Tags.sortedCopy(tags);
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }
}
