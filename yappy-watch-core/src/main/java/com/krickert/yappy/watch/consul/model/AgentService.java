package com.krickert.yappy.watch.consul.model;

import java.util.List;
import java.util.Map;

/**
 * The service half of a health entry.
 */
public record AgentService(
        String id,
        String service,
        String kind,
        List<String> tags,
        String address,
        Map<String, String> meta,
        int port,
        Map<String, Integer> weights,
        String namespace
) {
    public AgentService {
        tags = tags == null ? List.of() : List.copyOf(tags);
        meta = meta == null ? Map.of() : Map.copyOf(meta);
        weights = weights == null ? Map.of() : Map.copyOf(weights);
    }
}
