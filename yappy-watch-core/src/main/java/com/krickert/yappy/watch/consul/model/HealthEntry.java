package com.krickert.yappy.watch.consul.model;

import java.util.List;

/**
 * One raw health-endpoint entry: the node, the service instance and all checks that apply to it.
 */
public record HealthEntry(Node node, AgentService service, List<HealthCheck> checks) {

    public HealthEntry {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }
}
