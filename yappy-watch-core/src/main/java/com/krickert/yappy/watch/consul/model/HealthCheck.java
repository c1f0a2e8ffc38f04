package com.krickert.yappy.watch.consul.model;

public record HealthCheck(
        String node,
        String checkId,
        String name,
        String status,
        String notes,
        String output,
        String serviceId,
        String serviceName
) {
}
