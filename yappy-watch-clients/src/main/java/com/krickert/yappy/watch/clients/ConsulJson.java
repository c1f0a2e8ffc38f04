package com.krickert.yappy.watch.clients;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.krickert.yappy.watch.consul.model.AgentService;
import com.krickert.yappy.watch.consul.model.CaRoot;
import com.krickert.yappy.watch.consul.model.CatalogNode;
import com.krickert.yappy.watch.consul.model.CatalogNodeService;
import com.krickert.yappy.watch.consul.model.CatalogServiceEntry;
import com.krickert.yappy.watch.consul.model.HealthCheck;
import com.krickert.yappy.watch.consul.model.HealthEntry;
import com.krickert.yappy.watch.consul.model.Node;

import java.util.List;
import java.util.Map;

/**
 * Wire shapes of the Consul HTTP API, mapped onto the core model.
 */
final class ConsulJson {

    private ConsulJson() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NodeJson(
            @JsonProperty("ID") String id,
            @JsonProperty("Node") String node,
            @JsonProperty("Address") String address,
            @JsonProperty("Datacenter") String datacenter,
            @JsonProperty("TaggedAddresses") Map<String, String> taggedAddresses,
            @JsonProperty("Meta") Map<String, String> meta
    ) {
        Node toModel() {
            return new Node(id, node, address, datacenter, taggedAddresses, meta);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ServiceJson(
            @JsonProperty("ID") String id,
            @JsonProperty("Service") String service,
            @JsonProperty("Kind") String kind,
            @JsonProperty("Tags") List<String> tags,
            @JsonProperty("Address") String address,
            @JsonProperty("Meta") Map<String, String> meta,
            @JsonProperty("Port") int port,
            @JsonProperty("Weights") Map<String, Integer> weights,
            @JsonProperty("Namespace") String namespace,
            @JsonProperty("EnableTagOverride") boolean enableTagOverride
    ) {
        AgentService toAgentService() {
            return new AgentService(id, service, kind == null ? "" : kind, tags, address, meta, port,
                    weights, namespace == null ? "" : namespace);
        }

        CatalogNodeService toNodeService() {
            return new CatalogNodeService(id, service, tags, meta, port, address, enableTagOverride);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CheckJson(
            @JsonProperty("Node") String node,
            @JsonProperty("CheckID") String checkId,
            @JsonProperty("Name") String name,
            @JsonProperty("Status") String status,
            @JsonProperty("Notes") String notes,
            @JsonProperty("Output") String output,
            @JsonProperty("ServiceID") String serviceId,
            @JsonProperty("ServiceName") String serviceName
    ) {
        HealthCheck toModel() {
            return new HealthCheck(node, checkId, name, status, notes, output, serviceId, serviceName);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HealthEntryJson(
            @JsonProperty("Node") NodeJson node,
            @JsonProperty("Service") ServiceJson service,
            @JsonProperty("Checks") List<CheckJson> checks
    ) {
        HealthEntry toModel() {
            return new HealthEntry(
                    node == null ? null : node.toModel(),
                    service == null ? null : service.toAgentService(),
                    checks == null ? List.of() : checks.stream().map(CheckJson::toModel).toList());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogNodeJson(
            @JsonProperty("Node") NodeJson node,
            @JsonProperty("Services") Map<String, ServiceJson> services
    ) {
        CatalogNode toModel() {
            List<CatalogNodeService> list = services == null ? List.of()
                    : services.values().stream().map(ServiceJson::toNodeService).toList();
            return new CatalogNode(node == null ? null : node.toModel(), list);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogServiceJson(
            @JsonProperty("ID") String id,
            @JsonProperty("Node") String node,
            @JsonProperty("Address") String address,
            @JsonProperty("Datacenter") String datacenter,
            @JsonProperty("TaggedAddresses") Map<String, String> taggedAddresses,
            @JsonProperty("NodeMeta") Map<String, String> nodeMeta,
            @JsonProperty("ServiceID") String serviceId,
            @JsonProperty("ServiceName") String serviceName,
            @JsonProperty("ServiceAddress") String serviceAddress,
            @JsonProperty("ServiceTags") List<String> serviceTags,
            @JsonProperty("ServiceMeta") Map<String, String> serviceMeta,
            @JsonProperty("ServicePort") int servicePort,
            @JsonProperty("Namespace") String namespace
    ) {
        CatalogServiceEntry toModel() {
            return new CatalogServiceEntry(id, node, address, datacenter, taggedAddresses, nodeMeta,
                    serviceId, serviceName, serviceAddress, serviceTags, serviceMeta, servicePort,
                    namespace == null ? "" : namespace);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CaRootsJson(@JsonProperty("Roots") List<CaRoot> roots) {
    }
}
