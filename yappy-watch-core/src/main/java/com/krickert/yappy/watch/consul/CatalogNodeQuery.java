package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.CatalogNode;
import com.krickert.yappy.watch.consul.model.CatalogNodeService;
import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.dependency.QueryOptions;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A node and its services. With no name the local agent's node is used. An unknown node yields
 * {@link CatalogNode#empty()}.
 */
public class CatalogNodeQuery extends AbstractDependency<CatalogNode> {

    private static final Comparator<CatalogNodeService> BY_SERVICE_THEN_ID =
            Comparator.comparing(CatalogNodeService::service).thenComparing(CatalogNodeService::id);

    private final String name;
    private final String datacenter;

    public CatalogNodeQuery() {
        this("", "");
    }

    public CatalogNodeQuery(String name, String datacenter) {
        this.name = name == null ? "" : name;
        this.datacenter = datacenter == null ? "" : datacenter;
    }

    @Override
    public FetchResult<CatalogNode> fetch(Clients clients) {
        checkStopped();
        DiscoveryClient discovery = clients.discovery();
        String node = name.isEmpty() ? stopSignal.race(id(), discovery::agentNodeName) : name;
        QueryOptions opts = options().merge(QueryOptions.builder().datacenter(datacenter).build());

        IndexedResponse<Optional<CatalogNode>> response =
                stopSignal.race(id(), () -> discovery.catalogNode(node, opts));
        CatalogNode result = response.value()
                .map(found -> new CatalogNode(found.node(), sorted(found.services())))
                .orElseGet(CatalogNode::empty);
        return FetchResult.of(result, response.metadata());
    }

    private static List<CatalogNodeService> sorted(List<CatalogNodeService> services) {
        return services.stream().sorted(BY_SERVICE_THEN_ID).toList();
    }

    @Override
    public String id() {
        String target = datacenter.isEmpty() ? name : name + "@" + datacenter;
        return target.isEmpty() ? "catalog.node" : "catalog.node(" + target + ")";
    }

    @Override
    public boolean canShare() {
        return false;
    }
}
