package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.Node;
import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.dependency.QueryOptions;

import java.util.Comparator;
import java.util.List;

/**
 * All nodes in a datacenter, sorted by name then address unless ordered by distance from
 * {@code near}.
 */
public class CatalogNodesQuery extends AbstractDependency<List<Node>> {

    private static final Comparator<Node> BY_NODE_THEN_ADDRESS =
            Comparator.comparing(Node::node).thenComparing(Node::address);

    private final String datacenter;
    private final String near;

    public CatalogNodesQuery() {
        this("", "");
    }

    public CatalogNodesQuery(String datacenter, String near) {
        this.datacenter = datacenter == null ? "" : datacenter;
        this.near = near == null ? "" : near;
    }

    @Override
    public FetchResult<List<Node>> fetch(Clients clients) {
        checkStopped();
        QueryOptions opts = options().merge(QueryOptions.builder().datacenter(datacenter).near(near).build());
        IndexedResponse<List<Node>> response =
                stopSignal.race(id(), () -> clients.discovery().catalogNodes(opts));
        List<Node> nodes = near.isEmpty()
                ? response.value().stream().sorted(BY_NODE_THEN_ADDRESS).toList()
                : List.copyOf(response.value());
        return FetchResult.of(nodes, response.metadata());
    }

    @Override
    public String id() {
        String target = (datacenter.isEmpty() ? "" : "@" + datacenter) + (near.isEmpty() ? "" : "~" + near);
        return target.isEmpty() ? "catalog.nodes" : "catalog.nodes(" + target + ")";
    }

    @Override
    public boolean canShare() {
        return true;
    }
}
