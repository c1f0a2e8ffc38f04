package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.CatalogSnippet;
import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.dependency.QueryOptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Every service name in the catalog with its tags, sorted by name.
 */
public class CatalogServicesQuery extends AbstractDependency<List<CatalogSnippet>> {

    private final String datacenter;
    private final String namespace;
    private final Map<String, String> nodeMeta;

    public CatalogServicesQuery() {
        this("", "", Map.of());
    }

    public CatalogServicesQuery(String datacenter, String namespace, Map<String, String> nodeMeta) {
        this.datacenter = datacenter == null ? "" : datacenter;
        this.namespace = namespace == null ? "" : namespace;
        this.nodeMeta = nodeMeta == null ? Map.of() : Map.copyOf(nodeMeta);
    }

    @Override
    public FetchResult<List<CatalogSnippet>> fetch(Clients clients) {
        checkStopped();
        QueryOptions opts = options().merge(QueryOptions.builder()
                .datacenter(datacenter)
                .namespace(namespace)
                .build());
        IndexedResponse<Map<String, List<String>>> response =
                stopSignal.race(id(), () -> clients.discovery().catalogServices(nodeMeta, opts));
        List<CatalogSnippet> snippets = response.value().entrySet().stream()
                .map(e -> new CatalogSnippet(e.getKey(), e.getValue()))
                .sorted(Comparator.comparing(CatalogSnippet::name))
                .toList();
        return FetchResult.of(snippets, response.metadata());
    }

    @Override
    public String id() {
        List<String> parts = new ArrayList<>();
        if (!datacenter.isEmpty()) {
            parts.add("@" + datacenter);
        }
        if (!namespace.isEmpty()) {
            parts.add("ns=" + namespace);
        }
        new TreeMap<>(nodeMeta).forEach((k, v) -> parts.add("node-meta=" + k + ":" + v));
        if (parts.isEmpty()) {
            return "catalog.services";
        }
        parts.sort(null);
        return "catalog.services(" + String.join("&", parts) + ")";
    }

    @Override
    public boolean canShare() {
        return true;
    }
}
