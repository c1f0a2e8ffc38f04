package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.CatalogServiceEntry;
import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.dependency.QueryOptions;

import java.util.List;

/**
 * Catalog entries of one service, optionally narrowed to a tag.
 */
public class CatalogServiceQuery extends AbstractDependency<List<CatalogServiceEntry>> {

    private final String name;
    private final String tag;
    private final String datacenter;
    private final String near;

    private CatalogServiceQuery(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("catalog.service: name required");
        }
        this.name = builder.name;
        this.tag = builder.tag;
        this.datacenter = builder.datacenter;
        this.near = builder.near;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public FetchResult<List<CatalogServiceEntry>> fetch(Clients clients) {
        checkStopped();
        QueryOptions opts = options().merge(QueryOptions.builder().datacenter(datacenter).near(near).build());
        IndexedResponse<List<CatalogServiceEntry>> response =
                stopSignal.race(id(), () -> clients.discovery().catalogService(name, tag, opts));
        return FetchResult.of(List.copyOf(response.value()), response.metadata());
    }

    @Override
    public String id() {
        StringBuilder id = new StringBuilder("catalog.service(");
        if (!tag.isEmpty()) {
            id.append(tag).append('.');
        }
        id.append(name);
        if (!datacenter.isEmpty()) {
            id.append('@').append(datacenter);
        }
        if (!near.isEmpty()) {
            id.append('~').append(near);
        }
        return id.append(')').toString();
    }

    @Override
    public boolean canShare() {
        return true;
    }

    public static final class Builder {
        private final String name;
        private String tag = "";
        private String datacenter = "";
        private String near = "";

        private Builder(String name) {
            this.name = name;
        }

        public Builder tag(String tag) {
            this.tag = tag == null ? "" : tag;
            return this;
        }

        public Builder datacenter(String datacenter) {
            this.datacenter = datacenter == null ? "" : datacenter;
            return this;
        }

        public Builder near(String near) {
            this.near = near == null ? "" : near;
            return this;
        }

        public CatalogServiceQuery build() {
            return new CatalogServiceQuery(this);
        }
    }
}
