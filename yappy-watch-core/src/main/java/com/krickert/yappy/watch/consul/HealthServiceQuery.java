package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.AgentService;
import com.krickert.yappy.watch.consul.model.HealthEntry;
import com.krickert.yappy.watch.consul.model.HealthService;
import com.krickert.yappy.watch.consul.model.Node;
import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.dependency.QueryOptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Instances of a service with their aggregated health, filtered by status.
 * <p>
 * The default status filter is {@code passing}, which is pushed down to the server. Any other
 * combination is applied to the aggregated status of each instance. Results are sorted by node
 * then service id unless ordered by distance from {@code near}.
 */
public class HealthServiceQuery extends AbstractDependency<List<HealthService>> {

    private static final Comparator<HealthService> BY_NODE_THEN_ID =
            Comparator.comparing(HealthService::node).thenComparing(HealthService::id);

    private final String name;
    private final String tag;
    private final String datacenter;
    private final String near;
    private final String namespace;
    private final String filter;
    private final List<String> statusFilters;
    private final boolean connect;
    private final boolean passingOnly;

    private HealthServiceQuery(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("health.service: name required");
        }
        for (String status : builder.statusFilters) {
            if (!HealthStatus.FILTERS.contains(status)) {
                throw new IllegalArgumentException(
                        "health.service: invalid filter: \"" + status + "\" for \"" + builder.name + "\"");
            }
        }
        this.name = builder.name;
        this.tag = builder.tag;
        this.datacenter = builder.datacenter;
        this.near = builder.near;
        this.namespace = builder.namespace;
        this.filter = builder.filter;
        this.statusFilters = builder.statusFilters.isEmpty()
                ? List.of(HealthStatus.PASSING)
                : builder.statusFilters.stream().sorted().toList();
        this.connect = builder.connect;
        this.passingOnly = statusFilters.equals(List.of(HealthStatus.PASSING));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public FetchResult<List<HealthService>> fetch(Clients clients) {
        checkStopped();
        QueryOptions opts = options().merge(QueryOptions.builder()
                .datacenter(datacenter)
                .filter(filter)
                .namespace(namespace)
                .near(near)
                .build());
        IndexedResponse<List<HealthEntry>> response = stopSignal.race(id(),
                () -> clients.discovery().healthService(name, tag, passingOnly, connect, opts));

        List<HealthService> services = new ArrayList<>();
        for (HealthEntry entry : response.value()) {
            String status = HealthStatus.aggregate(entry.checks());
            if (accepts(status)) {
                services.add(toHealthService(entry, status));
            }
        }
        if (near.isEmpty()) {
            services.sort(BY_NODE_THEN_ID);
        }
        return FetchResult.of(List.copyOf(services), response.metadata());
    }

    private boolean accepts(String status) {
        return statusFilters.contains(HealthStatus.ANY) || statusFilters.contains(status);
    }

    private static HealthService toHealthService(HealthEntry entry, String status) {
        Node node = entry.node();
        AgentService service = entry.service();
        String address = service.address() == null || service.address().isEmpty()
                ? node.address()
                : service.address();
        return new HealthService(
                node.node(),
                node.id(),
                service.kind() == null ? "" : service.kind(),
                node.address(),
                node.datacenter(),
                node.taggedAddresses(),
                node.meta(),
                service.meta(),
                address,
                service.id(),
                service.service(),
                service.tags(),
                status,
                entry.checks(),
                service.port(),
                service.weights(),
                service.namespace() == null ? "" : service.namespace());
    }

    @Override
    public String id() {
        StringBuilder id = new StringBuilder();
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
        id.append('|').append(String.join(",", statusFilters));

        List<String> params = new ArrayList<>();
        if (!namespace.isEmpty()) {
            params.add("ns=" + namespace);
        }
        if (!filter.isEmpty()) {
            params.add("filter=" + filter);
        }
        if (!params.isEmpty()) {
            id.append('?').append(String.join("&", params));
        }
        return "health.service(" + id + ")";
    }

    @Override
    public boolean canShare() {
        return true;
    }

    boolean passingOnly() {
        return passingOnly;
    }

    public static final class Builder {
        private final String name;
        private String tag = "";
        private String datacenter = "";
        private String near = "";
        private String namespace = "";
        private String filter = "";
        private List<String> statusFilters = List.of();
        private boolean connect;

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

        public Builder namespace(String namespace) {
            this.namespace = namespace == null ? "" : namespace;
            return this;
        }

        /**
         * Server-side filter expression, passed through unchanged.
         */
        public Builder filter(String filter) {
            this.filter = filter == null ? "" : filter;
            return this;
        }

        public Builder statusFilters(List<String> statusFilters) {
            this.statusFilters = statusFilters == null ? List.of() : List.copyOf(statusFilters);
            return this;
        }

        /**
         * Query connect-capable endpoints (sidecar proxies or native services) of the service.
         */
        public Builder connect(boolean connect) {
            this.connect = connect;
            return this;
        }

        public HealthServiceQuery build() {
            return new HealthServiceQuery(this);
        }
    }
}
