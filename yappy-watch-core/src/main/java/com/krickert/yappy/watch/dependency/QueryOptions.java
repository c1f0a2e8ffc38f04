package com.krickert.yappy.watch.dependency;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Client-agnostic options sent with a query. Each dependency decides which of them it uses.
 * <p>
 * Zero values ({@code false}, empty string, {@code 0}, {@link Duration#ZERO}) mean "not set".
 * {@link #merge(QueryOptions)} is right-biased: every populated field of the override wins,
 * a zero-valued field never clobbers what is already set.
 *
 * @param allowStale        allow any server (not only the leader) to answer
 * @param datacenter        target datacenter
 * @param namespace         target namespace
 * @param filter            filter expression evaluated by the backend
 * @param near              sort results by round trip time from this node
 * @param requireConsistent force a consistent read through the leader
 * @param waitIndex         last observed change index; non-zero requests a blocking query
 * @param waitTime          maximum time a blocking query may be held open
 * @param defaultLease      lease to assume for secrets that do not report one
 */
public record QueryOptions(
        boolean allowStale,
        String datacenter,
        String namespace,
        String filter,
        String near,
        boolean requireConsistent,
        long waitIndex,
        Duration waitTime,
        Duration defaultLease
) {

    public static final QueryOptions EMPTY = builder().build();

    public QueryOptions {
        datacenter = datacenter == null ? "" : datacenter;
        namespace = namespace == null ? "" : namespace;
        filter = filter == null ? "" : filter;
        near = near == null ? "" : near;
        waitTime = waitTime == null ? Duration.ZERO : waitTime;
        defaultLease = defaultLease == null ? Duration.ZERO : defaultLease;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .allowStale(allowStale)
                .datacenter(datacenter)
                .namespace(namespace)
                .filter(filter)
                .near(near)
                .requireConsistent(requireConsistent)
                .waitIndex(waitIndex)
                .waitTime(waitTime)
                .defaultLease(defaultLease);
    }

    /**
     * Combines these options with {@code override}. A {@code null} override returns a copy of this.
     */
    public QueryOptions merge(QueryOptions override) {
        if (override == null) {
            return this;
        }
        return new QueryOptions(
                override.allowStale || allowStale,
                override.datacenter.isEmpty() ? datacenter : override.datacenter,
                override.namespace.isEmpty() ? namespace : override.namespace,
                override.filter.isEmpty() ? filter : override.filter,
                override.near.isEmpty() ? near : override.near,
                override.requireConsistent || requireConsistent,
                override.waitIndex != 0 ? override.waitIndex : waitIndex,
                override.waitTime.isZero() ? waitTime : override.waitTime,
                override.defaultLease.isZero() ? defaultLease : override.defaultLease
        );
    }

    /**
     * Copy of these options with the blocking fields cleared, for dependency kinds that never block.
     */
    public QueryOptions withoutBlocking() {
        return toBuilder().waitIndex(0).waitTime(Duration.ZERO).build();
    }

    public boolean isBlocking() {
        return waitIndex != 0;
    }

    /**
     * Renders the options as a Consul HTTP query string, keys sorted.
     */
    public String toQueryString() {
        Map<String, String> params = new TreeMap<>();
        if (allowStale) {
            params.put("stale", "true");
        }
        if (!datacenter.isEmpty()) {
            params.put("dc", datacenter);
        }
        if (!filter.isEmpty()) {
            params.put("filter", filter);
        }
        if (!namespace.isEmpty()) {
            params.put("ns", namespace);
        }
        if (!near.isEmpty()) {
            params.put("near", near);
        }
        if (requireConsistent) {
            params.put("consistent", "true");
        }
        if (waitIndex != 0) {
            params.put("index", Long.toUnsignedString(waitIndex));
        }
        if (!waitTime.isZero()) {
            params.put("wait", waitTime.toMillis() + "ms");
        }
        return params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    @Override
    public String toString() {
        return toQueryString();
    }

    public static final class Builder {
        private boolean allowStale;
        private String datacenter = "";
        private String namespace = "";
        private String filter = "";
        private String near = "";
        private boolean requireConsistent;
        private long waitIndex;
        private Duration waitTime = Duration.ZERO;
        private Duration defaultLease = Duration.ZERO;

        private Builder() {
        }

        public Builder allowStale(boolean allowStale) {
            this.allowStale = allowStale;
            return this;
        }

        public Builder datacenter(String datacenter) {
            this.datacenter = datacenter;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder filter(String filter) {
            this.filter = filter;
            return this;
        }

        public Builder near(String near) {
            this.near = near;
            return this;
        }

        public Builder requireConsistent(boolean requireConsistent) {
            this.requireConsistent = requireConsistent;
            return this;
        }

        public Builder waitIndex(long waitIndex) {
            this.waitIndex = waitIndex;
            return this;
        }

        public Builder waitTime(Duration waitTime) {
            this.waitTime = waitTime;
            return this;
        }

        public Builder defaultLease(Duration defaultLease) {
            this.defaultLease = defaultLease;
            return this;
        }

        public QueryOptions build() {
            return new QueryOptions(allowStale, datacenter, namespace, filter, near,
                    requireConsistent, waitIndex, waitTime, defaultLease);
        }
    }
}
