package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.KeyPair;
import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.dependency.QueryOptions;

import java.util.List;

/**
 * All key pairs under a prefix. {@link KeyPair#key()} is relative to the prefix.
 */
public class KvListQuery extends AbstractDependency<List<KeyPair>> {

    private final String prefix;
    private final String datacenter;
    private final String namespace;

    public KvListQuery(String prefix) {
        this(prefix, "", "");
    }

    public KvListQuery(String prefix, String datacenter, String namespace) {
        this.prefix = stripLeadingSlash(prefix);
        this.datacenter = datacenter == null ? "" : datacenter;
        this.namespace = namespace == null ? "" : namespace;
    }

    @Override
    public FetchResult<List<KeyPair>> fetch(Clients clients) {
        checkStopped();
        QueryOptions opts = options().merge(QueryOptions.builder()
                .datacenter(datacenter)
                .namespace(namespace)
                .build());
        IndexedResponse<List<KeyPair>> response =
                stopSignal.race(id(), () -> clients.discovery().kvList(prefix, opts));
        List<KeyPair> pairs = response.value().stream()
                .map(pair -> pair.withKey(relativeKey(prefix, pair.path())))
                .toList();
        return FetchResult.of(pairs, response.metadata());
    }

    @Override
    public String id() {
        return "kv.list(" + (datacenter.isEmpty() ? prefix : prefix + "@" + datacenter) + ")";
    }

    @Override
    public boolean canShare() {
        return true;
    }

    static String relativeKey(String prefix, String path) {
        String key = path.startsWith(prefix) ? path.substring(prefix.length()) : path;
        return stripLeadingSlash(key);
    }

    static String stripLeadingSlash(String s) {
        String r = s == null ? "" : s;
        while (r.startsWith("/")) {
            r = r.substring(1);
        }
        return r;
    }
}
