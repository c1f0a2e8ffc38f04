package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.dependency.QueryOptions;

import java.util.List;

/**
 * Key names under a prefix, relative to it.
 */
public class KvKeysQuery extends AbstractDependency<List<String>> {

    private final String prefix;
    private final String datacenter;

    public KvKeysQuery(String prefix) {
        this(prefix, "");
    }

    public KvKeysQuery(String prefix, String datacenter) {
        this.prefix = KvListQuery.stripLeadingSlash(prefix);
        this.datacenter = datacenter == null ? "" : datacenter;
    }

    @Override
    public FetchResult<List<String>> fetch(Clients clients) {
        checkStopped();
        QueryOptions opts = options().merge(QueryOptions.builder().datacenter(datacenter).build());
        IndexedResponse<List<String>> response =
                stopSignal.race(id(), () -> clients.discovery().kvKeys(prefix, opts));
        List<String> keys = response.value().stream()
                .map(key -> KvListQuery.relativeKey(prefix, key))
                .toList();
        return FetchResult.of(keys, response.metadata());
    }

    @Override
    public String id() {
        return "kv.keys(" + (datacenter.isEmpty() ? prefix : prefix + "@" + datacenter) + ")";
    }

    @Override
    public boolean canShare() {
        return true;
    }
}
