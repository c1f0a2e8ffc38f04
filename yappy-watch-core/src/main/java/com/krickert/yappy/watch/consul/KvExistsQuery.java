package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.KeyPair;
import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.dependency.QueryOptions;

import java.util.Optional;

/**
 * Whether a key exists. Never blocks: the wait index and wait time are dropped from any options
 * it is given.
 */
public class KvExistsQuery extends AbstractDependency<Boolean> {

    private final KvLookup lookup;

    public KvExistsQuery(KvLookup lookup) {
        this.lookup = lookup;
    }

    @Override
    public FetchResult<Boolean> fetch(Clients clients) {
        checkStopped();
        IndexedResponse<Optional<KeyPair>> response =
                stopSignal.race(id(), () -> lookup.get(clients.discovery(), options()));
        return FetchResult.of(response.value().isPresent(), response.metadata());
    }

    @Override
    public void setOptions(QueryOptions options) {
        super.setOptions(options == null ? null : options.withoutBlocking());
    }

    @Override
    public String id() {
        return "kv.exists(" + lookup.keyAtDatacenter() + ")";
    }

    @Override
    public boolean canShare() {
        return true;
    }
}
