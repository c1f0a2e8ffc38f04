package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.KeyPair;
import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;

import java.util.Optional;

/**
 * Value of a single key, empty while the key does not exist.
 */
public class KvGetQuery extends AbstractDependency<Optional<String>> {

    private final KvLookup lookup;

    public KvGetQuery(KvLookup lookup) {
        this.lookup = lookup;
    }

    @Override
    public FetchResult<Optional<String>> fetch(Clients clients) {
        checkStopped();
        IndexedResponse<Optional<KeyPair>> response =
                stopSignal.race(id(), () -> lookup.get(clients.discovery(), options()));
        return FetchResult.of(response.value().map(KeyPair::value), response.metadata());
    }

    @Override
    public String id() {
        return "kv.get(" + lookup.keyAtDatacenter() + ")";
    }

    @Override
    public boolean canShare() {
        return true;
    }

    @Override
    public boolean isBlockingQuery() {
        return true;
    }
}
