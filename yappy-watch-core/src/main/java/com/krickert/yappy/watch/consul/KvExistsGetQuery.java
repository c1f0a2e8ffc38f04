package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.KeyPair;
import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The full key pair, with {@link KeyPair#exists()} telling whether the key is there.
 */
public class KvExistsGetQuery extends AbstractDependency<KeyPair> {

    private final KvLookup lookup;

    public KvExistsGetQuery(KvLookup lookup) {
        this.lookup = lookup;
    }

    @Override
    public FetchResult<KeyPair> fetch(Clients clients) {
        checkStopped();
        IndexedResponse<Optional<KeyPair>> response =
                stopSignal.race(id(), () -> lookup.get(clients.discovery(), options()));
        KeyPair pair = response.value().orElseGet(() -> KeyPair.missing(lookup.key()));
        return FetchResult.of(pair, response.metadata());
    }

    @Override
    public String id() {
        List<String> params = new ArrayList<>();
        if (!lookup.datacenter().isEmpty()) {
            params.add("dc=" + lookup.datacenter());
        }
        if (!lookup.namespace().isEmpty()) {
            params.add("ns=" + lookup.namespace());
        }
        String key = params.isEmpty() ? lookup.key() : lookup.key() + "?" + String.join("&", params);
        return "kv.exists.get(" + key + ")";
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
