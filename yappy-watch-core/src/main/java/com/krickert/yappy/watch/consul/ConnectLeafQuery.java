package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.LeafCert;
import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;

/**
 * The connect leaf certificate the local agent holds for a service.
 */
public class ConnectLeafQuery extends AbstractDependency<LeafCert> {

    private final String service;

    public ConnectLeafQuery(String service) {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("connect.caleaf: service required");
        }
        this.service = service;
    }

    @Override
    public FetchResult<LeafCert> fetch(Clients clients) {
        checkStopped();
        IndexedResponse<LeafCert> response =
                stopSignal.race(id(), () -> clients.discovery().connectCaLeaf(service, options()));
        return FetchResult.of(response.value(), response.metadata());
    }

    @Override
    public String id() {
        return "connect.caleaf(" + service + ")";
    }

    @Override
    public boolean canShare() {
        return false;
    }

    @Override
    public boolean isBlockingQuery() {
        return true;
    }
}
