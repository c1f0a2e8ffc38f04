package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.CaRoot;
import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;

import java.util.List;

/**
 * The connect CA root certificates trusted by the local agent.
 */
public class ConnectCaQuery extends AbstractDependency<List<CaRoot>> {

    @Override
    public FetchResult<List<CaRoot>> fetch(Clients clients) {
        checkStopped();
        IndexedResponse<List<CaRoot>> response =
                stopSignal.race(id(), () -> clients.discovery().connectCaRoots(options()));
        return FetchResult.of(response.value(), response.metadata());
    }

    @Override
    public String id() {
        return "connect.caroots";
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
