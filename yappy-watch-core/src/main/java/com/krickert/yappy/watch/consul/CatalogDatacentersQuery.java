package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.dependency.AbstractDependency;
import com.krickert.yappy.watch.dependency.BlockingQueryEmulator;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.FetchResult;
import com.krickert.yappy.watch.dependency.QueryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Known datacenters, sorted. The listing has no index, so repeat polls sleep first.
 * <p>
 * With {@code ignoreFailing} each datacenter is probed with a consistent catalog read and
 * dropped when the probe fails.
 */
public class CatalogDatacentersQuery extends AbstractDependency<List<String>> {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogDatacentersQuery.class);

    public static final Duration POLL_INTERVAL = Duration.ofSeconds(15);

    private final boolean ignoreFailing;
    private final BlockingQueryEmulator emulator;
    private final Duration pollInterval;

    public CatalogDatacentersQuery(boolean ignoreFailing) {
        this(ignoreFailing, new BlockingQueryEmulator(), POLL_INTERVAL, Clock.systemUTC());
    }

    public CatalogDatacentersQuery(boolean ignoreFailing, BlockingQueryEmulator emulator,
                                   Duration pollInterval, Clock clock) {
        super(clock);
        this.ignoreFailing = ignoreFailing;
        this.emulator = emulator;
        this.pollInterval = pollInterval;
    }

    @Override
    public FetchResult<List<String>> fetch(Clients clients) {
        checkStopped();
        emulator.pauseIfPolled(id(), options(), pollInterval, stopSignal);

        DiscoveryClient discovery = clients.discovery();
        List<String> datacenters = stopSignal.race(id(), discovery::catalogDatacenters);
        List<String> result = new ArrayList<>();
        for (String dc : datacenters) {
            if (!ignoreFailing || reachable(discovery, dc)) {
                result.add(dc);
            }
        }
        result.sort(null);
        return FetchResult.synthetic(List.copyOf(result), clock);
    }

    private boolean reachable(DiscoveryClient discovery, String dc) {
        QueryOptions probe = QueryOptions.builder().datacenter(dc).requireConsistent(true).build();
        try {
            stopSignal.race(id(), () -> discovery.catalogServices(Map.of(), probe));
            return true;
        } catch (RuntimeException e) {
            checkStopped();
            LOG.debug("{}: skipping datacenter {}: {}", id(), dc, e.getMessage());
            return false;
        }
    }

    @Override
    public String id() {
        return "catalog.datacenters";
    }

    @Override
    public boolean canShare() {
        return true;
    }
}
