package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.AgentService;
import com.krickert.yappy.watch.consul.model.HealthCheck;
import com.krickert.yappy.watch.consul.model.HealthEntry;
import com.krickert.yappy.watch.consul.model.HealthService;
import com.krickert.yappy.watch.consul.model.Node;
import com.krickert.yappy.watch.dependency.Clients;
import com.krickert.yappy.watch.dependency.QueryOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthServiceQueryTest {

    @Mock
    private Clients clients;
    @Mock
    private DiscoveryClient discovery;

    private static HealthEntry entry(String node, String id, String serviceAddress, String... statuses) {
        List<HealthCheck> checks = new ArrayList<>();
        for (int i = 0; i < statuses.length; i++) {
            checks.add(new HealthCheck(node, "check-" + i, "check " + i, statuses[i], "", "", id, "web"));
        }
        return new HealthEntry(
                new Node(node + "-id", node, "10.0.0." + node.length(), "dc1", Map.of(), Map.of()),
                new AgentService(id, "web", "", List.of("v2", "blue"), serviceAddress, Map.of(), 8080,
                        Map.of("Passing", 1, "Warning", 1), ""),
                checks);
    }

    @Test
    @DisplayName("Default filter asks the server for passing instances only")
    void defaultFilterIsPassing() {
        HealthServiceQuery query = HealthServiceQuery.builder("web").build();

        assertTrue(query.passingOnly());
        assertEquals("health.service(web|passing)", query.id());
    }

    @Test
    void filtersAreSortedAndDisablePassingOnly() {
        HealthServiceQuery query = HealthServiceQuery.builder("web")
                .tag("v2")
                .datacenter("dc1")
                .near("_agent")
                .statusFilters(List.of("warning", "critical"))
                .namespace("team")
                .filter("Service.Meta.env == prod")
                .build();

        assertFalse(query.passingOnly());
        assertEquals("health.service(v2.web@dc1~_agent|critical,warning?ns=team&filter=Service.Meta.env == prod)",
                query.id());
    }

    @Test
    void unknownStatusFilterIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> HealthServiceQuery.builder("web").statusFilters(List.of("sick")).build());
        assertThrows(IllegalArgumentException.class, () -> HealthServiceQuery.builder(" ").build());
    }

    @Test
    void filtersOnAggregatedStatusAndSortsByNodeThenId() {
        when(clients.discovery()).thenReturn(discovery);
        when(discovery.healthService(eq("web"), eq(""), eq(false), eq(false), any()))
                .thenReturn(new IndexedResponse<>(List.of(
                        entry("node-b", "web-2", "", "passing", "warning"),
                        entry("node-a", "web-9", "192.168.1.9", "critical"),
                        entry("node-a", "web-1", "", "passing"),
                        entry("node-c", "web-3", "", "passing", "maintenance")), 40, Duration.ZERO));

        List<HealthService> services = HealthServiceQuery.builder("web")
                .statusFilters(List.of("passing", "warning"))
                .build()
                .fetch(clients)
                .value();

        assertEquals(List.of("web-1", "web-2"), services.stream().map(HealthService::id).toList());
        assertEquals("passing", services.get(0).status());
        assertEquals("warning", services.get(1).status());
        assertEquals(services.get(0).nodeAddress(), services.get(0).address());
        assertEquals(List.of("blue", "v2"), services.get(0).tags());
    }

    @Test
    void anyAcceptsEveryStatus() {
        when(clients.discovery()).thenReturn(discovery);
        when(discovery.healthService(anyString(), anyString(), anyBoolean(), anyBoolean(), any()))
                .thenReturn(new IndexedResponse<>(List.of(
                        entry("node-a", "web-1", "10.1.1.1", "critical"),
                        entry("node-b", "web-2", "", "maintenance")), 41, Duration.ZERO));

        List<HealthService> services = HealthServiceQuery.builder("web")
                .statusFilters(List.of("any"))
                .build()
                .fetch(clients)
                .value();

        assertEquals(2, services.size());
        assertEquals("10.1.1.1", services.get(0).address());
    }

    @Test
    void connectVariantAndScopeArePassedThrough() {
        when(clients.discovery()).thenReturn(discovery);
        when(discovery.healthService(eq("web"), eq("v2"), eq(true), eq(true), any()))
                .thenReturn(new IndexedResponse<>(List.of(), 7, Duration.ZERO));
        HealthServiceQuery query = HealthServiceQuery.builder("web")
                .tag("v2")
                .datacenter("dc3")
                .filter("Service.Port == 8080")
                .connect(true)
                .build();

        assertEquals(List.of(), query.fetch(clients).value());

        ArgumentCaptor<QueryOptions> captor = ArgumentCaptor.forClass(QueryOptions.class);
        verify(discovery).healthService(eq("web"), eq("v2"), eq(true), eq(true), captor.capture());
        assertEquals("dc3", captor.getValue().datacenter());
        assertEquals("Service.Port == 8080", captor.getValue().filter());
    }
}
