package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.HealthCheck;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthStatusTest {

    private static HealthCheck check(String checkId, String status) {
        return new HealthCheck("n1", checkId, checkId, status, "", "", "", "");
    }

    private static List<HealthCheck> checks(String... statuses) {
        return Arrays.stream(statuses).map(status -> check("serfHealth", status)).toList();
    }

    @Test
    void nodeMaintenanceOutranksEverything() {
        assertEquals("maintenance", HealthStatus.aggregate(List.of(
                check("serfHealth", "passing"),
                check("service:web", "critical"),
                check("_node_maintenance", "critical"))));
    }

    @Test
    void serviceMaintenanceCountsAsMaintenance() {
        assertEquals("maintenance", HealthStatus.aggregate(List.of(
                check("_service_maintenance:web-1", "critical"))));
    }

    @Test
    void criticalOutranksWarning() {
        assertEquals("critical", HealthStatus.aggregate(checks("warning", "critical", "passing")));
    }

    @Test
    void warningOutranksPassing() {
        assertEquals("warning", HealthStatus.aggregate(checks("passing", "warning")));
    }

    @Test
    void allPassingIsPassing() {
        assertEquals("passing", HealthStatus.aggregate(checks("passing", "passing")));
    }

    @Test
    void noChecksIsPassing() {
        assertEquals("passing", HealthStatus.aggregate(List.of()));
    }

    @Test
    void unknownStatusYieldsNoStatus() {
        assertEquals("", HealthStatus.aggregate(checks("passing", "sideways")));
    }
}
