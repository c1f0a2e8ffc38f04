package com.krickert.yappy.watch.consul;

import com.krickert.yappy.watch.consul.model.HealthCheck;

import java.util.List;
import java.util.Set;

/**
 * Health status names and the rule that folds a service's checks into one status.
 */
public final class HealthStatus {

    public static final String ANY = "any";
    public static final String PASSING = "passing";
    public static final String WARNING = "warning";
    public static final String CRITICAL = "critical";
    public static final String MAINTENANCE = "maintenance";

    public static final Set<String> FILTERS = Set.of(ANY, PASSING, WARNING, CRITICAL, MAINTENANCE);

    static final String NODE_MAINTENANCE_CHECK = "_node_maintenance";
    static final String SERVICE_MAINTENANCE_PREFIX = "_service_maintenance:";

    private HealthStatus() {
    }

    /**
     * Maintenance wins over critical, critical over warning, warning over passing. No checks
     * means passing. A check with an unknown status makes the result empty.
     */
    public static String aggregate(List<HealthCheck> checks) {
        boolean passing = false;
        boolean warning = false;
        boolean critical = false;
        boolean maintenance = false;
        for (HealthCheck check : checks) {
            String checkId = check.checkId() == null ? "" : check.checkId();
            if (checkId.equals(NODE_MAINTENANCE_CHECK) || checkId.startsWith(SERVICE_MAINTENANCE_PREFIX)) {
                maintenance = true;
                continue;
            }
            String status = check.status() == null ? "" : check.status();
            switch (status) {
                case PASSING -> passing = true;
                case WARNING -> warning = true;
                case CRITICAL -> critical = true;
                default -> {
                    return "";
                }
            }
        }
        if (maintenance) {
            return MAINTENANCE;
        }
        if (critical) {
            return CRITICAL;
        }
        if (warning) {
            return WARNING;
        }
        return PASSING;
    }
}
