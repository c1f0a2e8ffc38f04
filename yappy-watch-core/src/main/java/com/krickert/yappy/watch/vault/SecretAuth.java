package com.krickert.yappy.watch.vault;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Authentication block of a secret (present for login and token responses).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SecretAuth {
    private String clientToken = "";
    private String accessor = "";
    private List<String> policies;
    private Map<String, String> metadata;
    private int leaseDuration;
    private boolean renewable;

    void mergeFrom(SecretAuth other) {
        if (notEmpty(other.clientToken)) {
            clientToken = other.clientToken;
        }
        if (notEmpty(other.accessor)) {
            accessor = other.accessor;
        }
        if (other.policies != null && !other.policies.isEmpty()) {
            policies = other.policies;
        }
        if (other.metadata != null && !other.metadata.isEmpty()) {
            metadata = other.metadata;
        }
        if (other.leaseDuration != 0) {
            leaseDuration = other.leaseDuration;
        }
        if (other.renewable) {
            renewable = true;
        }
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }
}
