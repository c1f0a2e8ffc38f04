package com.krickert.yappy.watch.vault;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * Response-wrapping details; {@code token} is the single-use wrapping token.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SecretWrapInfo {
    private String token = "";
    private int ttl;
    private String creationTime = "";
    private String wrappedAccessor = "";

    void mergeFrom(SecretWrapInfo other) {
        if (other.token != null && !other.token.isEmpty()) {
            token = other.token;
        }
        if (other.ttl != 0) {
            ttl = other.ttl;
        }
        if (other.creationTime != null && !other.creationTime.isEmpty()) {
            creationTime = other.creationTime;
        }
        if (other.wrappedAccessor != null && !other.wrappedAccessor.isEmpty()) {
            wrappedAccessor = other.wrappedAccessor;
        }
    }
}
