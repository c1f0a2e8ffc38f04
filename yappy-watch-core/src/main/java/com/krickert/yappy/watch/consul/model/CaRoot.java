package com.krickert.yappy.watch.consul.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A connect CA root certificate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CaRoot(
        @JsonProperty("ID") String id,
        @JsonProperty("Name") String name,
        @JsonProperty("RootCert") String rootCertPem,
        @JsonProperty("Active") boolean active
) {
}
