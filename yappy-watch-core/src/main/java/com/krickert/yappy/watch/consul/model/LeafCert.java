package com.krickert.yappy.watch.consul.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A connect leaf certificate issued to a service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LeafCert(
        @JsonProperty("SerialNumber") String serialNumber,
        @JsonProperty("CertPEM") String certPem,
        @JsonProperty("PrivateKeyPEM") String privateKeyPem,
        @JsonProperty("Service") String service,
        @JsonProperty("ServiceURI") String serviceUri,
        @JsonProperty("ValidAfter") String validAfter,
        @JsonProperty("ValidBefore") String validBefore
) {
}
