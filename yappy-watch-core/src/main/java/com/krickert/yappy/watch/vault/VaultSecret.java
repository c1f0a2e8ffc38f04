package com.krickert.yappy.watch.vault;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A secret as returned by the secret store, and the renewal target a vault dependency keeps
 * between fetches.
 * <p>
 * Renewal responses are partial, so updates go through {@link #mergeFrom(VaultSecret)} which
 * never clears a populated field.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VaultSecret {
    private String requestId = "";
    private String leaseId = "";
    private int leaseDuration;
    private boolean renewable;
    private Map<String, Object> data;
    private List<String> warnings;
    private SecretAuth auth;
    private SecretWrapInfo wrapInfo;

    /**
     * Creates the caller-facing copy of a raw secret. {@code defaultLease} is the lease assumed when
     * the raw secret reports none.
     */
    public static VaultSecret transform(VaultSecret raw, Duration defaultLease) {
        VaultSecret ours = new VaultSecret();
        ours.setLeaseDuration(defaultLease == null ? 0 : (int) defaultLease.toSeconds());
        if (raw != null) {
            ours.mergeFrom(raw);
        }
        return ours;
    }

    /**
     * Copies every non-empty field of {@code other} onto this secret. Nested auth and wrap-info blocks
     * are merged field by field.
     */
    public void mergeFrom(VaultSecret other) {
        if (other == null) {
            return;
        }
        if (other.requestId != null && !other.requestId.isEmpty()) {
            requestId = other.requestId;
        }
        if (other.leaseId != null && !other.leaseId.isEmpty()) {
            leaseId = other.leaseId;
        }
        if (other.leaseDuration != 0) {
            leaseDuration = other.leaseDuration;
        }
        if (other.renewable) {
            renewable = true;
        }
        if (other.data != null && !other.data.isEmpty()) {
            data = other.data;
        }
        if (other.warnings != null && !other.warnings.isEmpty()) {
            warnings = other.warnings;
        }
        if (other.auth != null) {
            if (auth == null) {
                auth = new SecretAuth();
            }
            auth.mergeFrom(other.auth);
        }
        if (other.wrapInfo != null) {
            if (wrapInfo == null) {
                wrapInfo = new SecretWrapInfo();
            }
            wrapInfo.mergeFrom(other.wrapInfo);
        }
    }

    /**
     * Auth secrets are renewable when their auth block says so, other secrets when the lease does.
     */
    @JsonIgnore
    public boolean isEffectivelyRenewable() {
        return auth != null ? auth.isRenewable() : renewable;
    }

    @JsonIgnore
    public boolean hasLeaseId() {
        return leaseId != null && !leaseId.isEmpty();
    }
}
