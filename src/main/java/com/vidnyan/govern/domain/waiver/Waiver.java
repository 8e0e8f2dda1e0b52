package com.vidnyan.govern.domain.waiver;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Approved, time-bounded exception for one (control or policy, resource) pair.
 * Active while {@code expiresAt} is strictly after the evaluation instant.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Waiver(
    String id,
    String controlOrPolicyId,
    String resourceId,
    String reason,
    String approvedBy,
    Instant approvedAt,
    Instant expiresAt
) {

    public static final String ID_PREFIX = "waiver-";
    public static final int DEFAULT_EXPIRY_DAYS = 90;

    public static Waiver create(String controlOrPolicyId, String resourceId, String reason,
                                String approvedBy, Integer expiresInDays, Instant now) {
        int days = expiresInDays != null ? expiresInDays : DEFAULT_EXPIRY_DAYS;
        return Waiver.builder()
                .id(ID_PREFIX + UUID.randomUUID())
                .controlOrPolicyId(controlOrPolicyId)
                .resourceId(resourceId)
                .reason(reason)
                .approvedBy(approvedBy)
                .approvedAt(now)
                .expiresAt(now.plus(Duration.ofDays(days)))
                .build();
    }

    public boolean isActive(Instant now) {
        return expiresAt != null && expiresAt.isAfter(now);
    }

    public WaiverKey key() {
        return new WaiverKey(controlOrPolicyId, resourceId);
    }

    /**
     * Identity of a waiver slot; at most one live waiver per key.
     */
    public record WaiverKey(String controlOrPolicyId, String resourceId) {}
}
