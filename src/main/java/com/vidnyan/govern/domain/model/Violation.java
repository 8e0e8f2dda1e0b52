package com.vidnyan.govern.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vidnyan.govern.domain.policy.RuleAction;
import lombok.Builder;

/**
 * One failing (policy or framework, rule or control, resource) combination.
 * Immutable value object; the status is decided from the waiver layer when the
 * violation is built and never changes afterwards.
 * <p>
 * For policy violations {@code policyId}/{@code policyName} name the policy and
 * {@code ruleId} the fired rule. For control violations they name the framework
 * (null for a bare control) and {@code ruleId} is the control id; {@code action}
 * is null.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record Violation(
    String policyId,
    String policyName,
    String ruleId,
    String description,
    Severity severity,
    RuleAction action,
    String message,
    String remediation,
    String resourceId,
    String resourceType,
    String resourceName,
    String provider,
    ViolationStatus status
) {

    public Violation {
        status = status == null ? ViolationStatus.OPEN : status;
    }

    public boolean isOpen() {
        return status == ViolationStatus.OPEN;
    }

    public boolean isWaived() {
        return status == ViolationStatus.WAIVED;
    }
}
