package com.vidnyan.govern.domain.policy;

import java.time.Instant;
import java.util.List;

/**
 * Combined decision over many policies. Deny wins: one denying policy makes the
 * whole result denied, whatever the others say.
 */
public record AggregateResult(
    boolean allowed,
    boolean denied,
    List<String> denials,
    List<String> warnings,
    List<String> notifications,
    boolean approvalRequired,
    List<PolicyResult> results,
    int totalPolicies,
    int passedPolicies,
    int failedPolicies,
    Instant evaluatedAt,
    long totalDurationMs
) {

    public AggregateResult {
        denials = List.copyOf(denials);
        warnings = List.copyOf(warnings);
        notifications = List.copyOf(notifications);
        results = List.copyOf(results);
    }
}
