package com.vidnyan.govern.domain.policy;

import java.time.Instant;
import java.util.List;

/**
 * Result of evaluating one policy against one input.
 * {@code passed} is false iff a deny rule fired.
 */
public record PolicyResult(
    String policyId,
    String policyName,
    boolean passed,
    boolean denied,
    List<RuleResult> ruleResults,
    List<String> denials,
    List<String> warnings,
    List<String> notifications,
    boolean approvalRequired,
    Instant evaluatedAt,
    long durationMs
) {

    public PolicyResult {
        ruleResults = List.copyOf(ruleResults);
        denials = List.copyOf(denials);
        warnings = List.copyOf(warnings);
        notifications = List.copyOf(notifications);
    }

    /**
     * Passing result with no rules evaluated, used for disabled policies.
     */
    public static PolicyResult skipped(Policy policy, Instant now) {
        return new PolicyResult(policy.id(), policy.name(), true, false,
                List.of(), List.of(), List.of(), List.of(), false, now, 0);
    }

    public List<RuleResult> firedRules() {
        return ruleResults.stream().filter(RuleResult::fired).toList();
    }
}
