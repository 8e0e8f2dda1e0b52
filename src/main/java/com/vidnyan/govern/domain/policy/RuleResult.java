package com.vidnyan.govern.domain.policy;

/**
 * Outcome of one rule; {@code fired} means its condition matched.
 */
public record RuleResult(
    String ruleId,
    String description,
    boolean fired,
    RuleAction action,
    String message
) {

    public boolean passed() {
        return !fired;
    }
}
