package com.vidnyan.govern.domain.policy;

import com.vidnyan.govern.domain.condition.ConditionValidator;
import com.vidnyan.govern.domain.error.InvalidPolicyException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rejects malformed policies before they reach a store.
 */
public final class PolicyValidator {

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    private PolicyValidator() {
    }

    public static void validate(Policy policy) {
        List<String> problems = problems(policy);
        if (!problems.isEmpty()) {
            throw new InvalidPolicyException(policy.id(), problems);
        }
    }

    public static List<String> problems(Policy policy) {
        List<String> problems = new ArrayList<>();
        if (policy.id() == null || policy.id().isBlank()) {
            problems.add("id is required");
        } else if (!ID_PATTERN.matcher(policy.id()).matches()) {
            problems.add("id may only contain letters, digits, '.', '_' and '-'");
        }
        if (policy.name() == null || policy.name().isBlank()) {
            problems.add("name is required");
        }
        if (policy.type() == null) {
            problems.add("type is required");
        }
        for (String pattern : policy.autoAttachPatterns()) {
            if (!ScopeMatcher.isWellFormed(pattern)) {
                problems.add("unrecognized auto-attach pattern '" + pattern + "'");
            }
        }

        Set<String> ruleIds = new HashSet<>();
        for (int i = 0; i < policy.rules().size(); i++) {
            Rule rule = policy.rules().get(i);
            String path = "rules[" + i + "]";
            if (rule == null) {
                problems.add(path + ": rule is missing");
                continue;
            }
            if (rule.id() == null || rule.id().isBlank()) {
                problems.add(path + ": id is required");
            } else if (!ruleIds.add(rule.id())) {
                problems.add(path + ": duplicate rule id '" + rule.id() + "'");
            }
            if (rule.action() == null) {
                problems.add(path + ": action is required");
            }
            problems.addAll(ConditionValidator.validate(rule.condition(), path + ".condition"));
        }
        return problems;
    }
}
