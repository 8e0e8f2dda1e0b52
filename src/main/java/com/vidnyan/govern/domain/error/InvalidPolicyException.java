package com.vidnyan.govern.domain.error;

import lombok.Getter;

import java.util.List;

/**
 * A policy or control failed validation at the storage boundary.
 */
@Getter
public class InvalidPolicyException extends GovernanceException {

    private final List<String> problems;

    public InvalidPolicyException(String policyId, List<String> problems) {
        super("Invalid policy " + policyId + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
