package com.vidnyan.govern.domain.error;

import lombok.Getter;

/**
 * A caller referenced a policy, control or library template id that does not exist.
 */
@Getter
public class UnknownPolicyException extends GovernanceException {

    private final String policyId;

    public UnknownPolicyException(String policyId) {
        this("Unknown policy: " + policyId, policyId);
    }

    public UnknownPolicyException(String message, String policyId) {
        super(message);
        this.policyId = policyId;
    }
}
