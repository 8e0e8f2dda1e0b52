package com.vidnyan.govern.application.port.in;

import com.vidnyan.govern.application.port.out.PolicyRepository.PolicyFilter;
import com.vidnyan.govern.domain.policy.Policy;
import com.vidnyan.govern.domain.policy.PolicyDraft;

import java.util.List;

/**
 * CRUD over stored policies.
 */
public interface ManagePoliciesUseCase {

    List<Policy> list(PolicyFilter filter);

    /**
     * @throws com.vidnyan.govern.domain.error.UnknownPolicyException if no policy has that id
     */
    Policy get(String policyId);

    /**
     * Create or replace a policy from a draft. A replaced policy keeps its creation time.
     *
     * @throws com.vidnyan.govern.domain.error.InvalidPolicyException if the draft is malformed
     */
    Policy save(PolicyDraft draft);

    boolean delete(String policyId);
}
