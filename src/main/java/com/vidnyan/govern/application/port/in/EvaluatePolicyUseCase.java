package com.vidnyan.govern.application.port.in;

import com.vidnyan.govern.domain.model.EvaluationInput;
import com.vidnyan.govern.domain.policy.AggregateResult;
import com.vidnyan.govern.domain.policy.Policy;
import com.vidnyan.govern.domain.policy.PolicyResult;

/**
 * Trigger-mode evaluation of a single input, typically a planned change.
 */
public interface EvaluatePolicyUseCase {

    /**
     * Evaluate one stored policy.
     *
     * @throws com.vidnyan.govern.domain.error.UnknownPolicyException if no policy has that id
     */
    PolicyResult evaluate(String policyId, EvaluationInput input);

    PolicyResult evaluate(Policy policy, EvaluationInput input);

    /**
     * Evaluate every enabled stored policy; any denial denies.
     */
    AggregateResult evaluateAll(EvaluationInput input);
}
