package com.vidnyan.govern.application.port.out;

import com.vidnyan.govern.domain.model.Severity;
import com.vidnyan.govern.domain.policy.Policy;
import com.vidnyan.govern.domain.policy.PolicyType;

import java.util.List;
import java.util.Optional;

/**
 * Port for storing policies.
 * Implementations validate on save so stored policies always evaluate cleanly.
 */
public interface PolicyRepository {

    /**
     * List policies matching the filter, ordered by id.
     */
    List<Policy> list(PolicyFilter filter);

    Optional<Policy> findById(String policyId);

    /**
     * Validate and store a policy, replacing any policy with the same id.
     *
     * @throws com.vidnyan.govern.domain.error.InvalidPolicyException if the policy is malformed
     */
    Policy save(Policy policy);

    boolean delete(String policyId);

    /**
     * Optional criteria; null fields match everything.
     */
    record PolicyFilter(PolicyType type, Severity severity, Boolean enabled) {

        public static PolicyFilter all() {
            return new PolicyFilter(null, null, null);
        }

        public static PolicyFilter enabledOnly() {
            return new PolicyFilter(null, null, true);
        }

        public boolean test(Policy policy) {
            return (type == null || policy.type() == type)
                    && (severity == null || policy.severity() == severity)
                    && (enabled == null || policy.enabled() == enabled);
        }
    }
}
