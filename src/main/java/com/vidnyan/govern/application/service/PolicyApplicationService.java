package com.vidnyan.govern.application.service;

import com.vidnyan.govern.application.port.in.EvaluatePolicyUseCase;
import com.vidnyan.govern.application.port.in.ManagePoliciesUseCase;
import com.vidnyan.govern.application.port.in.ScanResourcesUseCase;
import com.vidnyan.govern.application.port.out.PolicyRepository;
import com.vidnyan.govern.application.port.out.PolicyRepository.PolicyFilter;
import com.vidnyan.govern.application.port.out.WaiverStore;
import com.vidnyan.govern.domain.error.UnknownPolicyException;
import com.vidnyan.govern.domain.model.EvaluationInput;
import com.vidnyan.govern.domain.model.Resource;
import com.vidnyan.govern.domain.model.Violation;
import com.vidnyan.govern.domain.policy.AggregateResult;
import com.vidnyan.govern.domain.policy.Policy;
import com.vidnyan.govern.domain.policy.PolicyDraft;
import com.vidnyan.govern.domain.policy.PolicyEvaluationEngine;
import com.vidnyan.govern.domain.policy.PolicyResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Orchestrates trigger-mode evaluation and policy management over the stored policies.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyApplicationService implements EvaluatePolicyUseCase, ScanResourcesUseCase, ManagePoliciesUseCase {

    private final PolicyRepository policyRepository;
    private final WaiverStore waiverStore;
    private final PolicyEvaluationEngine engine;
    private final Clock clock;

    @Override
    public PolicyResult evaluate(String policyId, EvaluationInput input) {
        return evaluate(get(policyId), input);
    }

    @Override
    public PolicyResult evaluate(Policy policy, EvaluationInput input) {
        PolicyResult result = engine.evaluate(policy, input);
        log.info("Policy {} evaluated: {}", policy.id(), result.denied() ? "DENIED" : "passed");
        return result;
    }

    @Override
    public AggregateResult evaluateAll(EvaluationInput input) {
        List<Policy> policies = policyRepository.list(PolicyFilter.enabledOnly());
        log.info("Evaluating input against {} policies", policies.size());

        AggregateResult result = engine.evaluateAll(policies, input);
        log.info("Evaluation complete: {} ({} denials, {} warnings, approval required: {})",
                result.allowed() ? "ALLOWED" : "DENIED",
                result.denials().size(),
                result.warnings().size(),
                result.approvalRequired());
        return result;
    }

    @Override
    public List<Violation> scanResources(List<Policy> policies, List<Resource> resources) {
        Instant startTime = clock.instant();
        log.info("Scanning {} resources against {} policies", resources.size(), policies.size());

        List<Violation> violations = engine.scanResources(policies, resources, waiverStore);

        long open = violations.stream().filter(Violation::isOpen).count();
        log.info("Scan complete: {} violations ({} open) in {}ms",
                violations.size(), open, Duration.between(startTime, clock.instant()).toMillis());
        return violations;
    }

    @Override
    public List<Violation> scanStored(List<Resource> resources) {
        return scanResources(policyRepository.list(PolicyFilter.enabledOnly()), resources);
    }

    @Override
    public List<Policy> list(PolicyFilter filter) {
        return policyRepository.list(filter != null ? filter : PolicyFilter.all());
    }

    @Override
    public Policy get(String policyId) {
        return policyRepository.findById(policyId)
                .orElseThrow(() -> new UnknownPolicyException(policyId));
    }

    @Override
    public Policy save(PolicyDraft draft) {
        Instant now = clock.instant();
        Policy policy = Policy.fromDraft(draft, now);
        Policy toStore = policyRepository.findById(policy.id())
                .map(existing -> policy.toBuilder().createdAt(existing.createdAt()).build())
                .orElse(policy);

        Policy saved = policyRepository.save(toStore);
        log.info("Saved policy {} ({} rules)", saved.id(), saved.rules().size());
        return saved;
    }

    @Override
    public boolean delete(String policyId) {
        boolean deleted = policyRepository.delete(policyId);
        if (deleted) {
            log.info("Deleted policy {}", policyId);
        }
        return deleted;
    }
}
