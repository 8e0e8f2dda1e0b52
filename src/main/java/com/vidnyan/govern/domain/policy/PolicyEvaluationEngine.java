package com.vidnyan.govern.domain.policy;

import com.vidnyan.govern.domain.condition.ConditionEvaluator;
import com.vidnyan.govern.domain.condition.FlattenedInput;
import com.vidnyan.govern.domain.condition.InputFlattener;
import com.vidnyan.govern.domain.condition.Polarity;
import com.vidnyan.govern.domain.error.GovernanceException;
import com.vidnyan.govern.domain.error.ScanTimeoutException;
import com.vidnyan.govern.domain.model.EvaluationInput;
import com.vidnyan.govern.domain.model.Resource;
import com.vidnyan.govern.domain.model.Violation;
import com.vidnyan.govern.domain.model.ViolationStatus;
import com.vidnyan.govern.domain.waiver.WaiverLookup;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Trigger-mode policy evaluation: single policy, deny-wins aggregation and bulk scanning.
 * <p>
 * Evaluation touches no shared mutable state. With an executor configured, bulk scans
 * fan out one task per resource and concatenate results in resource order, bounded by
 * the scan timeout.
 */
@Slf4j
public class PolicyEvaluationEngine {

    static final String APPROVAL_PREFIX = "Approval required: ";

    private final ConditionEvaluator conditionEvaluator;
    private final Clock clock;
    private final ExecutorService executor;
    private final Duration scanTimeout;

    public PolicyEvaluationEngine(ConditionEvaluator conditionEvaluator) {
        this(conditionEvaluator, Clock.systemUTC(), null, null);
    }

    public PolicyEvaluationEngine(ConditionEvaluator conditionEvaluator, Clock clock,
                                  ExecutorService executor, Duration scanTimeout) {
        this.conditionEvaluator = conditionEvaluator;
        this.clock = clock;
        this.executor = executor;
        this.scanTimeout = scanTimeout;
    }

    /**
     * Evaluate one policy. Every rule is evaluated, so warnings and notifications from
     * later rules surface even when an earlier rule already denies.
     */
    public PolicyResult evaluate(Policy policy, EvaluationInput input) {
        if (!policy.enabled()) {
            return PolicyResult.skipped(policy, clock.instant());
        }
        return evaluate(policy, InputFlattener.flatten(input));
    }

    private PolicyResult evaluate(Policy policy, FlattenedInput data) {
        Instant start = clock.instant();

        List<RuleResult> ruleResults = new ArrayList<>();
        List<String> denials = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> notifications = new ArrayList<>();
        boolean approvalRequired = false;

        for (Rule rule : policy.rules()) {
            boolean fired = conditionEvaluator.violates(rule.condition(), data, Polarity.VIOLATE_IF_TRUE);
            ruleResults.add(new RuleResult(rule.id(), rule.description(), fired, rule.action(), rule.message()));
            if (!fired) {
                continue;
            }

            log.debug("Rule {}/{} fired with action {}", policy.id(), rule.id(), rule.action());
            String message = rule.message() != null ? rule.message() : rule.id();
            switch (rule.action()) {
                case DENY -> denials.add(message);
                case WARN -> warnings.add(message);
                case REQUIRE_APPROVAL -> {
                    approvalRequired = true;
                    warnings.add(APPROVAL_PREFIX + message);
                }
                case NOTIFY -> notifications.add(message);
            }
        }

        Instant end = clock.instant();
        boolean denied = !denials.isEmpty();
        return new PolicyResult(
                policy.id(),
                policy.name(),
                !denied,
                denied,
                ruleResults,
                denials,
                warnings,
                notifications,
                approvalRequired,
                end,
                Duration.between(start, end).toMillis()
        );
    }

    /**
     * Evaluate every enabled policy against one input and combine: any denial denies.
     * Disabled policies are left out of the totals.
     */
    public AggregateResult evaluateAll(List<Policy> policies, EvaluationInput input) {
        Instant start = clock.instant();
        FlattenedInput data = InputFlattener.flatten(input);

        List<PolicyResult> results = new ArrayList<>();
        List<String> denials = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> notifications = new ArrayList<>();
        boolean approvalRequired = false;
        int passed = 0;
        int failed = 0;

        for (Policy policy : policies) {
            if (!policy.enabled()) {
                log.debug("Skipping disabled policy {}", policy.id());
                continue;
            }
            PolicyResult result = evaluate(policy, data);
            results.add(result);
            denials.addAll(result.denials());
            warnings.addAll(result.warnings());
            notifications.addAll(result.notifications());
            approvalRequired |= result.approvalRequired();
            if (result.denied()) {
                failed++;
            } else {
                passed++;
            }
        }

        Instant end = clock.instant();
        boolean denied = failed > 0;
        log.debug("Evaluated {} policies: {} passed, {} denied", results.size(), passed, failed);
        return new AggregateResult(
                !denied,
                denied,
                denials,
                warnings,
                notifications,
                approvalRequired,
                results,
                results.size(),
                passed,
                failed,
                end,
                Duration.between(start, end).toMillis()
        );
    }

    public List<Violation> scanResources(List<Policy> policies, List<Resource> resources) {
        return scanResources(policies, resources, WaiverLookup.none());
    }

    /**
     * Scan many resources against many policies. Each enabled policy whose scope applies
     * is evaluated, and every fired rule yields one violation.
     *
     * @throws ScanTimeoutException when a parallel scan exceeds the configured timeout
     */
    public List<Violation> scanResources(List<Policy> policies, List<Resource> resources, WaiverLookup waivers) {
        List<Policy> enabled = policies.stream().filter(Policy::enabled).toList();
        Instant now = clock.instant();

        if (executor == null || resources.size() < 2) {
            List<Violation> violations = new ArrayList<>();
            for (Resource resource : resources) {
                violations.addAll(scanResource(enabled, resource, waivers, now));
            }
            return violations;
        }
        return scanInParallel(enabled, resources, waivers, now);
    }

    private List<Violation> scanInParallel(List<Policy> policies, List<Resource> resources,
                                           WaiverLookup waivers, Instant now) {
        List<Callable<List<Violation>>> tasks = resources.stream()
                .<Callable<List<Violation>>>map(r -> () -> scanResource(policies, r, waivers, now))
                .toList();

        List<Future<List<Violation>>> futures;
        try {
            futures = scanTimeout != null
                    ? executor.invokeAll(tasks, scanTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    : executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GovernanceException("Scan interrupted", e);
        }

        List<Violation> violations = new ArrayList<>();
        for (Future<List<Violation>> future : futures) {
            try {
                violations.addAll(future.get());
            } catch (CancellationException e) {
                throw new ScanTimeoutException(scanTimeout, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GovernanceException("Scan interrupted", e);
            } catch (ExecutionException e) {
                throw new GovernanceException("Scan task failed", e.getCause());
            }
        }
        return violations;
    }

    private List<Violation> scanResource(List<Policy> policies, Resource resource,
                                         WaiverLookup waivers, Instant now) {
        FlattenedInput data = InputFlattener.flatten(resource);
        List<Violation> violations = new ArrayList<>();

        for (Policy policy : policies) {
            if (!ScopeMatcher.applies(policy, resource)) {
                continue;
            }
            PolicyResult result = evaluate(policy, data);
            for (RuleResult rule : result.firedRules()) {
                boolean waived = waivers.isWaived(policy.id(), resource.id(), now);
                violations.add(Violation.builder()
                        .policyId(policy.id())
                        .policyName(policy.name())
                        .ruleId(rule.ruleId())
                        .description(rule.description())
                        .severity(policy.severity())
                        .action(rule.action())
                        .message(rule.message() != null ? rule.message() : rule.ruleId())
                        .resourceId(resource.id())
                        .resourceType(resource.type())
                        .resourceName(resource.name())
                        .provider(resource.provider())
                        .status(waived ? ViolationStatus.WAIVED : ViolationStatus.OPEN)
                        .build());
            }
        }
        return violations;
    }
}
