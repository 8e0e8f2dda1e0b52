package com.vidnyan.govern.domain.policy;

import com.vidnyan.govern.domain.condition.Condition;
import com.vidnyan.govern.domain.condition.ConditionEvaluator;
import com.vidnyan.govern.domain.model.EvaluationInput;
import com.vidnyan.govern.domain.model.EvaluationInputs;
import com.vidnyan.govern.domain.model.Resource;
import com.vidnyan.govern.domain.model.Severity;
import com.vidnyan.govern.domain.model.Violation;
import com.vidnyan.govern.domain.model.ViolationStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static com.vidnyan.govern.domain.condition.Condition.*;
import static org.junit.jupiter.api.Assertions.*;

class PolicyEvaluationEngineTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final PolicyEvaluationEngine engine =
            new PolicyEvaluationEngine(new ConditionEvaluator(), CLOCK, null, null);

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private static Policy policy(String id, List<String> patterns, Rule... rules) {
        return Policy.builder()
                .id(id)
                .name(id)
                .type(PolicyType.PLAN)
                .enabled(true)
                .severity(Severity.HIGH)
                .autoAttachPatterns(patterns)
                .rules(List.of(rules))
                .build();
    }

    private static Rule rule(String id, Condition condition, RuleAction action, String message) {
        return new Rule(id, id + " description", condition, action, message);
    }

    private static Policy denyPublicS3() {
        return policy("deny-public-s3", List.of("type:aws_s3_bucket"),
                rule("no-public-acl", fieldEquals("resource.metadata.acl", "public-read"), RuleAction.DENY,
                        "S3 buckets must not have public ACLs"));
    }

    private static Resource bucket(String id, String acl) {
        return Resource.builder()
                .id(id)
                .type("aws_s3_bucket")
                .provider("aws")
                .name(id)
                .metadata(Map.of("acl", acl))
                .build();
    }

    @Test
    void evaluate_ShouldCollectMessagesPerAction() {
        // Arrange
        Policy policy = policy("cost", List.of(),
                rule("warn", fieldGt("cost.delta", 100), RuleAction.WARN, "over 100"),
                rule("approve", fieldGt("cost.delta", 500), RuleAction.REQUIRE_APPROVAL, "over 500"),
                rule("notify", fieldGt("cost.delta", 0), RuleAction.NOTIFY, "cost changed"),
                rule("deny", fieldGt("cost.delta", 10_000), RuleAction.DENY, "way over"));

        // Act
        PolicyResult result = engine.evaluate(policy, EvaluationInputs.forCost(100, 800, "USD"));

        // Assert
        assertTrue(result.passed());
        assertFalse(result.denied());
        assertTrue(result.approvalRequired());
        assertEquals(List.of("over 100", "Approval required: over 500"), result.warnings());
        assertEquals(List.of("cost changed"), result.notifications());
        assertTrue(result.denials().isEmpty());
        assertEquals(4, result.ruleResults().size());
        assertEquals(3, result.firedRules().size());
        assertEquals(NOW, result.evaluatedAt());
    }

    @Test
    void evaluate_ShouldDenyWhenDenyRuleFires() {
        PolicyResult result = engine.evaluate(denyPublicS3(), EvaluationInputs.forResource(bucket("b", "public-read")));

        assertFalse(result.passed());
        assertTrue(result.denied());
        assertEquals(List.of("S3 buckets must not have public ACLs"), result.denials());
    }

    @Test
    void evaluate_ShouldSkipDisabledPolicy() {
        Policy disabled = denyPublicS3().toBuilder().enabled(false).build();

        PolicyResult result = engine.evaluate(disabled, EvaluationInputs.forResource(bucket("b", "public-read")));

        assertTrue(result.passed());
        assertTrue(result.ruleResults().isEmpty());
    }

    @Test
    void evaluateAll_ShouldLetAnyDenyWin() {
        // Arrange
        Policy warnOnly = policy("warn-only", List.of(),
                rule("w", provider("aws"), RuleAction.WARN, "aws resource"));
        Policy disabled = policy("disabled", List.of(),
                rule("d", provider("aws"), RuleAction.DENY, "never")).toBuilder().enabled(false).build();
        EvaluationInput input = EvaluationInputs.forResource(bucket("b", "public-read"));

        // Act
        AggregateResult result = engine.evaluateAll(List.of(warnOnly, denyPublicS3(), disabled), input);

        // Assert
        assertTrue(result.denied());
        assertFalse(result.allowed());
        assertEquals(2, result.totalPolicies());
        assertEquals(1, result.passedPolicies());
        assertEquals(1, result.failedPolicies());
        assertEquals(List.of("S3 buckets must not have public ACLs"), result.denials());
        assertEquals(List.of("aws resource"), result.warnings());
    }

    @Test
    void evaluateAll_ShouldAllowWhenNothingDenies() {
        AggregateResult result = engine.evaluateAll(List.of(denyPublicS3()),
                EvaluationInputs.forResource(bucket("b", "private")));

        assertTrue(result.allowed());
        assertEquals(1, result.passedPolicies());
    }

    @Test
    void evaluateAll_ShouldAllowEmptyPolicySet() {
        AggregateResult result = engine.evaluateAll(List.of(), EvaluationInput.empty());

        assertTrue(result.allowed());
        assertEquals(0, result.totalPolicies());
    }

    @Test
    void scanResources_ShouldFlagOnlyPublicBucketsInScope() {
        // Arrange
        Resource vm = Resource.builder().id("vm-1").type("aws_instance").metadata(Map.of("acl", "public-read")).build();
        List<Resource> resources = List.of(bucket("b1", "public-read"), bucket("b2", "private"), vm);

        // Act
        List<Violation> violations = engine.scanResources(List.of(denyPublicS3()), resources);

        // Assert
        assertEquals(1, violations.size());
        Violation violation = violations.get(0);
        assertEquals("b1", violation.resourceId());
        assertEquals("deny-public-s3", violation.policyId());
        assertEquals("no-public-acl", violation.ruleId());
        assertEquals(Severity.HIGH, violation.severity());
        assertEquals(RuleAction.DENY, violation.action());
        assertEquals(ViolationStatus.OPEN, violation.status());
    }

    @Test
    void scanResources_ShouldDenyOnlyResourcesOfTheDeniedType() {
        // Arrange
        Policy denyS3 = policy("deny-s3", List.of(),
                rule("no-s3", resourceType("aws_s3_bucket"), RuleAction.DENY, "S3 buckets are not allowed"));
        Resource r1 = Resource.builder().id("r1").type("aws_s3_bucket").build();
        Resource r2 = Resource.builder().id("r2").type("aws_instance").build();

        // Act
        List<Violation> violations = engine.scanResources(List.of(denyS3), List.of(r1, r2));

        // Assert
        assertEquals(1, violations.size());
        assertEquals("r1", violations.get(0).resourceId());
        assertEquals("aws_s3_bucket", violations.get(0).resourceType());
        assertEquals("S3 buckets are not allowed", violations.get(0).message());
        assertEquals(RuleAction.DENY, violations.get(0).action());
    }

    @Test
    void scanResources_ShouldFallBackToRuleIdWhenMessageMissing() {
        // Arrange
        Policy policy = policy("owner-tag", List.of(), rule("owner", tagMissing("owner"), RuleAction.WARN, null));

        // Act
        List<Violation> violations = engine.scanResources(List.of(policy), List.of(bucket("b1", "private")));
        PolicyResult result = engine.evaluate(policy, EvaluationInputs.forResource(bucket("b1", "private")));

        // Assert
        assertEquals(1, violations.size());
        assertEquals("owner", violations.get(0).message());
        assertEquals(List.of("owner"), result.warnings());
    }

    @Test
    void scanResources_ShouldReportEveryActionAndApplyWaivers() {
        Policy policy = policy("tags", List.of("*"),
                rule("owner", tagMissing("owner"), RuleAction.DENY, "owner missing"),
                rule("team", tagMissing("team"), RuleAction.WARN, "team missing"));

        List<Violation> violations = engine.scanResources(List.of(policy), List.of(bucket("b1", "private")),
                (id, resourceId, now) -> id.equals("tags") && resourceId.equals("b1") && now.equals(NOW));

        assertEquals(2, violations.size());
        assertTrue(violations.stream().allMatch(Violation::isWaived));
        assertEquals(RuleAction.WARN, violations.get(1).action());
    }

    @Test
    void scanResources_ShouldKeepOrderWhenParallel() {
        // Arrange
        executor = Executors.newFixedThreadPool(4);
        PolicyEvaluationEngine parallel =
                new PolicyEvaluationEngine(new ConditionEvaluator(), CLOCK, executor, Duration.ofSeconds(10));
        List<Resource> resources = IntStream.range(0, 50)
                .mapToObj(i -> bucket("b" + i, i % 2 == 0 ? "public-read" : "private"))
                .toList();
        Policy tags = policy("tags", List.of(), rule("owner", tagMissing("owner"), RuleAction.WARN, "owner"));
        List<Policy> policies = List.of(denyPublicS3(), tags);

        // Act
        List<Violation> sequentialResult = engine.scanResources(policies, resources);
        List<Violation> parallelResult = parallel.scanResources(policies, resources);

        // Assert
        assertEquals(75, sequentialResult.size());
        assertEquals(sequentialResult, parallelResult);
    }
}
