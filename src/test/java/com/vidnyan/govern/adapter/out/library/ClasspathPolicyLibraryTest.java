package com.vidnyan.govern.adapter.out.library;

import com.vidnyan.govern.application.port.out.PolicyLibrary.LibraryPolicy;
import com.vidnyan.govern.config.GovernConfiguration;
import com.vidnyan.govern.domain.condition.BuiltinCustomConditions;
import com.vidnyan.govern.domain.condition.ConditionEvaluator;
import com.vidnyan.govern.domain.model.EvaluationInputs;
import com.vidnyan.govern.domain.model.Resource;
import com.vidnyan.govern.domain.policy.Policy;
import com.vidnyan.govern.domain.policy.PolicyEvaluationEngine;
import com.vidnyan.govern.domain.policy.PolicyResult;
import com.vidnyan.govern.domain.policy.PolicyValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClasspathPolicyLibraryTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private ClasspathPolicyLibrary library;

    @BeforeEach
    void setUp() {
        library = new ClasspathPolicyLibrary(GovernConfiguration.createObjectMapper(),
                "classpath*:policies/library/*.json");
        library.loadLibrary();
    }

    @Test
    void loadLibrary_ShouldLoadBundledTemplates() {
        List<String> ids = library.list().stream().map(LibraryPolicy::id).toList();

        assertEquals(List.of("blast-radius-limit", "block-prod-deletes", "cost-threshold", "deny-public-s3",
                "deny-untagged", "require-encryption", "require-tags", "restrict-instance-types"), ids);
        assertEquals(List.of("cost", "governance", "operations", "security"), library.categories());
        assertEquals(2, library.listByCategory("security").size());
    }

    @Test
    void templates_ShouldProduceValidPolicies() {
        for (LibraryPolicy entry : library.list()) {
            Policy policy = Policy.fromDraft(entry.template().withId(entry.id()), NOW);
            assertEquals(List.of(), PolicyValidator.problems(policy), entry.id());
        }
    }

    @Test
    void costThreshold_ShouldRequireApprovalForLargeIncrease() {
        // Arrange
        LibraryPolicy entry = library.findById("cost-threshold").orElseThrow();
        Policy policy = Policy.fromDraft(entry.template().withId(entry.id()), NOW);
        PolicyEvaluationEngine engine = new PolicyEvaluationEngine(
                new ConditionEvaluator(BuiltinCustomConditions.registry()));

        // Act
        PolicyResult small = engine.evaluate(policy, EvaluationInputs.forCost(1000, 1050, "USD"));
        PolicyResult large = engine.evaluate(policy, EvaluationInputs.forCost(1000, 1700, "USD"));

        // Assert
        assertTrue(small.passed());
        assertFalse(small.approvalRequired());
        assertTrue(large.passed());
        assertTrue(large.approvalRequired());
        assertEquals(2, large.warnings().size());
    }

    @Test
    void denyPublicS3_ShouldDenyPublicAcl() {
        LibraryPolicy entry = library.findById("deny-public-s3").orElseThrow();
        Policy policy = Policy.fromDraft(entry.template().withId(entry.id()), NOW);
        Resource bucket = Resource.builder().id("b").type("aws_s3_bucket")
                .metadata(Map.of("acl", "public-read")).build();

        PolicyResult result = new PolicyEvaluationEngine(new ConditionEvaluator())
                .evaluate(policy, EvaluationInputs.forResource(bucket));

        assertTrue(result.denied());
        assertEquals(1, result.denials().size());
    }

    @Test
    void loadLibrary_ShouldSkipMalformedEntries(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("broken.json"), "{\"id\": \"broken\"}");
        ClasspathPolicyLibrary fileLibrary = new ClasspathPolicyLibrary(GovernConfiguration.createObjectMapper(),
                dir.toUri() + "*.json");

        fileLibrary.loadLibrary();

        assertTrue(fileLibrary.list().isEmpty());
        assertTrue(fileLibrary.findById(null).isEmpty());
    }
}
