package com.vidnyan.govern.application.service;

import com.vidnyan.govern.adapter.out.store.InMemoryPolicyRepository;
import com.vidnyan.govern.adapter.out.store.InMemoryWaiverStore;
import com.vidnyan.govern.application.port.out.PolicyLibrary;
import com.vidnyan.govern.application.port.out.PolicyRepository.PolicyFilter;
import com.vidnyan.govern.domain.condition.ConditionEvaluator;
import com.vidnyan.govern.domain.error.InvalidPolicyException;
import com.vidnyan.govern.domain.error.UnknownPolicyException;
import com.vidnyan.govern.domain.model.EvaluationInputs;
import com.vidnyan.govern.domain.model.Resource;
import com.vidnyan.govern.domain.model.Severity;
import com.vidnyan.govern.domain.model.Violation;
import com.vidnyan.govern.domain.policy.AggregateResult;
import com.vidnyan.govern.domain.policy.Policy;
import com.vidnyan.govern.domain.policy.PolicyDraft;
import com.vidnyan.govern.domain.policy.PolicyEvaluationEngine;
import com.vidnyan.govern.domain.policy.PolicyType;
import com.vidnyan.govern.domain.policy.Rule;
import com.vidnyan.govern.domain.policy.RuleAction;
import com.vidnyan.govern.domain.waiver.Waiver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.vidnyan.govern.domain.condition.Condition.*;
import static org.junit.jupiter.api.Assertions.*;

class PolicyApplicationServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private InMemoryPolicyRepository repository;
    private InMemoryWaiverStore waiverStore;
    private PolicyApplicationService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        repository = new InMemoryPolicyRepository();
        waiverStore = new InMemoryWaiverStore();
        service = new PolicyApplicationService(repository, waiverStore,
                new PolicyEvaluationEngine(new ConditionEvaluator(), clock, null, null), clock);
    }

    private static PolicyDraft denyPublic(String id, Boolean enabled) {
        return new PolicyDraft(id, "No public buckets", null, PolicyType.PLAN, enabled, Severity.CRITICAL,
                null, List.of("type:storage"), List.of(
                        new Rule("public", "Public bucket", fieldEquals("resource.metadata.public", true),
                                RuleAction.DENY, "Bucket must not be public")));
    }

    private static Resource bucket(String id, boolean isPublic) {
        return Resource.builder().id(id).type("storage").metadata(Map.of("public", isPublic)).build();
    }

    @Test
    void evaluateAll_ShouldIgnoreDisabledPolicies() {
        // Arrange
        service.save(denyPublic("on", true));
        service.save(denyPublic("off", false));

        // Act
        AggregateResult result = service.evaluateAll(EvaluationInputs.forResource(bucket("b", true)));

        // Assert
        assertFalse(result.allowed());
        assertEquals(1, result.totalPolicies());
        assertEquals(List.of("Bucket must not be public"), result.denials());
    }

    @Test
    void evaluate_ShouldFailForUnknownPolicy() {
        assertThrows(UnknownPolicyException.class,
                () -> service.evaluate("missing", EvaluationInputs.forResource(bucket("b", true))));
    }

    @Test
    void scanStored_ShouldMarkWaivedViolations() {
        // Arrange
        service.save(denyPublic("no-public", true));
        waiverStore.add(Waiver.create("no-public", "b1", "static site", "alice", 30, NOW));

        // Act
        List<Violation> violations = service.scanStored(List.of(bucket("b1", true), bucket("b2", true), bucket("b3", false)));

        // Assert
        assertEquals(2, violations.size());
        assertTrue(violations.get(0).isWaived());
        assertTrue(violations.get(1).isOpen());
    }

    @Test
    void save_ShouldKeepCreationTimeOnReplace() {
        Policy created = service.save(denyPublic("p", true));
        Policy replaced = service.save(denyPublic("p", false));

        assertEquals(created.createdAt(), replaced.createdAt());
        assertFalse(service.get("p").enabled());
        assertEquals(1, service.list(PolicyFilter.all()).size());
    }

    @Test
    void save_ShouldRejectInvalidDraft() {
        PolicyDraft draft = new PolicyDraft("bad", "Bad", null, null, null, null, null,
                List.of("nonsense:1"), List.of());

        assertThrows(InvalidPolicyException.class, () -> service.save(draft));
        assertTrue(service.list(null).isEmpty());
    }

    @Test
    void importTemplate_ShouldStorePolicyUnderRequestedId() {
        // Arrange
        PolicyLibrary.LibraryPolicy entry = new PolicyLibrary.LibraryPolicy(
                "deny-public", "No public buckets", "", "security", denyPublic(null, null));
        PolicyLibrary library = new PolicyLibrary() {
            @Override
            public List<LibraryPolicy> list() {
                return List.of(entry);
            }

            @Override
            public Optional<LibraryPolicy> findById(String templateId) {
                return list().stream().filter(e -> e.id().equals(templateId)).findFirst();
            }

            @Override
            public List<String> categories() {
                return List.of("security");
            }

            @Override
            public List<LibraryPolicy> listByCategory(String category) {
                return list();
            }
        };
        PolicyLibraryService libraryService = new PolicyLibraryService(library, service);

        // Act
        Policy imported = libraryService.importTemplate("deny-public", "team-a-no-public");

        // Assert
        assertEquals("team-a-no-public", imported.id());
        assertTrue(imported.enabled());
        assertTrue(repository.findById("team-a-no-public").isPresent());
        assertThrows(UnknownPolicyException.class, () -> libraryService.importTemplate("missing", null));
    }

    @Test
    void delete_ShouldReportMissingPolicies() {
        service.save(denyPublic("p", true));

        assertTrue(service.delete("p"));
        assertFalse(service.delete("p"));
    }
}
