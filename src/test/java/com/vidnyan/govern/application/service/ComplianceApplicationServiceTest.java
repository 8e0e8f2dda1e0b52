package com.vidnyan.govern.application.service;

import com.vidnyan.govern.adapter.out.catalog.BuiltinFrameworkCatalog;
import com.vidnyan.govern.adapter.out.store.InMemoryReportStore;
import com.vidnyan.govern.adapter.out.store.InMemoryWaiverStore;
import com.vidnyan.govern.domain.compliance.ComplianceEvaluator;
import com.vidnyan.govern.domain.compliance.ComplianceReport;
import com.vidnyan.govern.domain.compliance.ScoreCalculator;
import com.vidnyan.govern.domain.compliance.TrendPoint;
import com.vidnyan.govern.domain.condition.BuiltinCustomConditions;
import com.vidnyan.govern.domain.condition.ConditionEvaluator;
import com.vidnyan.govern.domain.error.UnknownFrameworkException;
import com.vidnyan.govern.domain.error.UnknownPolicyException;
import com.vidnyan.govern.domain.model.Resource;
import com.vidnyan.govern.domain.model.Violation;
import com.vidnyan.govern.domain.waiver.Waiver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ComplianceApplicationServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private InMemoryWaiverStore waiverStore;
    private InMemoryReportStore reportStore;
    private ComplianceApplicationService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        waiverStore = new InMemoryWaiverStore();
        reportStore = new InMemoryReportStore();
        service = new ComplianceApplicationService(
                new BuiltinFrameworkCatalog(),
                new ComplianceEvaluator(new ConditionEvaluator(BuiltinCustomConditions.registry()), clock),
                waiverStore,
                reportStore,
                clock);
    }

    private static List<Resource> inventory() {
        return List.of(
                Resource.builder().id("db-1").type("database").region("eu-west-1")
                        .metadata(Map.of("encrypted", true, "backup_enabled", true, "logging_enabled", true))
                        .build(),
                Resource.builder().id("bucket-1").type("storage").metadata(Map.of("public_access", true)).build());
    }

    @Test
    void scan_ShouldStoreEachReport() {
        // Act
        ComplianceReport first = service.scan("soc2", inventory(), "all");
        service.scan("soc2", inventory(), "all");

        // Assert
        assertEquals(2, reportStore.count());
        assertEquals("soc2", first.framework());
        assertTrue(first.failedControls() > 0);
        List<TrendPoint> trend = service.trend("soc2", 10);
        assertEquals(2, trend.size());
        assertEquals(first.score(), trend.get(0).score());
        assertEquals(2, service.history(null, 10).size());
    }

    @Test
    void scan_ShouldApplyActiveWaivers() {
        ComplianceReport before = service.scan("soc2", inventory(), "all");
        for (Violation violation : before.violations()) {
            waiverStore.add(Waiver.create(violation.ruleId(), violation.resourceId(), "accepted", "ciso", 30, NOW));
        }

        ComplianceReport after = service.scan("soc2", inventory(), "all");

        assertEquals(0, after.failedControls());
        assertEquals(0, after.openViolations());
        assertTrue(after.waivedControls() > 0);
        assertEquals(ScoreCalculator.score(after.passedControls(), after.totalControls() - after.notApplicable()),
                after.score());
        assertTrue(after.score() < 100);
    }

    @Test
    void scan_ShouldRejectUnknownFramework() {
        assertThrows(UnknownFrameworkException.class, () -> service.scan("iso-27001", inventory(), "all"));
        assertThrows(UnknownFrameworkException.class, () -> service.trend("iso-27001", 5));
        assertEquals(0, reportStore.count());
    }

    @Test
    void evaluateControl_ShouldResolveControlWithinFramework() {
        List<Violation> violations = service.evaluateControl("soc2", "soc2-CC6.6", inventory());

        assertEquals(1, violations.size());
        assertEquals("bucket-1", violations.get(0).resourceId());
        assertThrows(UnknownPolicyException.class, () -> service.evaluateControl("soc2", "nope", inventory()));
    }

    @Test
    void frameworks_ShouldListBuiltins() {
        assertEquals(6, service.frameworks().size());
    }
}
