package com.vidnyan.govern.adapter.in.cli;

import com.vidnyan.govern.application.port.in.ComplianceScanUseCase;
import com.vidnyan.govern.application.port.out.ResourceInventory;
import com.vidnyan.govern.config.GovernProperties;
import com.vidnyan.govern.domain.compliance.CategorySummary;
import com.vidnyan.govern.domain.compliance.ComplianceReport;
import com.vidnyan.govern.domain.model.Resource;
import com.vidnyan.govern.domain.model.Severity;
import com.vidnyan.govern.domain.model.Violation;
import com.vidnyan.govern.domain.model.ViolationFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * CLI runner for a one-off compliance scan.
 * Runs when govern.scan.framework and govern.inventory.path are both set, then shuts down.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ComplianceScanRunner implements CommandLineRunner {

    static final int MAX_LISTED_VIOLATIONS = 10;

    private final ComplianceScanUseCase complianceScanUseCase;
    private final ObjectProvider<ResourceInventory> inventory;
    private final GovernProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) {
        String framework = properties.getScan().getFramework();
        ResourceInventory resourceInventory = inventory.getIfAvailable();
        if (framework == null || framework.isBlank() || resourceInventory == null) {
            log.info("No scan requested. Set govern.scan.framework and govern.inventory.path to run one.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║                 GOVERN - Compliance Scan                     ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Framework: {}", framework);
            log.info("║ Inventory: {}", properties.getInventory().getPath());
            log.info("╚══════════════════════════════════════════════════════════════╝");

            List<Resource> resources = resourceInventory.load();
            ComplianceReport report = complianceScanUseCase.scan(framework, resources, properties.getScan().getScope());
            printReport(report);
            exitCode = report.failedControls() > 0 ? 1 : 0;
        } catch (RuntimeException e) {
            log.error("Compliance scan failed: {}", e.getMessage(), e);
            exitCode = 2;
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    void printReport(ComplianceReport report) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" {} {} COMPLIANCE", report.frameworkName(), report.frameworkVersion());
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Score:          {}% (grade {})", report.score(), report.grade());
        log.info(" Controls:       {}", report.totalControls());
        log.info("   Passed:       {}", report.passedControls());
        log.info("   Failed:       {}", report.failedControls());
        log.info("   Waived:       {}", report.waivedControls());
        log.info("   N/A:          {}", report.notApplicable());
        log.info("───────────────────────────────────────────────────────────────");

        log.info(" BY CATEGORY:");
        for (Map.Entry<String, CategorySummary> entry : report.byCategory().entrySet()) {
            CategorySummary summary = entry.getValue();
            log.info("   {}: {}/{} passed", entry.getKey(), summary.passed(), summary.total());
        }
        log.info(" OPEN VIOLATIONS BY SEVERITY:");
        for (Severity severity : Severity.values()) {
            log.info("   {}: {}", severity.wireName(), report.bySeverity().getOrDefault(severity, 0));
        }
        log.info("═══════════════════════════════════════════════════════════════");

        List<Violation> open = ViolationFilter.open().apply(report.violations());
        if (open.isEmpty()) {
            log.info("");
            log.info("✅ No open violations.");
            return;
        }

        log.info("");
        log.info(" OPEN VIOLATIONS:");
        log.info("───────────────────────────────────────────────────────────────");
        open.stream().limit(MAX_LISTED_VIOLATIONS).forEach(v ->
                log.info(" [{}] {} {} on {} ({})", v.severity().wireName(), v.ruleId(), v.description(),
                        v.resourceName() != null ? v.resourceName() : v.resourceId(), v.resourceType()));
        if (open.size() > MAX_LISTED_VIOLATIONS) {
            log.info(" ... and {} more", open.size() - MAX_LISTED_VIOLATIONS);
        }
    }
}
