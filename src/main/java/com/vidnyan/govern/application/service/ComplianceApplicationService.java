package com.vidnyan.govern.application.service;

import com.vidnyan.govern.application.port.in.ComplianceScanUseCase;
import com.vidnyan.govern.application.port.out.FrameworkCatalog;
import com.vidnyan.govern.application.port.out.ReportStore;
import com.vidnyan.govern.application.port.out.ReportStore.StoredReport;
import com.vidnyan.govern.application.port.out.WaiverStore;
import com.vidnyan.govern.domain.compliance.ComplianceEvaluator;
import com.vidnyan.govern.domain.compliance.ComplianceReport;
import com.vidnyan.govern.domain.compliance.Control;
import com.vidnyan.govern.domain.compliance.ControlFramework;
import com.vidnyan.govern.domain.compliance.TrendPoint;
import com.vidnyan.govern.domain.error.UnknownFrameworkException;
import com.vidnyan.govern.domain.error.UnknownPolicyException;
import com.vidnyan.govern.domain.model.Resource;
import com.vidnyan.govern.domain.model.Violation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Orchestrates compliance scans: framework lookup, evaluation with waivers, report storage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceApplicationService implements ComplianceScanUseCase {

    private final FrameworkCatalog frameworkCatalog;
    private final ComplianceEvaluator complianceEvaluator;
    private final WaiverStore waiverStore;
    private final ReportStore reportStore;
    private final Clock clock;

    @Override
    public ComplianceReport scan(String frameworkId, List<Resource> resources, String scope) {
        Instant startTime = clock.instant();
        log.info("Starting {} compliance scan of {} resources", frameworkId, resources.size());

        // Step 1: Resolve framework
        log.info("Step 1: Resolving framework...");
        ControlFramework framework = framework(frameworkId);
        log.info("Framework: {} {} ({} controls)", framework.name(), framework.version(), framework.controls().size());

        // Step 2: Evaluate controls
        log.info("Step 2: Evaluating controls...");
        ComplianceReport report = complianceEvaluator.evaluate(framework, resources, waiverStore, scope);

        // Step 3: Store report
        log.info("Step 3: Storing report...");
        String reportId = reportStore.save(report);

        log.info("Compliance scan complete: score {} grade {} ({} passed, {} failed, {} waived, {} n/a) as {} in {}ms",
                report.score(),
                report.grade(),
                report.passedControls(),
                report.failedControls(),
                report.waivedControls(),
                report.notApplicable(),
                reportId,
                Duration.between(startTime, clock.instant()).toMillis());
        return report;
    }

    @Override
    public List<Violation> evaluateControl(String frameworkId, String controlId, List<Resource> resources) {
        ControlFramework framework = framework(frameworkId);
        Control control = framework.findControl(controlId)
                .orElseThrow(() -> new UnknownPolicyException(
                        "Unknown control " + controlId + " in framework " + frameworkId, controlId));
        return complianceEvaluator.evaluateControl(control, resources, framework, waiverStore, clock.instant());
    }

    @Override
    public List<TrendPoint> trend(String frameworkId, int limit) {
        framework(frameworkId);
        return reportStore.getTrend(frameworkId, limit);
    }

    @Override
    public List<StoredReport> history(String frameworkId, int limit) {
        return reportStore.list(frameworkId, limit);
    }

    @Override
    public List<ControlFramework> frameworks() {
        return frameworkCatalog.list();
    }

    private ControlFramework framework(String frameworkId) {
        return frameworkCatalog.findById(frameworkId)
                .orElseThrow(() -> new UnknownFrameworkException(frameworkId));
    }
}
