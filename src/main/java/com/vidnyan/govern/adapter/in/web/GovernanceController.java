package com.vidnyan.govern.adapter.in.web;

import com.vidnyan.govern.application.port.in.ComplianceScanUseCase;
import com.vidnyan.govern.application.port.in.EvaluatePolicyUseCase;
import com.vidnyan.govern.application.port.in.ManagePoliciesUseCase;
import com.vidnyan.govern.application.port.in.ManageWaiversUseCase;
import com.vidnyan.govern.application.port.in.ManageWaiversUseCase.WaiverRequest;
import com.vidnyan.govern.application.port.in.PolicyLibraryUseCase;
import com.vidnyan.govern.application.port.in.ScanResourcesUseCase;
import com.vidnyan.govern.application.port.out.PolicyLibrary.LibraryPolicy;
import com.vidnyan.govern.application.port.out.PolicyRepository.PolicyFilter;
import com.vidnyan.govern.application.port.out.ReportStore.StoredReport;
import com.vidnyan.govern.domain.compliance.ComplianceReport;
import com.vidnyan.govern.domain.compliance.ControlFramework;
import com.vidnyan.govern.domain.compliance.TrendPoint;
import com.vidnyan.govern.domain.model.EvaluationInput;
import com.vidnyan.govern.domain.model.Resource;
import com.vidnyan.govern.domain.model.Severity;
import com.vidnyan.govern.domain.model.Violation;
import com.vidnyan.govern.domain.model.ViolationFilter;
import com.vidnyan.govern.domain.model.ViolationStatus;
import com.vidnyan.govern.domain.policy.AggregateResult;
import com.vidnyan.govern.domain.policy.Policy;
import com.vidnyan.govern.domain.policy.PolicyDraft;
import com.vidnyan.govern.domain.policy.PolicyResult;
import com.vidnyan.govern.domain.policy.PolicyType;
import com.vidnyan.govern.domain.waiver.Waiver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for policy evaluation, compliance scans, waivers and the policy library.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class GovernanceController {

    private final EvaluatePolicyUseCase evaluatePolicyUseCase;
    private final ScanResourcesUseCase scanResourcesUseCase;
    private final ManagePoliciesUseCase managePoliciesUseCase;
    private final ComplianceScanUseCase complianceScanUseCase;
    private final ManageWaiversUseCase manageWaiversUseCase;
    private final PolicyLibraryUseCase policyLibraryUseCase;

    // Policies

    @PostMapping("/policies/evaluate")
    public AggregateResult evaluateAll(@RequestBody EvaluationInput input) {
        log.info("Received evaluation request for {}", describe(input));
        return evaluatePolicyUseCase.evaluateAll(input);
    }

    @PostMapping("/policies/{id}/evaluate")
    public PolicyResult evaluate(@PathVariable("id") String policyId, @RequestBody EvaluationInput input) {
        return evaluatePolicyUseCase.evaluate(policyId, input);
    }

    @PostMapping("/policies/scan")
    public ScanResponse scan(@RequestBody ScanRequest request) {
        List<Resource> resources = request.resources() != null ? request.resources() : List.of();
        log.info("Received scan request for {} resources", resources.size());

        List<Violation> violations = scanResourcesUseCase.scanStored(resources);
        ViolationFilter filter = new ViolationFilter(request.status(), request.severity(), request.resourceType());
        List<Violation> filtered = filter.apply(violations);
        long open = violations.stream().filter(Violation::isOpen).count();
        return new ScanResponse(resources.size(), violations.size(), (int) open, filtered);
    }

    @GetMapping("/policies")
    public List<Policy> listPolicies(@RequestParam(value = "type", required = false) String type,
                                     @RequestParam(value = "severity", required = false) String severity,
                                     @RequestParam(value = "enabled", required = false) Boolean enabled) {
        return managePoliciesUseCase.list(new PolicyFilter(
                type != null ? PolicyType.fromWire(type) : null,
                severity != null ? Severity.fromWire(severity) : null,
                enabled));
    }

    @GetMapping("/policies/{id}")
    public Policy getPolicy(@PathVariable("id") String policyId) {
        return managePoliciesUseCase.get(policyId);
    }

    @PostMapping("/policies")
    @ResponseStatus(HttpStatus.CREATED)
    public Policy savePolicy(@RequestBody PolicyDraft draft) {
        return managePoliciesUseCase.save(draft);
    }

    @DeleteMapping("/policies/{id}")
    public ResponseEntity<Void> deletePolicy(@PathVariable("id") String policyId) {
        return managePoliciesUseCase.delete(policyId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // Compliance

    @GetMapping("/compliance/frameworks")
    public List<FrameworkSummary> frameworks() {
        return complianceScanUseCase.frameworks().stream()
                .map(FrameworkSummary::of)
                .toList();
    }

    @PostMapping("/compliance/{framework}/scan")
    public ComplianceReport complianceScan(@PathVariable("framework") String framework,
                                           @RequestBody ComplianceScanRequest request) {
        List<Resource> resources = request.resources() != null ? request.resources() : List.of();
        String scope = request.scope() != null ? request.scope() : "all";
        return complianceScanUseCase.scan(framework, resources, scope);
    }

    @GetMapping("/compliance/{framework}/trend")
    public List<TrendPoint> trend(@PathVariable("framework") String framework,
                                  @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return complianceScanUseCase.trend(framework, limit);
    }

    @GetMapping("/compliance/reports")
    public List<StoredReport> reports(@RequestParam(value = "framework", required = false) String framework,
                                      @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return complianceScanUseCase.history(framework, limit);
    }

    // Waivers

    @GetMapping("/waivers")
    public List<Waiver> waivers(
            @RequestParam(value = "active", defaultValue = "true") boolean activeOnly) {
        return activeOnly ? manageWaiversUseCase.listActive() : manageWaiversUseCase.list();
    }

    @PostMapping("/waivers")
    @ResponseStatus(HttpStatus.CREATED)
    public Waiver addWaiver(@RequestBody WaiverRequest request) {
        return manageWaiversUseCase.add(request);
    }

    @DeleteMapping("/waivers/{id}")
    public ResponseEntity<Void> removeWaiver(@PathVariable("id") String waiverId) {
        return manageWaiversUseCase.remove(waiverId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // Library

    @GetMapping("/library")
    public List<LibraryPolicy> library(@RequestParam(value = "category", required = false) String category) {
        return policyLibraryUseCase.list(category);
    }

    @GetMapping("/library/categories")
    public List<String> libraryCategories() {
        return policyLibraryUseCase.categories();
    }

    @PostMapping("/library/{id}/import")
    @ResponseStatus(HttpStatus.CREATED)
    public Policy importTemplate(@PathVariable("id") String templateId,
                                 @RequestParam(value = "policyId", required = false) String policyId) {
        return policyLibraryUseCase.importTemplate(templateId, policyId);
    }

    private static String describe(EvaluationInput input) {
        if (input.resource() != null) {
            return "resource " + input.resource().displayName();
        }
        return input.plan() != null ? "plan" : "input";
    }

    public record ScanRequest(
        List<Resource> resources,
        ViolationStatus status,
        Severity severity,
        String resourceType
    ) {}

    public record ScanResponse(
        int resourcesScanned,
        int totalViolations,
        int openViolations,
        List<Violation> violations
    ) {}

    public record ComplianceScanRequest(
        List<Resource> resources,
        String scope
    ) {}

    public record FrameworkSummary(
        String id,
        String name,
        String version,
        String description,
        int controls,
        List<String> categories
    ) {
        static FrameworkSummary of(ControlFramework framework) {
            return new FrameworkSummary(framework.id(), framework.name(), framework.version(),
                    framework.description(), framework.controls().size(), framework.categories());
        }
    }
}
