package com.vidnyan.govern.domain.compliance;

import com.vidnyan.govern.domain.condition.ConditionEvaluator;
import com.vidnyan.govern.domain.condition.InputFlattener;
import com.vidnyan.govern.domain.condition.Polarity;
import com.vidnyan.govern.domain.model.Resource;
import com.vidnyan.govern.domain.model.Severity;
import com.vidnyan.govern.domain.model.Violation;
import com.vidnyan.govern.domain.model.ViolationStatus;
import com.vidnyan.govern.domain.waiver.WaiverLookup;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assertion-mode evaluation of controls and frameworks.
 */
@Slf4j
public class ComplianceEvaluator {

    private final ConditionEvaluator conditionEvaluator;
    private final Clock clock;

    public ComplianceEvaluator(ConditionEvaluator conditionEvaluator, Clock clock) {
        this.conditionEvaluator = conditionEvaluator;
        this.clock = clock;
    }

    /**
     * Violations of a bare control: one open violation per applicable resource whose
     * predicate is false. Resources of other types are skipped.
     */
    public List<Violation> evaluateControl(Control control, List<Resource> resources) {
        return evaluateControl(control, resources, null, WaiverLookup.none(), clock.instant());
    }

    public List<Violation> evaluateControl(Control control, List<Resource> resources,
                                           ControlFramework framework, WaiverLookup waivers, Instant now) {
        List<Violation> violations = new ArrayList<>();
        for (Resource resource : resources) {
            if (!control.appliesTo(resource.type())) {
                continue;
            }
            boolean violated = conditionEvaluator.violates(
                    control.predicate(), InputFlattener.flatten(resource), Polarity.PASS_IF_TRUE);
            if (!violated) {
                continue;
            }
            boolean waived = waivers.isWaived(control.id(), resource.id(), now);
            violations.add(Violation.builder()
                    .policyId(framework != null ? framework.id() : null)
                    .policyName(framework != null ? framework.name() : null)
                    .ruleId(control.id())
                    .description(control.title())
                    .severity(control.severity())
                    .message(control.description())
                    .remediation(control.remediation())
                    .resourceId(resource.id())
                    .resourceType(resource.type())
                    .resourceName(resource.name())
                    .provider(resource.provider())
                    .status(waived ? ViolationStatus.WAIVED : ViolationStatus.OPEN)
                    .build());
        }
        return violations;
    }

    /**
     * Classify every control of the framework and summarize into a report.
     */
    public ComplianceReport evaluate(ControlFramework framework, List<Resource> resources,
                                     WaiverLookup waivers, String scope) {
        Instant now = clock.instant();
        List<ControlOutcome> outcomes = new ArrayList<>();

        for (Control control : framework.controls()) {
            boolean applicable = resources.stream().anyMatch(r -> control.appliesTo(r.type()));
            List<Violation> violations = applicable
                    ? evaluateControl(control, resources, framework, waivers, now)
                    : List.of();
            ControlOutcome outcome = ControlOutcome.classify(control, applicable, violations);
            log.debug("Control {} -> {} ({} violations)", control.id(), outcome.status(), violations.size());
            outcomes.add(outcome);
        }

        return summarize(framework, outcomes, scope, now);
    }

    private ComplianceReport summarize(ControlFramework framework, List<ControlOutcome> outcomes,
                                       String scope, Instant now) {
        int passed = 0;
        int failed = 0;
        int waived = 0;
        int notApplicable = 0;
        List<Violation> violations = new ArrayList<>();
        Map<String, CategorySummary> byCategory = new LinkedHashMap<>();
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0);
        }

        for (ControlOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case PASSED -> passed++;
                case FAILED -> failed++;
                case WAIVED -> waived++;
                case NOT_APPLICABLE -> notApplicable++;
            }
            violations.addAll(outcome.violations());

            if (outcome.status() != ControlStatus.NOT_APPLICABLE) {
                boolean pass = outcome.status() != ControlStatus.FAILED;
                byCategory.merge(outcome.control().category(), CategorySummary.empty().add(pass),
                        (current, ignored) -> current.add(pass));
            }
        }

        for (Violation violation : violations) {
            if (violation.isOpen() && violation.severity() != null) {
                bySeverity.merge(violation.severity(), 1, Integer::sum);
            }
        }

        int total = outcomes.size();
        int score = ScoreCalculator.score(passed, total - notApplicable);
        return ComplianceReport.builder()
                .framework(framework.id())
                .frameworkName(framework.name())
                .frameworkVersion(framework.version())
                .generatedAt(now)
                .scope(scope)
                .score(score)
                .grade(ScoreCalculator.grade(score))
                .totalControls(total)
                .passedControls(passed)
                .failedControls(failed)
                .waivedControls(waived)
                .notApplicable(notApplicable)
                .violations(violations)
                .byCategory(byCategory)
                .bySeverity(bySeverity)
                .build();
    }
}
