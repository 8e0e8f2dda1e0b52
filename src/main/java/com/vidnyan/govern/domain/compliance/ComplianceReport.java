package com.vidnyan.govern.domain.compliance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vidnyan.govern.domain.model.Severity;
import com.vidnyan.govern.domain.model.Violation;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable summary of one compliance scan.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComplianceReport(
    String framework,
    String frameworkName,
    String frameworkVersion,
    Instant generatedAt,
    String scope,
    int score,
    Grade grade,
    int totalControls,
    int passedControls,
    int failedControls,
    int waivedControls,
    int notApplicable,
    List<Violation> violations,
    Map<String, CategorySummary> byCategory,
    Map<Severity, Integer> bySeverity
) {

    public ComplianceReport {
        violations = violations == null ? List.of() : List.copyOf(violations);
        byCategory = byCategory == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(byCategory));
        bySeverity = bySeverity == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(bySeverity));
    }

    public long openViolations() {
        return violations.stream().filter(Violation::isOpen).count();
    }
}
