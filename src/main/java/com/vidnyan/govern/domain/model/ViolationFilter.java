package com.vidnyan.govern.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Optional criteria over a violation list; null criteria match everything.
 */
public record ViolationFilter(
    ViolationStatus status,
    Severity severity,
    String resourceType
) {

    public static ViolationFilter all() {
        return new ViolationFilter(null, null, null);
    }

    public static ViolationFilter open() {
        return new ViolationFilter(ViolationStatus.OPEN, null, null);
    }

    public boolean test(Violation violation) {
        return (status == null || violation.status() == status)
                && (severity == null || violation.severity() == severity)
                && (resourceType == null || Objects.equals(violation.resourceType(), resourceType));
    }

    public List<Violation> apply(List<Violation> violations) {
        return violations.stream().filter(this::test).toList();
    }
}
