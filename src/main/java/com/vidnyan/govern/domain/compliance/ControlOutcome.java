package com.vidnyan.govern.domain.compliance;

import com.vidnyan.govern.domain.model.Violation;

import java.util.List;

/**
 * Result of checking one control against a resource set.
 */
public record ControlOutcome(
    Control control,
    ControlStatus status,
    List<Violation> violations
) {

    public ControlOutcome {
        violations = List.copyOf(violations);
    }

    /**
     * Not applicable when no resource matched; passed with no violations; waived when every
     * violation is waived; failed on any open violation.
     */
    static ControlOutcome classify(Control control, boolean applicable, List<Violation> violations) {
        ControlStatus status;
        if (!applicable) {
            status = ControlStatus.NOT_APPLICABLE;
        } else if (violations.isEmpty()) {
            status = ControlStatus.PASSED;
        } else if (violations.stream().allMatch(Violation::isWaived)) {
            status = ControlStatus.WAIVED;
        } else {
            status = ControlStatus.FAILED;
        }
        return new ControlOutcome(control, status, violations);
    }
}
