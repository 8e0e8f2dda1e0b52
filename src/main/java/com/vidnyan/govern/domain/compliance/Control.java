package com.vidnyan.govern.domain.compliance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vidnyan.govern.domain.condition.Condition;
import com.vidnyan.govern.domain.model.Severity;
import lombok.Builder;

import java.util.List;
import java.util.Set;

/**
 * Assertion-mode check: the predicate describes the compliant state, so a
 * resource violates the control when the predicate is false.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record Control(
    String id,
    String title,
    String description,
    String category,
    Severity severity,
    Set<String> applicableResourceTypes,
    Condition predicate,
    String remediation,
    List<String> references
) {

    public Control {
        applicableResourceTypes = applicableResourceTypes == null ? Set.of() : Set.copyOf(applicableResourceTypes);
        references = references == null ? List.of() : List.copyOf(references);
    }

    public boolean appliesTo(String resourceType) {
        return resourceType != null && applicableResourceTypes.contains(resourceType);
    }
}
