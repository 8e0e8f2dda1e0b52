package com.vidnyan.govern.domain.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vidnyan.govern.domain.model.Severity;

import java.util.List;

/**
 * Policy as authored, before defaults are applied. Library templates and API
 * requests arrive in this shape.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolicyDraft(
    String id,
    String name,
    String description,
    PolicyType type,
    Boolean enabled,
    Severity severity,
    List<String> labels,
    List<String> autoAttachPatterns,
    List<Rule> rules
) {

    public PolicyDraft withId(String newId) {
        return new PolicyDraft(newId, name, description, type, enabled, severity, labels, autoAttachPatterns, rules);
    }
}
