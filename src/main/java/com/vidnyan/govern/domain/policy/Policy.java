package com.vidnyan.govern.domain.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vidnyan.govern.domain.model.Severity;
import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Named, ordered set of trigger-mode rules with a scope.
 * An empty {@code autoAttachPatterns} list attaches the policy to every resource.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Policy(
    String id,
    String name,
    String description,
    PolicyType type,
    boolean enabled,
    Severity severity,
    List<String> labels,
    List<String> autoAttachPatterns,
    List<Rule> rules,
    Instant createdAt,
    Instant updatedAt
) {

    public static final String ID_PREFIX = "policy-";

    public Policy {
        labels = labels == null ? List.of() : List.copyOf(labels);
        autoAttachPatterns = autoAttachPatterns == null ? List.of() : List.copyOf(autoAttachPatterns);
        rules = rules == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rules));
        severity = severity == null ? Severity.MEDIUM : severity;
    }

    /**
     * Policy from a draft, filling defaults: generated id, enabled, medium severity,
     * plan type and both timestamps set to {@code now}.
     */
    public static Policy fromDraft(PolicyDraft draft, Instant now) {
        String id = draft.id() != null && !draft.id().isBlank()
                ? draft.id()
                : ID_PREFIX + UUID.randomUUID();
        return Policy.builder()
                .id(id)
                .name(draft.name())
                .description(draft.description() != null ? draft.description() : "")
                .type(draft.type() != null ? draft.type() : PolicyType.PLAN)
                .enabled(draft.enabled() == null || draft.enabled())
                .severity(draft.severity() != null ? draft.severity() : Severity.MEDIUM)
                .labels(draft.labels())
                .autoAttachPatterns(draft.autoAttachPatterns())
                .rules(draft.rules())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public Policy withUpdatedAt(Instant now) {
        return toBuilder().updatedAt(now).build();
    }
}
