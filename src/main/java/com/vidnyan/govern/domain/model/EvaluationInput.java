package com.vidnyan.govern.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

import java.util.List;

/**
 * Bundle of optional namespaces a policy condition may reference.
 * An absent namespace resolves every field below it to "not found".
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationInput(
    Resource resource,
    Plan plan,
    Cost cost,
    Graph graph,
    Actor actor,
    String environment
) {

    public static EvaluationInput empty() {
        return new EvaluationInput(null, null, null, null, null, null);
    }

    /**
     * Summary of a pending infrastructure plan.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Plan(
        int totalCreates,
        int totalUpdates,
        int totalDeletes,
        List<Resource> resources
    ) {
        public Plan {
            resources = resources == null ? List.of() : List.copyOf(resources);
        }
    }

    /**
     * Current and projected spend.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Cost(
        double current,
        double projected,
        double delta,
        String currency
    ) {}

    /**
     * Dependency graph context around the resource.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Graph(
        List<String> neighbors,
        int blastRadius,
        int dependencyDepth
    ) {
        public Graph {
            neighbors = neighbors == null ? List.of() : List.copyOf(neighbors);
        }
    }

    /**
     * Identity performing the operation.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Actor(
        String id,
        List<String> roles,
        List<String> groups
    ) {
        public Actor {
            roles = roles == null ? List.of() : List.copyOf(roles);
            groups = groups == null ? List.of() : List.copyOf(groups);
        }
    }
}
