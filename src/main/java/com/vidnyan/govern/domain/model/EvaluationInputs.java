package com.vidnyan.govern.domain.model;

import java.util.List;

/**
 * Builders for the common kinds of evaluation input.
 */
public final class EvaluationInputs {

    private static final String DEFAULT_CURRENCY = "USD";

    private EvaluationInputs() {
    }

    public static EvaluationInput forResource(Resource resource) {
        return EvaluationInput.builder().resource(resource).build();
    }

    public static EvaluationInput forResource(Resource resource, String environment) {
        return EvaluationInput.builder().resource(resource).environment(environment).build();
    }

    public static EvaluationInput forPlan(int creates, int updates, int deletes, List<Resource> resources) {
        return EvaluationInput.builder()
                .plan(new EvaluationInput.Plan(creates, updates, deletes, resources))
                .build();
    }

    /**
     * Cost input; the delta is always derived from the two amounts.
     */
    public static EvaluationInput forCost(double current, double projected, String currency) {
        String cur = currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency;
        return EvaluationInput.builder()
                .cost(new EvaluationInput.Cost(current, projected, projected - current, cur))
                .build();
    }

    /**
     * Resource input flagged as drifted, with the number of drifted fields.
     */
    public static EvaluationInput forDrift(Resource resource, List<String> driftedFields) {
        int count = driftedFields == null ? 0 : driftedFields.size();
        Resource drifted = resource
                .withMetadata("drifted", true)
                .withMetadata("driftFieldCount", count)
                .withMetadata("driftedFields", driftedFields == null ? List.of() : List.copyOf(driftedFields));
        return forResource(drifted);
    }

    /**
     * Access request: the actor plus the target resource carrying the requested operation.
     */
    public static EvaluationInput forAccess(EvaluationInput.Actor actor, Resource target, String operation) {
        return EvaluationInput.builder()
                .actor(actor)
                .resource(target.withMetadata("requestedOperation", operation))
                .build();
    }

    public static EvaluationInput forGraph(Resource resource, List<String> neighbors, int blastRadius, int depth) {
        return EvaluationInput.builder()
                .resource(resource)
                .graph(new EvaluationInput.Graph(neighbors, blastRadius, depth))
                .build();
    }
}
