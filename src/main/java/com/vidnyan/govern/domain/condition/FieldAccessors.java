package com.vidnyan.govern.domain.condition;

import com.vidnyan.govern.domain.model.EvaluationInput;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Typed accessor table for the fixed dotted paths of every namespace.
 * Built once; the flattener applies it to each input instead of re-parsing paths.
 * <p>
 * Dynamic paths below {@code resource.tags.} and {@code resource.metadata.} are
 * handled by {@link FlattenedInput}.
 */
public final class FieldAccessors {

    public static final String TAGS_PREFIX = "resource.tags.";
    public static final String METADATA_PREFIX = "resource.metadata.";

    private static final Map<String, Function<EvaluationInput, Object>> ACCESSORS = build();

    private FieldAccessors() {
    }

    private static Map<String, Function<EvaluationInput, Object>> build() {
        Map<String, Function<EvaluationInput, Object>> table = new LinkedHashMap<>();

        resource(table, "id", r -> r.resource().id());
        resource(table, "type", r -> r.resource().type());
        resource(table, "provider", r -> r.resource().provider());
        resource(table, "region", r -> r.resource().region());
        resource(table, "name", r -> r.resource().name());
        resource(table, "status", r -> r.resource().status());
        resource(table, "tags", r -> r.resource().tags());
        resource(table, "metadata", r -> r.resource().metadata());

        namespace(table, "plan", EvaluationInput::plan, Map.of(
                "totalCreates", i -> i.plan().totalCreates(),
                "totalUpdates", i -> i.plan().totalUpdates(),
                "totalDeletes", i -> i.plan().totalDeletes(),
                "resources", i -> i.plan().resources()));

        namespace(table, "cost", EvaluationInput::cost, Map.of(
                "current", i -> i.cost().current(),
                "projected", i -> i.cost().projected(),
                "delta", i -> i.cost().delta(),
                "currency", i -> i.cost().currency()));

        namespace(table, "graph", EvaluationInput::graph, Map.of(
                "neighbors", i -> i.graph().neighbors(),
                "blastRadius", i -> i.graph().blastRadius(),
                "dependencyDepth", i -> i.graph().dependencyDepth()));

        namespace(table, "actor", EvaluationInput::actor, Map.of(
                "id", i -> i.actor().id(),
                "roles", i -> i.actor().roles(),
                "groups", i -> i.actor().groups()));

        table.put("environment", EvaluationInput::environment);
        return Collections.unmodifiableMap(table);
    }

    private static void resource(Map<String, Function<EvaluationInput, Object>> table,
                                 String field, Function<EvaluationInput, Object> accessor) {
        table.put("resource." + field, i -> i.resource() == null ? null : accessor.apply(i));
    }

    private static void namespace(Map<String, Function<EvaluationInput, Object>> table,
                                  String prefix,
                                  Function<EvaluationInput, Object> root,
                                  Map<String, Function<EvaluationInput, Object>> fields) {
        fields.forEach((field, accessor) ->
                table.put(prefix + "." + field, i -> root.apply(i) == null ? null : accessor.apply(i)));
    }

    /**
     * Fixed paths known to the table.
     */
    public static Set<String> paths() {
        return ACCESSORS.keySet();
    }

    static Map<String, Function<EvaluationInput, Object>> table() {
        return ACCESSORS;
    }
}
