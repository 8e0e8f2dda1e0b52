package com.vidnyan.govern.domain.condition;

import com.vidnyan.govern.domain.model.Resource;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves {@code custom} condition nodes by name.
 */
public interface CustomConditionRegistry {

    /**
     * Evaluator for one custom condition name.
     */
    @FunctionalInterface
    interface CustomEvaluator {
        /**
         * @param args     arguments declared on the condition node
         * @param resource the resource under evaluation, or null when the input has none
         * @param input    the full flattened input
         */
        boolean evaluate(Map<String, Object> args, Resource resource, FlattenedInput input);
    }

    Optional<CustomEvaluator> find(String name);

    /**
     * Registry that resolves nothing; every custom node evaluates to false.
     */
    static CustomConditionRegistry none() {
        return name -> Optional.empty();
    }

    static CustomConditionRegistry of(Map<String, CustomEvaluator> evaluators) {
        Map<String, CustomEvaluator> copy = Map.copyOf(evaluators);
        return name -> Optional.ofNullable(name == null ? null : copy.get(name));
    }
}
