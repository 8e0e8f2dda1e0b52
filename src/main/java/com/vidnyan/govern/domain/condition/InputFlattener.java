package com.vidnyan.govern.domain.condition;

import com.vidnyan.govern.domain.model.EvaluationInput;
import com.vidnyan.govern.domain.model.Resource;

import java.util.HashMap;
import java.util.Map;

/**
 * Turns an {@link EvaluationInput} into a {@link FlattenedInput}.
 * Pure; called once per evaluation, never per rule.
 */
public final class InputFlattener {

    private InputFlattener() {
    }

    public static FlattenedInput flatten(EvaluationInput input) {
        if (input == null) {
            return FlattenedInput.empty();
        }

        Map<String, Object> values = new HashMap<>();
        FieldAccessors.table().forEach((path, accessor) -> {
            Object value = accessor.apply(input);
            if (value != null) {
                values.put(path, value);
            }
        });

        Resource resource = input.resource();
        if (resource != null) {
            resource.tags().forEach((k, v) -> values.put(FieldAccessors.TAGS_PREFIX + k, v));
            // null metadata values are kept: the field exists
            resource.metadata().forEach((k, v) -> values.put(FieldAccessors.METADATA_PREFIX + k, v));
        }

        return new FlattenedInput(values, resource);
    }

    public static FlattenedInput flatten(Resource resource) {
        return flatten(EvaluationInput.builder().resource(resource).build());
    }
}
