package com.vidnyan.govern.domain.condition;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Custom conditions shipped with the engine.
 */
public final class BuiltinCustomConditions {

    /**
     * True when the resource's region is listed in its {@code approved_regions} metadata,
     * or when no such list is defined.
     */
    public static final String REGION_APPROVED = "region_approved";

    /**
     * True when every tag named in the {@code tags} argument is present on the resource.
     */
    public static final String HAS_ALL_TAGS = "has_all_tags";

    private BuiltinCustomConditions() {
    }

    public static Map<String, CustomConditionRegistry.CustomEvaluator> evaluators() {
        Map<String, CustomConditionRegistry.CustomEvaluator> evaluators = new LinkedHashMap<>();
        evaluators.put(REGION_APPROVED, (args, resource, input) -> {
            if (resource == null) return false;
            Object approved = resource.metadata().get("approved_regions");
            if (!(approved instanceof Collection<?> regions)) {
                return true;
            }
            return regions.contains(resource.region());
        });
        evaluators.put(HAS_ALL_TAGS, (args, resource, input) -> {
            if (resource == null) return false;
            Object tags = args.get("tags");
            if (!(tags instanceof Collection<?> required)) {
                return true;
            }
            return required.stream().allMatch(t -> resource.hasTag(String.valueOf(t)));
        });
        return evaluators;
    }

    public static CustomConditionRegistry registry() {
        return CustomConditionRegistry.of(evaluators());
    }
}
