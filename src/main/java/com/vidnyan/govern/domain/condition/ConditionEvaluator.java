package com.vidnyan.govern.domain.condition;

import com.vidnyan.govern.domain.model.EvaluationInput;
import com.vidnyan.govern.domain.model.Resource;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Interpreter for the {@link Condition} grammar, shared by trigger-mode policies and
 * assertion-mode controls.
 * <p>
 * Total and side-effect free: missing fields, mismatched types, unresolvable custom
 * nodes and failing custom evaluators all evaluate to {@code false}. The only state
 * is a cache of compiled patterns, so one instance is safe to share across threads.
 */
@Slf4j
public class ConditionEvaluator {

    private final CustomConditionRegistry registry;
    private final Map<String, Optional<Pattern>> patterns = new ConcurrentHashMap<>();

    public ConditionEvaluator() {
        this(CustomConditionRegistry.none());
    }

    public ConditionEvaluator(CustomConditionRegistry registry) {
        this.registry = registry != null ? registry : CustomConditionRegistry.none();
    }

    /**
     * Whether the condition signals a violation under the given polarity.
     */
    public boolean violates(Condition condition, FlattenedInput input, Polarity polarity) {
        return polarity.violates(evaluate(condition, input));
    }

    public boolean evaluate(Condition condition, EvaluationInput input) {
        return evaluate(condition, InputFlattener.flatten(input));
    }

    public boolean evaluate(Condition condition, FlattenedInput input) {
        if (condition == null) {
            return false;
        }
        Resource resource = input.resource().orElse(null);

        if (condition instanceof Condition.FieldEquals c) {
            return input.contains(c.field()) && valuesEqual(input.get(c.field()), c.value());
        }
        if (condition instanceof Condition.FieldNotEquals c) {
            return !input.contains(c.field()) || !valuesEqual(input.get(c.field()), c.value());
        }
        if (condition instanceof Condition.FieldContains c) {
            return contains(input.get(c.field()), c.value());
        }
        if (condition instanceof Condition.FieldMatches c) {
            return matches(input, c);
        }
        if (condition instanceof Condition.FieldGt c) {
            return toNumber(input, c.field()) > c.value();
        }
        if (condition instanceof Condition.FieldLt c) {
            return toNumber(input, c.field()) < c.value();
        }
        if (condition instanceof Condition.FieldExists c) {
            return input.contains(c.field());
        }
        if (condition instanceof Condition.FieldNotExists c) {
            return !input.contains(c.field());
        }
        if (condition instanceof Condition.FieldIn c) {
            return input.contains(c.field()) && containsValue(c.values(), input.get(c.field()));
        }
        if (condition instanceof Condition.FieldNotIn c) {
            return !input.contains(c.field()) || !containsValue(c.values(), input.get(c.field()));
        }
        if (condition instanceof Condition.TagMissing c) {
            return resource == null || !resource.hasTag(c.tag());
        }
        if (condition instanceof Condition.TagEquals c) {
            return resource != null && Objects.equals(resource.tags().get(c.tag()), c.value());
        }
        if (condition instanceof Condition.ResourceType c) {
            return resource != null && Objects.equals(resource.type(), c.resourceType());
        }
        if (condition instanceof Condition.Provider c) {
            return resource != null && Objects.equals(resource.provider(), c.provider());
        }
        if (condition instanceof Condition.Region c) {
            return resource != null && Objects.equals(resource.region(), c.region());
        }
        if (condition instanceof Condition.And c) {
            return c.conditions().stream().allMatch(child -> evaluate(child, input));
        }
        if (condition instanceof Condition.Or c) {
            return c.conditions().stream().anyMatch(child -> evaluate(child, input));
        }
        if (condition instanceof Condition.Not c) {
            return !evaluate(c.condition(), input);
        }
        if (condition instanceof Condition.Custom c) {
            return evaluateCustom(c, resource, input);
        }
        return false;
    }

    private boolean evaluateCustom(Condition.Custom condition, Resource resource, FlattenedInput input) {
        Optional<CustomConditionRegistry.CustomEvaluator> evaluator = registry.find(condition.name());
        if (evaluator.isEmpty()) {
            log.debug("No custom evaluator registered for '{}', treating as no match", condition.name());
            return false;
        }
        try {
            return evaluator.get().evaluate(condition.args(), resource, input);
        } catch (RuntimeException e) {
            log.warn("Custom evaluator '{}' failed, treating as no match: {}", condition.name(), e.getMessage());
            return false;
        }
    }

    private boolean matches(FlattenedInput input, Condition.FieldMatches condition) {
        if (!input.contains(condition.field()) || condition.pattern() == null) {
            return false;
        }
        Optional<Pattern> pattern = patterns.computeIfAbsent(condition.pattern(), ConditionEvaluator::compile);
        return pattern
                .map(p -> p.matcher(String.valueOf(input.get(condition.field()))).find())
                .orElse(false);
    }

    private static Optional<Pattern> compile(String regex) {
        try {
            return Optional.of(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            log.warn("Invalid pattern '{}' reached evaluation, treating as no match", regex);
            return Optional.empty();
        }
    }

    private static boolean contains(Object haystack, Object needle) {
        if (haystack instanceof String s) {
            return needle != null && s.contains(String.valueOf(needle));
        }
        if (haystack instanceof Collection<?> collection) {
            return containsValue(collection, needle);
        }
        return false;
    }

    private static boolean containsValue(Collection<?> values, Object candidate) {
        for (Object value : values) {
            if (valuesEqual(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Equality where numbers compare by value regardless of boxed type.
     */
    static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }

    /**
     * Numeric coercion for comparators; anything that is not a number becomes NaN.
     */
    static double toNumber(FlattenedInput input, String field) {
        if (!input.contains(field)) {
            return Double.NaN;
        }
        Object value = input.get(field);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }
}
