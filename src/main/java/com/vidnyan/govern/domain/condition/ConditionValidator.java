package com.vidnyan.govern.domain.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Structural checks for condition trees, run when a policy is saved so that
 * evaluation never meets a malformed node.
 */
public final class ConditionValidator {

    private ConditionValidator() {
    }

    /**
     * @param path location of the condition in its policy, used to prefix problems
     * @return human-readable problems; empty when the tree is valid
     */
    public static List<String> validate(Condition condition, String path) {
        List<String> problems = new ArrayList<>();
        validate(condition, path, problems);
        return problems;
    }

    private static void validate(Condition condition, String path, List<String> problems) {
        if (condition == null) {
            problems.add(path + ": condition is missing");
            return;
        }

        if (condition instanceof Condition.FieldEquals c) {
            requireField(c.field(), path, problems);
        } else if (condition instanceof Condition.FieldNotEquals c) {
            requireField(c.field(), path, problems);
        } else if (condition instanceof Condition.FieldContains c) {
            requireField(c.field(), path, problems);
        } else if (condition instanceof Condition.FieldMatches c) {
            requireField(c.field(), path, problems);
            if (c.pattern() == null) {
                problems.add(path + ": field_matches requires a pattern");
            } else {
                try {
                    Pattern.compile(c.pattern());
                } catch (PatternSyntaxException e) {
                    problems.add(path + ": invalid pattern '" + c.pattern() + "': " + e.getDescription());
                }
            }
        } else if (condition instanceof Condition.FieldGt c) {
            requireField(c.field(), path, problems);
        } else if (condition instanceof Condition.FieldLt c) {
            requireField(c.field(), path, problems);
        } else if (condition instanceof Condition.FieldExists c) {
            requireField(c.field(), path, problems);
        } else if (condition instanceof Condition.FieldNotExists c) {
            requireField(c.field(), path, problems);
        } else if (condition instanceof Condition.FieldIn c) {
            requireField(c.field(), path, problems);
        } else if (condition instanceof Condition.FieldNotIn c) {
            requireField(c.field(), path, problems);
        } else if (condition instanceof Condition.TagMissing c) {
            requireText(c.tag(), "tag", path, problems);
        } else if (condition instanceof Condition.TagEquals c) {
            requireText(c.tag(), "tag", path, problems);
        } else if (condition instanceof Condition.ResourceType c) {
            requireText(c.resourceType(), "resourceType", path, problems);
        } else if (condition instanceof Condition.Provider c) {
            requireText(c.provider(), "provider", path, problems);
        } else if (condition instanceof Condition.Region c) {
            requireText(c.region(), "region", path, problems);
        } else if (condition instanceof Condition.And c) {
            validateChildren(c.conditions(), "and", path, problems);
        } else if (condition instanceof Condition.Or c) {
            validateChildren(c.conditions(), "or", path, problems);
        } else if (condition instanceof Condition.Not c) {
            validate(c.condition(), path + ".not", problems);
        } else if (condition instanceof Condition.Custom c) {
            requireText(c.name(), "name", path, problems);
        }
    }

    private static void validateChildren(List<Condition> children, String kind, String path, List<String> problems) {
        if (children.isEmpty()) {
            problems.add(path + ": '" + kind + "' needs at least one condition");
            return;
        }
        for (int i = 0; i < children.size(); i++) {
            validate(children.get(i), path + "." + kind + "[" + i + "]", problems);
        }
    }

    private static void requireField(String field, String path, List<String> problems) {
        requireText(field, "field", path, problems);
    }

    private static void requireText(String value, String name, String path, List<String> problems) {
        if (value == null || value.isBlank()) {
            problems.add(path + ": '" + name + "' is required");
        }
    }
}
