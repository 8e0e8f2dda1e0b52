package com.vidnyan.govern.domain.policy;

import com.vidnyan.govern.domain.model.Resource;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a policy attaches to a resource from its auto-attach patterns.
 * <p>
 * Supported patterns: {@code *}, {@code provider:<p>}, {@code type:<t>},
 * {@code region:<r>}, {@code tag:<k>} (tag present) and {@code tag:<k>=<v>}.
 * An empty pattern list attaches to everything; otherwise any single match suffices.
 */
public final class ScopeMatcher {

    public static final String WILDCARD = "*";

    private ScopeMatcher() {
    }

    public static boolean applies(Policy policy, Resource resource) {
        return applies(policy.autoAttachPatterns(), resource);
    }

    public static boolean applies(List<String> patterns, Resource resource) {
        if (patterns == null || patterns.isEmpty()) {
            return true;
        }
        for (String pattern : patterns) {
            if (matches(pattern, resource)) {
                return true;
            }
        }
        return false;
    }

    static boolean matches(String pattern, Resource resource) {
        if (pattern == null) return false;
        if (WILDCARD.equals(pattern)) return true;
        if (resource == null) return false;

        int colon = pattern.indexOf(':');
        if (colon < 0) return false;
        String key = pattern.substring(0, colon);
        String value = pattern.substring(colon + 1);

        return switch (key) {
            case "provider" -> Objects.equals(resource.provider(), value);
            case "type" -> Objects.equals(resource.type(), value);
            case "region" -> Objects.equals(resource.region(), value);
            case "tag" -> matchesTag(value, resource);
            default -> false;
        };
    }

    private static boolean matchesTag(String spec, Resource resource) {
        int eq = spec.indexOf('=');
        if (eq < 0) {
            return resource.hasTag(spec);
        }
        String tagKey = spec.substring(0, eq);
        String tagValue = spec.substring(eq + 1);
        if (tagValue.isEmpty()) {
            return resource.hasTag(tagKey);
        }
        return tagValue.equals(resource.tags().get(tagKey));
    }

    /**
     * Whether the pattern uses a recognized form.
     */
    public static boolean isWellFormed(String pattern) {
        if (pattern == null || pattern.isBlank()) return false;
        if (WILDCARD.equals(pattern)) return true;
        int colon = pattern.indexOf(':');
        if (colon < 0 || colon == pattern.length() - 1) return false;
        String key = pattern.substring(0, colon);
        return switch (key) {
            case "provider", "type", "region", "tag" -> true;
            default -> false;
        };
    }
}
