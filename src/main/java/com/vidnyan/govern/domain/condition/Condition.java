package com.vidnyan.govern.domain.condition;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed grammar of predicate nodes.
 * <p>
 * Field nodes address the flattened input by dotted path ({@code resource.tags.owner},
 * {@code plan.totalDeletes}, {@code cost.delta}, ...). Tag and identity nodes are shortcuts
 * over the input's resource. Combinators nest arbitrarily. {@code custom} delegates to a
 * {@link CustomConditionRegistry} and is the only extension point.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Condition.FieldEquals.class, name = "field_equals"),
    @JsonSubTypes.Type(value = Condition.FieldNotEquals.class, name = "field_not_equals"),
    @JsonSubTypes.Type(value = Condition.FieldContains.class, name = "field_contains"),
    @JsonSubTypes.Type(value = Condition.FieldMatches.class, name = "field_matches"),
    @JsonSubTypes.Type(value = Condition.FieldGt.class, name = "field_gt"),
    @JsonSubTypes.Type(value = Condition.FieldLt.class, name = "field_lt"),
    @JsonSubTypes.Type(value = Condition.FieldExists.class, name = "field_exists"),
    @JsonSubTypes.Type(value = Condition.FieldNotExists.class, name = "field_not_exists"),
    @JsonSubTypes.Type(value = Condition.FieldIn.class, name = "field_in"),
    @JsonSubTypes.Type(value = Condition.FieldNotIn.class, name = "field_not_in"),
    @JsonSubTypes.Type(value = Condition.TagMissing.class, name = "tag_missing"),
    @JsonSubTypes.Type(value = Condition.TagEquals.class, name = "tag_equals"),
    @JsonSubTypes.Type(value = Condition.ResourceType.class, name = "resource_type"),
    @JsonSubTypes.Type(value = Condition.Provider.class, name = "provider"),
    @JsonSubTypes.Type(value = Condition.Region.class, name = "region"),
    @JsonSubTypes.Type(value = Condition.And.class, name = "and"),
    @JsonSubTypes.Type(value = Condition.Or.class, name = "or"),
    @JsonSubTypes.Type(value = Condition.Not.class, name = "not"),
    @JsonSubTypes.Type(value = Condition.Custom.class, name = "custom")
})
public sealed interface Condition {

    record FieldEquals(String field, Object value) implements Condition {}

    record FieldNotEquals(String field, Object value) implements Condition {}

    /**
     * Substring test on strings, element membership on collections.
     */
    record FieldContains(String field, Object value) implements Condition {}

    /**
     * Regular expression searched in the stringified field value.
     */
    record FieldMatches(String field, String pattern) implements Condition {}

    record FieldGt(String field, double value) implements Condition {}

    record FieldLt(String field, double value) implements Condition {}

    record FieldExists(String field) implements Condition {}

    record FieldNotExists(String field) implements Condition {}

    record FieldIn(String field, List<Object> values) implements Condition {
        public FieldIn {
            values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
        }
    }

    record FieldNotIn(String field, List<Object> values) implements Condition {
        public FieldNotIn {
            values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
        }
    }

    record TagMissing(String tag) implements Condition {}

    record TagEquals(String tag, String value) implements Condition {}

    record ResourceType(String resourceType) implements Condition {}

    record Provider(String provider) implements Condition {}

    record Region(String region) implements Condition {}

    record And(List<Condition> conditions) implements Condition {
        public And {
            conditions = conditions == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(conditions));
        }
    }

    record Or(List<Condition> conditions) implements Condition {
        public Or {
            conditions = conditions == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(conditions));
        }
    }

    record Not(Condition condition) implements Condition {}

    /**
     * Named extension point resolved through a {@link CustomConditionRegistry}.
     */
    record Custom(@JsonAlias("evaluator") String name, Map<String, Object> args) implements Condition {
        public Custom {
            args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        }
    }

    // Factories, mostly used by the built-in catalogs and tests

    static Condition fieldEquals(String field, Object value) {
        return new FieldEquals(field, value);
    }

    static Condition fieldNotEquals(String field, Object value) {
        return new FieldNotEquals(field, value);
    }

    static Condition fieldContains(String field, Object value) {
        return new FieldContains(field, value);
    }

    static Condition fieldMatches(String field, String pattern) {
        return new FieldMatches(field, pattern);
    }

    static Condition fieldGt(String field, double value) {
        return new FieldGt(field, value);
    }

    static Condition fieldLt(String field, double value) {
        return new FieldLt(field, value);
    }

    static Condition fieldExists(String field) {
        return new FieldExists(field);
    }

    static Condition fieldNotExists(String field) {
        return new FieldNotExists(field);
    }

    static Condition fieldIn(String field, Object... values) {
        return new FieldIn(field, Arrays.asList(values));
    }

    static Condition fieldNotIn(String field, Object... values) {
        return new FieldNotIn(field, Arrays.asList(values));
    }

    static Condition tagMissing(String tag) {
        return new TagMissing(tag);
    }

    static Condition tagEquals(String tag, String value) {
        return new TagEquals(tag, value);
    }

    static Condition resourceType(String type) {
        return new ResourceType(type);
    }

    static Condition provider(String provider) {
        return new Provider(provider);
    }

    static Condition region(String region) {
        return new Region(region);
    }

    static Condition allOf(Condition... conditions) {
        return new And(List.of(conditions));
    }

    static Condition anyOf(Condition... conditions) {
        return new Or(List.of(conditions));
    }

    static Condition not(Condition condition) {
        return new Not(condition);
    }

    static Condition custom(String name, Map<String, Object> args) {
        return new Custom(name, args);
    }
}
