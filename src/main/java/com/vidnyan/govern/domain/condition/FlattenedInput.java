package com.vidnyan.govern.domain.condition;

import com.vidnyan.govern.domain.model.Resource;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only dotted-path view of one evaluation input.
 * <p>
 * A path is "found" when it is present in the view, even if its value is null
 * (a metadata entry explicitly set to null). Paths below {@code resource.metadata.}
 * that are not flattened directly are resolved by walking nested maps.
 */
public final class FlattenedInput {

    private static final FlattenedInput EMPTY = new FlattenedInput(Map.of(), null);

    private final Map<String, Object> values;
    private final Resource resource;

    FlattenedInput(Map<String, Object> values, Resource resource) {
        this.values = Collections.unmodifiableMap(values);
        this.resource = resource;
    }

    public static FlattenedInput empty() {
        return EMPTY;
    }

    public boolean contains(String path) {
        return path != null && (values.containsKey(path) || walkMetadata(path).isPresent());
    }

    /**
     * Value at {@code path}, or null when not found. Use {@link #contains} to tell
     * "not found" from an explicit null.
     */
    public Object get(String path) {
        if (path == null) return null;
        if (values.containsKey(path)) {
            return values.get(path);
        }
        return walkMetadata(path).map(Holder::value).orElse(null);
    }

    /**
     * The resource namespace, if the input carried one.
     */
    public Optional<Resource> resource() {
        return Optional.ofNullable(resource);
    }

    public int size() {
        return values.size();
    }

    private Optional<Holder> walkMetadata(String path) {
        if (resource == null || !path.startsWith(FieldAccessors.METADATA_PREFIX)) {
            return Optional.empty();
        }
        String[] parts = path.substring(FieldAccessors.METADATA_PREFIX.length()).split("\\.");
        Object current = resource.metadata();
        for (String part : parts) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(part)) {
                return Optional.empty();
            }
            current = map.get(part);
        }
        return Optional.of(new Holder(current));
    }

    private record Holder(Object value) {}
}
