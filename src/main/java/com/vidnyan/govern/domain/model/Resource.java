package com.vidnyan.govern.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized infrastructure resource, the subject of every evaluation.
 * Tags and metadata are never null.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Resource(
    String id,
    String type,
    String provider,
    String region,
    String name,
    String status,
    Map<String, String> tags,
    Map<String, Object> metadata
) {

    public Resource {
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasTag(String key) {
        return tags.containsKey(key);
    }

    /**
     * Copy of this resource with one metadata entry added or replaced.
     */
    public Resource withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return toBuilder().metadata(copy).build();
    }

    /**
     * Display name, falling back to the id.
     */
    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
