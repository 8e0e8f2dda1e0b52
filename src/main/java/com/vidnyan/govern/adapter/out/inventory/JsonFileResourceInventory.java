package com.vidnyan.govern.adapter.out.inventory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.govern.application.port.out.ResourceInventory;
import com.vidnyan.govern.domain.error.StoreException;
import com.vidnyan.govern.domain.model.Resource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a resource snapshot from a JSON file: either a bare array of resources or an
 * object with a {@code resources} array.
 */
@Slf4j
public class JsonFileResourceInventory implements ResourceInventory {

    private final ObjectMapper objectMapper;
    private final Path path;

    public JsonFileResourceInventory(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper;
        this.path = path;
    }

    @Override
    public List<Resource> load() {
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            JsonNode array = root.isArray() ? root : root.path("resources");
            if (!array.isArray()) {
                throw new StoreException("No resource array in " + path);
            }
            List<Resource> resources = objectMapper.convertValue(array, new TypeReference<List<Resource>>() {});
            log.info("Loaded {} resources from {}", resources.size(), path);
            return resources;
        } catch (IOException e) {
            log.error("Failed to read inventory {}", path, e);
            throw new StoreException("Failed to read inventory " + path, e);
        }
    }
}
