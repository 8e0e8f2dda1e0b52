package com.vidnyan.govern.domain.condition;

import com.vidnyan.govern.domain.model.EvaluationInput;
import com.vidnyan.govern.domain.model.EvaluationInputs;
import com.vidnyan.govern.domain.model.Resource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InputFlattenerTest {

    @Test
    void flatten_ShouldExposeResourceTagsAndMetadata() {
        // Arrange
        Resource resource = Resource.builder()
                .id("db-1")
                .type("database")
                .provider("aws")
                .tags(Map.of("owner", "data"))
                .metadata(Map.of("engine", "postgres"))
                .build();

        // Act
        FlattenedInput flat = InputFlattener.flatten(resource);

        // Assert
        assertEquals("db-1", flat.get("resource.id"));
        assertEquals("database", flat.get("resource.type"));
        assertEquals("data", flat.get("resource.tags.owner"));
        assertEquals("postgres", flat.get("resource.metadata.engine"));
        assertEquals(Map.of("owner", "data"), flat.get("resource.tags"));
        assertFalse(flat.contains("resource.region"));
        assertTrue(flat.resource().isPresent());
    }

    @Test
    void flatten_ShouldLeaveAbsentNamespacesUnfound() {
        FlattenedInput flat = InputFlattener.flatten(EvaluationInputs.forPlan(1, 2, 3, List.of()));

        assertEquals(3, flat.get("plan.totalDeletes"));
        assertFalse(flat.contains("cost.delta"));
        assertFalse(flat.contains("actor.id"));
        assertFalse(flat.contains("resource.id"));
        assertTrue(flat.resource().isEmpty());
    }

    @Test
    void flatten_ShouldHandleNullInput() {
        FlattenedInput flat = InputFlattener.flatten((EvaluationInput) null);

        assertEquals(0, flat.size());
        assertNull(flat.get("resource.id"));
    }

    @Test
    void flatten_ShouldExposeActorAndEnvironment() {
        EvaluationInput input = EvaluationInput.builder()
                .actor(new EvaluationInput.Actor("alice", List.of("admin"), List.of("ops")))
                .environment("staging")
                .build();

        FlattenedInput flat = InputFlattener.flatten(input);

        assertEquals("alice", flat.get("actor.id"));
        assertEquals(List.of("admin"), flat.get("actor.roles"));
        assertEquals("staging", flat.get("environment"));
    }
}
