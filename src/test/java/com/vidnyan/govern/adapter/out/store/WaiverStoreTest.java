package com.vidnyan.govern.adapter.out.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.govern.config.GovernConfiguration;
import com.vidnyan.govern.domain.error.StoreException;
import com.vidnyan.govern.domain.waiver.Waiver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WaiverStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final ObjectMapper objectMapper = GovernConfiguration.createObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void add_ShouldReplaceWaiverForSameControlAndResource() {
        // Arrange
        InMemoryWaiverStore store = new InMemoryWaiverStore();
        Waiver first = Waiver.create("soc2-CC6.1", "bucket-1", "legacy", "alice", 30, NOW);
        Waiver second = Waiver.create("soc2-CC6.1", "bucket-1", "extended", "bob", 60, NOW);

        // Act
        store.add(first);
        store.add(second);

        // Assert
        assertEquals(1, store.list().size());
        assertEquals("extended", store.list().get(0).reason());
        assertTrue(store.get(first.id()).isEmpty());
    }

    @Test
    void isWaived_ShouldHonorExpiryStrictly() {
        InMemoryWaiverStore store = new InMemoryWaiverStore();
        Waiver waiver = Waiver.create("pol", "r1", "reason", "alice", 1, NOW);
        store.add(waiver);

        assertTrue(store.isWaived("pol", "r1", NOW));
        assertTrue(store.isWaived("pol", "r1", NOW.plus(Duration.ofHours(23))));
        assertFalse(store.isWaived("pol", "r1", waiver.expiresAt()));
        assertFalse(store.isWaived("pol", "r2", NOW));
        assertEquals(0, store.listActive(waiver.expiresAt()).size());
        assertEquals(1, store.list().size());
    }

    @Test
    void remove_ShouldReportWhetherWaiverExisted() {
        InMemoryWaiverStore store = new InMemoryWaiverStore();
        Waiver waiver = store.add(Waiver.create("pol", "r1", "reason", "alice", null, NOW));

        assertTrue(store.remove(waiver.id()));
        assertFalse(store.remove(waiver.id()));
        assertFalse(store.isWaived("pol", "r1", NOW));
    }

    @Test
    void fileStore_ShouldSurviveReload() {
        // Arrange
        FileSystemWaiverStore store = new FileSystemWaiverStore(objectMapper, tempDir);
        Waiver kept = store.add(Waiver.create("pol", "r1", "reason", "alice", 10, NOW));
        Waiver removed = store.add(Waiver.create("pol", "r2", "reason", "alice", 10, NOW));
        store.remove(removed.id());

        // Act
        FileSystemWaiverStore reloaded = new FileSystemWaiverStore(objectMapper, tempDir);

        // Assert
        assertTrue(Files.exists(tempDir.resolve(FileSystemWaiverStore.FILE_NAME)));
        assertEquals(1, reloaded.list().size());
        assertEquals(kept, reloaded.list().get(0));
        assertTrue(reloaded.isWaived("pol", "r1", NOW));
    }

    @Test
    void fileStore_ShouldFailOnCorruptFile() throws Exception {
        Files.writeString(tempDir.resolve(FileSystemWaiverStore.FILE_NAME), "{not json");

        assertThrows(StoreException.class, () -> new FileSystemWaiverStore(objectMapper, tempDir));
    }

    @Test
    void add_ShouldRollBackWhenFileCannotBeWritten() throws Exception {
        // Arrange
        Path blocked = tempDir.resolve("blocked");
        Files.writeString(blocked, "not a directory");
        FileSystemWaiverStore store = new FileSystemWaiverStore(objectMapper, blocked);

        // Act
        assertThrows(StoreException.class,
                () -> store.add(Waiver.create("pol", "r1", "reason", "alice", 10, NOW)));

        // Assert
        assertFalse(store.isWaived("pol", "r1", NOW));
        assertTrue(store.list().isEmpty());
    }

    @Test
    void remove_ShouldRestoreWaiverWhenWriteFails() {
        // Arrange
        FailingWaiverStore store = new FailingWaiverStore();
        Waiver waiver = store.add(Waiver.create("pol", "r1", "reason", "alice", 10, NOW));
        store.failWrites = true;

        // Act
        assertThrows(StoreException.class, () -> store.remove(waiver.id()));

        // Assert
        assertTrue(store.isWaived("pol", "r1", NOW));
        assertEquals(waiver, store.get(waiver.id()).orElseThrow());
    }

    @Test
    void add_ShouldKeepReplacedWaiverWhenWriteFails() {
        // Arrange
        FailingWaiverStore store = new FailingWaiverStore();
        Waiver original = store.add(Waiver.create("pol", "r1", "original", "alice", 10, NOW));
        store.failWrites = true;

        // Act
        assertThrows(StoreException.class,
                () -> store.add(Waiver.create("pol", "r1", "replacement", "bob", 20, NOW)));

        // Assert
        assertEquals(List.of(original), store.list());
    }

    private static class FailingWaiverStore extends InMemoryWaiverStore {

        boolean failWrites;

        @Override
        protected void afterWrite() {
            if (failWrites) {
                throw new StoreException("disk full");
            }
        }
    }
}
