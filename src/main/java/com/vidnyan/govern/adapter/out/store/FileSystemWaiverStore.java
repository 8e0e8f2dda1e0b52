package com.vidnyan.govern.adapter.out.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.govern.domain.error.StoreException;
import com.vidnyan.govern.domain.waiver.Waiver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Waiver store persisted as one JSON document, rewritten atomically on every write.
 */
@Slf4j
public class FileSystemWaiverStore extends InMemoryWaiverStore {

    static final String FILE_NAME = "waivers.json";

    private final ObjectMapper objectMapper;
    private final Path file;

    public FileSystemWaiverStore(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper;
        this.file = directory.resolve(FILE_NAME);
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("No waiver file at {}, starting empty", file);
            return;
        }
        try {
            List<Waiver> stored = objectMapper.readValue(file.toFile(), new TypeReference<List<Waiver>>() {});
            stored.forEach(w -> waivers.put(w.key(), w));
            log.info("Loaded {} waivers from {}", waivers.size(), file);
        } catch (IOException e) {
            log.error("Failed to read waivers from {}", file, e);
            throw new StoreException("Failed to read waivers from " + file, e);
        }
    }

    @Override
    protected void afterWrite() {
        JsonFiles.writeAtomically(objectMapper, file, list());
    }
}
