package com.vidnyan.govern.adapter.out.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.govern.domain.error.StoreException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Report history persisted as one JSON document in save order.
 */
@Slf4j
public class FileSystemReportStore extends InMemoryReportStore {

    static final String FILE_NAME = "reports.json";

    private final ObjectMapper objectMapper;
    private final Path file;

    public FileSystemReportStore(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper;
        this.file = directory.resolve(FILE_NAME);
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            reports.addAll(objectMapper.readValue(file.toFile(), new TypeReference<List<StoredReport>>() {}));
            log.info("Loaded {} compliance reports from {}", reports.size(), file);
        } catch (IOException e) {
            log.error("Failed to read reports from {}", file, e);
            throw new StoreException("Failed to read reports from " + file, e);
        }
    }

    @Override
    protected void afterWrite() {
        JsonFiles.writeAtomically(objectMapper, file, reports);
    }
}
