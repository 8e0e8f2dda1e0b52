package com.vidnyan.govern.adapter.out.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.govern.domain.error.StoreException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON file writes shared by the file-backed stores.
 */
@Slf4j
final class JsonFiles {

    private JsonFiles() {
    }

    /**
     * Write to a sibling temp file, then move it over the target so readers never
     * see a partial document.
     */
    static void writeAtomically(ObjectMapper objectMapper, Path target, Object value) {
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Path temp = Files.createTempFile(target.toAbsolutePath().getParent(), target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), value);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to write {}", target, e);
            throw new StoreException("Failed to write " + target, e);
        }
    }
}
