package com.vidnyan.govern.adapter.out.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.govern.domain.error.StoreException;
import com.vidnyan.govern.domain.policy.Policy;
import com.vidnyan.govern.domain.policy.PolicyValidator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Policies persisted as one JSON file per policy, named after the policy id.
 * Files that fail to parse or validate are skipped with a warning on load.
 */
@Slf4j
public class FileSystemPolicyRepository extends InMemoryPolicyRepository {

    private final ObjectMapper objectMapper;
    private final Path directory;

    public FileSystemPolicyRepository(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper;
        this.directory = directory;
        load();
    }

    private void load() {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                try {
                    Policy policy = objectMapper.readValue(file.toFile(), Policy.class);
                    List<String> problems = PolicyValidator.problems(policy);
                    if (!problems.isEmpty()) {
                        log.warn("Skipping invalid policy file {}: {}", file.getFileName(), problems);
                        continue;
                    }
                    policies.put(policy.id(), policy);
                } catch (IOException e) {
                    log.warn("Failed to load policy from {}: {}", file.getFileName(), e.getMessage());
                }
            }
            log.info("Loaded {} policies from {}", policies.size(), directory);
        } catch (IOException e) {
            log.error("Failed to list policies in {}", directory, e);
            throw new StoreException("Failed to list policies in " + directory, e);
        }
    }

    @Override
    protected void persist(Policy policy) {
        JsonFiles.writeAtomically(objectMapper, fileFor(policy.id()), policy);
    }

    @Override
    protected void unpersist(String policyId) {
        try {
            Files.deleteIfExists(fileFor(policyId));
        } catch (IOException e) {
            log.error("Failed to delete policy file for {}", policyId, e);
            throw new StoreException("Failed to delete policy " + policyId, e);
        }
    }

    private Path fileFor(String policyId) {
        return directory.resolve(policyId + ".json");
    }
}
