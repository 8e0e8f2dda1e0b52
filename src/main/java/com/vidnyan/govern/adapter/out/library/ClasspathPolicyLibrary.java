package com.vidnyan.govern.adapter.out.library;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.govern.application.port.out.PolicyLibrary;
import com.vidnyan.govern.domain.policy.PolicyDraft;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Policy library loaded from JSON templates on the classpath.
 * Each file holds one entry: descriptive fields plus a {@code template} policy draft.
 */
@Slf4j
@Component
public class ClasspathPolicyLibrary implements PolicyLibrary {

    private final ObjectMapper objectMapper;
    private final String libraryPath;
    private final Map<String, LibraryPolicy> entries = new ConcurrentHashMap<>();

    public ClasspathPolicyLibrary(ObjectMapper objectMapper,
                                  @Value("${govern.library.path:classpath*:policies/library/*.json}") String libraryPath) {
        this.objectMapper = objectMapper;
        this.libraryPath = libraryPath;
    }

    @PostConstruct
    public void loadLibrary() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(libraryPath);

            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    LibraryPolicyDto dto = objectMapper.readValue(in, LibraryPolicyDto.class);
                    LibraryPolicy entry = mapToEntry(dto);
                    entries.put(entry.id(), entry);
                    log.info("Loaded library policy: {} - {}", entry.id(), entry.name());
                } catch (Exception e) {
                    log.warn("Failed to load library policy from {}: {}", resource.getFilename(), e.getMessage());
                }
            }

            log.info("Loaded {} library policies from {}", entries.size(), libraryPath);
        } catch (IOException e) {
            log.error("Failed to load policy library", e);
        }
    }

    @Override
    public List<LibraryPolicy> list() {
        return entries.values().stream()
                .sorted(Comparator.comparing(LibraryPolicy::id))
                .toList();
    }

    @Override
    public Optional<LibraryPolicy> findById(String templateId) {
        return Optional.ofNullable(templateId).map(entries::get);
    }

    @Override
    public List<String> categories() {
        return entries.values().stream()
                .map(LibraryPolicy::category)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
    }

    @Override
    public List<LibraryPolicy> listByCategory(String category) {
        return list().stream()
                .filter(e -> Objects.equals(e.category(), category))
                .toList();
    }

    private LibraryPolicy mapToEntry(LibraryPolicyDto dto) {
        if (dto.id == null || dto.template == null) {
            throw new IllegalArgumentException("library entry needs an id and a template");
        }
        return new LibraryPolicy(
                dto.id,
                dto.name != null ? dto.name : dto.template.name(),
                dto.description != null ? dto.description : dto.template.description(),
                dto.category,
                dto.template
        );
    }

    // DTO for JSON deserialization
    static class LibraryPolicyDto {
        public String id;
        public String name;
        public String description;
        public String category;
        public PolicyDraft template;
    }
}
