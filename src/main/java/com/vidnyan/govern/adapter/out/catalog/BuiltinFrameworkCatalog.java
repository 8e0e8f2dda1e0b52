package com.vidnyan.govern.adapter.out.catalog;

import com.vidnyan.govern.application.port.out.FrameworkCatalog;
import com.vidnyan.govern.domain.compliance.ControlFramework;
import com.vidnyan.govern.domain.compliance.catalog.BuiltinFrameworks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Framework catalog backed by the frameworks shipped with the engine.
 */
@Slf4j
@Component
public class BuiltinFrameworkCatalog implements FrameworkCatalog {

    private final Map<String, ControlFramework> frameworks = new LinkedHashMap<>();

    public BuiltinFrameworkCatalog() {
        for (ControlFramework framework : BuiltinFrameworks.all()) {
            frameworks.put(framework.id(), framework);
        }
        log.info("Registered {} compliance frameworks: {}", frameworks.size(), frameworks.keySet());
    }

    @Override
    public Optional<ControlFramework> findById(String frameworkId) {
        return Optional.ofNullable(frameworkId).map(frameworks::get);
    }

    @Override
    public List<ControlFramework> list() {
        return List.copyOf(frameworks.values());
    }
}
