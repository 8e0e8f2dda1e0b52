package com.vidnyan.govern.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.govern.adapter.out.inventory.JsonFileResourceInventory;
import com.vidnyan.govern.adapter.out.store.FileSystemPolicyRepository;
import com.vidnyan.govern.adapter.out.store.FileSystemReportStore;
import com.vidnyan.govern.adapter.out.store.FileSystemWaiverStore;
import com.vidnyan.govern.adapter.out.store.InMemoryPolicyRepository;
import com.vidnyan.govern.adapter.out.store.InMemoryReportStore;
import com.vidnyan.govern.adapter.out.store.InMemoryWaiverStore;
import com.vidnyan.govern.application.port.out.PolicyRepository;
import com.vidnyan.govern.application.port.out.ReportStore;
import com.vidnyan.govern.application.port.out.ResourceInventory;
import com.vidnyan.govern.application.port.out.WaiverStore;
import com.vidnyan.govern.domain.compliance.ComplianceEvaluator;
import com.vidnyan.govern.domain.condition.BuiltinCustomConditions;
import com.vidnyan.govern.domain.condition.ConditionEvaluator;
import com.vidnyan.govern.domain.condition.CustomConditionRegistry;
import com.vidnyan.govern.domain.policy.PolicyEvaluationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Spring configuration for the governance engine.
 * Wires the framework-free domain engines and picks store adapters from {@code govern.store.type}.
 */
@Slf4j
@Configuration
public class GovernConfiguration {

    /**
     * ObjectMapper for policies, reports and the REST API.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return createObjectMapper();
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CustomConditionRegistry customConditionRegistry() {
        return BuiltinCustomConditions.registry();
    }

    @Bean
    public ConditionEvaluator conditionEvaluator(CustomConditionRegistry registry) {
        return new ConditionEvaluator(registry);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService scanExecutor(GovernProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getScan().getParallelism()));
    }

    @Bean
    public PolicyEvaluationEngine policyEvaluationEngine(ConditionEvaluator conditionEvaluator, Clock clock,
                                                         ExecutorService scanExecutor, GovernProperties properties) {
        GovernProperties.Scan scan = properties.getScan();
        boolean parallel = scan.getParallelism() > 1;
        log.info("Policy scans run {} (timeout {})",
                parallel ? "with parallelism " + scan.getParallelism() : "sequentially", scan.getTimeout());
        return new PolicyEvaluationEngine(conditionEvaluator, clock, parallel ? scanExecutor : null, scan.getTimeout());
    }

    @Bean
    public ComplianceEvaluator complianceEvaluator(ConditionEvaluator conditionEvaluator, Clock clock) {
        return new ComplianceEvaluator(conditionEvaluator, clock);
    }

    @Bean
    public PolicyRepository policyRepository(ObjectMapper objectMapper, GovernProperties properties) {
        if (properties.getStore().isFileBacked()) {
            return new FileSystemPolicyRepository(objectMapper, storeDirectory(properties).resolve("policies"));
        }
        return new InMemoryPolicyRepository();
    }

    @Bean
    public WaiverStore waiverStore(ObjectMapper objectMapper, GovernProperties properties) {
        if (properties.getStore().isFileBacked()) {
            return new FileSystemWaiverStore(objectMapper, storeDirectory(properties));
        }
        return new InMemoryWaiverStore();
    }

    @Bean
    public ReportStore reportStore(ObjectMapper objectMapper, GovernProperties properties) {
        if (properties.getStore().isFileBacked()) {
            return new FileSystemReportStore(objectMapper, storeDirectory(properties));
        }
        return new InMemoryReportStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "govern.inventory", name = "path")
    public ResourceInventory resourceInventory(ObjectMapper objectMapper, GovernProperties properties) {
        return new JsonFileResourceInventory(objectMapper, Path.of(properties.getInventory().getPath()));
    }

    private static Path storeDirectory(GovernProperties properties) {
        Path directory = Path.of(properties.getStore().getDirectory());
        log.info("Using file-backed stores under {}", directory.toAbsolutePath());
        return directory;
    }
}
