package com.example.taskorchestrator.service.retry;

import com.example.taskorchestrator.config.OrchestratorProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named retry policies from {@code task-orchestrator.retry-policies}.
 * Unknown or missing references resolve to the default policy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryPolicyRegistry {

    private final OrchestratorProperties properties;

    private final Map<String, RetryPolicy> policies = new ConcurrentHashMap<>();

    @PostConstruct
    public void initialize() {
        properties.getRetryPolicies().forEach((name, config) -> policies.put(name, RetryPolicy.builder()
                .name(name)
                .backoff(config.getBackoff())
                .maxAttempts(config.getMaxAttempts())
                .initialDelay(config.getInitialDelay())
                .multiplier(config.getMultiplier())
                .maxDelay(config.getMaxDelay())
                .build()));

        policies.computeIfAbsent(properties.getDefaultRetryPolicy(), name -> RetryPolicy.builder().name(name).build());
        log.info("Loaded {} retry policies: {}", policies.size(), policies.keySet());
    }

    public RetryPolicy resolve(String name) {
        if (name != null) {
            var policy = policies.get(name);
            if (policy != null) {
                return policy;
            }
            log.warn("Unknown retry policy '{}', using '{}'", name, properties.getDefaultRetryPolicy());
        }
        return policies.get(properties.getDefaultRetryPolicy());
    }
}
