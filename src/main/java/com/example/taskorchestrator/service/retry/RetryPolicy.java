package com.example.taskorchestrator.service.retry;

import com.example.taskorchestrator.domain.enums.BackoffType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable retry configuration referenced by name from a trigger.
 */
@Value
@Builder
public class RetryPolicy {

    String name;

    @Builder.Default
    BackoffType backoff = BackoffType.EXPONENTIAL_JITTER;

    /**
     * Total attempts including the first one
     */
    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(60);

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    Duration maxDelay = Duration.ofHours(1);

    /**
     * Single attempt, no retries
     */
    public static RetryPolicy noRetry(String name) {
        return RetryPolicy.builder()
                .name(name)
                .backoff(BackoffType.FIXED)
                .maxAttempts(1)
                .initialDelay(Duration.ZERO)
                .maxDelay(Duration.ZERO)
                .build();
    }
}
