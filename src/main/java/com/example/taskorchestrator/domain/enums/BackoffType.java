package com.example.taskorchestrator.domain.enums;

/**
 * Backoff families a retry policy can select.
 */
public enum BackoffType {

    /**
     * Same delay before every retry
     */
    FIXED,

    /**
     * initialDelay * attempt
     */
    LINEAR,

    /**
     * initialDelay * multiplier^(attempt - 1), capped, then scaled by a random factor in [0.8, 1.2]
     */
    EXPONENTIAL_JITTER,

    /**
     * initialDelay * fib(attempt)
     */
    FIBONACCI
}
