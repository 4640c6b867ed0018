package com.example.taskorchestrator.service.retry;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes retry delays. Stateless apart from the jitter source.
 * <p>
 * {@code attemptNumber} is always the 1-based number of the attempt that just failed,
 * so the first retry of an exponential policy waits {@code initialDelay}.
 */
@Component
public class RetryPolicyEngine {

    static final double JITTER_MIN = 0.8;
    static final double JITTER_MAX = 1.2;

    private final DoubleSupplier jitterSource;

    public RetryPolicyEngine() {
        this(() -> ThreadLocalRandom.current().nextDouble(JITTER_MIN, JITTER_MAX));
    }

    RetryPolicyEngine(DoubleSupplier jitterSource) {
        this.jitterSource = jitterSource;
    }

    /**
     * Delay to wait before the attempt following {@code attemptNumber}.
     *
     * @param attemptNumber 1-based number of the failed attempt
     * @param policy        The trigger's retry policy
     * @return Delay, never negative and never above {@code maxDelay * 1.2}
     */
    public Duration nextDelay(int attemptNumber, RetryPolicy policy) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1, got " + attemptNumber);
        }

        var initialMs = policy.getInitialDelay().toMillis();
        var maxMs = policy.getMaxDelay().toMillis();

        return switch (policy.getBackoff()) {
            case FIXED -> policy.getInitialDelay();
            case LINEAR -> Duration.ofMillis(Math.round(cap(initialMs * (double) attemptNumber, maxMs)));
            case FIBONACCI -> Duration.ofMillis(Math.round(cap(initialMs * (double) fibonacci(attemptNumber), maxMs)));
            case EXPONENTIAL_JITTER -> {
                var base = cap(initialMs * Math.pow(policy.getMultiplier(), attemptNumber - 1), maxMs);
                yield Duration.ofMillis(Math.round(base * jitterSource.getAsDouble()));
            }
        };
    }

    /**
     * Whether another attempt may follow {@code attemptNumber}
     */
    public boolean shouldRetry(int attemptNumber, RetryPolicy policy) {
        return attemptNumber < policy.getMaxAttempts();
    }

    private static double cap(double delayMs, long maxMs) {
        // pow() overflows to infinity long before maxDelay matters
        if (Double.isInfinite(delayMs) || Double.isNaN(delayMs)) {
            return maxMs;
        }
        return Math.min(delayMs, maxMs);
    }

    /**
     * fib(1) = fib(2) = 1
     */
    static long fibonacci(int n) {
        long a = 0;
        long b = 1;
        for (var i = 0; i < n; i++) {
            var next = a + b;
            a = b;
            b = next;
            if (a < 0) {
                return Long.MAX_VALUE;
            }
        }
        return a;
    }
}
