package com.example.taskorchestrator.service.retry;

import com.example.taskorchestrator.config.MetricsConfig;
import com.example.taskorchestrator.domain.entity.Job;
import com.example.taskorchestrator.domain.enums.ErrorClassification;
import com.example.taskorchestrator.domain.enums.JobSource;
import com.example.taskorchestrator.domain.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Turns a failed attempt into either a new pending attempt or the end of the chain.
 * Shared by the executor and the reconciliation sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRetryService {

    private final JobRepository jobRepository;
    private final RetryPolicyEngine retryPolicyEngine;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Fail a running job and, if the policy allows, persist its next attempt.
     *
     * @param running        The job to fail, must be RUNNING
     * @param classification Why it failed
     * @param policy         Retry policy of the owning trigger
     * @param retrySource    Source recorded on the retry job
     * @return the failed job (saved) and the retry job if one was created
     */
    public RetryDecision failAndScheduleRetry(Job running, ErrorClassification classification, String errorType,
                                              String errorMessage, String stackTrace, boolean retryable,
                                              RetryPolicy policy, JobSource retrySource, String taskType) {
        var now = clock.instant();
        var attempt = running.getAttemptNumber();
        var retry = retryable && retryPolicyEngine.shouldRetry(attempt, policy) && attempt < running.getMaxAttempts();
        var retryAt = retry ? now.plus(retryPolicyEngine.nextDelay(attempt, policy)) : null;

        running.markFailed(now, classification, errorType, errorMessage, stackTrace, retryAt);
        var failed = jobRepository.save(running);
        metricsConfig.recordJobFailure(taskType, classification.name());

        if (!retry) {
            if (retryable) {
                log.warn("Job {} failed on attempt {}/{}, retries exhausted", failed.getId(), attempt, failed.getMaxAttempts());
                metricsConfig.recordRetryExhausted(taskType);
            } else {
                log.warn("Job {} failed with non-retryable {}: {}", failed.getId(), classification, errorMessage);
            }
            return new RetryDecision(failed, Optional.empty());
        }

        var next = jobRepository.save(Job.nextAttemptOf(failed, retrySource, retryAt, now));
        metricsConfig.recordRetry(taskType, next.getAttemptNumber());
        log.info("Job {} failed on attempt {}/{} ({}), retry {} scheduled at {}",
                failed.getId(), attempt, failed.getMaxAttempts(), classification, next.getId(), retryAt);
        return new RetryDecision(failed, Optional.of(next));
    }

    public record RetryDecision(Job failedJob, Optional<Job> retryJob) {

        public boolean isRetryScheduled() {
            return retryJob.isPresent();
        }
    }
}
