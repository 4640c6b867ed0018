package com.example.taskorchestrator.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for job not found
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public JobNotFoundException(UUID jobId) {
        this(jobId.toString());
    }
}
