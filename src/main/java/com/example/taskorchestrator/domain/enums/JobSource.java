package com.example.taskorchestrator.domain.enums;

/**
 * What caused a job to be created.
 */
public enum JobSource {
    SCHEDULE,
    RETRY,
    MANUAL,
    EVENT,
    RECOVERY
}
