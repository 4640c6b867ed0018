package com.example.taskorchestrator.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Trigger priority levels. When two entries share a due time,
 * the higher priority is dispatched first.
 */
@Getter
@RequiredArgsConstructor
public enum TriggerPriority {

    LOW(1, "Low"),

    NORMAL(5, "Normal"),

    HIGH(8, "High"),

    /**
     * Used for operator initiated executions
     */
    CRITICAL(10, "Critical");

    private final int value;
    private final String displayName;
}
