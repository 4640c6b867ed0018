package com.example.taskorchestrator.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How a trigger decides when it is due.
 */
@Getter
@RequiredArgsConstructor
public enum ScheduleType {

    CRON("Cron", true),

    INTERVAL("Fixed interval", true),

    /**
     * Fired only when an external event is signalled
     */
    EVENT("Event driven", false),

    /**
     * Fired only on operator request
     */
    MANUAL("Manual only", false);

    private final String displayName;

    /**
     * Whether the trigger carries a next-due timestamp that the engine polls
     */
    private final boolean recurring;
}
