package com.example.taskorchestrator.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for trigger not found
 */
@Getter
public class TriggerNotFoundException extends RuntimeException {

    private final String triggerId;

    public TriggerNotFoundException(String triggerId) {
        super("Trigger not found: " + triggerId);
        this.triggerId = triggerId;
    }

    public TriggerNotFoundException(UUID triggerId) {
        this(triggerId.toString());
    }
}
