package com.example.taskorchestrator.exception;

import lombok.Getter;

/**
 * The trigger, job or lock store could not be reached. Transient: the current
 * cycle is skipped and retried on the next one.
 */
@Getter
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, Throwable cause) {
        super(String.format("Store unavailable during %s: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }
}
