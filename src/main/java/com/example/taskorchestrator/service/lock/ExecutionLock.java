package com.example.taskorchestrator.service.lock;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * A held execution lock. The token identifies this particular acquisition, so a stale
 * handle from an earlier acquisition by the same holder can never extend or release it.
 */
@Value
@Builder
public class ExecutionLock {

    String resourceId;

    String holderId;

    String token;

    Instant acquiredAt;

    @With
    Instant expiresAt;

    @With
    int heartbeatCount;

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
