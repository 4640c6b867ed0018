package com.example.taskorchestrator.service.worker;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Identity of this worker process, used as the lock holder id and recorded on jobs.
 */
@Slf4j
@Getter
@Component
public class WorkerIdentity {

    private final String hostname;
    private final String workerId;

    public WorkerIdentity(@Value("${HOSTNAME:unknown}") String fallbackHostname) {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local hostname, using {}: {}", fallbackHostname, e.getMessage());
            host = fallbackHostname;
        }
        this.hostname = host;
        // suffix keeps ids unique when a restarted container reuses the pid
        this.workerId = host + "-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("Worker identity: {}", workerId);
    }
}
