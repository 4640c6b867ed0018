package com.example.taskorchestrator.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class JobOutcomeLogger {

    @EventListener
    public void onJobOutcome(JobOutcomeEvent event) {
        if (event.isRetryExhausted()) {
            log.error("Job {} of trigger {} ({}) failed terminally after attempt {}/{}: [{}] {}",
                    event.getJobId(), event.getTriggerId(), event.getTaskType(),
                    event.getAttemptNumber(), event.getMaxAttempts(),
                    event.getErrorClassification(), event.getErrorMessage());
        } else {
            log.debug("Job {} of trigger {} finished with status {}",
                    event.getJobId(), event.getTriggerId(), event.getStatus());
        }
    }
}
