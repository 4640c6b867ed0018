package com.example.taskorchestrator.service.schedule;

import com.example.taskorchestrator.domain.entity.Trigger;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Computes the next due time of a recurring trigger.
 * <p>
 * The next time is derived from the due time of the firing that just ran, not from when
 * it finished, so a trigger keeps its phase. If that time has already passed (the engine
 * was down, or an execution overran), missed fires collapse into the first schedule time
 * after {@code now}. Returns null for event and manual triggers and for cron expressions
 * with no further fire time. An unusable schedule definition raises IllegalArgumentException.
 */
@Component
public class NextDueCalculator {

    public Instant nextDueAfter(Trigger trigger, Instant previousDue, Instant now) {
        return switch (trigger.getScheduleType()) {
            case CRON -> nextCron(trigger, previousDue, now);
            case INTERVAL -> nextInterval(trigger, previousDue, now);
            case EVENT, MANUAL -> null;
        };
    }

    private Instant nextCron(Trigger trigger, Instant previousDue, Instant now) {
        var cron = parseCron(trigger.getCronExpression());
        var zone = zoneOf(trigger);

        var next = cron.next(previousDue.atZone(zone));
        if (next != null && !next.toInstant().isAfter(now)) {
            next = cron.next(now.atZone(zone));
        }
        return next != null ? next.toInstant() : null;
    }

    private Instant nextInterval(Trigger trigger, Instant previousDue, Instant now) {
        var step = intervalOf(trigger);
        var next = previousDue.plus(step);
        if (!next.isAfter(now)) {
            var missed = Duration.between(previousDue, now).toMillis() / step.toMillis();
            next = previousDue.plus(step.multipliedBy(missed + 1));
        }
        return next;
    }

    /**
     * Accepts standard 5-field cron by assuming second 0
     */
    static CronExpression parseCron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron trigger has no cron expression");
        }
        var trimmed = expression.trim();
        var fields = trimmed.split("\\s+").length;
        return CronExpression.parse(fields == 5 ? "0 " + trimmed : trimmed);
    }

    private static ZoneId zoneOf(Trigger trigger) {
        var timezone = trigger.getTimezone();
        try {
            return ZoneId.of(timezone == null || timezone.isBlank() ? "UTC" : timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone '" + timezone + "'", e);
        }
    }

    private static Duration intervalOf(Trigger trigger) {
        if (trigger.getIntervalAmount() == null || trigger.getIntervalAmount() <= 0 || trigger.getIntervalUnit() == null) {
            throw new IllegalArgumentException("Interval trigger " + trigger.getId() + " has no positive interval");
        }
        return trigger.getIntervalUnit().toDuration(trigger.getIntervalAmount());
    }
}
