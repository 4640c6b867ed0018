package com.example.taskorchestrator.domain.enums;

import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@RequiredArgsConstructor
public enum IntervalUnit {

    SECONDS(ChronoUnit.SECONDS),
    MINUTES(ChronoUnit.MINUTES),
    HOURS(ChronoUnit.HOURS),
    DAYS(ChronoUnit.DAYS);

    private final ChronoUnit chronoUnit;

    public Duration toDuration(long amount) {
        return Duration.of(amount, chronoUnit);
    }
}
