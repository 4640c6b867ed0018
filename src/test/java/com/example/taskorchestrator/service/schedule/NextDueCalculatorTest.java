package com.example.taskorchestrator.service.schedule;

import com.example.taskorchestrator.domain.entity.Trigger;
import com.example.taskorchestrator.domain.enums.IntervalUnit;
import com.example.taskorchestrator.domain.enums.ScheduleType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NextDueCalculator Tests")
class NextDueCalculatorTest {

    private static final Instant T0 = Instant.parse("2024-03-10T00:00:00Z");

    private final NextDueCalculator calculator = new NextDueCalculator();

    private static Trigger interval(long amount, IntervalUnit unit) {
        return Trigger.builder()
                .scheduleType(ScheduleType.INTERVAL)
                .intervalAmount(amount)
                .intervalUnit(unit)
                .build();
    }

    private static Trigger cron(String expression, String timezone) {
        return Trigger.builder()
                .scheduleType(ScheduleType.CRON)
                .cronExpression(expression)
                .timezone(timezone)
                .build();
    }

    @Nested
    @DisplayName("Interval Tests")
    class IntervalTests {

        @Test
        @DisplayName("Next due keeps the phase of the previous due time")
        void keepsPhase() {
            var trigger = interval(60, IntervalUnit.SECONDS);

            var next = calculator.nextDueAfter(trigger, T0, T0.plusSeconds(10));

            assertThat(next).isEqualTo(T0.plusSeconds(60));
        }

        @Test
        @DisplayName("Missed fires collapse into the first slot after now")
        void collapsesMissedFires() {
            var trigger = interval(60, IntervalUnit.SECONDS);

            var next = calculator.nextDueAfter(trigger, T0, T0.plusSeconds(1000));

            assertThat(next).isEqualTo(T0.plusSeconds(1020));
        }

        @Test
        @DisplayName("A fire landing exactly on now is pushed one step further")
        void exactBoundary() {
            var trigger = interval(1, IntervalUnit.MINUTES);

            var next = calculator.nextDueAfter(trigger, T0, T0.plusSeconds(120));

            assertThat(next).isEqualTo(T0.plusSeconds(180));
        }

        @Test
        @DisplayName("Successive due times strictly increase")
        void monotonic() {
            var trigger = interval(7, IntervalUnit.SECONDS);
            var previous = T0;
            var now = T0;

            for (var i = 0; i < 100; i++) {
                now = now.plusSeconds(i % 3 == 0 ? 20 : 1);
                var next = calculator.nextDueAfter(trigger, previous, now);
                assertThat(next).isAfter(previous).isAfter(now);
                previous = next;
            }
        }

        @Test
        @DisplayName("Missing interval is rejected")
        void rejectsMissingInterval() {
            var trigger = Trigger.builder().scheduleType(ScheduleType.INTERVAL).build();

            assertThatThrownBy(() -> calculator.nextDueAfter(trigger, T0, T0.plusSeconds(1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Cron Tests")
    class CronTests {

        @Test
        @DisplayName("Five-field expressions fire on the minute")
        void fiveFieldExpression() {
            var trigger = cron("*/15 * * * *", "UTC");

            var next = calculator.nextDueAfter(trigger, T0, T0.plusSeconds(1));

            assertThat(next).isEqualTo(Instant.parse("2024-03-10T00:15:00Z"));
        }

        @Test
        @DisplayName("Six-field expressions support seconds")
        void sixFieldExpression() {
            var trigger = cron("*/10 * * * * *", "UTC");

            var next = calculator.nextDueAfter(trigger, T0, T0.plusSeconds(1));

            assertThat(next).isEqualTo(T0.plusSeconds(10));
        }

        @Test
        @DisplayName("Expressions are evaluated in the trigger's timezone")
        void honoursTimezone() {
            var trigger = cron("0 9 * * *", "America/New_York");
            var previous = Instant.parse("2024-03-09T14:00:00Z");

            // DST starts in New York on 2024-03-10, 09:00 EDT is 13:00 UTC
            var next = calculator.nextDueAfter(trigger, previous, previous.plusSeconds(1));

            assertThat(next).isEqualTo(Instant.parse("2024-03-10T13:00:00Z"));
        }

        @Test
        @DisplayName("Missed cron fires collapse into one catch-up")
        void collapsesMissedFires() {
            var trigger = cron("0 * * * *", "UTC");
            var now = Instant.parse("2024-03-10T05:30:00Z");

            var next = calculator.nextDueAfter(trigger, T0, now);

            assertThat(next).isEqualTo(Instant.parse("2024-03-10T06:00:00Z"));
        }

        @Test
        @DisplayName("Invalid expression and timezone are rejected")
        void rejectsInvalidDefinitions() {
            assertThatThrownBy(() -> calculator.nextDueAfter(cron("not a cron", "UTC"), T0, T0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> calculator.nextDueAfter(cron("0 * * * *", "Mars/Olympus"), T0, T0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> calculator.nextDueAfter(cron(" ", "UTC"), T0, T0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Event and manual triggers have no next due time")
    void nonRecurringTriggers() {
        var event = Trigger.builder().scheduleType(ScheduleType.EVENT).build();
        var manual = Trigger.builder().scheduleType(ScheduleType.MANUAL).build();

        assertThat(calculator.nextDueAfter(event, T0, T0)).isNull();
        assertThat(calculator.nextDueAfter(manual, T0, T0)).isNull();
    }
}
