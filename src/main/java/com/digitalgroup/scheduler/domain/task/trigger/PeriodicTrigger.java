package com.digitalgroup.scheduler.domain.task.trigger;

import com.digitalgroup.scheduler.domain.task.enums.TriggerKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fires at {@code startAt + n * interval} for every n that keeps the fire time within {@code [startAt, endAt]}.
 */
public record PeriodicTrigger(Duration interval, Instant startAt, Instant endAt) implements TaskTrigger {

    public PeriodicTrigger {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(startAt, "startAt");
        Objects.requireNonNull(endAt, "endAt");
    }

    @Override
    public TriggerKind kind() {
        return TriggerKind.PERIODIC;
    }
}
