package com.digitalgroup.scheduler.domain.task.trigger;

import com.digitalgroup.scheduler.domain.task.enums.TriggerKind;

import java.time.Instant;
import java.util.Objects;

/**
 * Fires once at {@code runAt} (UTC).
 */
public record OneTimeTrigger(Instant runAt) implements TaskTrigger {

    public OneTimeTrigger {
        Objects.requireNonNull(runAt, "runAt");
    }

    @Override
    public TriggerKind kind() {
        return TriggerKind.ONE_TIME;
    }
}
