package com.digitalgroup.scheduler.domain.task.trigger;

import com.digitalgroup.scheduler.domain.task.enums.TriggerKind;

/**
 * Timing rule of a scheduled task. Implemented by {@link OneTimeTrigger} and {@link PeriodicTrigger}.
 */
public interface TaskTrigger {

    TriggerKind kind();
}
