package com.digitalgroup.scheduler.domain.task;

import com.digitalgroup.scheduler.domain.task.entity.ScheduledTask;

/**
 * Caller of a task operation. The system caller may manage every task, including ownerless general tasks.
 */
public record Requester(Long userId, boolean system) {

    public static Requester user(Long userId) {
        return new Requester(userId, false);
    }

    public static Requester systemCaller() {
        return new Requester(null, true);
    }

    public boolean canManage(ScheduledTask task) {
        return system || task.isOwnedBy(userId);
    }

    @Override
    public String toString() {
        return system ? "system" : "user:" + userId;
    }
}
