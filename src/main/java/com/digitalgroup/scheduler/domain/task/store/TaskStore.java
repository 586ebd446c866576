package com.digitalgroup.scheduler.domain.task.store;

import com.digitalgroup.scheduler.domain.task.entity.ScheduledTask;

import java.util.List;
import java.util.Optional;

/**
 * Durable mapping from task id to task definition and scheduling state.
 *
 * {@link #save} is a per-task compare-and-swap on the task version: saving a task whose version is
 * older than the stored one fails with
 * {@link org.springframework.dao.OptimisticLockingFailureException}.
 * Callers must continue with the instance returned by {@link #save}.
 */
public interface TaskStore {

    ScheduledTask save(ScheduledTask task);

    Optional<ScheduledTask> findById(String id);

    Optional<ScheduledTask> findByTaskName(String taskName);

    boolean existsByTaskName(String taskName);

    /**
     * @return true if a record was deleted
     */
    boolean deleteById(String id);

    List<ScheduledTask> findActive();

    List<ScheduledTask> findByOwner(Long ownerId);

    List<ScheduledTask> findAll();
}
