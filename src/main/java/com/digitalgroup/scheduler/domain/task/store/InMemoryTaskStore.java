package com.digitalgroup.scheduler.domain.task.store;

import com.digitalgroup.scheduler.domain.task.entity.ScheduledTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Non-durable task store. Tasks are lost on restart.
 * Stored instances are copied on the way in and out so callers never share state with the map.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "scheduler.store", havingValue = "memory")
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentHashMap<String, ScheduledTask> tasks = new ConcurrentHashMap<>();

    public InMemoryTaskStore() {
        log.warn("Using in-memory task store, scheduled tasks will not survive a restart");
    }

    @Override
    public ScheduledTask save(ScheduledTask task) {
        ScheduledTask stored = tasks.compute(task.getId(), (id, current) -> {
            Long currentVersion = current != null ? current.getVersion() : null;
            if (!Objects.equals(currentVersion, task.getVersion())) {
                throw new OptimisticLockingFailureException(
                        "Task " + id + " was modified concurrently (expected version " + task.getVersion()
                                + ", found " + currentVersion + ")");
            }
            ScheduledTask copy = task.copy();
            copy.incrementVersion();
            return copy;
        });
        return stored.copy();
    }

    @Override
    public Optional<ScheduledTask> findById(String id) {
        return Optional.ofNullable(tasks.get(id)).map(ScheduledTask::copy);
    }

    @Override
    public Optional<ScheduledTask> findByTaskName(String taskName) {
        return tasks.values().stream()
                .filter(task -> taskName.equals(task.getTaskName()))
                .findFirst()
                .map(ScheduledTask::copy);
    }

    @Override
    public boolean existsByTaskName(String taskName) {
        return findByTaskName(taskName).isPresent();
    }

    @Override
    public boolean deleteById(String id) {
        return tasks.remove(id) != null;
    }

    @Override
    public List<ScheduledTask> findActive() {
        return tasks.values().stream()
                .filter(ScheduledTask::isActive)
                .sorted(Comparator.comparing(ScheduledTask::getNextFireAt,
                        Comparator.nullsLast(Comparator.<Instant>naturalOrder())))
                .map(ScheduledTask::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<ScheduledTask> findByOwner(Long ownerId) {
        return tasks.values().stream()
                .filter(task -> task.isOwnedBy(ownerId))
                .sorted(Comparator.comparing(ScheduledTask::getCreatedAt))
                .map(ScheduledTask::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<ScheduledTask> findAll() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(ScheduledTask::getCreatedAt))
                .map(ScheduledTask::copy)
                .collect(Collectors.toList());
    }
}
