package com.digitalgroup.scheduler.domain.task.store;

import com.digitalgroup.scheduler.domain.task.entity.ScheduledTask;
import com.digitalgroup.scheduler.domain.task.repository.ScheduledTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * SQL-backed task store. Lost updates are prevented by the entity's {@code @Version} column.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduler.store", havingValue = "jpa", matchIfMissing = true)
public class JpaTaskStore implements TaskStore {

    private final ScheduledTaskRepository repository;

    @Override
    @Transactional
    public ScheduledTask save(ScheduledTask task) {
        return repository.save(task);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScheduledTask> findById(String id) {
        return repository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScheduledTask> findByTaskName(String taskName) {
        return repository.findByTaskName(taskName);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByTaskName(String taskName) {
        return repository.existsByTaskName(taskName);
    }

    @Override
    @Transactional
    public boolean deleteById(String id) {
        if (!repository.existsById(id)) {
            log.debug("Task {} already deleted", id);
            return false;
        }
        repository.deleteById(id);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledTask> findActive() {
        return repository.findByActiveTrueOrderByNextFireAtAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledTask> findByOwner(Long ownerId) {
        return repository.findByOwnerIdOrderByCreatedAtAsc(ownerId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledTask> findAll() {
        return repository.findAllByOrderByCreatedAtAsc();
    }
}
