package com.digitalgroup.scheduler.domain.task.repository;

import com.digitalgroup.scheduler.domain.task.entity.ScheduledTask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ScheduledTaskRepository extends JpaRepository<ScheduledTask, String> {

    /**
     * Active tasks for restart recovery
     */
    List<ScheduledTask> findByActiveTrueOrderByNextFireAtAsc();

    List<ScheduledTask> findByOwnerIdOrderByCreatedAtAsc(Long ownerId);

    List<ScheduledTask> findAllByOrderByCreatedAtAsc();

    Optional<ScheduledTask> findByTaskName(String taskName);

    boolean existsByTaskName(String taskName);
}
