package com.digitalgroup.scheduler.domain.task.store;

import com.digitalgroup.scheduler.domain.task.entity.ScheduledTask;
import com.digitalgroup.scheduler.support.TestTasks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private InMemoryTaskStore taskStore;

    @BeforeEach
    void setUp() {
        taskStore = new InMemoryTaskStore();
    }

    @Test
    void save_NewTask_AssignsVersion() {
        ScheduledTask saved = taskStore.save(TestTasks.oneTime(1L, NOW.plusSeconds(60), NOW));

        assertEquals(0L, saved.getVersion());
        assertTrue(taskStore.findById(saved.getId()).isPresent());
    }

    @Test
    void save_StaleCopy_ThrowsOptimisticLockingFailure() {
        ScheduledTask saved = taskStore.save(TestTasks.oneTime(1L, NOW.plusSeconds(60), NOW));
        ScheduledTask first = taskStore.findById(saved.getId()).orElseThrow();
        ScheduledTask second = taskStore.findById(saved.getId()).orElseThrow();

        first.setActive(false);
        taskStore.save(first);

        second.setNextFireAt(NOW.plusSeconds(120));
        assertThrows(OptimisticLockingFailureException.class, () -> taskStore.save(second));
        assertTrue(taskStore.findById(saved.getId()).orElseThrow().isPaused());
    }

    @Test
    void findById_ReturnsDetachedCopy() {
        ScheduledTask saved = taskStore.save(TestTasks.oneTime(1L, NOW.plusSeconds(60), NOW));

        taskStore.findById(saved.getId()).orElseThrow().setActive(false);

        assertTrue(taskStore.findById(saved.getId()).orElseThrow().isActive());
    }

    @Test
    void findByOwner_OnlyReturnsOwnedTasks() {
        taskStore.save(TestTasks.oneTime(1L, NOW.plusSeconds(60), NOW));
        taskStore.save(TestTasks.oneTime(2L, NOW.plusSeconds(60), NOW));
        taskStore.save(TestTasks.named("nightly-report", Duration.ofHours(1), NOW, NOW.plus(Duration.ofDays(1)), NOW));

        assertEquals(1, taskStore.findByOwner(1L).size());
        assertEquals(3, taskStore.findAll().size());
        assertTrue(taskStore.existsByTaskName("nightly-report"));
    }

    @Test
    void deleteById_Missing_ReturnsFalse() {
        ScheduledTask saved = taskStore.save(TestTasks.oneTime(1L, NOW.plusSeconds(60), NOW));

        assertTrue(taskStore.deleteById(saved.getId()));
        assertFalse(taskStore.deleteById(saved.getId()));
    }
}
