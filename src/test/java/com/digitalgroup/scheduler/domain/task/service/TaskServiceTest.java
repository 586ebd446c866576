package com.digitalgroup.scheduler.domain.task.service;

import com.digitalgroup.scheduler.api.v1.dto.task.CreateTaskRequest;
import com.digitalgroup.scheduler.domain.task.Requester;
import com.digitalgroup.scheduler.domain.task.entity.ScheduledTask;
import com.digitalgroup.scheduler.domain.task.trigger.OneTimeTrigger;
import com.digitalgroup.scheduler.domain.task.trigger.PeriodicTrigger;
import com.digitalgroup.scheduler.exception.ForbiddenOperationException;
import com.digitalgroup.scheduler.exception.InvalidTaskException;
import com.digitalgroup.scheduler.job.SchedulerCore;
import com.digitalgroup.scheduler.support.TestTasks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private SchedulerCore schedulerCore;

    private TaskService taskService;

    @BeforeEach
    void setUp() {
        taskService = new TaskService(schedulerCore, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createTask_OneTime_BuildsTaskWithCallerCredentials() {
        when(schedulerCore.create(any(ScheduledTask.class))).thenAnswer(inv -> inv.getArgument(0));
        CreateTaskRequest request = new CreateTaskRequest("one_time", null, "https://hooks.test/run",
                null, Map.of("user_id", 4), "2024-03-01T12:00:00", null, null, null);

        String id = taskService.createTask(request, Requester.user(1L), "Bearer abc", "key-9");

        ArgumentCaptor<ScheduledTask> captor = ArgumentCaptor.forClass(ScheduledTask.class);
        verify(schedulerCore).create(captor.capture());
        ScheduledTask task = captor.getValue();
        assertEquals(id, task.getId());
        assertEquals(1L, task.getOwnerId());
        assertEquals(new OneTimeTrigger(Instant.parse("2024-03-01T12:00:00Z")), task.getTrigger());
        assertEquals("application/json", task.getContentType());
        assertEquals("Bearer abc", task.getAuthorization());
        assertEquals("key-9", task.getSecretRef());
        assertEquals(Map.of("user_id", 4), task.getPayload());
    }

    @Test
    void createTask_Periodic_ParsesFrequencyAndOffsets() {
        when(schedulerCore.create(any(ScheduledTask.class))).thenAnswer(inv -> inv.getArgument(0));
        CreateTaskRequest request = new CreateTaskRequest("periodic", null, "http://hooks.test/run",
                "application/x-www-form-urlencoded", null, null,
                "2024-03-01T12:00:00+02:00", "2024-03-02T10:00:00Z", Map.of("hours", 1, "minutes", 30));

        taskService.createTask(request, Requester.user(1L), "Bearer abc", null);

        ArgumentCaptor<ScheduledTask> captor = ArgumentCaptor.forClass(ScheduledTask.class);
        verify(schedulerCore).create(captor.capture());
        assertEquals(new PeriodicTrigger(Duration.ofMinutes(90),
                        Instant.parse("2024-03-01T10:00:00Z"), Instant.parse("2024-03-02T10:00:00Z")),
                captor.getValue().getTrigger());
        assertNull(captor.getValue().getSecretRef());
    }

    @Test
    void createTask_UnknownTaskType_ThrowsException() {
        CreateTaskRequest request = new CreateTaskRequest("hourly", null, "http://hooks.test/run",
                null, null, "2024-03-01T12:00:00", null, null, null);

        assertThrows(InvalidTaskException.class,
                () -> taskService.createTask(request, Requester.user(1L), "Bearer abc", null));
        verifyNoInteractions(schedulerCore);
    }

    @Test
    void createTask_MissingRunDatetime_ThrowsException() {
        CreateTaskRequest request = new CreateTaskRequest("one_time", null, "http://hooks.test/run",
                null, null, null, null, null, null);

        assertThrows(InvalidTaskException.class,
                () -> taskService.createTask(request, Requester.user(1L), "Bearer abc", null));
    }

    @Test
    void createTask_MalformedDatetime_ThrowsException() {
        CreateTaskRequest request = new CreateTaskRequest("one_time", null, "http://hooks.test/run",
                null, null, "next tuesday", null, null, null);

        assertThrows(InvalidTaskException.class,
                () -> taskService.createTask(request, Requester.user(1L), "Bearer abc", null));
    }

    @Test
    void createTask_RelativeUrl_ThrowsException() {
        CreateTaskRequest request = new CreateTaskRequest("one_time", null, "/run",
                null, null, "2024-03-01T12:00:00", null, null, null);

        assertThrows(InvalidTaskException.class,
                () -> taskService.createTask(request, Requester.user(1L), "Bearer abc", null));
    }

    @Test
    void createTask_TaskNameFromRegularUser_ThrowsException() {
        CreateTaskRequest request = new CreateTaskRequest("one_time", "my-task", "http://hooks.test/run",
                null, null, "2024-03-01T12:00:00", null, null, null);

        assertThrows(InvalidTaskException.class,
                () -> taskService.createTask(request, Requester.user(1L), "Bearer abc", null));
    }

    @Test
    void createTask_GeneralTaskFromSystem_HasNoOwner() {
        when(schedulerCore.create(any(ScheduledTask.class))).thenAnswer(inv -> inv.getArgument(0));
        CreateTaskRequest request = new CreateTaskRequest("one_time", "purge_expired", "http://hooks.test/run",
                null, null, "2024-03-01T12:00:00", null, null, null);

        taskService.createTask(request, Requester.systemCaller(), "Bearer sys", null);

        ArgumentCaptor<ScheduledTask> captor = ArgumentCaptor.forClass(ScheduledTask.class);
        verify(schedulerCore).create(captor.capture());
        assertNull(captor.getValue().getOwnerId());
        assertEquals("purge_expired", captor.getValue().getTaskName());
    }

    @Test
    void createTask_InvalidTaskName_ThrowsException() {
        CreateTaskRequest request = new CreateTaskRequest("one_time", "bad name!", "http://hooks.test/run",
                null, null, "2024-03-01T12:00:00", null, null, null);

        assertThrows(InvalidTaskException.class,
                () -> taskService.createTask(request, Requester.systemCaller(), "Bearer sys", null));
    }

    @Test
    void getTask_OtherUsersTask_ThrowsForbidden() {
        ScheduledTask task = TestTasks.oneTime(2L, NOW.plusSeconds(60), NOW);
        when(schedulerCore.get(task.getId())).thenReturn(task);

        assertThrows(ForbiddenOperationException.class, () -> taskService.getTask(task.getId(), Requester.user(1L)));
    }

    @Test
    void toView_PausedTask_NextRunIsNone() {
        ScheduledTask task = TestTasks.oneTime(1L, NOW.plusSeconds(60), NOW);
        task.setActive(false);

        Map<String, Object> view = taskService.toView(task);

        assertEquals("None", view.get("next_run_datetime"));
        assertEquals(true, view.get("paused"));
        assertEquals("one_time", view.get("task_type"));
        assertEquals("2024-03-01T10:01:00Z", view.get("run_datetime"));
    }

    @Test
    void toView_PeriodicTask_ReportsFrequencyInSeconds() {
        ScheduledTask task = TestTasks.periodic(1L, Duration.ofHours(1), NOW, NOW.plus(Duration.ofDays(1)), NOW);
        task.setNextFireAt(NOW);

        Map<String, Object> view = taskService.toView(task);

        assertEquals(Map.of("seconds", 3600L), view.get("frequency"));
        assertEquals("2024-03-01T10:00:00Z", view.get("next_run_datetime"));
        assertFalse(view.containsKey("run_datetime"));
    }
}
