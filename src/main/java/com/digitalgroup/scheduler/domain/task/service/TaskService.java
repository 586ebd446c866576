package com.digitalgroup.scheduler.domain.task.service;

import com.digitalgroup.scheduler.api.v1.dto.task.CreateTaskRequest;
import com.digitalgroup.scheduler.domain.task.Requester;
import com.digitalgroup.scheduler.domain.task.entity.ScheduledTask;
import com.digitalgroup.scheduler.domain.task.enums.TriggerKind;
import com.digitalgroup.scheduler.domain.task.trigger.Frequency;
import com.digitalgroup.scheduler.domain.task.trigger.OneTimeTrigger;
import com.digitalgroup.scheduler.domain.task.trigger.PeriodicTrigger;
import com.digitalgroup.scheduler.domain.task.trigger.TaskTrigger;
import com.digitalgroup.scheduler.exception.ForbiddenOperationException;
import com.digitalgroup.scheduler.exception.InvalidTaskException;
import com.digitalgroup.scheduler.job.BatchResult;
import com.digitalgroup.scheduler.job.SchedulerCore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns REST requests into scheduler operations and scheduled tasks into their wire view.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskService {

    static final String NONE = "None";
    private static final Pattern TASK_NAME_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    private final SchedulerCore schedulerCore;
    private final Clock clock;

    /**
     * Builds a task from the request and hands it to the scheduler.
     *
     * @param authorization the caller's Authorization header, replayed on every dispatch
     * @param secretRef     value of the X-Secret-Key-Id header, forwarded on every dispatch
     * @return the id of the created task
     */
    public String createTask(CreateTaskRequest request, Requester requester, String authorization, String secretRef) {
        if (request == null) {
            throw new InvalidTaskException("Missing or invalid data.");
        }
        TriggerKind kind = TriggerKind.fromValue(request.taskType());
        if (kind == null) {
            throw new InvalidTaskException("Task type not correct. Please use periodic or one_time as task type.");
        }

        String taskName = validateTaskName(request.taskName(), requester);
        String url = validateUrl(request.url());
        String contentType = validateContentType(request.contentType());
        TaskTrigger trigger = kind.isPeriodic() ? parsePeriodic(request) : parseOneTime(request);

        ScheduledTask task = ScheduledTask.create(
                requester.system() ? null : requester.userId(),
                taskName,
                trigger,
                url,
                contentType,
                request.postData(),
                authorization,
                StringUtils.hasText(secretRef) ? secretRef : null,
                clock.instant());

        return schedulerCore.create(task).getId();
    }

    public ScheduledTask getTask(String taskId, Requester requester) {
        return checkVisible(schedulerCore.get(taskId), requester);
    }

    public ScheduledTask getTaskByName(String taskName, Requester requester) {
        return checkVisible(schedulerCore.getByName(taskName), requester);
    }

    public void removeTaskByName(String taskName, Requester requester) {
        ScheduledTask task = getTaskByName(taskName, requester);
        schedulerCore.remove(task.getId(), requester);
    }

    public ScheduledTask pauseTask(String taskId, Requester requester) {
        return schedulerCore.pause(taskId, requester);
    }

    public ScheduledTask resumeTask(String taskId, Requester requester) {
        return schedulerCore.resume(taskId, requester);
    }

    public void removeTask(String taskId, Requester requester) {
        schedulerCore.remove(taskId, requester);
    }

    public BatchResult removeTasks(List<String> taskIds, Requester requester) {
        return schedulerCore.removeBatch(taskIds, requester);
    }

    public BatchResult pauseTasks(List<String> taskIds, Requester requester) {
        return schedulerCore.pauseBatch(taskIds, requester);
    }

    public BatchResult resumeTasks(List<String> taskIds, Requester requester) {
        return schedulerCore.resumeBatch(taskIds, requester);
    }

    /**
     * @param taskType optional "one_time" / "periodic" filter
     */
    public List<ScheduledTask> listTasks(Requester requester, String taskType, Boolean paused) {
        TriggerKind kind = null;
        if (StringUtils.hasText(taskType)) {
            kind = TriggerKind.fromValue(taskType);
            if (kind == null) {
                throw new InvalidTaskException("Task type not correct. Please use periodic or one_time as task type.");
            }
        }
        return schedulerCore.list(requester, kind, paused);
    }

    /**
     * Wire view of a task. Datetimes are ISO-8601 UTC; {@code next_run_datetime} is "None" for a paused task.
     */
    public Map<String, Object> toView(ScheduledTask task) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", task.getId());
        view.put("task_name", task.getTaskName());
        view.put("task_type", task.getTriggerKind().getValue());
        view.put("url", task.getTargetUrl());
        view.put("content_type", task.getContentType());
        view.put("post_data", task.getPayload());
        view.put("paused", task.isPaused());
        if (task.getTriggerKind() == TriggerKind.PERIODIC) {
            view.put("start_datetime", format(task.getStartAt()));
            view.put("end_datetime", format(task.getEndAt()));
            view.put("frequency", Map.of("seconds", task.getIntervalSeconds()));
        } else {
            view.put("run_datetime", format(task.getRunAt()));
        }
        view.put("next_run_datetime", task.getNextFireAt() != null ? format(task.getNextFireAt()) : NONE);
        view.put("last_run_datetime", task.getLastRunAt() != null ? format(task.getLastRunAt()) : null);
        view.put("last_run_status", task.getLastRunStatus());
        return view;
    }

    private OneTimeTrigger parseOneTime(CreateTaskRequest request) {
        return new OneTimeTrigger(parseDateTime("run_datetime", request.runDatetime()));
    }

    private PeriodicTrigger parsePeriodic(CreateTaskRequest request) {
        if (request.frequency() == null) {
            throw new InvalidTaskException("Missing or invalid data: frequency is required for periodic tasks");
        }
        Frequency frequency = Frequency.fromMap(request.frequency());
        Instant startAt = parseDateTime("start_datetime", request.startDatetime());
        Instant endAt = parseDateTime("end_datetime", request.endDatetime());
        return new PeriodicTrigger(frequency.toDuration(), startAt, endAt);
    }

    /**
     * ISO-8601 with or without an offset; values without one are taken as UTC.
     */
    static Instant parseDateTime(String field, String value) {
        if (!StringUtils.hasText(value)) {
            throw new InvalidTaskException("Missing or invalid data: " + field + " is required");
        }
        String trimmed = value.trim();
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ex) {
                throw new InvalidTaskException("Invalid " + field + " '" + value + "', expected ISO-8601 datetime");
            }
        }
    }

    private String validateTaskName(String taskName, Requester requester) {
        if (taskName == null) {
            return null;
        }
        if (!requester.system()) {
            throw new InvalidTaskException("task_name is only allowed for general tasks created by the system user");
        }
        if (!TASK_NAME_PATTERN.matcher(taskName).matches()) {
            throw new InvalidTaskException("task_name may only contain letters, digits, '-' and '_'");
        }
        return taskName;
    }

    private String validateUrl(String url) {
        if (!StringUtils.hasText(url)) {
            throw new InvalidTaskException("Missing or invalid data: url is required");
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (uri.getHost() == null || scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new InvalidTaskException("Invalid url '" + url + "', expected an absolute http(s) URL");
            }
            return uri.toString();
        } catch (URISyntaxException e) {
            throw new InvalidTaskException("Invalid url '" + url + "'");
        }
    }

    private String validateContentType(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return ScheduledTask.DEFAULT_CONTENT_TYPE;
        }
        try {
            return MediaType.parseMediaType(contentType).toString();
        } catch (InvalidMediaTypeException e) {
            throw new InvalidTaskException("Invalid content_type '" + contentType + "'");
        }
    }

    private ScheduledTask checkVisible(ScheduledTask task, Requester requester) {
        if (!requester.canManage(task)) {
            throw new ForbiddenOperationException("Task " + task.getId() + " does not belong to " + requester);
        }
        return task;
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
