package com.digitalgroup.scheduler.api.v1;

import com.digitalgroup.scheduler.api.v1.dto.task.CreateTaskRequest;
import com.digitalgroup.scheduler.api.v1.dto.task.TaskIdsRequest;
import com.digitalgroup.scheduler.domain.task.entity.ScheduledTask;
import com.digitalgroup.scheduler.domain.task.service.TaskService;
import com.digitalgroup.scheduler.job.BatchResult;
import com.digitalgroup.scheduler.job.dispatch.HttpTaskDispatcher;
import com.digitalgroup.scheduler.security.CustomUserDetails;
import com.digitalgroup.scheduler.web.dto.PagedResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Task scheduling REST API.
 */
@Slf4j
@RestController
@RequestMapping("/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskService taskService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestHeader(name = HttpTaskDispatcher.SECRET_KEY_HEADER, required = false) String secretKeyId,
            @RequestBody CreateTaskRequest request) {

        String id = taskService.createTask(request, currentUser.toRequester(), authorization, secretKeyId);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    /**
     * List the caller's tasks (every task for the system user) with standard REST pagination
     */
    @GetMapping
    public ResponseEntity<PagedResponse<Map<String, Object>>> index(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @RequestParam(required = false, defaultValue = "1") int page,
            @RequestParam(name = "per_page", required = false, defaultValue = "20") int perPage,
            @RequestParam(name = "task_type", required = false) String taskType,
            @RequestParam(required = false) Boolean paused) {

        int safePage = Math.max(page, 1);
        int safePerPage = Math.min(Math.max(perPage, 1), 100);

        List<Map<String, Object>> tasks = taskService.listTasks(currentUser.toRequester(), taskType, paused).stream()
                .map(taskService::toView)
                .collect(Collectors.toList());

        return ResponseEntity.ok(PagedResponse.paginate(tasks, safePage, safePerPage));
    }

    @GetMapping("/id/{id}")
    public ResponseEntity<Map<String, Object>> show(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable String id) {
        ScheduledTask task = taskService.getTask(id, currentUser.toRequester());
        return ResponseEntity.ok(Map.of("task", taskService.toView(task)));
    }

    @DeleteMapping("/id/{id}")
    public ResponseEntity<Map<String, Object>> delete(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable String id) {
        taskService.removeTask(id, currentUser.toRequester());
        return ResponseEntity.ok(Map.of("message", "Task has been removed successfully"));
    }

    /**
     * Batch removal. Always 200; the body reports each id's outcome.
     */
    @DeleteMapping
    public ResponseEntity<Map<String, Object>> deleteBatch(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @Valid @RequestBody TaskIdsRequest request) {
        BatchResult result = taskService.removeTasks(request.ids(), currentUser.toRequester());
        return ResponseEntity.ok(toBatchResponse("removed", result));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<Map<String, Object>> pause(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable String id) {
        ScheduledTask task = taskService.pauseTask(id, currentUser.toRequester());
        return ResponseEntity.ok(Map.of(
                "message", "Task has been paused successfully",
                "task", taskService.toView(task)
        ));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<Map<String, Object>> resume(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable String id) {
        ScheduledTask task = taskService.resumeTask(id, currentUser.toRequester());
        return ResponseEntity.ok(Map.of(
                "message", "Task has been resumed successfully",
                "task", taskService.toView(task)
        ));
    }

    @PostMapping("/pause")
    public ResponseEntity<Map<String, Object>> pauseBatch(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @Valid @RequestBody TaskIdsRequest request) {
        BatchResult result = taskService.pauseTasks(request.ids(), currentUser.toRequester());
        return ResponseEntity.ok(toBatchResponse("paused", result));
    }

    @PostMapping("/resume")
    public ResponseEntity<Map<String, Object>> resumeBatch(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @Valid @RequestBody TaskIdsRequest request) {
        BatchResult result = taskService.resumeTasks(request.ids(), currentUser.toRequester());
        return ResponseEntity.ok(toBatchResponse("resumed", result));
    }

    @GetMapping("/name/{name}")
    public ResponseEntity<Map<String, Object>> showByName(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable String name) {
        ScheduledTask task = taskService.getTaskByName(name, currentUser.toRequester());
        return ResponseEntity.ok(Map.of("task", taskService.toView(task)));
    }

    @DeleteMapping("/name/{name}")
    public ResponseEntity<Map<String, Object>> deleteByName(
            @AuthenticationPrincipal CustomUserDetails currentUser,
            @PathVariable String name) {
        taskService.removeTaskByName(name, currentUser.toRequester());
        return ResponseEntity.ok(Map.of("message", "Task has been removed successfully"));
    }

    private Map<String, Object> toBatchResponse(String succeededKey, BatchResult result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put(succeededKey, result.succeeded());
        response.put("not_found", result.notFound());
        response.put("forbidden", result.forbidden());
        response.put("conflict", result.conflict());
        return response;
    }
}
