package com.digitalgroup.scheduler.job.dispatch;

import com.digitalgroup.scheduler.domain.task.entity.ScheduledTask;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Snapshot of a fired task handed to the dispatcher. Independent of the stored entity.
 */
public record DispatchRequest(String taskId,
                              Long ownerId,
                              String targetUrl,
                              String contentType,
                              Map<String, Object> payload,
                              String authorization,
                              String secretRef,
                              Instant scheduledAt) {

    public static DispatchRequest of(ScheduledTask task, Instant scheduledAt) {
        return new DispatchRequest(
                task.getId(),
                task.getOwnerId(),
                task.getTargetUrl(),
                task.getContentType(),
                task.getPayload() != null ? new HashMap<>(task.getPayload()) : Map.of(),
                task.getAuthorization(),
                task.getSecretRef(),
                scheduledAt);
    }
}
