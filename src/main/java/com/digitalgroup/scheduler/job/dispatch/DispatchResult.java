package com.digitalgroup.scheduler.job.dispatch;

import java.time.Instant;

/**
 * Outcome of one dispatch, delivered back to the scheduler through the future returned by
 * {@link TaskDispatcher#enqueue}.
 */
public record DispatchResult(String taskId,
                             Outcome outcome,
                             Integer statusCode,
                             String detail,
                             Instant completedAt) {

    public enum Outcome {
        SUCCEEDED,
        HTTP_ERROR,
        TRANSPORT_ERROR,
        DROPPED
    }

    public static DispatchResult succeeded(String taskId, int statusCode, Instant at) {
        return new DispatchResult(taskId, Outcome.SUCCEEDED, statusCode, null, at);
    }

    public static DispatchResult httpError(String taskId, int statusCode, String detail, Instant at) {
        return new DispatchResult(taskId, Outcome.HTTP_ERROR, statusCode, detail, at);
    }

    public static DispatchResult transportError(String taskId, String detail, Instant at) {
        return new DispatchResult(taskId, Outcome.TRANSPORT_ERROR, null, detail, at);
    }

    public static DispatchResult dropped(String taskId, String detail, Instant at) {
        return new DispatchResult(taskId, Outcome.DROPPED, null, detail, at);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCEEDED;
    }

    /**
     * Short form stored on the task, e.g. "SUCCEEDED 200" or "HTTP_ERROR 500".
     */
    public String summary() {
        return statusCode != null ? outcome.name() + " " + statusCode : outcome.name();
    }
}
