package com.digitalgroup.scheduler.exception;

import org.springframework.http.HttpStatus;

/**
 * The task is already in the requested state, or the request clashes with an existing task.
 */
public class TaskStateConflictException extends BusinessException {

    public static final String ALREADY_PAUSED = "ALREADY_PAUSED";
    public static final String ALREADY_RUNNING = "ALREADY_RUNNING";
    public static final String DUPLICATE_NAME = "DUPLICATE_TASK_NAME";
    public static final String EXHAUSTED = "TASK_EXHAUSTED";

    public TaskStateConflictException(String message, String code) {
        super(message, HttpStatus.CONFLICT, code);
    }
}
