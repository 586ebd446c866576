package com.digitalgroup.scheduler.exception;

import org.springframework.http.HttpStatus;

/**
 * Malformed or logically inconsistent task definition. The task is never persisted.
 */
public class InvalidTaskException extends BusinessException {

    public InvalidTaskException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "INVALID_TASK");
    }
}
