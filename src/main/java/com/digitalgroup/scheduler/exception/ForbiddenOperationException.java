package com.digitalgroup.scheduler.exception;

import org.springframework.http.HttpStatus;

/**
 * Operation on a task by a caller that neither owns it nor is the system caller.
 */
public class ForbiddenOperationException extends BusinessException {

    public ForbiddenOperationException(String message) {
        super(message, HttpStatus.FORBIDDEN, "FORBIDDEN");
    }
}
