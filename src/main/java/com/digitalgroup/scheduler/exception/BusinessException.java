package com.digitalgroup.scheduler.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class for errors reported synchronously to the API caller.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public BusinessException(String message) {
        this(message, HttpStatus.BAD_REQUEST, "BUSINESS_ERROR");
    }

    public BusinessException(String message, HttpStatus status, String code) {
        super(message);
        this.status = status;
        this.code = code;
    }
}
