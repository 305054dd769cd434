package com.seatplanner.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A write collided with a uniqueness rule. When raised inside a batch the whole batch is rolled back.
 */
public class ResourceConflictException extends ProblemException {

    public ResourceConflictException(String code, String detail) {
        super(HttpStatus.CONFLICT, code, detail);
    }

    public ResourceConflictException(String code, String detail, Throwable cause) {
        super(HttpStatus.CONFLICT, code, detail, cause);
    }
}
