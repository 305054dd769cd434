package com.seatplanner.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A required field is missing or a value is out of range. Raised before anything is written.
 */
public class InvalidRequestException extends ProblemException {

    public InvalidRequestException(String code, String detail) {
        super(HttpStatus.BAD_REQUEST, code, detail);
    }
}
