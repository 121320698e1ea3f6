package com.millennicare.identity.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception carrying HTTP semantics for RFC 7807 responses.
 * Controllers throw these; GlobalExceptionHandler renders them.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    static final String PROBLEM_BASE = "https://millennicare.com/problems/";

    private final HttpStatus status;
    private final String type;   // e.g. https://millennicare.com/problems/not-found
    private final String title;

    protected ApiException(HttpStatus status, String slug, String title, String detail) {
        super(detail);
        this.status = status;
        this.type = PROBLEM_BASE + slug;
        this.title = title;
    }
}
