package com.millennicare.identity.exception;

import org.springframework.http.HttpStatus;

public final class ResourceExceptions {

    private ResourceExceptions() {}

    /** 404 Not Found. */
    public static final class NotFound extends ApiException {
        public NotFound(String detail) {
            super(HttpStatus.NOT_FOUND, "not-found", "Not Found", detail);
        }
    }

    /** 409 Conflict: uniqueness or state conflict. */
    public static final class Conflict extends ApiException {
        public Conflict(String detail) {
            super(HttpStatus.CONFLICT, "conflict", "Conflict", detail);
        }
    }
}
