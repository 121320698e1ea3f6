package com.millennicare.identity.exception;

import org.springframework.http.HttpStatus;

/**
 * Failures caused by the shape or content of the client's request.
 */
public final class RequestExceptions {

    private RequestExceptions() {}

    /** 400 Bad Request: unsupported provider, wrong code intent, unknown OAuth state and the like. */
    public static final class BadRequest extends ApiException {
        public BadRequest(String detail) {
            super(HttpStatus.BAD_REQUEST, "bad-request", "Bad Request", detail);
        }
    }
}
