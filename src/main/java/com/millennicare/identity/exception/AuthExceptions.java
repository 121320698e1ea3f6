package com.millennicare.identity.exception;

import org.springframework.http.HttpStatus;

public final class AuthExceptions {

    private AuthExceptions() {}

    /** 401 Unauthorized. Detail must stay generic so it never reveals which check failed. */
    public static final class Unauthorized extends ApiException {
        public Unauthorized(String detail) {
            super(HttpStatus.UNAUTHORIZED, "unauthorized", "Unauthorized", detail);
        }
    }
}
