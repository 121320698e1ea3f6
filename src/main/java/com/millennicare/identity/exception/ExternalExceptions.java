package com.millennicare.identity.exception;

import org.springframework.http.HttpStatus;

/**
 * Failures caused by systems outside this service (OAuth providers, saturated worker pools).
 */
public final class ExternalExceptions {

    private ExternalExceptions() {}

    /** 503 Service Unavailable: a dependency could not be reached or is overloaded. */
    public static final class ServiceUnavailable extends ApiException {
        public ServiceUnavailable(String detail) {
            super(HttpStatus.SERVICE_UNAVAILABLE, "service-unavailable", "Service Unavailable", detail);
        }
    }
}
