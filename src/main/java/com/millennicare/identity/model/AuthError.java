package com.millennicare.identity.model;

import com.millennicare.identity.exception.ApiException;
import com.millennicare.identity.exception.AuthExceptions;
import com.millennicare.identity.exception.ExternalExceptions;
import com.millennicare.identity.exception.RequestExceptions;
import com.millennicare.identity.exception.ResourceExceptions;

import java.util.Objects;

/**
 * Typed failure produced by the auth services. The HTTP layer turns it into an {@link ApiException}.
 */
public record AuthError(AuthErrorKind kind, String message) {

    public AuthError {
        Objects.requireNonNull(kind, "kind");
    }

    public ApiException toException() {
        return switch (kind) {
            case UNAUTHORIZED -> new AuthExceptions.Unauthorized(message);
            case CONFLICT -> new ResourceExceptions.Conflict(message);
            case NOT_FOUND -> new ResourceExceptions.NotFound(message);
            case BAD_REQUEST -> new RequestExceptions.BadRequest(message);
            case SERVICE_UNAVAILABLE -> new ExternalExceptions.ServiceUnavailable(message);
        };
    }
}
