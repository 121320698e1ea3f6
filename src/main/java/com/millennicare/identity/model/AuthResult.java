package com.millennicare.identity.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an auth operation: either a value or an {@link AuthError}.
 * Expected domain failures travel as values; infrastructure failures still throw.
 */
public sealed interface AuthResult<T> permits AuthResult.Success, AuthResult.Failure {

    record Success<T>(T value) implements AuthResult<T> {}

    record Failure<T>(AuthError failure) implements AuthResult<T> {
        public Failure {
            Objects.requireNonNull(failure, "failure");
        }
    }

    static <T> AuthResult<T> success(T value) {
        return new Success<>(value);
    }

    static AuthResult<Void> ok() {
        return new Success<>(null);
    }

    static <T> AuthResult<T> failure(AuthErrorKind kind, String message) {
        return new Failure<>(new AuthError(kind, message));
    }

    default boolean isSuccess() {
        return this instanceof Success<T>;
    }

    default Optional<AuthError> error() {
        return this instanceof Failure<T> f ? Optional.of(f.failure()) : Optional.empty();
    }

    /** Returns the value or throws the {@link com.millennicare.identity.exception.ApiException} matching the error. */
    default T orElseThrow() {
        if (this instanceof Success<T> s) {
            return s.value();
        }
        throw ((Failure<T>) this).failure().toException();
    }
}
