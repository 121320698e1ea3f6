package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.model.AuthErrorKind;
import com.millennicare.identity.model.AuthResult;
import org.springframework.transaction.interceptor.TransactionAspectSupport;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Builds failure results. A failure inside a transaction marks it rollback-only,
 * so nothing written before the failure is committed.
 */
final class AuthFailures {

    static final String INVALID_CREDENTIALS = "Incorrect email or password";
    static final String PROVIDER_AUTH_FAILED = "Failed to authenticate with provider";

    private AuthFailures() {}

    static <T> AuthResult<T> fail(AuthErrorKind kind, String message) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
        }
        return AuthResult.failure(kind, message);
    }
}
