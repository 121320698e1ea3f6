package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.config.AsyncConfig;
import com.millennicare.identity.config.AuthProperties;
import com.millennicare.identity.exception.ExternalExceptions;
import com.millennicare.identity.service.PasswordHasher;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the Argon2 encoder on the bounded hashing pool. The request thread waits for
 * the result; a full pool or a timeout surfaces as 503.
 */
@Slf4j
@Service
public class Argon2PasswordHasher implements PasswordHasher {

    private static final String DUMMY_PASSWORD = "Dummy-Password!0";

    private final PasswordEncoder encoder;
    private final AsyncTaskExecutor executor;
    private final Duration timeout;

    private String dummyHash;

    public Argon2PasswordHasher(PasswordEncoder encoder,
                                @Qualifier(AsyncConfig.PASSWORD_HASHING_EXECUTOR) AsyncTaskExecutor executor,
                                AuthProperties authProperties) {
        this.encoder = encoder;
        this.executor = executor;
        this.timeout = authProperties.passwordHashing().timeout();
    }

    @PostConstruct
    void init() {
        dummyHash = encoder.encode(DUMMY_PASSWORD);
    }

    @Override
    public String hash(String rawPassword) {
        if (rawPassword == null || rawPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        return await(() -> encoder.encode(rawPassword));
    }

    @Override
    public boolean verify(String rawPassword, String encodedHash) {
        if (rawPassword == null || encodedHash == null || encodedHash.isBlank()) {
            return false;
        }
        return await(() -> encoder.matches(rawPassword, encodedHash));
    }

    @Override
    public void verifyDummy(String rawPassword) {
        verify(rawPassword == null ? "" : rawPassword, dummyHash);
    }

    private <T> T await(Callable<T> work) {
        final Future<T> future;
        try {
            future = executor.submit(work);
        } catch (RejectedExecutionException e) {
            log.warn("Password hashing pool saturated");
            throw new ExternalExceptions.ServiceUnavailable("The service is busy. Try again shortly.");
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Password hashing exceeded {}", timeout);
            throw new ExternalExceptions.ServiceUnavailable("The service is busy. Try again shortly.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ExternalExceptions.ServiceUnavailable("Request interrupted.");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Password hashing failed", cause);
        }
    }
}
