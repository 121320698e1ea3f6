package com.millennicare.identity.service;

import com.millennicare.identity.entity.Session;
import com.millennicare.identity.entity.User;

import java.util.Optional;
import java.util.UUID;

public interface SessionService {

    Session create(User user);

    /** True only when the session exists, belongs to {@code userId} and has not expired. */
    boolean isActive(UUID sessionId, UUID userId);

    /**
     * Pushes the expiry of a live session to now + session lifetime.
     * Expired sessions are reported as absent and left for the sweeper.
     */
    Optional<Session> extend(UUID sessionId);

    /** Deletes the session; absent is not an error. */
    void delete(UUID sessionId);

    int purgeExpired();
}
