package com.millennicare.identity.service;

import java.util.Optional;

/**
 * Short-lived CSRF state for the OAuth round trip.
 */
public interface OAuthStateStore {

    /** Stores {@code roleName} under a fresh random state and returns the state. */
    String create(String roleName);

    /**
     * Reads and deletes the state in one step. A state can be redeemed at most once;
     * unknown, expired and already redeemed states all yield empty.
     */
    Optional<String> redeem(String state);
}
