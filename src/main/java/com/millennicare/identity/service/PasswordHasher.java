package com.millennicare.identity.service;

/**
 * Argon2id hashing. Output is a self-describing PHC string (parameters, salt and hash).
 */
public interface PasswordHasher {

    String hash(String rawPassword);

    boolean verify(String rawPassword, String encodedHash);

    /**
     * Spends the cost of one verification without a real hash, so a missing user
     * or account takes as long as a wrong password.
     */
    void verifyDummy(String rawPassword);
}
