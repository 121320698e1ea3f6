package com.millennicare.identity.service;

/**
 * Outbound email. Implementations deliver asynchronously; delivery failures are
 * logged and never reach the caller.
 */
public interface EmailSender {

    void sendVerificationEmail(String to, String code, String verificationLink);

    void sendPasswordResetEmail(String to, String resetLink);
}
