package com.millennicare.identity.service;

import com.millennicare.identity.entity.User;
import com.millennicare.identity.entity.VerificationCode;
import com.millennicare.identity.entity.VerificationPurpose;

import java.time.Instant;
import java.util.Optional;

public interface VerificationCodeService {

    /** Clear-text values handed to the email sender; only their digests are stored. */
    record IssuedCode(String code, String token, Instant expiresAt) {}

    /** Creates a fresh code for (user, purpose), deleting any previous one. */
    IssuedCode issue(User user, VerificationPurpose purpose);

    Optional<VerificationCode> findByToken(String token);

    boolean matchesCode(VerificationCode stored, String code);

    /**
     * Deletes the code. Returns false when another caller already consumed it.
     */
    boolean consume(VerificationCode stored);

    int purgeExpired();
}
