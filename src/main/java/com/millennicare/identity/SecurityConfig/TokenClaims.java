package com.millennicare.identity.SecurityConfig;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Verified content of an access or refresh token. {@code roles} is empty for refresh tokens.
 */
public record TokenClaims(
        UUID userId,
        UUID sessionId,
        List<String> roles,
        TokenType type,
        String tokenId,
        Instant issuedAt,
        Instant expiresAt
) {
    public TokenClaims {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
