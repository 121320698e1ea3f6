package com.millennicare.identity.SecurityConfig;

import java.util.List;
import java.util.UUID;

/**
 * Security principal put in the context by {@link JwtAuthFilterConfig} once the
 * access token and its backing session have both been checked.
 */
public record AuthenticatedSession(UUID userId, UUID sessionId, List<String> roles) {

    public AuthenticatedSession {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
