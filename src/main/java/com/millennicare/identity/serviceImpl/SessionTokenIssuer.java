package com.millennicare.identity.serviceImpl;

import com.millennicare.identity.SecurityConfig.JwtTokenProviderConfig;
import com.millennicare.identity.dto.AuthTokens;
import com.millennicare.identity.entity.Session;
import com.millennicare.identity.service.RoleService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/** Mints the access/refresh pair for a session, with the user's current roles. */
@Component
@RequiredArgsConstructor
class SessionTokenIssuer {

    private final JwtTokenProviderConfig tokenProvider;
    private final RoleService roleService;

    AuthTokens issue(UUID userId, Session session) {
        List<String> roles = roleService.roleNamesOf(userId);
        return AuthTokens.builder()
                .accessToken(tokenProvider.issueAccessToken(userId, session.getId(), roles))
                .expiresIn(tokenProvider.getAccessTokenTtl().toSeconds())
                .refreshToken(tokenProvider.issueRefreshToken(userId, session.getId()))
                .refreshExpiresIn(tokenProvider.getRefreshTokenTtl().toSeconds())
                .sessionId(session.getId())
                .sessionExpiresAt(session.getExpiresAt())
                .build();
    }
}
