package com.millennicare.identity.SecurityConfig;

import com.millennicare.identity.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Stateless HS256 token issuer. Access tokens carry {@code sub}, {@code sessionId} and
 * {@code roles}; refresh tokens carry {@code sub} and {@code sessionId}. Both carry a
 * {@code type} claim that {@link #decode(String, TokenType)} checks.
 */
@Slf4j
@Component
public class JwtTokenProviderConfig {

    public static final String REFRESH_TOKEN_COOKIE = "refreshToken";

    static final String CLAIM_SESSION_ID = "sessionId";
    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_TYPE = "type";

    private final AuthProperties.Jwt jwtProperties;
    private final Clock clock;

    private SecretKey signingKey;
    private JwtParser jwtParser;

    public JwtTokenProviderConfig(AuthProperties authProperties, Clock clock) {
        this.jwtProperties = authProperties.jwt();
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        String secret = jwtProperties.secret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must be provided (base64).");
        }
        final byte[] keyBytes;
        try {
            keyBytes = Decoders.BASE64.decode(secret.trim());
        } catch (RuntimeException e) {
            throw new IllegalStateException("JWT secret must be valid Base64.", e);
        }
        // HS256 needs a key of at least 256 bits
        if (keyBytes.length < 32) {
            throw new IllegalStateException("JWT secret too short for HS256. Provide >= 256-bit Base64 key.");
        }

        signingKey = Keys.hmacShaKeyFor(keyBytes);

        var parserBuilder = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(30);

        if (hasText(jwtProperties.issuer())) {
            parserBuilder = parserBuilder.requireIssuer(jwtProperties.issuer());
        }
        if (hasText(jwtProperties.audience())) {
            parserBuilder = parserBuilder.requireAudience(jwtProperties.audience());
        }
        jwtParser = parserBuilder.build();
    }

    public String issueAccessToken(UUID userId, UUID sessionId, List<String> roles) {
        return baseBuilder(userId, sessionId, TokenType.ACCESS, jwtProperties.accessTokenTtl())
                .claim(CLAIM_ROLES, roles == null ? List.of() : List.copyOf(roles))
                .compact();
    }

    public String issueRefreshToken(UUID userId, UUID sessionId) {
        return baseBuilder(userId, sessionId, TokenType.REFRESH, jwtProperties.refreshTokenTtl())
                .compact();
    }

    /**
     * Verifies signature, expiry, optional issuer/audience and the {@code type} claim.
     * Every failure collapses to {@link Optional#empty()}.
     */
    public Optional<TokenClaims> decode(String token, TokenType expectedType) {
        if (!hasText(token)) return Optional.empty();
        try {
            Claims claims = jwtParser.parseSignedClaims(token).getPayload();
            if (!expectedType.claim().equals(claims.get(CLAIM_TYPE, String.class))) {
                log.debug("Rejected token: expected type {}", expectedType.claim());
                return Optional.empty();
            }
            String subject = claims.getSubject();
            String sessionId = claims.get(CLAIM_SESSION_ID, String.class);
            if (subject == null || sessionId == null) {
                log.debug("Rejected token: missing sub or sessionId");
                return Optional.empty();
            }
            return Optional.of(new TokenClaims(
                    UUID.fromString(subject),
                    UUID.fromString(sessionId),
                    readRoles(claims),
                    expectedType,
                    claims.getId(),
                    toInstant(claims.getIssuedAt()),
                    toInstant(claims.getExpiration())
            ));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid JWT: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Resolve the refresh token cookie value, if the client sent one. */
    public Optional<String> resolveRefreshTokenCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) return Optional.empty();
        return Arrays.stream(cookies)
                .filter(c -> REFRESH_TOKEN_COOKIE.equals(c.getName()))
                .map(Cookie::getValue)
                .filter(JwtTokenProviderConfig::hasText)
                .findFirst();
    }

    public Duration getAccessTokenTtl() {
        return jwtProperties.accessTokenTtl();
    }

    public Duration getRefreshTokenTtl() {
        return jwtProperties.refreshTokenTtl();
    }

    private JwtBuilder baseBuilder(UUID userId, UUID sessionId, TokenType type, Duration ttl) {
        Instant now = clock.instant();
        JwtBuilder builder = Jwts.builder()
                .subject(userId.toString())
                .id(UUID.randomUUID().toString().replace("-", ""))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .claim(CLAIM_SESSION_ID, sessionId.toString())
                .claim(CLAIM_TYPE, type.claim());
        if (hasText(jwtProperties.issuer())) {
            builder.issuer(jwtProperties.issuer());
        }
        if (hasText(jwtProperties.audience())) {
            builder.audience().add(jwtProperties.audience()).and();
        }
        return builder.signWith(signingKey, Jwts.SIG.HS256);
    }

    private static List<String> readRoles(Claims claims) {
        Object raw = claims.get(CLAIM_ROLES);
        if (raw instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
