package com.millennicare.identity.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Immutable auth settings, bound once at startup from {@code app.auth.*}.
 * Components receive this record through constructor injection.
 */
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        @DefaultValue Jwt jwt,
        @DefaultValue("30d") Duration sessionTtl,
        @DefaultValue("15m") Duration verificationCodeTtl,
        @DefaultValue("10m") Duration oauthStateTtl,
        @DefaultValue("false") boolean resendVerificationOnSignIn,
        @DefaultValue("true") boolean refreshCookieSecure,
        @DefaultValue({"careseeker", "caregiver"}) List<String> selfAssignableRoles,
        @DefaultValue Links links,
        @DefaultValue PasswordHashing passwordHashing
) {

    public AuthProperties {
        selfAssignableRoles = selfAssignableRoles == null
                ? List.of()
                : selfAssignableRoles.stream().map(r -> r.trim().toLowerCase(Locale.ROOT)).toList();
    }

    public boolean isSelfAssignable(String roleName) {
        return roleName != null && selfAssignableRoles.contains(roleName.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Token signing settings. {@code secret} is a Base64 HMAC key of at least 256 bits.
     * Issuer and audience are only enforced when non-blank.
     */
    public record Jwt(
            String secret,
            @DefaultValue("") String issuer,
            @DefaultValue("") String audience,
            @DefaultValue("30m") Duration accessTokenTtl,
            @DefaultValue("30d") Duration refreshTokenTtl
    ) {}

    /** Where emailed links point to (the frontend, not this service). */
    public record Links(
            @DefaultValue("http://localhost:3000") String frontendBaseUrl,
            @DefaultValue("/verify-email") String verifyEmailPath,
            @DefaultValue("/reset-password") String resetPasswordPath
    ) {
        public String verifyEmailUrl(String token) {
            return link(verifyEmailPath, token);
        }

        public String resetPasswordUrl(String token) {
            return link(resetPasswordPath, token);
        }

        private String link(String path, String token) {
            return UriComponentsBuilder.fromHttpUrl(frontendBaseUrl)
                    .path(path)
                    .queryParam("token", token)
                    .encode()
                    .toUriString();
        }
    }

    /** Argon2id cost parameters (memory in KiB) and the sizing of the dedicated hashing pool. */
    public record PasswordHashing(
            @DefaultValue("19456") int memoryKib,
            @DefaultValue("2") int iterations,
            @DefaultValue("1") int parallelism,
            @DefaultValue("4") int poolSize,
            @DefaultValue("64") int queueCapacity,
            @DefaultValue("10s") Duration timeout
    ) {}
}
