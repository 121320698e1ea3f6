package com.millennicare.identity.oauth;

/**
 * Result of the authorization-code exchange. {@code refreshToken}, {@code idToken},
 * {@code expiresInSeconds} and {@code scope} may be null when the provider omits them.
 */
public record ProviderTokens(
        String accessToken,
        String refreshToken,
        String idToken,
        Long expiresInSeconds,
        String scope
) {
    @Override
    public String toString() {
        return "ProviderTokens[scope=" + scope + ", expiresInSeconds=" + expiresInSeconds + "]";
    }
}
