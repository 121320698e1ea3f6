package com.millennicare.identity.oauth;

import com.millennicare.identity.entity.AuthProvider;

/**
 * Outbound calls to one OAuth provider. Exchange and profile calls throw
 * {@link OAuthGatewayException} on failure.
 */
public interface OAuthProviderClient {

    AuthProvider provider();

    /** False when client credentials are missing, in which case the provider is not offered. */
    boolean isConfigured();

    String authorizationUrl(String state);

    ProviderTokens exchangeCode(String code);

    ProviderProfile fetchProfile(ProviderTokens tokens);
}
