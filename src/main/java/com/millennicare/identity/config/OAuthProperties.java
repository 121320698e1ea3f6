package com.millennicare.identity.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Registered OAuth providers keyed by provider id ({@code google}, ...).
 */
@ConfigurationProperties(prefix = "app.oauth")
public record OAuthProperties(
        @DefaultValue("5s") Duration connectTimeout,
        @DefaultValue("10s") Duration readTimeout,
        Map<String, Provider> providers
) {

    public OAuthProperties {
        providers = providers == null ? Map.of() : Map.copyOf(providers);
    }

    public record Provider(
            String clientId,
            String clientSecret,
            String redirectUri,
            String authorizationUri,
            String tokenUri,
            String userInfoUri,
            List<String> scopes
    ) {
        public Provider {
            scopes = scopes == null ? List.of() : List.copyOf(scopes);
        }
    }
}
