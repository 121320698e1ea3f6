package com.millennicare.identity.oauth;

import com.millennicare.identity.entity.AuthProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class OAuthProviderRegistry {

    private final Map<AuthProvider, OAuthProviderClient> clients;

    public OAuthProviderRegistry(List<OAuthProviderClient> available) {
        Map<AuthProvider, OAuthProviderClient> map = new EnumMap<>(AuthProvider.class);
        for (OAuthProviderClient client : available) {
            if (client.isConfigured()) {
                map.put(client.provider(), client);
            } else {
                log.info("OAuth provider '{}' has no client credentials; disabled", client.provider().id());
            }
        }
        this.clients = Collections.unmodifiableMap(map);
    }

    /** Configured client for a provider id such as {@code google}; empty for unknown or disabled providers. */
    public Optional<OAuthProviderClient> find(String providerId) {
        return AuthProvider.fromId(providerId)
                .filter(AuthProvider::isFederated)
                .map(clients::get);
    }
}
