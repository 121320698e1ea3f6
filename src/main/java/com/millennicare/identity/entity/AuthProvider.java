package com.millennicare.identity.entity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Provider ids stored in {@code accounts.provider_id}.
 */
public enum AuthProvider {
    CREDENTIALS("credentials"),
    GOOGLE("google");

    private final String id;

    AuthProvider(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean isFederated() {
        return this != CREDENTIALS;
    }

    public static Optional<AuthProvider> fromId(String id) {
        if (id == null) return Optional.empty();
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(p -> p.id.equals(normalized)).findFirst();
    }
}
