package com.millennicare.identity.oauth;

/** Identity as reported by the provider. {@code providerAccountId} is the provider's stable user id. */
public record ProviderProfile(
        String providerAccountId,
        String email,
        String givenName,
        String familyName,
        String name
) {
    /** Best available display name: {@code name}, else given + family, else the email. */
    public String displayName() {
        if (name != null && !name.isBlank()) return name.trim();
        String joined = ((givenName == null ? "" : givenName) + " " + (familyName == null ? "" : familyName)).trim();
        return joined.isEmpty() ? email : joined;
    }
}
