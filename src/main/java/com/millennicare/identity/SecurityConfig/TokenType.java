package com.millennicare.identity.SecurityConfig;

/** Value of the {@code type} claim. A token is only accepted where its type is expected. */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claim;

    TokenType(String claim) {
        this.claim = claim;
    }

    public String claim() {
        return claim;
    }
}
