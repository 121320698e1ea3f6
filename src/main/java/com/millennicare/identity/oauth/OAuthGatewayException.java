package com.millennicare.identity.oauth;

import lombok.Getter;

/**
 * Outbound OAuth call failure. {@link Kind#PROVIDER_REJECTED} means the provider answered
 * with an error or an unusable body; {@link Kind#UNREACHABLE} means no answer arrived.
 */
@Getter
public class OAuthGatewayException extends RuntimeException {

    public enum Kind {
        PROVIDER_REJECTED,
        UNREACHABLE
    }

    private final Kind kind;

    public OAuthGatewayException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public OAuthGatewayException(Kind kind, String message) {
        this(kind, message, null);
    }
}
