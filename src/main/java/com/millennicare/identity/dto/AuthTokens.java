package com.millennicare.identity.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthTokens {

    @Builder.Default
    private String tokenType = "Bearer";
    private String accessToken;
    /** Access token lifetime in seconds. */
    private long expiresIn;
    private String refreshToken;
    private long refreshExpiresIn;
    private UUID sessionId;
    private Instant sessionExpiresAt;
}
