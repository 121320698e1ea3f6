package com.millennicare.identity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/** Optional body of /refresh; the {@code refreshToken} cookie is used when this is absent. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RefreshTokenRequest {

    @ToString.Exclude
    private String refreshToken;
}
