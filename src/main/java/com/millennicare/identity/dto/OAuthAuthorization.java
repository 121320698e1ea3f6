package com.millennicare.identity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Where to send the browser to start an OAuth login. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OAuthAuthorization {
    private String provider;
    private String authorizationUrl;
}
