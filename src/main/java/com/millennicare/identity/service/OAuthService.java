package com.millennicare.identity.service;

import com.millennicare.identity.dto.AuthTokens;
import com.millennicare.identity.dto.OAuthAuthorization;
import com.millennicare.identity.model.AuthResult;

public interface OAuthService {

    AuthResult<OAuthAuthorization> initiate(String provider, String roleName);

    AuthResult<AuthTokens> callback(String provider, String code, String state);
}
