package com.millennicare.identity.service;

import com.millennicare.identity.dto.AuthTokens;
import com.millennicare.identity.dto.SignInRequest;
import com.millennicare.identity.dto.UserSummary;
import com.millennicare.identity.model.AuthResult;

import java.util.UUID;

public interface AuthService {

    AuthResult<AuthTokens> signIn(SignInRequest request);

    AuthResult<AuthTokens> refresh(String refreshToken);

    void signOut(UUID sessionId);

    AuthResult<UserSummary> currentUser(UUID userId);
}
