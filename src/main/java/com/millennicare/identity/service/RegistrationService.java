package com.millennicare.identity.service;

import com.millennicare.identity.dto.SignUpRequest;
import com.millennicare.identity.dto.UserSummary;
import com.millennicare.identity.model.AuthResult;

public interface RegistrationService {

    AuthResult<UserSummary> signUp(SignUpRequest request);

    AuthResult<Void> verifyEmail(String token, String code);

    /** Silent when the user is unknown or already verified. */
    void resendVerification(String email);
}
