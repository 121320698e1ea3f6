package com.millennicare.identity.service;

import com.millennicare.identity.model.AuthResult;

public interface PasswordResetService {

    /** Always succeeds from the caller's point of view so account existence is not revealed. */
    void forgotPassword(String email);

    AuthResult<Void> resetPassword(String token, String newPassword);
}
