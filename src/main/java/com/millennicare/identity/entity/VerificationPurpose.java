package com.millennicare.identity.entity;

public enum VerificationPurpose {
    VERIFY_EMAIL,
    FORGOT_PASSWORD
}
