package com.millennicare.identity.model;

public enum AuthErrorKind {
    UNAUTHORIZED,
    CONFLICT,
    NOT_FOUND,
    BAD_REQUEST,
    SERVICE_UNAVAILABLE
}
