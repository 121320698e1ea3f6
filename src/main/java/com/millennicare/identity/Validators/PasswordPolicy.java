package com.millennicare.identity.Validators;

import java.util.regex.Pattern;

/**
 * Password rule shared by request validation and the services:
 * 8 to 64 characters, at least one uppercase letter and one of {@code !@#$%^&*}.
 */
public final class PasswordPolicy {

    public static final String REGEX = "^(?=.*[A-Z])(?=.*[!@#$%^&*]).{8,64}$";
    public static final String MESSAGE =
            "Password must be 8-64 characters long, contain at least one uppercase letter and one special character (!@#$%^&*).";

    private static final Pattern PATTERN = Pattern.compile(REGEX);

    private PasswordPolicy() {}

    public static boolean isSatisfiedBy(String password) {
        return password != null && PATTERN.matcher(password).matches();
    }
}
