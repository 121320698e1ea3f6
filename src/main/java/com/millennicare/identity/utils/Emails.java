package com.millennicare.identity.utils;

import java.util.Locale;

public final class Emails {

    private Emails() {}

    /** Trimmed and lower-cased; the only form stored or queried. */
    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
