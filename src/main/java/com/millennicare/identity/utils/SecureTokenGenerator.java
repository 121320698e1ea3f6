package com.millennicare.identity.utils;

import org.springframework.security.core.token.Sha512DigestUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Random values for verification codes, link tokens and OAuth state, plus the
 * one-way digests under which codes and tokens are stored.
 */
@Component
public class SecureTokenGenerator {

    private static final int TOKEN_BYTES = 32;

    private final SecureRandom random = new SecureRandom();

    /** 256-bit random value, Base64URL without padding. */
    public String newUrlToken() {
        byte[] buf = new byte[TOKEN_BYTES];
        random.nextBytes(buf);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }

    /** Uniform numeric code of exactly {@code digits} digits, leading zeros kept. */
    public String newNumericCode(int digits) {
        if (digits < 1 || digits > 9) throw new IllegalArgumentException("digits must be 1..9");
        int bound = (int) Math.pow(10, digits);
        return String.format("%0" + digits + "d", random.nextInt(bound));
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String sha512Hex(String value) {
        return Sha512DigestUtils.shaHex(value);
    }

    /** Constant-time comparison of two hex digests. */
    public static boolean digestEquals(String a, String b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.US_ASCII), b.getBytes(StandardCharsets.US_ASCII));
    }
}
