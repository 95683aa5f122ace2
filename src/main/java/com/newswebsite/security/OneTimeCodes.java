package com.newswebsite.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.HexFormat;

/**
 * One-time secrets: e-mail verification codes and password-reset tokens.
 */
public final class OneTimeCodes {

    public static final Duration VERIFICATION_CODE_TTL = Duration.ofHours(24);
    public static final Duration RESET_TOKEN_TTL = Duration.ofMinutes(10);

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final int RESET_TOKEN_BYTES = 32;

    private OneTimeCodes() {
    }

    /**
     * Six-digit numeric code in the range 100000..999999.
     */
    public static String verificationCode() {
        return String.valueOf(100_000 + SECURE_RANDOM.nextInt(900_000));
    }

    /**
     * 32 random bytes, hex encoded. Only {@link #sha256Hex(String)} of this value is stored.
     */
    public static String resetToken() {
        byte[] randomBytes = new byte[RESET_TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        return HexFormat.of().formatHex(randomBytes);
    }

    public static String sha256Hex(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
