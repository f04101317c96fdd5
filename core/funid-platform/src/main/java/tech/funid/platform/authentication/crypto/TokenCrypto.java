package tech.funid.platform.authentication.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * Hashing, random token generation and timing-safe comparison shared by the
 * OAuth stores and PKCE verification.
 */
public final class TokenCrypto {

    /** Random bytes behind an authorization code. */
    public static final int AUTHORIZATION_CODE_BYTES = 32;

    /** Random bytes behind a refresh token. Longer lived, so longer. */
    public static final int REFRESH_TOKEN_BYTES = 48;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private TokenCrypto() {
    }

    public static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * base64url(SHA-256(value)) over the UTF-8 bytes of {@code value}.
     * This is the at-rest form of refresh tokens.
     */
    public static String sha256Base64Url(String value) {
        return Base64Url.encode(sha256(value.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Generate {@code byteLength} bytes from a {@link SecureRandom} and base64url-encode them.
     */
    public static String generateSecureToken(int byteLength) {
        if (byteLength <= 0) {
            throw new IllegalArgumentException("byteLength must be positive");
        }
        byte[] bytes = new byte[byteLength];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64Url.encode(bytes);
    }

    /**
     * Constant-time string comparison. Lengths are compared first; equal-length
     * inputs are always scanned in full.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        byte[] left = a.getBytes(StandardCharsets.UTF_8);
        byte[] right = b.getBytes(StandardCharsets.UTF_8);
        if (left.length != right.length) {
            return false;
        }
        int result = 0;
        for (int i = 0; i < left.length; i++) {
            result |= left[i] ^ right[i];
        }
        return result == 0;
    }
}
