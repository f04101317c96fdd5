package tech.funid.platform.authentication.crypto;

import java.util.Base64;

/**
 * URL-safe base64 without padding (RFC 4648 section 5), as used by JWTs,
 * PKCE challenges and opaque OAuth tokens.
 */
public final class Base64Url {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private Base64Url() {
    }

    public static String encode(byte[] bytes) {
        return ENCODER.encodeToString(bytes);
    }

    /**
     * Decode a base64url string. Padding is optional on input.
     *
     * @throws IllegalArgumentException if the input contains characters outside the URL-safe alphabet
     */
    public static byte[] decode(String value) {
        return DECODER.decode(value);
    }
}
