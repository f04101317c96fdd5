package tech.funid.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import tech.funid.platform.authentication.crypto.Base64Url;
import tech.funid.platform.authentication.crypto.TokenCrypto;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * PKCE (Proof Key for Code Exchange) verification.
 *
 * PKCE is mandatory for every client, public or confidential, and only the
 * S256 method is accepted:
 * <pre>
 * code_challenge = BASE64URL(SHA256(ASCII(code_verifier)))
 * </pre>
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String METHOD_S256 = "S256";

    private static final Pattern VERIFIER = Pattern.compile("^[A-Za-z0-9\\-._~]{43,128}$");

    // 32-byte SHA-256 digest, base64url without padding
    private static final Pattern S256_CHALLENGE = Pattern.compile("^[A-Za-z0-9\\-_]{43}$");

    /**
     * Compute the S256 challenge for a verifier.
     */
    public String computeChallenge(String codeVerifier) {
        return Base64Url.encode(TokenCrypto.sha256(codeVerifier.getBytes(StandardCharsets.US_ASCII)));
    }

    /**
     * Verify a code verifier against the challenge stored with an authorization code.
     *
     * @param codeVerifier The verifier provided in the token request
     * @param codeChallenge The challenge stored with the authorization code
     * @param method Stored challenge method; anything other than S256 fails
     * @return true if the verifier matches the challenge
     */
    public boolean verify(String codeVerifier, String codeChallenge, String method) {
        if (codeVerifier == null || codeChallenge == null) {
            return false;
        }
        if (!METHOD_S256.equals(method)) {
            return false;
        }
        if (!isValidCodeVerifier(codeVerifier)) {
            return false;
        }
        return TokenCrypto.constantTimeEquals(computeChallenge(codeVerifier), codeChallenge);
    }

    /**
     * True when the challenge has the exact shape of an S256 output.
     */
    public boolean isValidCodeChallenge(String codeChallenge) {
        return codeChallenge != null && S256_CHALLENGE.matcher(codeChallenge).matches();
    }

    /**
     * Per RFC 7636: 43-128 characters, unreserved characters only.
     */
    public boolean isValidCodeVerifier(String codeVerifier) {
        return codeVerifier != null && VERIFIER.matcher(codeVerifier).matches();
    }
}
