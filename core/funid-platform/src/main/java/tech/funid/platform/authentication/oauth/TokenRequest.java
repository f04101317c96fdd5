package tech.funid.platform.authentication.oauth;

import tech.funid.platform.authentication.crypto.TokenCrypto;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * A token endpoint request, decoded once from whichever body encoding the
 * client used. Blank parameters are normalised to null.
 */
public record TokenRequest(
    BodyEncoding encoding,
    String grantType,
    String code,
    String redirectUri,
    String clientId,
    String clientSecret,
    String codeVerifier,
    String refreshToken
) {

    public enum BodyEncoding {
        FORM,
        JSON
    }

    /**
     * Decode an {@code application/x-www-form-urlencoded} body.
     */
    public static TokenRequest fromForm(Map<String, List<String>> form) {
        return new TokenRequest(
            BodyEncoding.FORM,
            first(form, "grant_type"),
            first(form, "code"),
            first(form, "redirect_uri"),
            first(form, "client_id"),
            first(form, "client_secret"),
            first(form, "code_verifier"),
            first(form, "refresh_token"));
    }

    /**
     * Decode an {@code application/json} body. Scalars are taken by their string
     * form; objects and arrays are treated as absent.
     */
    public static TokenRequest fromJson(Map<String, Object> body) {
        return new TokenRequest(
            BodyEncoding.JSON,
            scalar(body, "grant_type"),
            scalar(body, "code"),
            scalar(body, "redirect_uri"),
            scalar(body, "client_id"),
            scalar(body, "client_secret"),
            scalar(body, "code_verifier"),
            scalar(body, "refresh_token"));
    }

    /**
     * Apply HTTP Basic client credentials (RFC 6749 section 2.3.1), if the header carries them.
     *
     * @throws OAuthException if the header is malformed or names a different client than the body
     */
    public TokenRequest withBasicCredentials(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, "Basic ", 0, 6)) {
            return this;
        }
        String basicClientId;
        String basicSecret;
        try {
            String decoded = new String(Base64.getDecoder().decode(authorizationHeader.substring(6).trim()), StandardCharsets.UTF_8);
            int colon = decoded.indexOf(':');
            if (colon <= 0) {
                throw OAuthException.invalidRequest("Malformed Basic authorization header");
            }
            // Both halves are form-urlencoded; a stray '%' fails here
            basicClientId = URLDecoder.decode(decoded.substring(0, colon), StandardCharsets.UTF_8);
            basicSecret = URLDecoder.decode(decoded.substring(colon + 1), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw OAuthException.invalidRequest("Malformed Basic authorization header");
        }

        if (clientId != null && !TokenCrypto.constantTimeEquals(clientId, basicClientId)) {
            throw OAuthException.invalidRequest("client_id in body does not match client credentials");
        }
        return new TokenRequest(encoding, grantType, code, redirectUri, basicClientId,
            basicSecret.isEmpty() ? null : basicSecret, codeVerifier, refreshToken);
    }

    private static String first(Map<String, List<String>> form, String name) {
        if (form == null) {
            return null;
        }
        List<String> values = form.get(name);
        return values == null || values.isEmpty() ? null : normalise(values.get(0));
    }

    private static String scalar(Map<String, Object> body, String name) {
        if (body == null) {
            return null;
        }
        Object value = body.get(name);
        if (value instanceof String s) {
            return normalise(s);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return null;
    }

    private static String normalise(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
