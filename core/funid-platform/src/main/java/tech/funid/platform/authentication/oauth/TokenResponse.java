package tech.funid.platform.authentication.oauth;

/**
 * Successful token endpoint response (RFC 6749 section 5.1, OIDC Core 3.1.3.3).
 */
public record TokenResponse(
    String access_token,
    String token_type,
    long expires_in,
    String refresh_token,
    String id_token,
    String scope
) {
}
