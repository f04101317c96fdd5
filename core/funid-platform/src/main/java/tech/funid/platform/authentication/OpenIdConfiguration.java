package tech.funid.platform.authentication;

import tech.funid.platform.authentication.oauth.OAuthScope;

import java.util.List;

/**
 * OpenID Connect discovery document (OIDC Discovery 1.0 section 3).
 */
public record OpenIdConfiguration(
    String issuer,
    String authorization_endpoint,
    String token_endpoint,
    String userinfo_endpoint,
    String jwks_uri,
    List<String> response_types_supported,
    List<String> grant_types_supported,
    List<String> subject_types_supported,
    List<String> id_token_signing_alg_values_supported,
    List<String> scopes_supported,
    List<String> token_endpoint_auth_methods_supported,
    List<String> code_challenge_methods_supported,
    List<String> claims_supported
) {

    static OpenIdConfiguration of(String issuer, String baseUrl) {
        return new OpenIdConfiguration(
            issuer,
            baseUrl + "/oauth/authorize",
            baseUrl + "/oauth/token",
            baseUrl + "/oauth/userinfo",
            baseUrl + "/.well-known/jwks.json",
            List.of("code"),
            List.of("authorization_code", "refresh_token"),
            List.of("public"),
            List.of(KeyMaterial.ALGORITHM),
            List.copyOf(OAuthScope.supportedValues()),
            List.of("client_secret_post", "client_secret_basic", "none"),
            List.of("S256"),
            List.of("sub", "iss", "aud", "exp", "iat", "nonce",
                "name", "picture", "email", "email_verified", "wallet_address", "camly_balance"));
    }
}
