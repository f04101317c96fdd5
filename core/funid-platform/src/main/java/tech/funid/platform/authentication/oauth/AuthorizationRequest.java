package tech.funid.platform.authentication.oauth;

/**
 * Parameters of {@code GET /oauth/authorize}, as received.
 */
public record AuthorizationRequest(
    String responseType,
    String clientId,
    String redirectUri,
    String scope,
    String state,
    String codeChallenge,
    String codeChallengeMethod,
    String nonce
) {
}
