package tech.funid.platform.authentication.oauth;

/**
 * Terminal or waiting state of an authorization request and where the user agent goes next.
 */
public record AuthorizationOutcome(AuthorizationState state, String redirectUri) {
}
