package tech.funid.platform.authentication.oauth;

import java.time.Instant;

/**
 * A single-use authorization grant issued at consent approval.
 *
 * The expiry is fixed at creation. Once {@code used} is set the code can
 * never be redeemed again, expired or not.
 */
public class AuthorizationCode {

    public String id;

    /**
     * The opaque code value handed to the client.
     */
    public String code;

    public String clientId;

    /**
     * The user who approved the grant (token subject).
     */
    public String userId;

    /**
     * Redirect URI the code was issued for. The token request must present the same value.
     */
    public String redirectUri;

    public String scope;

    public String codeChallenge;

    public String codeChallengeMethod;

    public String state;

    /**
     * OIDC nonce, copied into the ID token.
     */
    public String nonce;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    public boolean used = false;

    public boolean isExpired() {
        return !Instant.now().isBefore(expiresAt);
    }
}
