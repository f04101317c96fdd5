package tech.funid.platform.authentication.oauth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A registered relying-party application.
 *
 * <p>Supports two client types:
 * <ul>
 *   <li>PUBLIC: SPAs and mobile apps (no secret, PKCE only)</li>
 *   <li>CONFIDENTIAL: server-side apps (hashed secret + PKCE)</li>
 * </ul>
 *
 * Clients are provisioned administratively and are read-only here.
 * Deactivate rather than delete to revoke a client.
 */
public class OAuthClient {

    public String id;

    /**
     * Public client identifier used in OAuth flows.
     */
    public String clientId;

    /**
     * Display name shown on the consent screen.
     */
    public String clientName;

    public ClientType clientType = ClientType.PUBLIC;

    /**
     * Tagged one-way hash of the shared secret, see {@link ClientSecretHasher}.
     * Null for PUBLIC clients.
     */
    public String clientSecretHash;

    /**
     * Allowed redirect URIs. Matched by exact string comparison only.
     */
    public List<String> redirectUris = new ArrayList<>();

    /**
     * Scopes this client may request. Empty means every supported scope.
     */
    public List<String> allowedScopes = new ArrayList<>();

    public String logoUri;

    public boolean active = true;

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public enum ClientType {
        PUBLIC,
        CONFIDENTIAL
    }

    public boolean isConfidential() {
        return clientType == ClientType.CONFIDENTIAL;
    }

    public boolean isRedirectUriAllowed(String redirectUri) {
        return redirectUri != null && redirectUris.contains(redirectUri);
    }
}
