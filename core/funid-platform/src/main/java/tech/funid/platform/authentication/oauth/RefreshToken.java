package tech.funid.platform.authentication.oauth;

import java.time.Instant;

/**
 * Stores refresh tokens for long-lived sessions.
 *
 * Features:
 * - Token rotation: each use revokes the token and issues a new one
 * - Family tracking: tokens descending from one code exchange share a family
 * - Reuse detection: replaying a rotated token can revoke the whole family
 *
 * Only the token hash is stored, never the token itself.
 */
public class RefreshToken {

    /**
     * base64url(SHA-256(token)).
     */
    public String tokenHash;

    public String userId;

    public String clientId;

    public String scope;

    /**
     * Shared by every token rotated from the same authorization code.
     */
    public String tokenFamily;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    public boolean revoked = false;

    public Instant revokedAt;

    /**
     * Hash of the token that replaced this one. Set only by rotation.
     */
    public String replacedBy;

    public boolean isExpired() {
        return !Instant.now().isBefore(expiresAt);
    }

    /**
     * True when the token was revoked because it was exchanged for a successor.
     */
    public boolean wasRotated() {
        return revoked && replacedBy != null;
    }
}
