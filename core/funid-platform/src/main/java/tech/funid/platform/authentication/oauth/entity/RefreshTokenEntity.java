package tech.funid.platform.authentication.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * JPA entity for oauth_refresh_tokens table.
 */
@Entity
@Table(name = "oauth_refresh_tokens", indexes = {
    @Index(name = "idx_oauth_refresh_tokens_family", columnList = "token_family")
})
public class RefreshTokenEntity {

    @Id
    @Column(name = "token_hash", length = 64)
    public String tokenHash;

    @Column(name = "user_id", nullable = false, length = 64)
    public String userId;

    @Column(name = "client_id", nullable = false, length = 100)
    public String clientId;

    @Column(name = "scope", length = 500)
    public String scope;

    @Column(name = "token_family", nullable = false, length = 17)
    public String tokenFamily;

    @Column(name = "revoked", nullable = false)
    public boolean revoked;

    @Column(name = "revoked_at")
    public Instant revokedAt;

    @Column(name = "replaced_by", length = 64)
    public String replacedBy;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    public RefreshTokenEntity() {
    }
}
