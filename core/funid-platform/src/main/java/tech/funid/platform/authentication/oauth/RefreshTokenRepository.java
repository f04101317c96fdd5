package tech.funid.platform.authentication.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for RefreshToken entities.
 */
public interface RefreshTokenRepository {

    // Read operations
    Optional<RefreshToken> findActiveToken(String tokenHash);
    Optional<RefreshToken> findByTokenHash(String tokenHash);

    // Write operations
    void persist(RefreshToken token);

    /**
     * Atomically revoke a token that is not yet revoked.
     *
     * @param replacedBy hash of the successor token, or null when not rotating
     * @return true only for the single caller that performed the revocation
     */
    boolean revokeToken(String tokenHash, String replacedBy);

    /**
     * Revoke every still-active token of a family.
     *
     * @return number of tokens revoked
     */
    int revokeTokenFamily(String tokenFamily);

    long deleteExpired(Instant cutoff);
}
