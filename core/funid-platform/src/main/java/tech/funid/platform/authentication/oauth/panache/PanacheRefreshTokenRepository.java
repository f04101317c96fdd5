package tech.funid.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.funid.platform.authentication.oauth.RefreshToken;
import tech.funid.platform.authentication.oauth.RefreshTokenRepository;
import tech.funid.platform.authentication.oauth.entity.RefreshTokenEntity;
import tech.funid.platform.authentication.oauth.mapper.RefreshTokenMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of RefreshTokenRepository.
 *
 * Revocations commit in their own transaction so rotation and reuse
 * detection take effect regardless of what happens after them.
 */
@ApplicationScoped
public class PanacheRefreshTokenRepository
    implements RefreshTokenRepository, PanacheRepositoryBase<RefreshTokenEntity, String> {

    @Override
    public Optional<RefreshToken> findActiveToken(String tokenHash) {
        return find("tokenHash = ?1 and revoked = false", tokenHash)
            .firstResultOptional()
            .map(RefreshTokenMapper::toDomain);
    }

    @Override
    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        return find("tokenHash", tokenHash)
            .firstResultOptional()
            .map(RefreshTokenMapper::toDomain);
    }

    @Override
    @Transactional
    public void persist(RefreshToken token) {
        RefreshTokenEntity entity = RefreshTokenMapper.toEntity(token);
        persist(entity);
    }

    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public boolean revokeToken(String tokenHash, String replacedBy) {
        return update("revoked = true, revokedAt = ?1, replacedBy = ?2 where tokenHash = ?3 and revoked = false",
            Instant.now(), replacedBy, tokenHash) == 1;
    }

    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public int revokeTokenFamily(String tokenFamily) {
        return update("revoked = true, revokedAt = ?1 where tokenFamily = ?2 and revoked = false",
            Instant.now(), tokenFamily);
    }

    @Override
    @Transactional
    public long deleteExpired(Instant cutoff) {
        return delete("expiresAt < ?1", cutoff);
    }
}
