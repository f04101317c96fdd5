package tech.funid.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.funid.platform.authentication.oauth.AuthorizationCode;
import tech.funid.platform.authentication.oauth.AuthorizationCodeRepository;
import tech.funid.platform.authentication.oauth.entity.AuthorizationCodeEntity;
import tech.funid.platform.authentication.oauth.mapper.AuthorizationCodeMapper;
import tech.funid.platform.shared.EntityType;
import tech.funid.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of AuthorizationCodeRepository.
 *
 * {@link #markAsUsed(String)} commits in its own transaction: a code retired
 * on an expired or duplicate redemption stays retired even when the
 * surrounding request fails.
 */
@ApplicationScoped
public class PanacheAuthorizationCodeRepository
    implements AuthorizationCodeRepository, PanacheRepositoryBase<AuthorizationCodeEntity, String> {

    @Override
    public Optional<AuthorizationCode> findUnusedCode(String code) {
        return find("code = ?1 and used = false", code)
            .firstResultOptional()
            .map(AuthorizationCodeMapper::toDomain);
    }

    @Override
    @Transactional
    public void persist(AuthorizationCode authCode) {
        if (authCode.id == null) {
            authCode.id = TsidGenerator.generate(EntityType.AUTH_CODE);
        }
        if (authCode.createdAt == null) {
            authCode.createdAt = Instant.now();
        }
        AuthorizationCodeEntity entity = AuthorizationCodeMapper.toEntity(authCode);
        persist(entity);
    }

    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public boolean markAsUsed(String code) {
        return update("used = true where code = ?1 and used = false", code) == 1;
    }

    @Override
    @Transactional
    public long deleteExpired(Instant cutoff) {
        return delete("expiresAt < ?1", cutoff);
    }
}
