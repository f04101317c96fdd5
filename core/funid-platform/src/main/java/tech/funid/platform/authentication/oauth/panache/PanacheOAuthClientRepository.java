package tech.funid.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.funid.platform.authentication.oauth.OAuthClient;
import tech.funid.platform.authentication.oauth.OAuthClientRepository;
import tech.funid.platform.authentication.oauth.entity.OAuthClientEntity;
import tech.funid.platform.authentication.oauth.mapper.OAuthClientMapper;
import tech.funid.platform.shared.EntityType;
import tech.funid.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of OAuthClientRepository.
 */
@ApplicationScoped
public class PanacheOAuthClientRepository
    implements OAuthClientRepository, PanacheRepositoryBase<OAuthClientEntity, String> {

    @Override
    public Optional<OAuthClient> findActiveByClientId(String clientId) {
        return find("clientId = ?1 and active = true", clientId)
            .firstResultOptional()
            .map(OAuthClientMapper::toDomain);
    }

    @Override
    @Transactional
    public void persist(OAuthClient client) {
        if (client.id == null) {
            client.id = TsidGenerator.generate(EntityType.OAUTH_CLIENT);
        }
        Instant now = Instant.now();
        if (client.createdAt == null) {
            client.createdAt = now;
        }
        client.updatedAt = now;
        persist(OAuthClientMapper.toEntity(client));
    }
}
