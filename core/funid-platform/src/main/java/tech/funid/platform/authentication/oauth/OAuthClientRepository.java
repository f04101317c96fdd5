package tech.funid.platform.authentication.oauth;

import java.util.Optional;

/**
 * Repository interface for OAuthClient entities.
 */
public interface OAuthClientRepository {

    /**
     * Active client by its public identifier. Inactive clients are never returned.
     */
    Optional<OAuthClient> findActiveByClientId(String clientId);

    void persist(OAuthClient client);
}
