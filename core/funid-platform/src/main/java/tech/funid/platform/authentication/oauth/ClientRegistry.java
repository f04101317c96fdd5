package tech.funid.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Optional;

/**
 * Lookup and authentication of registered relying parties.
 *
 * Inactive clients are indistinguishable from unknown ones.
 */
@ApplicationScoped
public class ClientRegistry {

    @Inject
    OAuthClientRepository clientRepository;

    @Inject
    ClientSecretHasher secretHasher;

    public Optional<OAuthClient> getClient(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            return Optional.empty();
        }
        return clientRepository.findActiveByClientId(clientId);
    }

    /**
     * Confidential clients must present their secret. Public clients always pass;
     * any secret they send is ignored.
     */
    public boolean authenticate(OAuthClient client, String clientSecret) {
        if (!client.isConfidential()) {
            return true;
        }
        if (clientSecret == null || clientSecret.isEmpty() || client.clientSecretHash == null) {
            return false;
        }
        return secretHasher.verify(clientSecret, client.clientSecretHash);
    }
}
