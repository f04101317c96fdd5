package tech.funid.platform.authentication.oauth;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

class InMemoryOAuthClientRepository implements OAuthClientRepository {

    final Map<String, OAuthClient> clients = new ConcurrentHashMap<>();

    @Override
    public Optional<OAuthClient> findActiveByClientId(String clientId) {
        return Optional.ofNullable(clients.get(clientId)).filter(c -> c.active);
    }

    @Override
    public void persist(OAuthClient client) {
        clients.put(client.clientId, client);
    }
}
