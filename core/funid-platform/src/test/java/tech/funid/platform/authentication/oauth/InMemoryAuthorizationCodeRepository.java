package tech.funid.platform.authentication.oauth;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Thread-safe in-memory code store with the same conditional-update semantics as the database.
 */
class InMemoryAuthorizationCodeRepository implements AuthorizationCodeRepository {

    final Map<String, AuthorizationCode> codes = new ConcurrentHashMap<>();

    @Override
    public Optional<AuthorizationCode> findUnusedCode(String code) {
        return Optional.ofNullable(codes.get(code))
            .filter(c -> !c.used)
            .map(InMemoryAuthorizationCodeRepository::copy);
    }

    @Override
    public void persist(AuthorizationCode code) {
        codes.put(code.code, copy(code));
    }

    @Override
    public boolean markAsUsed(String code) {
        AtomicBoolean transitioned = new AtomicBoolean();
        codes.computeIfPresent(code, (key, stored) -> {
            if (!stored.used) {
                stored.used = true;
                transitioned.set(true);
            }
            return stored;
        });
        return transitioned.get();
    }

    @Override
    public long deleteExpired(Instant cutoff) {
        long before = codes.size();
        codes.values().removeIf(c -> c.expiresAt.isBefore(cutoff));
        return before - codes.size();
    }

    AuthorizationCode get(String code) {
        return codes.get(code);
    }

    private static AuthorizationCode copy(AuthorizationCode source) {
        AuthorizationCode copy = new AuthorizationCode();
        copy.id = source.id;
        copy.code = source.code;
        copy.clientId = source.clientId;
        copy.userId = source.userId;
        copy.redirectUri = source.redirectUri;
        copy.scope = source.scope;
        copy.codeChallenge = source.codeChallenge;
        copy.codeChallengeMethod = source.codeChallengeMethod;
        copy.state = source.state;
        copy.nonce = source.nonce;
        copy.createdAt = source.createdAt;
        copy.expiresAt = source.expiresAt;
        copy.used = source.used;
        return copy;
    }
}
