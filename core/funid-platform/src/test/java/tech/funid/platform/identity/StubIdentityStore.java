package tech.funid.platform.identity;

import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Alternative;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory identity store. Replaces the platform client in {@code @QuarkusTest}s
 * and is constructed directly in unit tests.
 */
@Alternative
@Priority(1)
@ApplicationScoped
public class StubIdentityStore implements IdentityStore {

    public final Map<String, UserProfile> profiles = new ConcurrentHashMap<>();
    public final Map<String, String> emails = new ConcurrentHashMap<>();
    public final Map<String, String> sessions = new ConcurrentHashMap<>();

    public StubIdentityStore withUser(String userId, UserProfile profile, String email) {
        if (profile != null) {
            profiles.put(userId, profile);
        }
        if (email != null) {
            emails.put(userId, email);
        }
        return this;
    }

    public StubIdentityStore withSession(String sessionToken, String userId) {
        sessions.put(sessionToken, userId);
        return this;
    }

    @Override
    public Optional<UserProfile> getProfile(String userId) {
        return Optional.ofNullable(profiles.get(userId));
    }

    @Override
    public Optional<String> getEmail(String userId) {
        return Optional.ofNullable(emails.get(userId));
    }

    @Override
    public Optional<String> resolveSessionUser(String sessionToken) {
        return Optional.ofNullable(sessions.get(sessionToken));
    }
}
