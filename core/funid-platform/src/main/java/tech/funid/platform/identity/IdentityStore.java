package tech.funid.platform.identity;

import java.util.Optional;

/**
 * The upstream user directory. It owns profiles, emails and end-user
 * sessions; the identity provider only reads from it.
 *
 * Implementations return empty for "not found" and throw
 * {@link IdentityStoreException} when the store cannot answer.
 */
public interface IdentityStore {

    Optional<UserProfile> getProfile(String userId);

    Optional<String> getEmail(String userId);

    /**
     * Resolve a platform session token to the id of the signed-in user.
     *
     * @return empty when the token is not a valid session
     */
    Optional<String> resolveSessionUser(String sessionToken);
}
