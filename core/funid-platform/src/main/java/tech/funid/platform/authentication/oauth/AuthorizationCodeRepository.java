package tech.funid.platform.authentication.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for AuthorizationCode entities.
 */
public interface AuthorizationCodeRepository {

    /**
     * Look up a code that has not been used yet. Expired codes are returned
     * so the caller can retire them.
     */
    Optional<AuthorizationCode> findUnusedCode(String code);

    void persist(AuthorizationCode code);

    /**
     * Atomically flip {@code used} from false to true.
     *
     * @return true only for the single caller that performed the transition
     */
    boolean markAsUsed(String code);

    /**
     * Delete codes that expired before {@code cutoff}.
     *
     * @return number of rows removed
     */
    long deleteExpired(Instant cutoff);
}
