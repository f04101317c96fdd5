package tech.funid.platform.authentication.oauth;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.funid.platform.authentication.AuthConfig;

import java.time.Instant;

/**
 * Deletes expired authorization codes and refresh tokens.
 *
 * Best effort and idempotent. Expired rows are already unusable, so a
 * skipped run only costs storage. Revoked refresh tokens are kept until
 * they expire so replay of a rotated token can still be recognised.
 */
@ApplicationScoped
public class OAuthCleanupJob {

    private static final Logger LOG = Logger.getLogger(OAuthCleanupJob.class);

    @Inject
    AuthConfig authConfig;

    @Inject
    AuthorizationCodeRepository codeRepository;

    @Inject
    RefreshTokenRepository refreshTokenRepository;

    @Scheduled(every = "${funid.auth.cleanup.interval:1h}", identity = "oauth-cleanup",
               concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledCleanup() {
        if (!authConfig.cleanup().enabled()) {
            return;
        }
        try {
            cleanup(Instant.now());
        } catch (RuntimeException e) {
            LOG.errorf(e, "OAuth cleanup failed: %s", e.getMessage());
        }
    }

    /**
     * @return total number of rows removed
     */
    public long cleanup(Instant cutoff) {
        long codes = codeRepository.deleteExpired(cutoff);
        long tokens = refreshTokenRepository.deleteExpired(cutoff);
        if (codes > 0 || tokens > 0) {
            LOG.infof("OAuth cleanup removed %d authorization code(s) and %d refresh token(s)", codes, tokens);
        }
        return codes + tokens;
    }
}
