package tech.funid.platform.authentication.oauth;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Counters for the OAuth endpoints. Rejection reasons that are collapsed in
 * responses (not found, used, expired) are told apart here.
 */
@ApplicationScoped
public class OAuthMetrics {

    @Inject
    MeterRegistry registry;

    public void tokensIssued(GrantType grantType) {
        registry.counter("funid.oauth.token.issued", "grant_type", grantType.value()).increment();
    }

    public void grantRejected(String grantType, String reason) {
        registry.counter("funid.oauth.token.rejected", "grant_type", grantType, "reason", reason).increment();
    }

    public void authorizeOutcome(AuthorizationState state) {
        registry.counter("funid.oauth.authorize", "outcome", state.name().toLowerCase()).increment();
    }

    public void refreshReuseDetected() {
        registry.counter("funid.oauth.refresh.reuse_detected").increment();
    }
}
