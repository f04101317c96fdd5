package tech.funid.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.funid.platform.authentication.AuthConfig;
import tech.funid.platform.authentication.JwtTokenService;
import tech.funid.platform.authentication.crypto.TokenCrypto;
import tech.funid.platform.shared.EntityType;
import tech.funid.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.Map;

/**
 * Token endpoint logic for the authorization_code and refresh_token grants.
 *
 * Failures about the grant itself (unknown, used, expired, wrong client,
 * wrong redirect_uri, bad PKCE proof) all produce the same invalid_grant
 * response; the concrete reason only goes to the log and metrics.
 *
 * State transitions (code used, token revoked) are conditional updates in
 * the store, so of two concurrent redemptions exactly one proceeds.
 */
@ApplicationScoped
public class TokenService {

    private static final Logger LOG = Logger.getLogger(TokenService.class);

    static final String INVALID_CODE = "Invalid or expired authorization code";
    static final String INVALID_REFRESH_TOKEN = "Invalid or expired refresh token";
    static final String CLIENT_AUTH_FAILED = "Client authentication failed";

    @Inject
    AuthConfig authConfig;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    AuthorizationCodeRepository codeRepository;

    @Inject
    RefreshTokenRepository refreshTokenRepository;

    @Inject
    PkceService pkceService;

    @Inject
    JwtTokenService jwtTokenService;

    @Inject
    ClaimsAssembler claimsAssembler;

    @Inject
    OAuthMetrics metrics;

    /**
     * Dispatch on grant_type.
     */
    public TokenResponse exchange(TokenRequest request) {
        if (request.grantType() == null) {
            throw OAuthException.invalidRequest("grant_type is required");
        }
        GrantType grantType = GrantType.fromValue(request.grantType()).orElse(null);
        if (grantType == null) {
            metrics.grantRejected("unsupported", "unsupported_grant_type");
            throw new OAuthException(OAuthError.UNSUPPORTED_GRANT_TYPE,
                "Supported grant types: authorization_code, refresh_token");
        }
        return switch (grantType) {
            case AUTHORIZATION_CODE -> redeemAuthorizationCode(request);
            case REFRESH_TOKEN -> redeemRefreshToken(request);
        };
    }

    TokenResponse redeemAuthorizationCode(TokenRequest request) {
        GrantType grant = GrantType.AUTHORIZATION_CODE;
        require(request.code(), "code");
        require(request.redirectUri(), "redirect_uri");
        require(request.clientId(), "client_id");
        require(request.codeVerifier(), "code_verifier");

        AuthorizationCode authCode = codeRepository.findUnusedCode(request.code()).orElse(null);
        if (authCode == null) {
            throw rejectGrant(grant, request.clientId(), "not_found_or_used", INVALID_CODE);
        }
        if (authCode.isExpired()) {
            codeRepository.markAsUsed(authCode.code);
            throw rejectGrant(grant, request.clientId(), "expired", INVALID_CODE);
        }
        if (!authCode.clientId.equals(request.clientId())) {
            throw rejectGrant(grant, request.clientId(), "client_mismatch", INVALID_CODE);
        }
        if (!authCode.redirectUri.equals(request.redirectUri())) {
            throw rejectGrant(grant, request.clientId(), "redirect_uri_mismatch", INVALID_CODE);
        }
        if (!pkceService.verify(request.codeVerifier(), authCode.codeChallenge, authCode.codeChallengeMethod)) {
            throw rejectGrant(grant, request.clientId(), "pkce_verification_failed", INVALID_CODE);
        }

        OAuthClient client = authenticateClient(grant, request);

        // Single point of truth for concurrent redemptions
        if (!codeRepository.markAsUsed(authCode.code)) {
            throw rejectGrant(grant, client.clientId, "concurrent_redemption", INVALID_CODE);
        }

        return issueTokens(grant, authCode.userId, client.clientId, authCode.scope, authCode.nonce,
            TsidGenerator.generate(EntityType.TOKEN_FAMILY),
            TokenCrypto.generateSecureToken(TokenCrypto.REFRESH_TOKEN_BYTES));
    }

    TokenResponse redeemRefreshToken(TokenRequest request) {
        GrantType grant = GrantType.REFRESH_TOKEN;
        require(request.refreshToken(), "refresh_token");
        require(request.clientId(), "client_id");

        String tokenHash = TokenCrypto.sha256Base64Url(request.refreshToken());
        RefreshToken stored = refreshTokenRepository.findActiveToken(tokenHash).orElse(null);
        if (stored == null) {
            detectReuse(tokenHash, request.clientId());
            throw rejectGrant(grant, request.clientId(), "not_found_or_revoked", INVALID_REFRESH_TOKEN);
        }
        if (stored.isExpired()) {
            refreshTokenRepository.revokeToken(tokenHash, null);
            throw rejectGrant(grant, request.clientId(), "expired", INVALID_REFRESH_TOKEN);
        }
        if (!stored.clientId.equals(request.clientId())) {
            throw rejectGrant(grant, request.clientId(), "client_mismatch", INVALID_REFRESH_TOKEN);
        }

        OAuthClient client = authenticateClient(grant, request);

        String successor = TokenCrypto.generateSecureToken(TokenCrypto.REFRESH_TOKEN_BYTES);
        if (!refreshTokenRepository.revokeToken(tokenHash, TokenCrypto.sha256Base64Url(successor))) {
            throw rejectGrant(grant, client.clientId, "concurrent_rotation", INVALID_REFRESH_TOKEN);
        }

        // The nonce belongs to the original authentication and is not carried forward
        return issueTokens(grant, stored.userId, client.clientId, stored.scope, null, stored.tokenFamily, successor);
    }

    private TokenResponse issueTokens(GrantType grant, String userId, String clientId, String scope,
                                      String nonce, String tokenFamily, String refreshTokenValue) {
        String accessToken = jwtTokenService.issueAccessToken(userId, clientId, scope);
        Map<String, Object> identityClaims = claimsAssembler.identityClaims(userId, OAuthScope.parse(scope));
        String idToken = jwtTokenService.issueIdToken(userId, clientId, identityClaims, nonce);

        Instant now = Instant.now();
        RefreshToken refreshToken = new RefreshToken();
        refreshToken.tokenHash = TokenCrypto.sha256Base64Url(refreshTokenValue);
        refreshToken.userId = userId;
        refreshToken.clientId = clientId;
        refreshToken.scope = scope;
        refreshToken.tokenFamily = tokenFamily;
        refreshToken.createdAt = now;
        refreshToken.expiresAt = now.plus(authConfig.jwt().refreshTokenExpiry());
        refreshTokenRepository.persist(refreshToken);

        metrics.tokensIssued(grant);
        LOG.infof("Issued tokens via %s for user %s, client %s", grant.value(), userId, clientId);

        return new TokenResponse(
            accessToken,
            "Bearer",
            jwtTokenService.accessTokenExpiry().getSeconds(),
            refreshTokenValue,
            idToken,
            scope);
    }

    private OAuthClient authenticateClient(GrantType grant, TokenRequest request) {
        OAuthClient client = clientRegistry.getClient(request.clientId()).orElse(null);
        if (client == null) {
            throw rejectClient(grant, request.clientId(), "unknown_client");
        }
        if (!clientRegistry.authenticate(client, request.clientSecret())) {
            throw rejectClient(grant, request.clientId(),
                request.clientSecret() == null ? "missing_client_secret" : "bad_client_secret");
        }
        return client;
    }

    /**
     * A revoked token that was replaced by rotation should never be seen again.
     * If it is, someone else may hold the lineage.
     */
    private void detectReuse(String tokenHash, String clientId) {
        refreshTokenRepository.findByTokenHash(tokenHash)
            .filter(RefreshToken::wasRotated)
            .ifPresent(token -> {
                metrics.refreshReuseDetected();
                if (authConfig.refreshToken().revokeFamilyOnReuse()) {
                    int revoked = refreshTokenRepository.revokeTokenFamily(token.tokenFamily);
                    LOG.warnf("Rotated refresh token replayed by client %s; revoked %d token(s) in family %s",
                        clientId, revoked, token.tokenFamily);
                } else {
                    LOG.warnf("Rotated refresh token replayed by client %s (family %s)", clientId, token.tokenFamily);
                }
            });
    }

    private static void require(String value, String name) {
        if (value == null) {
            throw OAuthException.invalidRequest(name + " is required");
        }
    }

    private OAuthException rejectGrant(GrantType grant, String clientId, String reason, String description) {
        LOG.infof("Rejected %s grant for client %s: %s", grant.value(), clientId, reason);
        metrics.grantRejected(grant.value(), reason);
        return OAuthException.invalidGrant(description);
    }

    private OAuthException rejectClient(GrantType grant, String clientId, String reason) {
        LOG.warnf("Client authentication failed for %s on %s grant: %s", clientId, grant.value(), reason);
        metrics.grantRejected(grant.value(), reason);
        return OAuthException.invalidClient(CLIENT_AUTH_FAILED);
    }
}
