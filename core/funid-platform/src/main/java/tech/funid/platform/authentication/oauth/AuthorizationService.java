package tech.funid.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.funid.platform.authentication.AuthConfig;
import tech.funid.platform.authentication.crypto.TokenCrypto;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Authorization endpoint logic: request validation, hand-off to the consent
 * screen, and code issuance on the consent callback.
 *
 * Until the client and redirect_uri are verified, errors are thrown as
 * {@link OAuthException} and rendered directly. From then on the caller is
 * sent back to the client's redirect_uri with {@code error} and {@code state}.
 */
@ApplicationScoped
public class AuthorizationService {

    private static final Logger LOG = Logger.getLogger(AuthorizationService.class);

    static final String RESPONSE_TYPE_CODE = "code";

    @Inject
    AuthConfig authConfig;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    AuthorizationCodeRepository codeRepository;

    @Inject
    PkceService pkceService;

    @Inject
    OAuthMetrics metrics;

    /**
     * Validate an authorization request and route it to the consent screen.
     *
     * @return AWAITING_CONSENT with the consent URL, or REJECTED with an
     *         {@code invalid_scope} redirect to the client
     * @throws OAuthException for failures before redirect_uri is verified
     */
    public AuthorizationOutcome authorize(AuthorizationRequest request) {
        OAuthClient client;
        try {
            client = validate(request);
        } catch (OAuthException e) {
            LOG.infof("Rejected authorization request for client %s: %s", request.clientId(), e.getMessage());
            metrics.authorizeOutcome(AuthorizationState.REJECTED);
            throw e;
        }

        Set<OAuthScope> scopes = grantableScopes(request.scope(), client);
        if (scopes.isEmpty()) {
            LOG.infof("No grantable scope in '%s' for client %s", request.scope(), client.clientId);
            metrics.authorizeOutcome(AuthorizationState.REJECTED);
            return new AuthorizationOutcome(AuthorizationState.REJECTED,
                errorRedirect(request.redirectUri(), OAuthError.INVALID_SCOPE,
                    "None of the requested scopes are supported", request.state()));
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", client.clientId);
        params.put("client_name", client.clientName);
        params.put("logo_uri", client.logoUri);
        params.put("scope", OAuthScope.join(scopes));
        params.put("state", request.state());
        params.put("redirect_uri", request.redirectUri());
        params.put("code_challenge", request.codeChallenge());
        params.put("code_challenge_method", PkceService.METHOD_S256);
        params.put("nonce", request.nonce());

        LOG.debugf("Authorization request for client %s awaiting consent", client.clientId);
        metrics.authorizeOutcome(AuthorizationState.AWAITING_CONSENT);
        return new AuthorizationOutcome(AuthorizationState.AWAITING_CONSENT,
            RedirectUris.withQuery(authConfig.consent().uiUrl(), params));
    }

    /**
     * Apply the user's consent decision.
     *
     * The decision echoes the original request, so client, redirect_uri, state
     * and PKCE parameters are validated again here.
     *
     * @param userId the signed-in user making the decision
     * @return CODE_ISSUED or DENIED, with the client redirect target
     */
    public AuthorizationOutcome decide(String userId, ConsentDecision decision) {
        if (decision == null) {
            throw OAuthException.invalidRequest("Request body is required");
        }
        OAuthClient client = verifyClientAndRedirect(decision.clientId(), decision.redirectUri());
        if (isBlank(decision.state())) {
            throw OAuthException.invalidRequest("state is required");
        }
        if (decision.approved() == null) {
            throw OAuthException.invalidRequest("approved is required");
        }

        if (!decision.approved()) {
            LOG.infof("User %s denied consent for client %s", userId, client.clientId);
            metrics.authorizeOutcome(AuthorizationState.DENIED);
            return new AuthorizationOutcome(AuthorizationState.DENIED,
                errorRedirect(decision.redirectUri(), OAuthError.ACCESS_DENIED, "User denied consent", decision.state()));
        }

        validatePkceParameters(decision.codeChallenge(), decision.codeChallengeMethod());
        Set<OAuthScope> scopes = grantableScopes(decision.scope(), client);
        if (scopes.isEmpty()) {
            throw OAuthException.invalidScope("None of the requested scopes are supported");
        }

        AuthorizationCode authCode = new AuthorizationCode();
        authCode.code = TokenCrypto.generateSecureToken(TokenCrypto.AUTHORIZATION_CODE_BYTES);
        authCode.clientId = client.clientId;
        authCode.userId = userId;
        authCode.redirectUri = decision.redirectUri();
        authCode.scope = OAuthScope.join(scopes);
        authCode.codeChallenge = decision.codeChallenge();
        authCode.codeChallengeMethod = PkceService.METHOD_S256;
        authCode.state = decision.state();
        authCode.nonce = isBlank(decision.nonce()) ? null : decision.nonce();
        authCode.createdAt = Instant.now();
        authCode.expiresAt = authCode.createdAt.plus(authConfig.jwt().authorizationCodeExpiry());
        codeRepository.persist(authCode);

        LOG.infof("Issued authorization code for user %s, client %s, scope '%s'", userId, client.clientId, authCode.scope);
        metrics.authorizeOutcome(AuthorizationState.CODE_ISSUED);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("code", authCode.code);
        params.put("state", decision.state());
        return new AuthorizationOutcome(AuthorizationState.CODE_ISSUED,
            RedirectUris.withQuery(decision.redirectUri(), params));
    }

    /**
     * Steps that must pass before anything is sent to the redirect_uri, in order.
     */
    private OAuthClient validate(AuthorizationRequest request) {
        if (!RESPONSE_TYPE_CODE.equals(request.responseType())) {
            throw new OAuthException(OAuthError.UNSUPPORTED_RESPONSE_TYPE,
                "Only response_type=code is supported");
        }
        if (isBlank(request.clientId())) {
            throw OAuthException.invalidRequest("client_id is required");
        }
        if (isBlank(request.redirectUri())) {
            throw OAuthException.invalidRequest("redirect_uri is required");
        }
        if (isBlank(request.state())) {
            throw OAuthException.invalidRequest("state is required");
        }
        validatePkceParameters(request.codeChallenge(), request.codeChallengeMethod());
        return verifyClientAndRedirect(request.clientId(), request.redirectUri());
    }

    private void validatePkceParameters(String codeChallenge, String codeChallengeMethod) {
        if (isBlank(codeChallenge)) {
            throw OAuthException.invalidRequest("code_challenge is required (PKCE)");
        }
        if (codeChallengeMethod != null && !PkceService.METHOD_S256.equals(codeChallengeMethod)) {
            throw OAuthException.invalidRequest("code_challenge_method must be S256");
        }
        if (!pkceService.isValidCodeChallenge(codeChallenge)) {
            throw OAuthException.invalidRequest("code_challenge must be a 43 character base64url S256 value");
        }
    }

    private OAuthClient verifyClientAndRedirect(String clientId, String redirectUri) {
        if (isBlank(clientId)) {
            throw OAuthException.invalidRequest("client_id is required");
        }
        if (isBlank(redirectUri)) {
            throw OAuthException.invalidRequest("redirect_uri is required");
        }
        OAuthClient client = clientRegistry.getClient(clientId)
            .orElseThrow(() -> OAuthException.invalidClient("Unknown or inactive client"));
        if (!client.isRedirectUriAllowed(redirectUri)) {
            throw OAuthException.invalidRequest("redirect_uri is not registered for this client");
        }
        return client;
    }

    /**
     * Requested scopes reduced to the supported set, then to the client's allowed
     * scopes when it declares any. An absent scope parameter means {@code openid}.
     */
    Set<OAuthScope> grantableScopes(String requested, OAuthClient client) {
        String scope = isBlank(requested) ? OAuthScope.DEFAULT_SCOPE : requested;
        Set<OAuthScope> scopes = new LinkedHashSet<>(OAuthScope.parse(scope));
        if (client.allowedScopes != null && !client.allowedScopes.isEmpty()) {
            scopes.removeIf(s -> !client.allowedScopes.contains(s.value()));
        }
        return scopes;
    }

    private static String errorRedirect(String redirectUri, OAuthError error, String description, String state) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("error", error.code());
        params.put("error_description", description);
        params.put("state", state);
        return RedirectUris.withQuery(redirectUri, params);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
