package tech.funid.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.funid.platform.authentication.JwtTokenService;
import tech.funid.platform.authentication.JwtTokenService.AccessTokenClaims;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a bearer access token into the OIDC userinfo document.
 * Subject and scope come only from the verified token.
 */
@ApplicationScoped
public class UserInfoService {

    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    JwtTokenService jwtTokenService;

    @Inject
    ClaimsAssembler claimsAssembler;

    public Map<String, Object> userInfo(String authorizationHeader) {
        String token = bearerToken(authorizationHeader)
            .orElseThrow(() -> OAuthException.invalidToken("Missing or invalid Authorization header"));
        AccessTokenClaims claims = jwtTokenService.verifyAccessToken(token)
            .orElseThrow(() -> OAuthException.invalidToken("Invalid or expired access token"));

        Map<String, Object> userInfo = new LinkedHashMap<>();
        userInfo.put("sub", claims.subject());
        userInfo.putAll(claimsAssembler.identityClaims(claims.subject(), OAuthScope.parse(claims.scope())));
        return userInfo;
    }

    static Optional<String> bearerToken(String authorizationHeader) {
        if (authorizationHeader == null
            || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
