package tech.funid.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.funid.platform.identity.IdentityStore;
import tech.funid.platform.identity.UserProfile;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the scope-gated user claims shared by ID tokens and the userinfo
 * response. A claim is only ever looked up when its scope was granted.
 *
 * <ul>
 *   <li>profile: {@code name}, {@code picture}</li>
 *   <li>email: {@code email}, {@code email_verified} (always true, the platform verifies emails)</li>
 *   <li>wallet: {@code wallet_address}, {@code camly_balance}</li>
 * </ul>
 */
@ApplicationScoped
public class ClaimsAssembler {

    @Inject
    IdentityStore identityStore;

    public Map<String, Object> identityClaims(String userId, Set<OAuthScope> scopes) {
        Map<String, Object> claims = new LinkedHashMap<>();

        boolean profileScope = scopes.contains(OAuthScope.PROFILE);
        boolean walletScope = scopes.contains(OAuthScope.WALLET);
        if (profileScope || walletScope) {
            Optional<UserProfile> profile = identityStore.getProfile(userId);
            if (profile.isPresent()) {
                UserProfile p = profile.get();
                if (profileScope) {
                    putIfPresent(claims, "name", p.displayName());
                    putIfPresent(claims, "picture", p.avatarUrl());
                }
                if (walletScope) {
                    putIfPresent(claims, "wallet_address", p.walletAddress());
                    if (p.balance() != null) {
                        claims.put("camly_balance", p.balance());
                    }
                }
            }
        }

        if (scopes.contains(OAuthScope.EMAIL)) {
            identityStore.getEmail(userId).ifPresent(email -> {
                claims.put("email", email);
                claims.put("email_verified", true);
            });
        }
        return claims;
    }

    private static void putIfPresent(Map<String, Object> claims, String name, String value) {
        if (value != null && !value.isBlank()) {
            claims.put(name, value);
        }
    }
}
