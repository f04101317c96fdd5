package tech.funid.platform.authentication.oauth;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scopes understood by the identity provider and the claims they unlock.
 */
public enum OAuthScope {

    OPENID("openid"),
    /** name, picture */
    PROFILE("profile"),
    /** email, email_verified */
    EMAIL("email"),
    /** wallet_address, camly_balance */
    WALLET("wallet");

    /** Used when an authorization request carries no scope parameter. */
    public static final String DEFAULT_SCOPE = "openid";

    private final String value;

    OAuthScope(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<OAuthScope> fromValue(String value) {
        return Arrays.stream(values()).filter(s -> s.value.equals(value)).findFirst();
    }

    /**
     * Parse a space-delimited scope string, keeping request order and dropping
     * duplicates and unknown values.
     */
    public static Set<OAuthScope> parse(String scope) {
        Set<OAuthScope> scopes = new LinkedHashSet<>();
        if (scope == null || scope.isBlank()) {
            return scopes;
        }
        for (String part : scope.trim().split("\\s+")) {
            fromValue(part).ifPresent(scopes::add);
        }
        return scopes;
    }

    public static String join(Collection<OAuthScope> scopes) {
        return scopes.stream().map(OAuthScope::value).collect(Collectors.joining(" "));
    }

    public static Set<String> supportedValues() {
        return Arrays.stream(values()).map(OAuthScope::value).collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
