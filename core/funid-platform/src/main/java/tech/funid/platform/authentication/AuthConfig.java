package tech.funid.platform.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the FUN-ID identity provider.
 *
 * Example configuration:
 * <pre>
 * funid.auth.jwt.issuer=https://funprofile-api.funecosystem.org
 * funid.auth.jwt.key-id=funid-key-2026
 * funid.auth.jwt.private-key=${FUNID_RSA_PRIVATE_KEY}
 * funid.auth.consent.ui-url=https://example.org/oauth/consent
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "funid.auth")
public interface AuthConfig {

    /**
     * Public base URL used for endpoint URLs in the discovery document.
     * Defaults to the issuer.
     */
    @WithName("external-base-url")
    Optional<String> externalBaseUrl();

    /**
     * JWT signing and token lifetime configuration.
     */
    JwtConfig jwt();

    /**
     * External consent screen.
     */
    ConsentConfig consent();

    @WithName("refresh-token")
    RefreshTokenConfig refreshToken();

    CleanupConfig cleanup();

    /**
     * JWT configuration.
     */
    interface JwtConfig {
        /**
         * Token issuer (iss claim).
         * Should match the public URL of this service.
         */
        @WithDefault("https://funprofile-api.funecosystem.org")
        String issuer();

        /**
         * Key id published in the JWKS and set as the kid header.
         * Derived from the public key when not set.
         */
        @WithName("key-id")
        Optional<String> keyId();

        /**
         * Inline PKCS#8 private key (PEM). Takes precedence over {@link #privateKeyPath()}.
         */
        @WithName("private-key")
        Optional<String> privateKey();

        /**
         * Inline SPKI public key (PEM). Derived from the private key when absent.
         */
        @WithName("public-key")
        Optional<String> publicKey();

        @WithName("private-key-path")
        Optional<String> privateKeyPath();

        @WithName("public-key-path")
        Optional<String> publicKeyPath();

        /**
         * Generate and persist an RSA key pair when no key is configured.
         * Development only.
         */
        @WithName("generate-dev-keys")
        @WithDefault("false")
        boolean generateDevKeys();

        @WithName("dev-key-dir")
        @WithDefault(".jwt-keys")
        String devKeyDir();

        /**
         * Access token expiry duration.
         * Default: 1 hour
         */
        @WithName("access-token-expiry")
        @WithDefault("PT1H")
        Duration accessTokenExpiry();

        /**
         * ID token expiry duration.
         * Default: 1 hour
         */
        @WithName("id-token-expiry")
        @WithDefault("PT1H")
        Duration idTokenExpiry();

        /**
         * Refresh token expiry duration.
         * Default: 30 days
         */
        @WithName("refresh-token-expiry")
        @WithDefault("P30D")
        Duration refreshTokenExpiry();

        /**
         * Authorization code expiry duration.
         * Default: 10 minutes
         */
        @WithName("authorization-code-expiry")
        @WithDefault("PT10M")
        Duration authorizationCodeExpiry();
    }

    interface ConsentConfig {
        /**
         * URL of the consent screen the authorize endpoint redirects to.
         */
        @WithName("ui-url")
        @WithDefault("https://soul-spark-web3.lovable.app/oauth/consent")
        String uiUrl();
    }

    interface RefreshTokenConfig {
        /**
         * Revoke every token in a rotation family when an already-rotated
         * token is presented again.
         */
        @WithName("revoke-family-on-reuse")
        @WithDefault("true")
        boolean revokeFamilyOnReuse();
    }

    interface CleanupConfig {
        @WithDefault("true")
        boolean enabled();

        /**
         * Sweep interval, in Quarkus scheduler syntax.
         */
        @WithDefault("1h")
        String interval();
    }
}
