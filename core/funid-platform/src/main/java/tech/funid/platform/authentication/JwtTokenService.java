package tech.funid.platform.authentication;

import io.smallrye.jwt.algorithm.SignatureAlgorithm;
import io.smallrye.jwt.build.Jwt;
import io.smallrye.jwt.build.JwtClaimsBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.jwt.consumer.JwtContext;
import org.jose4j.jwx.HeaderParameterNames;
import org.jose4j.jwx.JsonWebStructure;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Issues and verifies the RS256 tokens of the identity provider.
 *
 * Access tokens and ID tokens are signed with the same key but carry
 * different {@code typ} headers ({@code at+jwt} vs {@code JWT}); verification
 * of an access token rejects anything else, so an ID token can never be
 * replayed as a bearer credential.
 */
@ApplicationScoped
public class JwtTokenService {

    private static final Logger LOG = Logger.getLogger(JwtTokenService.class);

    public static final String ACCESS_TOKEN_TYPE = "at+jwt";
    public static final String ID_TOKEN_TYPE = "JWT";

    @Inject
    AuthConfig authConfig;

    @Inject
    KeyMaterial keyMaterial;

    /**
     * Claims of a verified access token.
     */
    public record AccessTokenClaims(String subject, String clientId, String scope, Instant expiresAt) {
    }

    /**
     * Sign an access token for {@code subject}, audience {@code clientId}.
     */
    public String issueAccessToken(String subject, String clientId, String scope) {
        Instant now = Instant.now();
        JwtClaimsBuilder builder = Jwt.issuer(issuer())
            .subject(subject)
            .audience(clientId)
            .claim("client_id", clientId)
            .claim("scope", scope)
            .issuedAt(now)
            .expiresAt(now.plus(accessTokenExpiry()));
        return sign(builder, ACCESS_TOKEN_TYPE);
    }

    /**
     * Sign an ID token.
     *
     * @param identityClaims scope-gated user claims (name, email, wallet...)
     * @param nonce the authorization request nonce, or null to omit it
     */
    public String issueIdToken(String subject, String audience, Map<String, Object> identityClaims, String nonce) {
        Instant now = Instant.now();
        JwtClaimsBuilder builder = Jwt.claims(identityClaims)
            .issuer(issuer())
            .subject(subject)
            .audience(audience)
            .issuedAt(now)
            .expiresAt(now.plus(authConfig.jwt().idTokenExpiry()));
        if (nonce != null) {
            builder.claim("nonce", nonce);
        }
        return sign(builder, ID_TOKEN_TYPE);
    }

    /**
     * Verify an access token against the published key and this issuer.
     *
     * @return the verified claims, or empty if the token is malformed, expired,
     *         signed by another key, issued by someone else or not an access token
     */
    public Optional<AccessTokenClaims> verifyAccessToken(String token) {
        Optional<KeyMaterial.SigningKeys> keys = keyMaterial.current();
        if (keys.isEmpty() || token == null || token.isBlank()) {
            return Optional.empty();
        }

        JwtConsumer consumer = new JwtConsumerBuilder()
            .setRequireExpirationTime()
            .setRequireSubject()
            .setExpectedIssuer(issuer())
            .setSkipDefaultAudienceValidation()
            .setVerificationKey(keys.get().publicKey())
            .setJwsAlgorithmConstraints(new AlgorithmConstraints(
                AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256))
            .build();

        try {
            JwtContext context = consumer.process(token);
            JsonWebStructure jws = context.getJoseObjects().get(0);

            String typ = jws.getHeader(HeaderParameterNames.TYPE);
            if (!ACCESS_TOKEN_TYPE.equalsIgnoreCase(typ)) {
                LOG.debugf("Rejected token with typ %s as access token", typ);
                return Optional.empty();
            }
            String kid = jws.getKeyIdHeaderValue();
            if (kid != null && !kid.equals(keys.get().keyId())) {
                LOG.debugf("Rejected token signed with unknown key ID %s", kid);
                return Optional.empty();
            }

            JwtClaims claims = context.getJwtClaims();
            return Optional.of(new AccessTokenClaims(
                claims.getSubject(),
                claims.getStringClaimValue("client_id"),
                claims.getStringClaimValue("scope"),
                Instant.ofEpochMilli(claims.getExpirationTime().getValueInMillis())));
        } catch (InvalidJwtException | MalformedClaimException e) {
            LOG.debugf("Access token validation failed: %s", e.getMessage());
            return Optional.empty();
        }
    }

    public String issuer() {
        return authConfig.jwt().issuer();
    }

    public Duration accessTokenExpiry() {
        return authConfig.jwt().accessTokenExpiry();
    }

    private String sign(JwtClaimsBuilder builder, String type) {
        KeyMaterial.SigningKeys keys = keyMaterial.signingKeys();
        return builder.jws()
            .algorithm(SignatureAlgorithm.RS256)
            .keyId(keys.keyId())
            .header(HeaderParameterNames.TYPE, type)
            .sign(keys.privateKey());
    }
}
