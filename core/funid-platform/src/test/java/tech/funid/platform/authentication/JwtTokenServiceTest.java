package tech.funid.platform.authentication;

import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwx.HeaderParameterNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.funid.platform.authentication.JwtTokenService.AccessTokenClaims;
import tech.funid.platform.authentication.crypto.Base64Url;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for JwtTokenService signing and access token verification.
 */
class JwtTokenServiceTest {

    private TestAuthConfig config;
    private JwtTokenService service;

    @BeforeEach
    void setUp() {
        config = TestAuthConfig.withSharedKeys();
        service = AuthTestSupport.jwtTokenService(config, AuthTestSupport.keyMaterial(config));
    }

    private static Map<String, Object> header(String jwt) throws Exception {
        String json = new String(Base64Url.decode(jwt.split("\\.")[0]), StandardCharsets.UTF_8);
        return JwtClaims.parse(json).getClaimsMap();
    }

    private static JwtClaims payload(String jwt) throws Exception {
        return JwtClaims.parse(new String(Base64Url.decode(jwt.split("\\.")[1]), StandardCharsets.UTF_8));
    }

    private String handSigned(KeyPair keyPair, String typ, String kid, NumericDate expiresAt) throws Exception {
        JwtClaims claims = new JwtClaims();
        claims.setIssuer(config.issuer);
        claims.setSubject("user-1");
        claims.setClaim("client_id", "fun-play");
        claims.setClaim("scope", "openid");
        claims.setExpirationTime(expiresAt);

        JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(keyPair.getPrivate());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);
        jws.setKeyIdHeaderValue(kid);
        jws.setHeader(HeaderParameterNames.TYPE, typ);
        return jws.getCompactSerialization();
    }

    private static NumericDate inMinutes(float minutes) {
        NumericDate date = NumericDate.now();
        date.addSeconds((long) (minutes * 60));
        return date;
    }

    // ========================================
    // ISSUANCE TESTS
    // ========================================

    @Test
    @DisplayName("issueAccessToken should sign RS256 with typ at+jwt and the configured kid")
    void issueAccessToken_shouldSetHeaders() throws Exception {
        String token = service.issueAccessToken("user-1", "fun-play", "openid profile");

        Map<String, Object> header = header(token);
        assertThat(header).containsEntry("alg", "RS256")
            .containsEntry("typ", "at+jwt")
            .containsEntry("kid", "funid-test-key");

        JwtClaims claims = payload(token);
        assertThat(claims.getIssuer()).isEqualTo("https://id.funid.test");
        assertThat(claims.getSubject()).isEqualTo("user-1");
        assertThat(claims.getAudience()).containsExactly("fun-play");
        assertThat(claims.getClaimValue("client_id")).isEqualTo("fun-play");
        assertThat(claims.getClaimValue("scope")).isEqualTo("openid profile");
        assertThat(claims.getExpirationTime().getValue() - claims.getIssuedAt().getValue()).isEqualTo(3600L);
    }

    @Test
    @DisplayName("issueIdToken should carry identity claims and the nonce with typ JWT")
    void issueIdToken_shouldIncludeClaimsAndNonce() throws Exception {
        String token = service.issueIdToken("user-1", "fun-play", Map.of("name", "Camly"), "n-0S6");

        assertThat(header(token)).containsEntry("typ", "JWT").containsEntry("kid", "funid-test-key");
        JwtClaims claims = payload(token);
        assertThat(claims.getAudience()).containsExactly("fun-play");
        assertThat(claims.getClaimValue("name")).isEqualTo("Camly");
        assertThat(claims.getClaimValue("nonce")).isEqualTo("n-0S6");
    }

    @Test
    @DisplayName("issueIdToken should omit the nonce when none was requested")
    void issueIdToken_shouldOmitNonce_whenNull() throws Exception {
        String token = service.issueIdToken("user-1", "fun-play", Map.of(), null);

        assertThat(payload(token).hasClaim("nonce")).isFalse();
    }

    @Test
    @DisplayName("issueAccessToken should fail when no signing key is configured")
    void issueAccessToken_shouldThrow_whenNoKey() {
        TestAuthConfig empty = new TestAuthConfig();
        JwtTokenService unkeyed = AuthTestSupport.jwtTokenService(empty, AuthTestSupport.keyMaterial(empty));

        assertThatThrownBy(() -> unkeyed.issueAccessToken("user-1", "fun-play", "openid"))
            .isInstanceOf(KeyMaterialException.class);
    }

    // ========================================
    // VERIFICATION TESTS
    // ========================================

    @Test
    @DisplayName("verifyAccessToken should return the claims of a token it issued")
    void verifyAccessToken_shouldReturnClaims_whenIssuedHere() {
        String token = service.issueAccessToken("user-1", "fun-play", "openid email");

        AccessTokenClaims claims = service.verifyAccessToken(token).orElseThrow();

        assertThat(claims.subject()).isEqualTo("user-1");
        assertThat(claims.clientId()).isEqualTo("fun-play");
        assertThat(claims.scope()).isEqualTo("openid email");
        assertThat(claims.expiresAt()).isAfter(Instant.now());
    }

    @Test
    @DisplayName("verifyAccessToken should reject an ID token")
    void verifyAccessToken_shouldReject_whenIdToken() {
        String idToken = service.issueIdToken("user-1", "fun-play", Map.of(), null);

        assertThat(service.verifyAccessToken(idToken)).isEmpty();
    }

    @Test
    @DisplayName("verifyAccessToken should reject tokens signed by another key")
    void verifyAccessToken_shouldReject_whenSignedByOtherKey() throws Exception {
        String forged = handSigned(TestKeys.generate(), "at+jwt", "funid-test-key", inMinutes(5));

        assertThat(service.verifyAccessToken(forged)).isEmpty();
    }

    @Test
    @DisplayName("verifyAccessToken should reject expired tokens")
    void verifyAccessToken_shouldReject_whenExpired() throws Exception {
        String expired = handSigned(TestKeys.KEY_PAIR, "at+jwt", "funid-test-key", inMinutes(-5));
        String valid = handSigned(TestKeys.KEY_PAIR, "at+jwt", "funid-test-key", inMinutes(5));

        assertThat(service.verifyAccessToken(expired)).isEmpty();
        assertThat(service.verifyAccessToken(valid)).isPresent();
    }

    @Test
    @DisplayName("verifyAccessToken should reject a kid that is not published")
    void verifyAccessToken_shouldReject_whenKidUnknown() throws Exception {
        String token = handSigned(TestKeys.KEY_PAIR, "at+jwt", "retired-key", inMinutes(5));

        assertThat(service.verifyAccessToken(token)).isEmpty();
    }

    @Test
    @DisplayName("verifyAccessToken should reject tokens from another issuer")
    void verifyAccessToken_shouldReject_whenIssuerDiffers() {
        TestAuthConfig other = TestAuthConfig.withSharedKeys();
        other.issuer = "https://evil.example";
        String token = AuthTestSupport.jwtTokenService(other, AuthTestSupport.keyMaterial(other))
            .issueAccessToken("user-1", "fun-play", "openid");

        assertThat(service.verifyAccessToken(token)).isEmpty();
    }

    @Test
    @DisplayName("verifyAccessToken should reject garbage and blank input")
    void verifyAccessToken_shouldReject_whenMalformed() {
        assertThat(service.verifyAccessToken("not.a.jwt")).isEmpty();
        assertThat(service.verifyAccessToken("")).isEmpty();
        assertThat(service.verifyAccessToken(null)).isEmpty();
    }
}
