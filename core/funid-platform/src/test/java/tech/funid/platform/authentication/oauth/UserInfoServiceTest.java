package tech.funid.platform.authentication.oauth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static tech.funid.platform.authentication.oauth.OAuthTestFixture.*;

class UserInfoServiceTest {

    private OAuthTestFixture fixture;
    private UserInfoService service;

    @BeforeEach
    void setUp() {
        fixture = new OAuthTestFixture();
        service = fixture.userInfoService;
    }

    private static OAuthError errorOf(Throwable e) {
        return ((OAuthException) e).error();
    }

    @Test
    @DisplayName("userInfo should return sub and the claims unlocked by the token scope")
    void userInfo_shouldReturnScopedClaims() {
        String token = fixture.jwtTokenService.issueAccessToken(USER_ID, PUBLIC_CLIENT_ID, "openid email");

        Map<String, Object> info = service.userInfo("Bearer " + token);

        assertThat(info).containsOnlyKeys("sub", "email", "email_verified")
            .containsEntry("sub", USER_ID)
            .containsEntry("email", "camly@fun.rich")
            .containsEntry("email_verified", true);
    }

    @Test
    @DisplayName("userInfo should include profile and wallet claims when granted")
    void userInfo_shouldIncludeProfileAndWallet() {
        String token = fixture.jwtTokenService.issueAccessToken(USER_ID, PUBLIC_CLIENT_ID, "openid profile wallet");

        Map<String, Object> info = service.userInfo("bearer " + token);

        assertThat(info)
            .containsEntry("name", "Camly Duong")
            .containsEntry("picture", "https://cdn.fun.rich/a.png")
            .containsEntry("wallet_address", "0xabc123")
            .containsKey("camly_balance")
            .doesNotContainKey("email");
    }

    @Test
    @DisplayName("userInfo should return only sub when the user has no profile")
    void userInfo_shouldReturnOnlySub_whenProfileMissing() {
        String token = fixture.jwtTokenService.issueAccessToken("unknown-user", PUBLIC_CLIENT_ID, "openid profile email");

        assertThat(service.userInfo("Bearer " + token)).containsOnlyKeys("sub");
    }

    @Test
    @DisplayName("userInfo should reject a missing or non-bearer Authorization header")
    void userInfo_shouldThrowInvalidToken_whenHeaderMissing() {
        assertThatThrownBy(() -> service.userInfo(null))
            .satisfies(e -> assertThat(errorOf(e)).isEqualTo(OAuthError.INVALID_TOKEN));
        assertThatThrownBy(() -> service.userInfo("Basic abc"))
            .satisfies(e -> assertThat(errorOf(e)).isEqualTo(OAuthError.INVALID_TOKEN));
        assertThatThrownBy(() -> service.userInfo("Bearer "))
            .satisfies(e -> assertThat(((OAuthException) e).status()).isEqualTo(401));
    }

    @Test
    @DisplayName("userInfo should reject an ID token presented as bearer credential")
    void userInfo_shouldThrowInvalidToken_whenIdTokenPresented() {
        String idToken = fixture.jwtTokenService.issueIdToken(USER_ID, PUBLIC_CLIENT_ID, Map.of(), null);

        assertThatThrownBy(() -> service.userInfo("Bearer " + idToken))
            .satisfies(e -> assertThat(errorOf(e)).isEqualTo(OAuthError.INVALID_TOKEN))
            .hasMessageContaining("Invalid or expired access token");
    }

    @Test
    @DisplayName("bearerToken should parse the scheme case-insensitively")
    void bearerToken_shouldIgnoreSchemeCase() {
        assertThat(UserInfoService.bearerToken("BEARER abc")).contains("abc");
        assertThat(UserInfoService.bearerToken("Bearer  abc ")).contains("abc");
        assertThat(UserInfoService.bearerToken("Bearerabc")).isEmpty();
    }
}
