package tech.funid.platform.identity;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PlatformIdentityStore.
 * Tests status code handling against a mocked platform client.
 */
@ExtendWith(MockitoExtension.class)
class PlatformIdentityStoreTest {

    private static final String USER_ID = "7f0c1c2e-4b7a-4c55-9a52-2f6f1d3b8e10";

    @Mock
    private PlatformIdentityClient client;

    @Mock
    private IdentityConfig config;

    @InjectMocks
    private PlatformIdentityStore store;

    @BeforeEach
    void setUp() {
        lenient().when(config.serviceKey()).thenReturn(Optional.of("svc-key"));
    }

    private static WebApplicationException httpError(int status) {
        Response response = mock(Response.class);
        lenient().when(response.getStatusInfo()).thenReturn(Response.Status.fromStatusCode(status));
        lenient().when(response.getStatus()).thenReturn(status);
        return new WebApplicationException(response);
    }

    // ========================================
    // PROFILE TESTS
    // ========================================

    @Test
    @DisplayName("getProfile should query by id with the service key")
    void getProfile_shouldReturnProfile_whenFound() {
        // Arrange
        UserProfile profile = new UserProfile(USER_ID, "Camly", null, "0xabc", new BigDecimal("10"));
        when(client.findProfiles("eq." + USER_ID, "*", "svc-key", "Bearer svc-key")).thenReturn(List.of(profile));

        // Act
        Optional<UserProfile> result = store.getProfile(USER_ID);

        // Assert
        assertThat(result).contains(profile);
    }

    @Test
    @DisplayName("getProfile should return empty when no row matches")
    void getProfile_shouldReturnEmpty_whenNoRows() {
        when(client.findProfiles(anyString(), anyString(), anyString(), anyString())).thenReturn(List.of());

        assertThat(store.getProfile(USER_ID)).isEmpty();
    }

    @Test
    @DisplayName("getProfile should return empty on 404")
    void getProfile_shouldReturnEmpty_when404() {
        WebApplicationException error = httpError(404);
        when(client.findProfiles(anyString(), anyString(), anyString(), anyString())).thenThrow(error);

        assertThat(store.getProfile(USER_ID)).isEmpty();
    }

    @Test
    @DisplayName("getProfile should fail closed on server errors")
    void getProfile_shouldThrow_when500() {
        WebApplicationException error = httpError(500);
        when(client.findProfiles(anyString(), anyString(), anyString(), anyString())).thenThrow(error);

        assertThatThrownBy(() -> store.getProfile(USER_ID))
            .isInstanceOf(IdentityStoreException.class)
            .hasMessageContaining("profile lookup");
    }

    // ========================================
    // EMAIL TESTS
    // ========================================

    @Test
    @DisplayName("getEmail should return the auth user's email")
    void getEmail_shouldReturnEmail_whenUserExists() {
        when(client.getUser(USER_ID, "svc-key", "Bearer svc-key")).thenReturn(new PlatformUser(USER_ID, "camly@fun.rich"));

        assertThat(store.getEmail(USER_ID)).contains("camly@fun.rich");
    }

    @Test
    @DisplayName("getEmail should return empty when the user has no email")
    void getEmail_shouldReturnEmpty_whenEmailMissing() {
        when(client.getUser(anyString(), anyString(), anyString())).thenReturn(new PlatformUser(USER_ID, null));

        assertThat(store.getEmail(USER_ID)).isEmpty();
    }

    @Test
    @DisplayName("getEmail should fail closed when the platform is unreachable")
    void getEmail_shouldThrow_whenUnreachable() {
        when(client.getUser(anyString(), anyString(), anyString()))
            .thenThrow(new ProcessingException("Connection refused"));

        assertThatThrownBy(() -> store.getEmail(USER_ID))
            .isInstanceOf(IdentityStoreException.class)
            .hasCauseInstanceOf(ProcessingException.class);
    }

    // ========================================
    // SESSION TESTS
    // ========================================

    @Test
    @DisplayName("resolveSessionUser should pass the session token as bearer credential")
    void resolveSessionUser_shouldReturnUserId_whenSessionValid() {
        when(client.getSessionUser("svc-key", "Bearer session-token")).thenReturn(new PlatformUser(USER_ID, null));

        assertThat(store.resolveSessionUser("session-token")).contains(USER_ID);
    }

    @Test
    @DisplayName("resolveSessionUser should return empty when the platform rejects the session")
    void resolveSessionUser_shouldReturnEmpty_when401() {
        WebApplicationException error = httpError(401);
        when(client.getSessionUser(anyString(), anyString())).thenThrow(error);

        assertThat(store.resolveSessionUser("expired")).isEmpty();
    }

    @Test
    @DisplayName("resolveSessionUser should not call the platform for a blank token")
    void resolveSessionUser_shouldReturnEmpty_whenTokenBlank() {
        assertThat(store.resolveSessionUser(" ")).isEmpty();
        assertThat(store.resolveSessionUser(null)).isEmpty();

        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("resolveSessionUser should fail closed on server errors")
    void resolveSessionUser_shouldThrow_when503() {
        WebApplicationException error = httpError(503);
        when(client.getSessionUser(anyString(), anyString())).thenThrow(error);

        assertThatThrownBy(() -> store.resolveSessionUser("session-token"))
            .isInstanceOf(IdentityStoreException.class);
    }
}
