package tech.funid.platform.authentication.oauth;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Map;

/**
 * Renders {@link OAuthException} as the OAuth 2.0 error response:
 * <pre>
 * { "error": "invalid_grant", "error_description": "..." }
 * </pre>
 * {@code invalid_token} additionally gets a {@code WWW-Authenticate} challenge (RFC 6750).
 */
@Provider
public class OAuthExceptionMapper implements ExceptionMapper<OAuthException> {

    @Override
    public Response toResponse(OAuthException exception) {
        Response.ResponseBuilder response = Response.status(exception.status())
            .type(MediaType.APPLICATION_JSON)
            .entity(Map.of(
                "error", exception.error().code(),
                "error_description", exception.description()));

        if (exception.error() == OAuthError.INVALID_TOKEN) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, String.format(
                "Bearer error=\"%s\", error_description=\"%s\"",
                exception.error().code(), exception.description().replace("\"", "'")));
        }
        return response.build();
    }
}
