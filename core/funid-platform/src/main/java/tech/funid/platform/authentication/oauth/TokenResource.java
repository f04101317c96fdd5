package tech.funid.platform.authentication.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * OAuth2 token endpoint.
 *
 * Accepts form-encoded (RFC 6749) or JSON bodies. Client credentials may be
 * sent in the body or as HTTP Basic. Errors are never redirected.
 */
@Path("/oauth/token")
@Tag(name = "OAuth2 Authorization", description = "OAuth2 authorization code flow endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class TokenResource {

    @Inject
    TokenService tokenService;

    @Inject
    OAuthJsonBodies jsonBodies;

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "Exchange an authorization code or refresh token")
    @APIResponse(responseCode = "200", description = "Token set")
    @APIResponse(responseCode = "400", description = "OAuth error response")
    public TokenResponse token(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            MultivaluedMap<String, String> form
    ) {
        return tokenService.exchange(TokenRequest.fromForm(form).withBasicCredentials(authorization));
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Exchange an authorization code or refresh token (JSON body)")
    public TokenResponse tokenJson(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            String body
    ) {
        return tokenService.exchange(TokenRequest.fromJson(jsonBodies.readObject(body)).withBasicCredentials(authorization));
    }

    @POST
    @Consumes(MediaType.WILDCARD)
    @Operation(hidden = true)
    public TokenResponse unsupportedBody() {
        throw OAuthException.invalidRequest(
            "Content-Type must be application/x-www-form-urlencoded or application/json");
    }
}
