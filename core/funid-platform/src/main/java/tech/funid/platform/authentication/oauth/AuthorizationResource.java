package tech.funid.platform.authentication.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.parameters.RequestBody;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.funid.platform.identity.IdentityStore;

import java.net.URI;
import java.util.Map;

/**
 * OAuth2 authorization endpoint (authorization code flow with mandatory PKCE).
 *
 * The browser hits {@code GET /oauth/authorize} and is redirected to the
 * consent screen. The consent screen, acting for a signed-in user, posts the
 * decision to {@code /oauth/authorize/callback} and receives the redirect
 * target to send the browser to.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749">RFC 6749 - OAuth 2.0</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@Path("/oauth/authorize")
@Tag(name = "OAuth2 Authorization", description = "OAuth2 authorization code flow endpoints")
public class AuthorizationResource {

    @Inject
    AuthorizationService authorizationService;

    @Inject
    IdentityStore identityStore;

    @Inject
    OAuthJsonBodies jsonBodies;

    /**
     * GET /oauth/authorize?
     *   response_type=code
     *   &client_id=my-spa
     *   &redirect_uri=https://app.example.com/callback
     *   &scope=openid profile
     *   &state=xyz123
     *   &code_challenge=E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM
     *   &code_challenge_method=S256
     */
    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Start authorization code flow")
    @APIResponse(responseCode = "302", description = "Redirect to the consent screen, or invalid_scope redirect to the client")
    @APIResponse(responseCode = "400", description = "Invalid request, reported directly")
    public Response authorize(
            @Parameter(description = "Must be 'code'")
            @QueryParam("response_type") String responseType,

            @Parameter(description = "OAuth client ID")
            @QueryParam("client_id") String clientId,

            @Parameter(description = "Registered redirect URI")
            @QueryParam("redirect_uri") String redirectUri,

            @Parameter(description = "Requested scopes (space-separated), defaults to openid")
            @QueryParam("scope") String scope,

            @Parameter(description = "Client state for CSRF protection")
            @QueryParam("state") String state,

            @Parameter(description = "PKCE code challenge")
            @QueryParam("code_challenge") String codeChallenge,

            @Parameter(description = "PKCE challenge method, S256 only")
            @QueryParam("code_challenge_method") String codeChallengeMethod,

            @Parameter(description = "OIDC nonce for replay protection")
            @QueryParam("nonce") String nonce
    ) {
        AuthorizationOutcome outcome = authorizationService.authorize(new AuthorizationRequest(
            responseType, clientId, redirectUri, scope, state, codeChallenge, codeChallengeMethod, nonce));
        return Response.status(Response.Status.FOUND)
            .location(URI.create(outcome.redirectUri()))
            .build();
    }

    /**
     * Consent decision from the consent screen. Returns the redirect target as
     * {@code {"redirect_uri": "..."}} for the caller to navigate to.
     */
    @POST
    @Path("/callback")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Record the user's consent decision")
    @APIResponse(responseCode = "200", description = "Redirect descriptor with code or access_denied")
    @APIResponse(responseCode = "401", description = "No signed-in user")
    public Response callback(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestBody(content = @Content(schema = @Schema(implementation = ConsentDecision.class)))
            String body
    ) {
        String sessionToken = UserInfoService.bearerToken(authorization)
            .orElseThrow(() -> OAuthException.invalidToken("Missing authorization token"));
        String userId = identityStore.resolveSessionUser(sessionToken)
            .orElseThrow(() -> OAuthException.invalidToken("Invalid or expired session"));

        AuthorizationOutcome outcome = authorizationService.decide(userId, jsonBodies.readConsentDecision(body));
        return Response.ok(Map.of("redirect_uri", outcome.redirectUri())).build();
    }
}
