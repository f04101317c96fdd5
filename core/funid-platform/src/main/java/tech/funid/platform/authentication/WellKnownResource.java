package tech.funid.platform.authentication;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;
import java.util.Map;

/**
 * Well-known endpoints for OAuth2/OIDC discovery.
 * Public, unauthenticated and cacheable.
 */
@Path("/.well-known")
@Tag(name = "Discovery", description = "OAuth2/OIDC discovery endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class WellKnownResource {

    static final String DISCOVERY_CACHE_CONTROL = "public, max-age=3600";
    static final String JWKS_CACHE_CONTROL = "public, max-age=3600, stale-while-revalidate=86400";

    @Inject
    AuthConfig authConfig;

    @Inject
    KeyMaterial keyMaterial;

    /**
     * JSON Web Key Set (JWKS) endpoint.
     * Returns an empty set while no key is configured.
     */
    @GET
    @Path("/jwks.json")
    @Operation(summary = "Get JSON Web Key Set for token verification")
    @APIResponse(responseCode = "200", description = "JWKS document")
    public Response jwks() {
        List<Map<String, Object>> keys = keyMaterial.publicJwk().map(jwk -> List.of(jwk)).orElse(List.of());
        return Response.ok(Map.of("keys", keys))
            .header(HttpHeaders.CACHE_CONTROL, JWKS_CACHE_CONTROL)
            .header("Access-Control-Allow-Origin", "*")
            .build();
    }

    /**
     * OpenID Connect Discovery endpoint.
     */
    @GET
    @Path("/openid-configuration")
    @Operation(summary = "Get OpenID Connect discovery document")
    @APIResponse(responseCode = "200", description = "OpenID configuration")
    public Response openIdConfiguration() {
        String issuer = authConfig.jwt().issuer();
        String baseUrl = authConfig.externalBaseUrl().orElse(issuer).replaceAll("/$", "");
        return Response.ok(OpenIdConfiguration.of(issuer, baseUrl))
            .header(HttpHeaders.CACHE_CONTROL, DISCOVERY_CACHE_CONTROL)
            .header("Access-Control-Allow-Origin", "*")
            .build();
    }
}
