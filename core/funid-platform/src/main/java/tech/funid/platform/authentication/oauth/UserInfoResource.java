package tech.funid.platform.authentication.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.Map;

/**
 * OIDC UserInfo endpoint.
 */
@Path("/oauth/userinfo")
@Tag(name = "OpenID Connect", description = "OIDC user claims")
@Produces(MediaType.APPLICATION_JSON)
public class UserInfoResource {

    @Inject
    UserInfoService userInfoService;

    @GET
    @Operation(summary = "Claims about the user owning the access token")
    @APIResponse(responseCode = "200", description = "Scope-gated user claims")
    @APIResponse(responseCode = "401", description = "Missing, invalid or expired access token")
    public Map<String, Object> userInfo(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        return userInfoService.userInfo(authorization);
    }
}
