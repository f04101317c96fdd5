package tech.funid.platform.identity;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;

/**
 * REST client for the upstream platform's data and auth APIs.
 */
@RegisterRestClient(configKey = "identity-platform")
@Produces(MediaType.APPLICATION_JSON)
public interface PlatformIdentityClient {

    /**
     * @param idFilter PostgREST filter, e.g. {@code eq.<uuid>}
     */
    @GET
    @Path("/rest/v1/profiles")
    List<UserProfile> findProfiles(@QueryParam("id") String idFilter,
                                   @QueryParam("select") String select,
                                   @HeaderParam("apikey") String apiKey,
                                   @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization);

    @GET
    @Path("/auth/v1/admin/users/{id}")
    PlatformUser getUser(@PathParam("id") String userId,
                         @HeaderParam("apikey") String apiKey,
                         @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization);

    /**
     * The user owning the bearer session token in {@code authorization}.
     */
    @GET
    @Path("/auth/v1/user")
    PlatformUser getSessionUser(@HeaderParam("apikey") String apiKey,
                                @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization);
}
