package tech.funid.platform.common;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.ext.Provider;

/**
 * Adds no-store headers to every OAuth endpoint response, errors included.
 * Tokens, codes and userinfo must never be cached by browsers or intermediaries.
 *
 * Discovery and JWKS under {@code .well-known/} are public and set their own
 * caching headers.
 */
@Provider
@Priority(Priorities.HEADER_DECORATOR)
public class NoCacheFilter implements ContainerResponseFilter {

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        String path = requestContext.getUriInfo().getPath();
        if (path.startsWith("/")) {
            path = path.substring(1);
        }
        if (!path.startsWith("oauth/")) {
            return;
        }

        responseContext.getHeaders().putSingle(HttpHeaders.CACHE_CONTROL, "no-store");
        responseContext.getHeaders().putSingle("Pragma", "no-cache");
    }
}
