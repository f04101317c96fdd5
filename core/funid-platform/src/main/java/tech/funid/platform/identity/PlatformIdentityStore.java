package tech.funid.platform.identity;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * {@link IdentityStore} backed by the upstream platform REST API.
 *
 * 404 means "no such record"; 401/403 on session resolution means "not
 * signed in". Anything else fails closed with {@link IdentityStoreException}.
 */
@ApplicationScoped
public class PlatformIdentityStore implements IdentityStore {

    private static final Logger LOG = Logger.getLogger(PlatformIdentityStore.class);

    @Inject
    @RestClient
    PlatformIdentityClient client;

    @Inject
    IdentityConfig config;

    @Override
    public Optional<UserProfile> getProfile(String userId) {
        try {
            List<UserProfile> profiles = client.findProfiles("eq." + userId, "*", serviceKey(), bearer(serviceKey()));
            return profiles == null || profiles.isEmpty() ? Optional.empty() : Optional.of(profiles.get(0));
        } catch (WebApplicationException e) {
            if (status(e) == 404) {
                return Optional.empty();
            }
            throw failure("profile lookup", e);
        } catch (ProcessingException e) {
            throw failure("profile lookup", e);
        }
    }

    @Override
    public Optional<String> getEmail(String userId) {
        try {
            PlatformUser user = client.getUser(userId, serviceKey(), bearer(serviceKey()));
            return Optional.ofNullable(user).map(PlatformUser::email).filter(email -> !email.isBlank());
        } catch (WebApplicationException e) {
            if (status(e) == 404) {
                return Optional.empty();
            }
            throw failure("email lookup", e);
        } catch (ProcessingException e) {
            throw failure("email lookup", e);
        }
    }

    @Override
    public Optional<String> resolveSessionUser(String sessionToken) {
        if (sessionToken == null || sessionToken.isBlank()) {
            return Optional.empty();
        }
        try {
            PlatformUser user = client.getSessionUser(serviceKey(), bearer(sessionToken));
            return Optional.ofNullable(user).map(PlatformUser::id);
        } catch (WebApplicationException e) {
            int status = status(e);
            if (status == 401 || status == 403 || status == 404) {
                LOG.debugf("Session token rejected by identity platform (HTTP %d)", status);
                return Optional.empty();
            }
            throw failure("session resolution", e);
        } catch (ProcessingException e) {
            throw failure("session resolution", e);
        }
    }

    private String serviceKey() {
        return config.serviceKey().orElse("");
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    private static int status(WebApplicationException e) {
        return e.getResponse() != null ? e.getResponse().getStatus() : 0;
    }

    private static IdentityStoreException failure(String operation, RuntimeException cause) {
        LOG.errorf("Identity platform %s failed: %s", operation, cause.getMessage());
        return new IdentityStoreException("Identity platform " + operation + " failed", cause);
    }
}
