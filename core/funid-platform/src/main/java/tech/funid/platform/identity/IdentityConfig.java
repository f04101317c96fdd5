package tech.funid.platform.identity;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Credentials for the upstream platform. The base URL is the REST client
 * setting {@code quarkus.rest-client.identity-platform.url}.
 */
@ConfigMapping(prefix = "funid.identity")
public interface IdentityConfig {

    /**
     * Service key sent as {@code apikey} and as the bearer credential on
     * administrative lookups.
     */
    @WithName("service-key")
    Optional<String> serviceKey();
}
