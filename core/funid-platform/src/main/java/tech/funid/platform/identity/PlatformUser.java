package tech.funid.platform.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Auth user record returned by the upstream platform.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlatformUser(String id, String email) {
}
