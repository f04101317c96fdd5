package tech.funid.platform.authentication.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body the consent screen posts to {@code /oauth/authorize/callback}. It
 * echoes the authorization request, so every field is re-validated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsentDecision(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("redirect_uri") String redirectUri,
    @JsonProperty("scope") String scope,
    @JsonProperty("state") String state,
    @JsonProperty("code_challenge") String codeChallenge,
    @JsonProperty("code_challenge_method") String codeChallengeMethod,
    @JsonProperty("nonce") String nonce,
    @JsonProperty("approved") Boolean approved
) {
}
