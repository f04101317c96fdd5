package tech.funid.platform.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Profile attributes exposed through OIDC claims. Every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserProfile(
    @JsonProperty("id") String id,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("avatar_url") String avatarUrl,
    @JsonProperty("wallet_address") String walletAddress,
    @JsonProperty("camly_balance") BigDecimal balance
) {
}
