package tech.funid.platform.shared;

/**
 * Entity types with their 3-character ID prefixes.
 *
 * IDs are stored with the prefix: "{prefix}_{tsid}" (e.g., "oac_0HZXEQ5Y8JY5Z"),
 * 17 characters in total.
 */
public enum EntityType {

    OAUTH_CLIENT("oac"),
    AUTH_CODE("acd"),
    TOKEN_FAMILY("tfm");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
