package tech.funid.platform.authentication.oauth;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.funid.platform.authentication.crypto.TokenCrypto;

/**
 * One-way hashing of OAuth client secrets.
 *
 * Stored hashes carry a format tag so the algorithm can be migrated without
 * invalidating existing clients:
 * <ul>
 *   <li>{@code sha256:<base64url>} - written by {@link #hash(String)}. Client
 *       secrets are high-entropy random values, so a fast digest is enough.</li>
 *   <li>{@code $argon2id$...} - PHC strings, accepted on verification for
 *       secrets provisioned through the password tooling.</li>
 * </ul>
 * Any other tag never verifies.
 */
@ApplicationScoped
public class ClientSecretHasher {

    private static final Logger LOG = Logger.getLogger(ClientSecretHasher.class);

    static final String SHA256_PREFIX = "sha256:";
    static final String ARGON2ID_PREFIX = "$argon2id$";

    private static final int HASH_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    private final Argon2 argon2;

    public ClientSecretHasher() {
        this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id, SALT_LENGTH, HASH_LENGTH);
    }

    /**
     * Hash a client secret in the default {@code sha256:} format.
     */
    public String hash(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Client secret cannot be null or empty");
        }
        return SHA256_PREFIX + TokenCrypto.sha256Base64Url(secret);
    }

    /**
     * Verify a presented secret against a stored, tagged hash.
     */
    public boolean verify(String secret, String storedHash) {
        if (secret == null || storedHash == null) {
            return false;
        }
        if (storedHash.startsWith(SHA256_PREFIX)) {
            String expected = storedHash.substring(SHA256_PREFIX.length());
            return TokenCrypto.constantTimeEquals(TokenCrypto.sha256Base64Url(secret), expected);
        }
        if (storedHash.startsWith(ARGON2ID_PREFIX)) {
            try {
                return argon2.verify(storedHash, secret.toCharArray());
            } catch (RuntimeException e) {
                LOG.warnf("Malformed argon2id client secret hash: %s", e.getMessage());
                return false;
            }
        }
        LOG.warn("Client secret hash has an unknown format tag");
        return false;
    }
}
