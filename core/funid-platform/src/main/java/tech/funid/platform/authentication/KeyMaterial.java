package tech.funid.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.funid.platform.authentication.crypto.Base64Url;
import tech.funid.platform.authentication.crypto.TokenCrypto;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the RSA key pair used to sign and verify tokens.
 *
 * Keys are imported lazily on first use and cached for the life of the
 * process. The cache is a single volatile reference to an immutable
 * {@link SigningKeys}; two threads importing concurrently produce equal
 * values, so the race is harmless. {@link #clear()} and {@link #rotate()}
 * drop the cache so a new key can be picked up without a restart.
 *
 * Key sources, first match wins:
 * <ol>
 *   <li>inline PEM ({@code funid.auth.jwt.private-key} / {@code public-key})</li>
 *   <li>PEM files ({@code private-key-path} / {@code public-key-path})</li>
 *   <li>generated dev keys, when {@code generate-dev-keys} is enabled</li>
 * </ol>
 * With no source the provider still starts: JWKS is empty and signing fails.
 */
@ApplicationScoped
public class KeyMaterial {

    private static final Logger LOG = Logger.getLogger(KeyMaterial.class);

    public static final String ALGORITHM = "RS256";
    private static final int KEY_SIZE = 2048;

    @Inject
    AuthConfig authConfig;

    private volatile SigningKeys cached;

    /**
     * Imported key pair. {@code privateKey} is null when only a public key is configured.
     */
    public record SigningKeys(RSAPrivateKey privateKey, RSAPublicKey publicKey, String keyId) {

        public boolean canSign() {
            return privateKey != null;
        }
    }

    /**
     * The current keys, importing them on first call.
     *
     * @return empty when no key source is configured
     * @throws KeyMaterialException if a configured key cannot be read or parsed
     */
    public Optional<SigningKeys> current() {
        SigningKeys keys = cached;
        if (keys == null) {
            keys = load();
            if (keys != null) {
                cached = keys;
                LOG.infof("RSA key material loaded with key ID: %s (signing %s)",
                    keys.keyId(), keys.canSign() ? "enabled" : "disabled");
            }
        }
        return Optional.ofNullable(keys);
    }

    /**
     * Keys able to sign.
     *
     * @throws KeyMaterialException if no private key is configured
     */
    public SigningKeys signingKeys() {
        SigningKeys keys = current()
            .orElseThrow(() -> new KeyMaterialException("No RSA signing key configured"));
        if (!keys.canSign()) {
            throw new KeyMaterialException("Only a public key is configured; token signing is unavailable");
        }
        return keys;
    }

    /**
     * The public key as a JWK, or empty when no key is configured.
     */
    public Optional<Map<String, Object>> publicJwk() {
        return current().map(keys -> toJwk(keys.publicKey(), keys.keyId()));
    }

    /**
     * Drop the cached keys. The next call re-imports from configuration.
     */
    public void clear() {
        cached = null;
        LOG.info("RSA key material cache cleared");
    }

    /**
     * Drop the cached keys and import them again immediately.
     */
    public Optional<SigningKeys> rotate() {
        String previous = cached != null ? cached.keyId() : null;
        clear();
        Optional<SigningKeys> next = current();
        LOG.infof("RSA key material rotated: %s -> %s", previous, next.map(SigningKeys::keyId).orElse(null));
        return next;
    }

    private SigningKeys load() {
        AuthConfig.JwtConfig jwt = authConfig.jwt();
        try {
            String privatePem = readPem(jwt.privateKey(), jwt.privateKeyPath());
            String publicPem = readPem(jwt.publicKey(), jwt.publicKeyPath());

            if (privatePem == null && publicPem == null) {
                if (jwt.generateDevKeys()) {
                    return loadOrGenerateDevKeys(Path.of(jwt.devKeyDir()));
                }
                LOG.warn("No RSA key configured; JWKS will be empty and token issuance will fail");
                return null;
            }

            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            RSAPrivateKey privateKey = privatePem == null ? null
                : (RSAPrivateKey) keyFactory.generatePrivate(new PKCS8EncodedKeySpec(parsePemKey(privatePem, "PRIVATE KEY")));
            RSAPublicKey publicKey = publicPem != null
                ? (RSAPublicKey) keyFactory.generatePublic(new X509EncodedKeySpec(parsePemKey(publicPem, "PUBLIC KEY")))
                : derivePublicKey(keyFactory, privateKey);

            int bits = publicKey.getModulus().bitLength();
            if (bits < KEY_SIZE) {
                throw new KeyMaterialException("RSA key is " + bits + " bits; at least " + KEY_SIZE + " are required");
            }
            return new SigningKeys(privateKey, publicKey, keyId(publicKey));
        } catch (IOException | GeneralSecurityException | IllegalArgumentException | ClassCastException e) {
            throw new KeyMaterialException("Failed to load RSA key material", e);
        }
    }

    private String readPem(Optional<String> inline, Optional<String> path) throws IOException {
        Optional<String> value = inline.filter(v -> !v.isBlank());
        if (value.isPresent()) {
            return value.get();
        }
        Optional<String> file = path.filter(v -> !v.isBlank());
        if (file.isPresent()) {
            return Files.readString(Path.of(file.get()), StandardCharsets.US_ASCII);
        }
        return null;
    }

    /**
     * Strip PEM armour and whitespace. Literal {@code \n} sequences, common when
     * keys are passed through environment variables, are removed too.
     */
    static byte[] parsePemKey(String pem, String type) {
        String base64 = pem
            .replace("-----BEGIN " + type + "-----", "")
            .replace("-----END " + type + "-----", "")
            .replace("\\n", "")
            .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    private RSAPublicKey derivePublicKey(KeyFactory keyFactory, RSAPrivateKey privateKey) throws GeneralSecurityException {
        if (!(privateKey instanceof RSAPrivateCrtKey crt)) {
            throw new KeyMaterialException("Public key not configured and cannot be derived from the private key");
        }
        return (RSAPublicKey) keyFactory.generatePublic(new RSAPublicKeySpec(crt.getModulus(), crt.getPublicExponent()));
    }

    /**
     * Load dev keys from a local directory, or generate and persist new ones,
     * so tokens survive restarts during development.
     */
    private SigningKeys loadOrGenerateDevKeys(Path keyDir) throws IOException, GeneralSecurityException {
        Path privateKeyFile = keyDir.resolve("private.key");
        Path publicKeyFile = keyDir.resolve("public.key");

        RSAPrivateKey privateKey;
        RSAPublicKey publicKey;
        if (Files.exists(privateKeyFile) && Files.exists(publicKeyFile)) {
            LOG.infof("Loading persisted dev JWT keys from %s", keyDir);
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            privateKey = (RSAPrivateKey) keyFactory.generatePrivate(new PKCS8EncodedKeySpec(Files.readAllBytes(privateKeyFile)));
            publicKey = (RSAPublicKey) keyFactory.generatePublic(new X509EncodedKeySpec(Files.readAllBytes(publicKeyFile)));
        } else {
            LOG.infof("Generating new dev JWT keys (will be persisted to %s)", keyDir);
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
            keyGen.initialize(KEY_SIZE, new SecureRandom());
            KeyPair keyPair = keyGen.generateKeyPair();
            privateKey = (RSAPrivateKey) keyPair.getPrivate();
            publicKey = (RSAPublicKey) keyPair.getPublic();
            Files.createDirectories(keyDir);
            Files.write(privateKeyFile, privateKey.getEncoded());
            Files.write(publicKeyFile, publicKey.getEncoded());
        }
        LOG.warn("Using dev JWT keys. Configure funid.auth.jwt.private-key for production.");
        return new SigningKeys(privateKey, publicKey, keyId(publicKey));
    }

    private String keyId(RSAPublicKey publicKey) {
        return authConfig.jwt().keyId()
            .filter(kid -> !kid.isBlank())
            .orElseGet(() -> Base64Url.encode(TokenCrypto.sha256(publicKey.getEncoded())).substring(0, 8));
    }

    static Map<String, Object> toJwk(RSAPublicKey publicKey, String keyId) {
        Map<String, Object> jwk = new LinkedHashMap<>();
        jwk.put("kty", "RSA");
        jwk.put("use", "sig");
        jwk.put("alg", ALGORITHM);
        jwk.put("kid", keyId);
        jwk.put("n", Base64Url.encode(unsigned(publicKey.getModulus())));
        jwk.put("e", Base64Url.encode(unsigned(publicKey.getPublicExponent())));
        return jwk;
    }

    // BigInteger adds a leading zero byte for the sign bit
    private static byte[] unsigned(BigInteger value) {
        byte[] bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            byte[] tmp = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, tmp, 0, tmp.length);
            return tmp;
        }
        return bytes;
    }
}
