package tech.funid.platform.authentication;

/**
 * Wires the token services without CDI.
 */
public final class AuthTestSupport {

    private AuthTestSupport() {
    }

    public static KeyMaterial keyMaterial(AuthConfig config) {
        KeyMaterial keyMaterial = new KeyMaterial();
        keyMaterial.authConfig = config;
        return keyMaterial;
    }

    public static JwtTokenService jwtTokenService(AuthConfig config, KeyMaterial keyMaterial) {
        JwtTokenService service = new JwtTokenService();
        service.authConfig = config;
        service.keyMaterial = keyMaterial;
        return service;
    }
}
