package tech.funid.platform.authentication.oauth;

/**
 * A protocol error returned to the caller as {@code {error, error_description}}.
 */
public class OAuthException extends RuntimeException {

    private final OAuthError error;
    private final String description;

    public OAuthException(OAuthError error, String description) {
        super(error.code() + ": " + description);
        this.error = error;
        this.description = description;
    }

    public static OAuthException invalidRequest(String description) {
        return new OAuthException(OAuthError.INVALID_REQUEST, description);
    }

    public static OAuthException invalidClient(String description) {
        return new OAuthException(OAuthError.INVALID_CLIENT, description);
    }

    public static OAuthException invalidGrant(String description) {
        return new OAuthException(OAuthError.INVALID_GRANT, description);
    }

    public static OAuthException invalidScope(String description) {
        return new OAuthException(OAuthError.INVALID_SCOPE, description);
    }

    public static OAuthException invalidToken(String description) {
        return new OAuthException(OAuthError.INVALID_TOKEN, description);
    }

    public OAuthError error() {
        return error;
    }

    public String description() {
        return description;
    }

    public int status() {
        return error.status();
    }
}
