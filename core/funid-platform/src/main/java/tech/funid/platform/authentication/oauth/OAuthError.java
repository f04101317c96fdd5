package tech.funid.platform.authentication.oauth;

/**
 * OAuth 2.0 error codes (RFC 6749 section 4.1.2.1 and 5.2, RFC 6750 section 3.1)
 * with the HTTP status used when the error is returned directly.
 */
public enum OAuthError {

    INVALID_REQUEST("invalid_request", 400),
    INVALID_CLIENT("invalid_client", 400),
    INVALID_GRANT("invalid_grant", 400),
    INVALID_SCOPE("invalid_scope", 400),
    UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type", 400),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type", 400),
    ACCESS_DENIED("access_denied", 403),
    INVALID_TOKEN("invalid_token", 401),
    SERVER_ERROR("server_error", 500);

    private final String code;
    private final int status;

    OAuthError(String code, int status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public int status() {
        return status;
    }
}
