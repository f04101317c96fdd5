package tech.funid.platform.common;

/**
 * A dependency the request needs (identity store, key material) failed.
 * Rendered as {@code 500 server_error} so clients retry instead of giving up.
 */
public class UpstreamFailureException extends RuntimeException {

    public UpstreamFailureException(String message) {
        super(message);
    }

    public UpstreamFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
