package tech.funid.platform.authentication;

import tech.funid.platform.common.UpstreamFailureException;

/**
 * Signing key missing, unreadable or malformed.
 */
public class KeyMaterialException extends UpstreamFailureException {

    public KeyMaterialException(String message) {
        super(message);
    }

    public KeyMaterialException(String message, Throwable cause) {
        super(message, cause);
    }
}
