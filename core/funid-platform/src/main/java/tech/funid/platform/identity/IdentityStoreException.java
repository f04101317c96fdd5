package tech.funid.platform.identity;

import tech.funid.platform.common.UpstreamFailureException;

/**
 * The identity store was unreachable or answered with an unexpected status.
 */
public class IdentityStoreException extends UpstreamFailureException {

    public IdentityStoreException(String message) {
        super(message);
    }

    public IdentityStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
