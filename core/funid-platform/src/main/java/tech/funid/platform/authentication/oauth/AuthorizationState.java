package tech.funid.platform.authentication.oauth;

/**
 * States of an authorization request.
 *
 * <pre>
 * AWAITING_CONSENT -> CODE_ISSUED
 *                  -> DENIED
 * any validation step -> REJECTED
 * </pre>
 */
public enum AuthorizationState {
    AWAITING_CONSENT,
    CODE_ISSUED,
    REJECTED,
    DENIED
}
