package io.a2a.authclient.client.auth;

import io.a2a.authclient.spec.A2AClientException;

/**
 * Indicates that no usable credential could be produced for a call.
 * <p>
 * The cause, when present, is the failure reported by the credential provider: a
 * {@link SigningException}, a {@link TokenAcquisitionException}, or whatever a custom
 * provider failed with.
 */
public class AuthenticationException extends A2AClientException {

    public AuthenticationException(final String msg) {
        super(msg);
    }

    public AuthenticationException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
