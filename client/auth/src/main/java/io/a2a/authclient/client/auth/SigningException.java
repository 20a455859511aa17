package io.a2a.authclient.client.auth;

import io.a2a.authclient.spec.A2AClientException;

/**
 * Indicates that a token could not be signed locally, because the secret is unusable or the
 * signature could not be computed.
 */
public class SigningException extends A2AClientException {

    public SigningException(final String msg) {
        super(msg);
    }

    public SigningException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
