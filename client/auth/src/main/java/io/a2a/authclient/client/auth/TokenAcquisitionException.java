package io.a2a.authclient.client.auth;

import io.a2a.authclient.spec.A2AClientException;
import org.jspecify.annotations.Nullable;

/**
 * Indicates that a token could not be obtained from a token endpoint or a token source.
 * Covers network failures, error responses and responses that cannot be parsed.
 */
public class TokenAcquisitionException extends A2AClientException {

    @Nullable
    private final Integer statusCode;

    public TokenAcquisitionException(final String msg) {
        super(msg);
        this.statusCode = null;
    }

    public TokenAcquisitionException(final String msg, final Throwable cause) {
        super(msg, cause);
        this.statusCode = null;
    }

    public TokenAcquisitionException(final String msg, final int statusCode) {
        super(msg);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status returned by the token endpoint, or null if none was received
     */
    @Nullable
    public Integer getStatusCode() {
        return statusCode;
    }
}
