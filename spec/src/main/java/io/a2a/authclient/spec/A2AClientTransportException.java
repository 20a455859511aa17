package io.a2a.authclient.spec;

import org.jspecify.annotations.Nullable;

/**
 * Indicates that a request could not be dispatched to the agent, or that the agent
 * answered with a non-successful HTTP status.
 */
public class A2AClientTransportException extends A2AClientException {

    @Nullable
    private final Integer statusCode;

    public A2AClientTransportException(final String msg) {
        super(msg);
        this.statusCode = null;
    }

    public A2AClientTransportException(final String msg, final Throwable cause) {
        super(msg, cause);
        this.statusCode = null;
    }

    /**
     * Creates a new exception for an HTTP response with an error status.
     *
     * @param msg the exception message
     * @param statusCode the HTTP status code returned by the agent
     */
    public A2AClientTransportException(final String msg, final int statusCode) {
        super(msg);
        this.statusCode = statusCode;
    }

    /**
     * Returns the HTTP status code of the failed response.
     *
     * @return the status code, or null if no response was received
     */
    @Nullable
    public Integer getStatusCode() {
        return statusCode;
    }
}
