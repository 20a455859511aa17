package io.a2a.authclient.spec;

/**
 * Base exception for failures surfaced by the A2A client.
 * <p>
 * Every failure of a client call is reported as a subclass of this exception:
 * <ul>
 *   <li>{@link A2AClientTransportException} - the request could not be dispatched</li>
 *   <li>{@link A2AClientProtocolException} - the response could not be decoded or correlated</li>
 *   <li>{@link A2AServerException} - the agent answered with a JSON-RPC error</li>
 *   <li>{@link A2AClientCancelledException} - the call was cancelled before it completed</li>
 * </ul>
 * Credential failures are reported by the auth module's subclasses.
 */
public class A2AClientException extends Exception {

    public A2AClientException() {
        super();
    }

    public A2AClientException(final String msg) {
        super(msg);
    }

    public A2AClientException(final Throwable cause) {
        super(cause);
    }

    public A2AClientException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
