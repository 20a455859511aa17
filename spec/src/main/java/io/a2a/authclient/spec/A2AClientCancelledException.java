package io.a2a.authclient.spec;

/**
 * Indicates that a call was cancelled, or its calling thread interrupted, before a response
 * was received. No partial result is ever returned alongside it.
 */
public class A2AClientCancelledException extends A2AClientException {

    public A2AClientCancelledException(final String msg) {
        super(msg);
    }

    public A2AClientCancelledException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
