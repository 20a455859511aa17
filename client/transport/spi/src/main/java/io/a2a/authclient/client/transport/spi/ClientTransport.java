package io.a2a.authclient.client.transport.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Dispatches fully built JSON-RPC requests to an agent.
 * <p>
 * Implementations deliver the request as is and complete the returned future with the raw
 * response body. Any failure to obtain a successful response, including error statuses,
 * completes the future exceptionally, preferably with an
 * {@link io.a2a.authclient.spec.A2AClientTransportException}. Cancelling the returned future
 * must abort the exchange.
 */
public interface ClientTransport {

    CompletableFuture<String> send(TransportRequest request);
}
