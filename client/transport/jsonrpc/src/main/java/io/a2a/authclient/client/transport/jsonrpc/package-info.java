/**
 * JSON-RPC over HTTP: envelope construction, credential attachment, request ids and the
 * default {@link io.a2a.authclient.client.transport.spi.ClientTransport}.
 */
@NullMarked
package io.a2a.authclient.client.transport.jsonrpc;

import org.jspecify.annotations.NullMarked;
