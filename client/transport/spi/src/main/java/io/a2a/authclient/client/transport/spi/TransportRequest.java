package io.a2a.authclient.client.transport.spi;

import java.util.Map;

import io.a2a.authclient.util.Assert;

/**
 * A request ready to be put on the wire: headers, credentials included, and serialized body.
 *
 * @param url the agent URL
 * @param headers the HTTP headers
 * @param body the serialized JSON-RPC envelope
 */
public record TransportRequest(String url, Map<String, String> headers, String body) {

    public TransportRequest {
        Assert.checkNotNullParam("url", url);
        Assert.checkNotNullParam("body", body);
        headers = Map.copyOf(Assert.checkNotNullParam("headers", headers));
    }

    @Override
    public String toString() {
        return "TransportRequest[url=" + url + ", headers=" + headers.keySet() + "]";
    }
}
