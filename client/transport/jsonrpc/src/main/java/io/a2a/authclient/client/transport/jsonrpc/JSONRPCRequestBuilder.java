package io.a2a.authclient.client.transport.jsonrpc;

import static io.a2a.authclient.client.http.HttpClient.CONTENT_TYPE;
import static io.a2a.authclient.client.http.HttpClient.APPLICATION_JSON;
import static io.a2a.authclient.util.Utils.OBJECT_MAPPER;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.a2a.authclient.client.auth.AuthenticationException;
import io.a2a.authclient.client.auth.CredentialArtifact;
import io.a2a.authclient.client.transport.spi.TransportRequest;
import io.a2a.authclient.spec.A2AClientException;
import io.a2a.authclient.spec.JSONRPCRequest;
import io.a2a.authclient.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Builds JSON-RPC envelopes and turns them, together with a credential, into requests ready
 * to be sent to one agent.
 */
public class JSONRPCRequestBuilder {

    private final String agentUrl;
    private final Clock clock;

    public JSONRPCRequestBuilder(String agentUrl, Clock clock) {
        this.agentUrl = Assert.checkNotBlankParam("agentUrl", agentUrl);
        this.clock = Assert.checkNotNullParam("clock", clock);
    }

    /**
     * Creates the envelope of a call.
     *
     * @param method the method to invoke
     * @param params the method parameters, encoded with the shared object mapper
     * @param id the request id, a String or a Number
     * @return the envelope
     * @throws A2AClientException if the parameters cannot be encoded
     */
    public JSONRPCRequest build(String method, @Nullable Object params, Object id) throws A2AClientException {
        JsonNode encoded;
        try {
            encoded = params == null ? null : OBJECT_MAPPER.valueToTree(params);
        } catch (IllegalArgumentException e) {
            throw new A2AClientException("Failed to encode params of " + method + ": " + e.getMessage(), e);
        }
        return new JSONRPCRequest(id, method, encoded);
    }

    /**
     * Attaches a credential to an envelope and serializes it.
     *
     * @param envelope the envelope to send
     * @param artifact the credential to attach, null to send the request unauthenticated
     * @return the request to hand to the transport
     * @throws AuthenticationException if the credential has expired
     * @throws A2AClientException if the envelope cannot be serialized
     */
    public TransportRequest attach(JSONRPCRequest envelope, @Nullable CredentialArtifact artifact)
            throws A2AClientException {
        Assert.checkNotNullParam("envelope", envelope);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(CONTENT_TYPE, APPLICATION_JSON);
        if (artifact != null) {
            if (artifact.isExpired(clock.instant())) {
                throw new AuthenticationException("Credential for " + envelope.method() + " expired at "
                        + artifact.expiresAt());
            }
            headers.put(artifact.name(), artifact.headerValue());
        }

        String body;
        try {
            body = OBJECT_MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new A2AClientException("Failed to serialize " + envelope.method() + " request: " + e.getMessage(), e);
        }
        return new TransportRequest(agentUrl, headers, body);
    }
}
