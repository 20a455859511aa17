package io.a2a.authclient.client.transport.jsonrpc;

import static io.a2a.authclient.util.Utils.OBJECT_MAPPER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import io.a2a.authclient.client.auth.AuthenticationException;
import io.a2a.authclient.client.auth.CredentialArtifact;
import io.a2a.authclient.client.transport.spi.TransportRequest;
import io.a2a.authclient.spec.A2AClientException;
import io.a2a.authclient.spec.A2AMethods;
import io.a2a.authclient.spec.JSONRPCRequest;
import io.a2a.authclient.spec.Message;
import io.a2a.authclient.spec.TaskSendParams;
import io.a2a.authclient.spec.TextPart;
import org.junit.jupiter.api.Test;

public class JSONRPCRequestBuilderTest {

    private static final String AGENT_URL = "http://localhost:8080/";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final JSONRPCRequestBuilder builder = new JSONRPCRequestBuilder(AGENT_URL, Clock.fixed(NOW, ZoneOffset.UTC));

    private static TaskSendParams sendParams() {
        Message message = new Message(Message.Role.USER,
                List.of(new TextPart("Hello, this is an authenticated request")), null);
        return new TaskSendParams("auth-test-task", message);
    }

    @Test
    public void testBuildEncodesParams() throws Exception {
        JSONRPCRequest request = builder.build(A2AMethods.SEND_TASK, sendParams(), "auth-test-task");

        assertEquals("2.0", request.jsonrpc());
        assertEquals("auth-test-task", request.id());
        assertEquals("tasks/send", request.method());
        assertEquals("auth-test-task", request.params().get("id").asText());
        assertEquals("text", request.params().get("message").get("parts").get(0).get("type").asText());
    }

    @Test
    public void testBuildWithoutParams() throws Exception {
        assertNull(builder.build(A2AMethods.GET_TASK, null, 7L).params());
    }

    @Test
    public void testUnencodableParams() {
        assertThrows(A2AClientException.class, () -> builder.build(A2AMethods.SEND_TASK, new Object(), "id"));
    }

    @Test
    public void testAttachBearer() throws Exception {
        JSONRPCRequest request = builder.build(A2AMethods.GET_TASK, Map.of("id", "t-1"), "t-1");
        TransportRequest transportRequest = builder.attach(request,
                CredentialArtifact.bearer("abc", NOW.plusSeconds(60)));

        assertEquals(AGENT_URL, transportRequest.url());
        assertEquals("Bearer abc", transportRequest.headers().get("Authorization"));
        assertEquals("application/json", transportRequest.headers().get("Content-Type"));

        JsonNode body = OBJECT_MAPPER.readTree(transportRequest.body());
        assertEquals("2.0", body.get("jsonrpc").asText());
        assertEquals("t-1", body.get("id").asText());
        assertEquals("tasks/get", body.get("method").asText());
        assertEquals("t-1", body.get("params").get("id").asText());
    }

    @Test
    public void testAttachHeader() throws Exception {
        JSONRPCRequest request = builder.build(A2AMethods.GET_TASK, Map.of("id", "t-1"), 1);
        TransportRequest transportRequest = builder.attach(request, CredentialArtifact.header("X-API-Key", "my-api-key"));

        assertEquals("my-api-key", transportRequest.headers().get("X-API-Key"));
        assertFalse(transportRequest.headers().containsKey("Authorization"));
        assertEquals(1, OBJECT_MAPPER.readTree(transportRequest.body()).get("id").asInt());
    }

    @Test
    public void testAttachNothing() throws Exception {
        JSONRPCRequest request = builder.build(A2AMethods.GET_TASK, Map.of("id", "t-1"), "t-1");
        TransportRequest transportRequest = builder.attach(request, null);

        assertEquals(Map.of("Content-Type", "application/json"), transportRequest.headers());
    }

    @Test
    public void testExpiredCredentialIsNeverAttached() throws Exception {
        JSONRPCRequest request = builder.build(A2AMethods.GET_TASK, Map.of("id", "t-1"), "t-1");

        assertThrows(AuthenticationException.class,
                () -> builder.attach(request, CredentialArtifact.bearer("abc", NOW)));
        assertThrows(AuthenticationException.class,
                () -> builder.attach(request, CredentialArtifact.bearer("abc", NOW.minusSeconds(1))));
    }
}
