package io.a2a.authclient.client.http.jdk;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.a2a.authclient.client.http.HttpClient;
import io.a2a.authclient.client.http.HttpResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class JdkHttpClientTest {

    private WireMockServer server;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();

        configureFor("localhost", server.port());
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private String getServerUrl() {
        return "http://localhost:" + server.port();
    }

    @Test
    public void testBaseUrlNormalization() {
        String baseUrl = "http://localhost:8080";

        JdkHttpClient client = new JdkHttpClient(baseUrl);
        Assertions.assertEquals(baseUrl, client.getBaseUrl());

        baseUrl = "http://localhost";
        client = new JdkHttpClient(baseUrl);
        Assertions.assertEquals("http://localhost", client.getBaseUrl());

        baseUrl = "https://localhost:443";
        client = new JdkHttpClient(baseUrl);
        Assertions.assertEquals("https://localhost:443", client.getBaseUrl());

        baseUrl = "http://localhost:8080/oauth2/token";
        client = new JdkHttpClient(baseUrl);
        Assertions.assertEquals("http://localhost:8080", client.getBaseUrl());
    }

    @Test
    public void testInvalidBaseUrl() {
        assertThrows(IllegalArgumentException.class, () -> new JdkHttpClient("not a url"));
    }

    @Test
    public void testPostSendsHeadersAndBody() throws Exception {
        givenThat(post(urlPathEqualTo("/agent"))
                .willReturn(okForContentType("application/json", "{\"ok\":true}")));

        HttpResponse response = new JdkHttpClientBuilder()
                .create(getServerUrl())
                .post("/agent")
                .addHeader(HttpClient.CONTENT_TYPE, HttpClient.APPLICATION_JSON)
                .addHeaders(Map.of("X-API-Key", "my-api-key"))
                .send("{\"hello\":\"world\"}")
                .get(5, TimeUnit.SECONDS);

        assertTrue(response.success());
        assertEquals(200, response.statusCode());
        assertEquals("{\"ok\":true}", response.body());

        verify(postRequestedFor(urlEqualTo("/agent"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withHeader("X-API-Key", equalTo("my-api-key"))
                .withRequestBody(equalToJson("{\"hello\":\"world\"}")));
    }

    @Test
    public void testErrorStatusIsReportedNotThrown() throws Exception {
        givenThat(post(urlPathEqualTo("/"))
                .willReturn(aResponse().withStatus(401)));

        HttpResponse response = HttpClient.createHttpClient(getServerUrl())
                .post("/")
                .send()
                .get(5, TimeUnit.SECONDS);

        assertFalse(response.success());
        assertEquals(401, response.statusCode());
        assertEquals("", response.body());
    }

    @Test
    public void testRequestTimeout() {
        givenThat(post(urlPathEqualTo("/slow"))
                .willReturn(ok().withFixedDelay(2000)));

        CompletableFuture<HttpResponse> future = new JdkHttpClientBuilder()
                .timeout(Duration.ofMillis(200))
                .create(getServerUrl())
                .post("/slow")
                .send();

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(HttpTimeoutException.class, e.getCause());
    }

    @Test
    public void testCancelAbortsRequest() {
        givenThat(post(urlPathEqualTo("/slow"))
                .willReturn(ok().withFixedDelay(5000)));

        CompletableFuture<HttpResponse> future = HttpClient.createHttpClient(getServerUrl())
                .post("/slow")
                .send();
        assertTrue(future.cancel(true));

        assertThrows(CancellationException.class, future::join);
    }

    @Test
    public void testTimeoutMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new JdkHttpClientBuilder().timeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new JdkHttpClientBuilder().timeout(Duration.ofSeconds(-1)));
    }
}
