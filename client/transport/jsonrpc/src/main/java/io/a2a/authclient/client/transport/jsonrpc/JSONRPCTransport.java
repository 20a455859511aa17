package io.a2a.authclient.client.transport.jsonrpc;

import static java.net.HttpURLConnection.HTTP_FORBIDDEN;
import static java.net.HttpURLConnection.HTTP_UNAUTHORIZED;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import io.a2a.authclient.client.http.HttpClient;
import io.a2a.authclient.client.http.HttpClientBuilder;
import io.a2a.authclient.client.http.HttpResponse;
import io.a2a.authclient.client.transport.spi.ClientTransport;
import io.a2a.authclient.client.transport.spi.TransportRequest;
import io.a2a.authclient.spec.A2AClientTransportException;
import io.a2a.authclient.util.Assert;
import io.a2a.authclient.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends JSON-RPC requests to one agent as HTTP POSTs to the path of the agent URL.
 */
public class JSONRPCTransport implements ClientTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCTransport.class);

    static final String AUTHENTICATION_FAILED = "Authentication failed: client credentials are missing or invalid";
    static final String AUTHORIZATION_FAILED = "Authorization failed: client credentials lack the required permissions";

    private final HttpClient httpClient;
    private final String agentUrl;
    private final String agentPath;

    public JSONRPCTransport(String agentUrl) {
        this(agentUrl, null);
    }

    public JSONRPCTransport(String agentUrl, @Nullable HttpClientBuilder httpClientBuilder) {
        this.agentUrl = Assert.checkNotBlankParam("agentUrl", agentUrl);
        HttpClientBuilder builder = Utils.defaultIfNull(httpClientBuilder, HttpClientBuilder.DEFAULT_FACTORY);
        this.httpClient = builder.create(agentUrl);

        this.agentPath = Utils.requestPathOf(agentUrl);
    }

    @Override
    public CompletableFuture<String> send(TransportRequest request) {
        Assert.checkNotNullParam("request", request);
        if (!agentUrl.equals(request.url())) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "Request for " + request.url() + " sent through transport for " + agentUrl));
        }

        CompletableFuture<HttpResponse> response;
        try {
            response = httpClient.post(agentPath)
                    .addHeaders(request.headers())
                    .send(request.body());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new A2AClientTransportException("Failed to send request to " + agentUrl + ": " + e.getMessage(), e));
        }

        CompletableFuture<String> body = response
                .exceptionally(new Function<Throwable, HttpResponse>() {
                    @Override
                    public HttpResponse apply(Throwable throwable) {
                        Throwable cause = Utils.unwrapCompletionException(throwable);
                        if (cause instanceof CancellationException) {
                            throw (CancellationException) cause;
                        }
                        LOGGER.debug("Request to {} failed", agentUrl, cause);
                        throw Utils.asCompletionException(new A2AClientTransportException(
                                "Failed to send request to " + agentUrl + ": " + cause.getMessage(), cause));
                    }
                })
                .thenCompose(new Function<HttpResponse, CompletionStage<String>>() {
                    @Override
                    public CompletionStage<String> apply(HttpResponse httpResponse) {
                        if (!httpResponse.success()) {
                            int status = httpResponse.statusCode();
                            LOGGER.debug("Agent {} responded with status {}", agentUrl, status);
                            if (status == HTTP_UNAUTHORIZED) {
                                return CompletableFuture.failedStage(
                                        new A2AClientTransportException(AUTHENTICATION_FAILED, status));
                            } else if (status == HTTP_FORBIDDEN) {
                                return CompletableFuture.failedStage(
                                        new A2AClientTransportException(AUTHORIZATION_FAILED, status));
                            }
                            return CompletableFuture.failedStage(new A2AClientTransportException(
                                    "Request failed with status " + status + ": " + httpResponse.body(), status));
                        }
                        return CompletableFuture.completedFuture(httpResponse.body());
                    }
                });
        return Utils.propagateCancellation(body, response);
    }

    String getAgentPath() {
        return agentPath;
    }
}
