package io.a2a.authclient.client.http.jdk;

import static java.net.HttpURLConnection.HTTP_MULT_CHOICE;
import static java.net.HttpURLConnection.HTTP_OK;

import io.a2a.authclient.client.http.HttpClient;
import io.a2a.authclient.client.http.HttpResponse;
import io.a2a.authclient.util.Utils;
import org.jspecify.annotations.Nullable;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLStreamHandler;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

class JdkHttpClient implements HttpClient {

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;
    private final @Nullable Duration timeout;

    JdkHttpClient(String baseUrl) {
        this(baseUrl, null);
    }

    JdkHttpClient(String baseUrl, @Nullable Duration timeout) {
        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL);
        if (timeout != null) {
            builder.connectTimeout(timeout);
        }
        this.httpClient = builder.build();
        this.timeout = timeout;

        URL targetUrl = buildUrl(baseUrl);
        this.baseUrl = targetUrl.getProtocol() + "://" + targetUrl.getAuthority();
    }

    String getBaseUrl() {
        return baseUrl;
    }

    @Nullable
    Duration getTimeout() {
        return timeout;
    }

    private static final URLStreamHandler URL_HANDLER = new URLStreamHandler() {
        protected URLConnection openConnection(URL u) {
            return null;
        }
    };

    private static URL buildUrl(String uri) {
        try {
            return new URL(null, uri, URL_HANDLER);
        } catch (MalformedURLException var2) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid");
        }
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        protected final Map<String, String> headers = new HashMap<>();

        public JdkRequestBuilder(String path) {
            this.path = path;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(@Nullable Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected HttpRequest.Builder createRequestBuilder() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path));
            if (timeout != null) {
                builder.timeout(timeout);
            }
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            return builder;
        }
    }

    private class JdkPostRequestBuilder extends JdkRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {
        String body = "";

        public JdkPostRequestBuilder(String path) {
            super(path);
        }

        @Override
        public PostRequestBuilder body(@Nullable String body) {
            this.body = body == null ? "" : body;
            return this;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            final HttpRequest request = super.createRequestBuilder()
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();

            CompletableFuture<java.net.http.HttpResponse<String>> exchange =
                    httpClient.sendAsync(request, BodyHandlers.ofString(StandardCharsets.UTF_8));
            // the JDK client aborts the exchange only when its own future is cancelled
            return Utils.propagateCancellation(exchange.thenApply(JdkHttpResponse::new), exchange);
        }
    }

    private record JdkHttpResponse(java.net.http.HttpResponse<String> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public boolean success() {
            return response.statusCode() >= HTTP_OK && response.statusCode() < HTTP_MULT_CHOICE;
        }

        @Override
        public String body() {
            String body = response.body();
            return body == null ? "" : body;
        }
    }
}
