package io.a2a.authclient.client.http;

import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous HTTP client bound to the scheme and authority of one base URL.
 * <p>
 * Requests are addressed by path relative to that base. Cancelling the future returned by
 * {@link RequestBuilder#send()} aborts the underlying exchange.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient("http://localhost:8080");
 * HttpResponse response = client.post("/")
 *     .addHeader("Authorization", "Bearer token")
 *     .send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tasks/get\"}")
 *     .get();
 * }</pre>
 */
public interface HttpClient {

    /** HTTP Content-Type header name. */
    String CONTENT_TYPE = "Content-Type";
    /** HTTP Accept header name. */
    String ACCEPT = "Accept";
    /** JSON content type value. */
    String APPLICATION_JSON = "application/json";
    /** Form content type value. */
    String APPLICATION_FORM_URLENCODED = "application/x-www-form-urlencoded";

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    PostRequestBuilder post(String path);

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(@Nullable Map<String, String> headers);
    }

    interface PostRequestBuilder extends RequestBuilder<PostRequestBuilder> {
        PostRequestBuilder body(@Nullable String body);

        default CompletableFuture<HttpResponse> send(String body) {
            return this.body(body).send();
        }
    }
}
