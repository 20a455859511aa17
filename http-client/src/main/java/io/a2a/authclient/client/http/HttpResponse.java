package io.a2a.authclient.client.http;

public interface HttpResponse {
    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /**
     * Returns the buffered response body.
     *
     * @return the body, empty but never null when the response had none
     */
    String body();
}
