package io.a2a.authclient.client.http;

import io.a2a.authclient.client.http.jdk.JdkHttpClientBuilder;

/**
 * Creates {@link HttpClient}s. The client configuration and the credential providers that
 * talk to token endpoints both obtain their clients through this factory, so an alternative
 * HTTP stack can be plugged in at a single place.
 */
public interface HttpClientBuilder {

    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    HttpClient create(String url);
}
