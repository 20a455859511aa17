/**
 * HTTP client abstraction used to reach A2A agents and OAuth2 token endpoints.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.a2a.authclient.client.http.HttpClient} - asynchronous request builder API</li>
 *   <li>{@link io.a2a.authclient.client.http.HttpClientBuilder} - factory, defaulting to the JDK implementation</li>
 *   <li>{@link io.a2a.authclient.client.http.HttpResponse} - status and buffered body</li>
 * </ul>
 */
@NullMarked
package io.a2a.authclient.client.http;

import org.jspecify.annotations.NullMarked;
