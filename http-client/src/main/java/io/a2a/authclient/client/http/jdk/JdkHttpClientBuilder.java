package io.a2a.authclient.client.http.jdk;

import java.time.Duration;

import io.a2a.authclient.client.http.HttpClient;
import io.a2a.authclient.client.http.HttpClientBuilder;
import io.a2a.authclient.util.Assert;
import org.jspecify.annotations.Nullable;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    private @Nullable Duration timeout;

    /**
     * Sets the timeout applied to every request of the created clients.
     *
     * @param timeout the request timeout, must be positive
     * @return this builder
     */
    public JdkHttpClientBuilder timeout(Duration timeout) {
        Assert.checkNotNullParam("timeout", timeout);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
        return this;
    }

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url, timeout);
    }
}
