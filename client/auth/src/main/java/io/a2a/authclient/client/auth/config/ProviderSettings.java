package io.a2a.authclient.client.auth.config;

import java.time.Clock;
import java.time.Duration;

import io.a2a.authclient.client.http.HttpClientBuilder;
import io.a2a.authclient.util.Assert;

/**
 * Client wide settings handed to an {@link AuthConfig} when it creates its provider.
 *
 * @param clock the clock token expiry is checked against
 * @param skew the margin before expiry at which cached tokens are replaced
 * @param httpClientBuilder the factory for clients talking to token endpoints
 */
public record ProviderSettings(Clock clock, Duration skew, HttpClientBuilder httpClientBuilder) {

    public ProviderSettings {
        Assert.checkNotNullParam("clock", clock);
        Assert.checkNotNullParam("skew", skew);
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        if (skew.isNegative()) {
            throw new IllegalArgumentException("Skew must not be negative: " + skew);
        }
    }
}
