package io.a2a.authclient.client;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import io.a2a.authclient.client.auth.CredentialProvider;
import io.a2a.authclient.client.auth.TokenCache;
import io.a2a.authclient.client.auth.TokenSource;
import io.a2a.authclient.client.auth.config.ApiKeyAuthConfig;
import io.a2a.authclient.client.auth.config.AuthConfig;
import io.a2a.authclient.client.auth.config.CustomAuthConfig;
import io.a2a.authclient.client.auth.config.OAuth2ClientCredentialsAuthConfig;
import io.a2a.authclient.client.auth.config.OAuth2TokenSourceAuthConfig;
import io.a2a.authclient.client.auth.config.SignedTokenAuthConfig;
import io.a2a.authclient.client.http.HttpClientBuilder;
import io.a2a.authclient.client.http.jdk.JdkHttpClientBuilder;
import io.a2a.authclient.client.transport.jsonrpc.RequestIdGenerator;
import io.a2a.authclient.client.transport.spi.ClientTransport;
import io.a2a.authclient.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Configuration of an {@link A2AClient}.
 * <p>
 * At most one authentication scheme can be selected; a client built without one sends its
 * requests unauthenticated.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ClientConfig config = ClientConfig.builder()
 *     .oauth2ClientCredentials("my-client-id", "my-client-secret",
 *             "http://localhost:8080/oauth2/token", List.of("a2a.read", "a2a.write"))
 *     .timeout(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public class ClientConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final @Nullable AuthConfig auth;
    private final Duration timeout;
    private final Duration skew;
    private final Clock clock;
    private final HttpClientBuilder httpClientBuilder;
    private final @Nullable ClientTransport transport;
    private final RequestIdGenerator requestIdGenerator;

    private ClientConfig(Builder builder) {
        this.auth = builder.auth;
        this.timeout = builder.timeout;
        this.skew = builder.skew;
        this.clock = builder.clock;
        this.httpClientBuilder = builder.httpClientBuilder != null
                ? builder.httpClientBuilder
                : new JdkHttpClientBuilder().timeout(builder.timeout);
        this.transport = builder.transport;
        this.requestIdGenerator = builder.requestIdGenerator;
    }

    public @Nullable AuthConfig getAuth() {
        return auth;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getSkew() {
        return skew;
    }

    public Clock getClock() {
        return clock;
    }

    public HttpClientBuilder getHttpClientBuilder() {
        return httpClientBuilder;
    }

    public @Nullable ClientTransport getTransport() {
        return transport;
    }

    public RequestIdGenerator getRequestIdGenerator() {
        return requestIdGenerator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private @Nullable AuthConfig auth;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration skew = TokenCache.DEFAULT_SKEW;
        private Clock clock = Clock.systemUTC();
        private @Nullable HttpClientBuilder httpClientBuilder;
        private @Nullable ClientTransport transport;
        private RequestIdGenerator requestIdGenerator = RequestIdGenerator.taskId();

        private Builder() {
        }

        /**
         * Selects the authentication scheme.
         *
         * @param auth the scheme
         * @return this builder
         * @throws IllegalStateException if a scheme has already been selected
         */
        public Builder auth(AuthConfig auth) {
            Assert.checkNotNullParam("auth", auth);
            if (this.auth != null) {
                throw new IllegalStateException("Authentication is already configured as " + this.auth
                        + ", cannot also use " + auth);
            }
            this.auth = auth;
            return this;
        }

        public Builder apiKeyAuth(String apiKey) {
            return auth(new ApiKeyAuthConfig(apiKey));
        }

        public Builder apiKeyAuth(String apiKey, String headerName) {
            return auth(new ApiKeyAuthConfig(apiKey, headerName));
        }

        public Builder signedTokenAuth(byte[] secret, String audience, String issuer, Duration validity) {
            return auth(new SignedTokenAuthConfig(secret, audience, issuer, validity));
        }

        public Builder signedTokenAuth(SignedTokenAuthConfig config) {
            return auth(config);
        }

        public Builder oauth2ClientCredentials(String clientId, String clientSecret, String tokenUrl, List<String> scopes) {
            return auth(new OAuth2ClientCredentialsAuthConfig(clientId, clientSecret, tokenUrl, scopes));
        }

        public Builder oauth2TokenSource(TokenSource tokenSource) {
            return auth(new OAuth2TokenSourceAuthConfig(tokenSource));
        }

        public Builder authProvider(CredentialProvider provider) {
            return auth(new CustomAuthConfig(provider));
        }

        /**
         * Sets the timeout of each HTTP request, to the agent and to token endpoints alike.
         * Ignored when an explicit {@link #httpClientBuilder(HttpClientBuilder)} is set.
         *
         * @param timeout the timeout, must be positive
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            Assert.checkNotNullParam("timeout", timeout);
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder skew(Duration skew) {
            Assert.checkNotNullParam("skew", skew);
            if (skew.isNegative()) {
                throw new IllegalArgumentException("Skew must not be negative: " + skew);
            }
            this.skew = skew;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Assert.checkNotNullParam("clock", clock);
            return this;
        }

        public Builder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
            this.httpClientBuilder = Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
            return this;
        }

        /**
         * Replaces the default HTTP JSON-RPC transport.
         *
         * @param transport the transport
         * @return this builder
         */
        public Builder transport(ClientTransport transport) {
            this.transport = Assert.checkNotNullParam("transport", transport);
            return this;
        }

        public Builder requestIdGenerator(RequestIdGenerator requestIdGenerator) {
            this.requestIdGenerator = Assert.checkNotNullParam("requestIdGenerator", requestIdGenerator);
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
