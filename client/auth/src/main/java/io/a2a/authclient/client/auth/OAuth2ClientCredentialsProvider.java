package io.a2a.authclient.client.auth;

import static io.a2a.authclient.client.http.HttpClient.ACCEPT;
import static io.a2a.authclient.client.http.HttpClient.APPLICATION_FORM_URLENCODED;
import static io.a2a.authclient.client.http.HttpClient.APPLICATION_JSON;
import static io.a2a.authclient.client.http.HttpClient.CONTENT_TYPE;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.a2a.authclient.client.http.HttpClient;
import io.a2a.authclient.client.http.HttpClientBuilder;
import io.a2a.authclient.client.http.HttpResponse;
import io.a2a.authclient.util.Assert;
import io.a2a.authclient.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Authenticates with bearer tokens obtained through the OAuth2 client credentials grant.
 * <p>
 * The token is kept in a {@link TokenCache} and exchanged again once it gets within the skew
 * of its expiry. Concurrent calls share a single exchange.
 */
public class OAuth2ClientCredentialsProvider implements CredentialProvider {

    static final String GRANT_TYPE = "client_credentials";

    private static final TypeReference<OAuth2TokenResponse> TOKEN_RESPONSE_REFERENCE = new TypeReference<>() {
    };

    private final String clientId;
    private final String clientSecret;
    private final String tokenUrl;
    private final List<String> scopes;
    private final HttpClient httpClient;
    private final String tokenPath;
    private final Clock clock;
    private final TokenCache cache;

    public OAuth2ClientCredentialsProvider(String clientId, String clientSecret, String tokenUrl, List<String> scopes) {
        this(clientId, clientSecret, tokenUrl, scopes, HttpClientBuilder.DEFAULT_FACTORY,
                TokenCache.DEFAULT_SKEW, Clock.systemUTC());
    }

    public OAuth2ClientCredentialsProvider(String clientId, String clientSecret, String tokenUrl, List<String> scopes,
                                           HttpClientBuilder httpClientBuilder, Duration skew, Clock clock) {
        this.clientId = Assert.checkNotBlankParam("clientId", clientId);
        this.clientSecret = Assert.checkNotNullParam("clientSecret", clientSecret);
        this.tokenUrl = Assert.checkNotBlankParam("tokenUrl", tokenUrl);
        this.scopes = List.copyOf(Assert.checkNotNullParam("scopes", scopes));
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        this.httpClient = httpClientBuilder.create(tokenUrl);
        this.tokenPath = Utils.requestPathOf(tokenUrl);
        this.clock = Assert.checkNotNullParam("clock", clock);
        this.cache = new TokenCache("token endpoint " + tokenUrl, this::exchange, clock, skew);
    }

    @Override
    public CompletableFuture<CredentialArtifact> produceArtifact(CredentialContext context) {
        return cache.get();
    }

    /**
     * Drops the cached token, for example after the agent rejected it.
     */
    public void invalidate() {
        cache.invalidate();
    }

    private CompletableFuture<CredentialArtifact> exchange() {
        Instant requestStart = clock.instant();
        CompletableFuture<HttpResponse> response;
        try {
            response = httpClient.post(tokenPath)
                    .addHeader(CONTENT_TYPE, APPLICATION_FORM_URLENCODED)
                    .addHeader(ACCEPT, APPLICATION_JSON)
                    .send(formBody());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new TokenAcquisitionException("Failed to send token request to " + tokenUrl, e));
        }

        CompletableFuture<CredentialArtifact> artifact = response.handle(
                new BiFunction<HttpResponse, Throwable, CredentialArtifact>() {
                    @Override
                    public CredentialArtifact apply(@Nullable HttpResponse httpResponse, @Nullable Throwable throwable) {
                        if (throwable != null) {
                            Throwable cause = Utils.unwrapCompletionException(throwable);
                            if (cause instanceof CancellationException) {
                                throw (CancellationException) cause;
                            }
                            throw Utils.asCompletionException(new TokenAcquisitionException(
                                    "Token request to " + tokenUrl + " failed: " + cause.getMessage(), cause));
                        }
                        try {
                            return toArtifact(Assert.checkNotNullParam("response", httpResponse), requestStart);
                        } catch (TokenAcquisitionException e) {
                            throw Utils.asCompletionException(e);
                        }
                    }
                });
        return Utils.propagateCancellation(artifact, response);
    }

    private CredentialArtifact toArtifact(HttpResponse response, Instant requestStart) throws TokenAcquisitionException {
        if (!response.success()) {
            throw new TokenAcquisitionException(
                    "Token endpoint " + tokenUrl + " responded with status " + response.statusCode(),
                    response.statusCode());
        }

        OAuth2TokenResponse token;
        try {
            token = Utils.unmarshalFrom(response.body(), TOKEN_RESPONSE_REFERENCE);
        } catch (JsonProcessingException e) {
            throw new TokenAcquisitionException("Failed to parse token response from " + tokenUrl, e);
        }
        if (token == null || token.accessToken() == null || token.accessToken().isBlank()) {
            throw new TokenAcquisitionException("Token response from " + tokenUrl + " carries no access_token");
        }
        String tokenType = token.tokenType();
        if (tokenType != null && !tokenType.isEmpty() && !OAuth2Token.BEARER.equalsIgnoreCase(tokenType)) {
            throw new TokenAcquisitionException("Unsupported token type from " + tokenUrl + ": " + tokenType);
        }

        Long expiresIn = token.expiresIn();
        Instant expiresAt = null;
        if (expiresIn != null && expiresIn > 0) {
            try {
                expiresAt = requestStart.plusSeconds(expiresIn);
            } catch (ArithmeticException | DateTimeException e) {
                throw new TokenAcquisitionException("Invalid expires_in from " + tokenUrl + ": " + expiresIn, e);
            }
        }
        return CredentialArtifact.bearer(token.accessToken(), expiresAt);
    }

    private String formBody() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", GRANT_TYPE);
        form.put("client_id", clientId);
        form.put("client_secret", clientSecret);
        if (!scopes.isEmpty()) {
            form.put("scope", String.join(" ", scopes));
        }
        return form.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public List<String> getScopes() {
        return scopes;
    }

    @Override
    public String toString() {
        return "OAuth2ClientCredentialsProvider[clientId=" + clientId + ", clientSecret=***, tokenUrl=" + tokenUrl
                + ", scopes=" + scopes + "]";
    }
}
