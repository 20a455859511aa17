package io.a2a.authclient.client.auth;

import java.util.concurrent.CompletableFuture;

import io.a2a.authclient.util.Assert;

/**
 * Sends a static API key in a request header. The key never expires and is never refreshed.
 */
public class ApiKeyCredentialProvider implements CredentialProvider {

    public static final String DEFAULT_HEADER_NAME = "X-API-Key";

    private final CredentialArtifact artifact;

    public ApiKeyCredentialProvider(String apiKey) {
        this(apiKey, DEFAULT_HEADER_NAME);
    }

    public ApiKeyCredentialProvider(String apiKey, String headerName) {
        Assert.checkNotBlankParam("apiKey", apiKey);
        Assert.checkNotBlankParam("headerName", headerName);
        this.artifact = CredentialArtifact.header(headerName, apiKey);
    }

    @Override
    public CompletableFuture<CredentialArtifact> produceArtifact(CredentialContext context) {
        return CompletableFuture.completedFuture(artifact);
    }

    public String getHeaderName() {
        return artifact.name();
    }
}
