package io.a2a.authclient.client.auth.config;

import io.a2a.authclient.client.auth.ApiKeyCredentialProvider;
import io.a2a.authclient.client.auth.CredentialProvider;
import io.a2a.authclient.util.Assert;

/**
 * Authenticates with a static API key.
 *
 * @param apiKey the key
 * @param headerName the header carrying the key
 */
public record ApiKeyAuthConfig(String apiKey, String headerName) implements AuthConfig {

    public ApiKeyAuthConfig {
        Assert.checkNotBlankParam("apiKey", apiKey);
        Assert.checkNotBlankParam("headerName", headerName);
    }

    public ApiKeyAuthConfig(String apiKey) {
        this(apiKey, ApiKeyCredentialProvider.DEFAULT_HEADER_NAME);
    }

    @Override
    public CredentialProvider createProvider(ProviderSettings settings) {
        return new ApiKeyCredentialProvider(apiKey, headerName);
    }

    @Override
    public String toString() {
        return "ApiKeyAuthConfig[apiKey=***, headerName=" + headerName + "]";
    }
}
