package io.a2a.authclient.client.auth.config;

import io.a2a.authclient.client.auth.CredentialProvider;
import io.a2a.authclient.util.Assert;

/**
 * Authenticates with a caller supplied provider, used as is.
 *
 * @param provider the provider
 */
public record CustomAuthConfig(CredentialProvider provider) implements AuthConfig {

    public CustomAuthConfig {
        Assert.checkNotNullParam("provider", provider);
    }

    @Override
    public CredentialProvider createProvider(ProviderSettings settings) {
        return provider;
    }
}
