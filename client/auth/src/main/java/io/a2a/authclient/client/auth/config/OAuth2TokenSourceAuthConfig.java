package io.a2a.authclient.client.auth.config;

import io.a2a.authclient.client.auth.CredentialProvider;
import io.a2a.authclient.client.auth.OAuth2TokenSourceProvider;
import io.a2a.authclient.client.auth.TokenSource;
import io.a2a.authclient.util.Assert;

/**
 * Authenticates with tokens from a caller managed {@link TokenSource}.
 *
 * @param tokenSource the source asked for a token on every call
 */
public record OAuth2TokenSourceAuthConfig(TokenSource tokenSource) implements AuthConfig {

    public OAuth2TokenSourceAuthConfig {
        Assert.checkNotNullParam("tokenSource", tokenSource);
    }

    @Override
    public CredentialProvider createProvider(ProviderSettings settings) {
        return new OAuth2TokenSourceProvider(tokenSource, settings.clock());
    }
}
