package io.a2a.authclient.client.auth.config;

import io.a2a.authclient.client.auth.CredentialProvider;

/**
 * Selects how the client authenticates. Exactly one variant is configured per client; it
 * creates the {@link CredentialProvider} the client then uses for every call.
 */
public sealed interface AuthConfig
        permits ApiKeyAuthConfig, SignedTokenAuthConfig, OAuth2ClientCredentialsAuthConfig,
                OAuth2TokenSourceAuthConfig, CustomAuthConfig {

    /**
     * Creates the provider described by this configuration.
     *
     * @param settings the client wide settings the provider shares
     * @return a new provider owning its own token cache, if it has one
     */
    CredentialProvider createProvider(ProviderSettings settings);
}
