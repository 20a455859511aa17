package io.a2a.authclient.client.auth.config;

import java.util.List;

import io.a2a.authclient.client.auth.CredentialProvider;
import io.a2a.authclient.client.auth.OAuth2ClientCredentialsProvider;
import io.a2a.authclient.util.Assert;

/**
 * Authenticates with tokens from the OAuth2 client credentials grant.
 *
 * @param clientId the client id
 * @param clientSecret the client secret
 * @param tokenUrl the token endpoint
 * @param scopes the requested scopes, possibly empty
 */
public record OAuth2ClientCredentialsAuthConfig(String clientId, String clientSecret, String tokenUrl,
                                                List<String> scopes) implements AuthConfig {

    public OAuth2ClientCredentialsAuthConfig {
        Assert.checkNotBlankParam("clientId", clientId);
        Assert.checkNotNullParam("clientSecret", clientSecret);
        Assert.checkNotBlankParam("tokenUrl", tokenUrl);
        scopes = List.copyOf(Assert.checkNotNullParam("scopes", scopes));
    }

    @Override
    public CredentialProvider createProvider(ProviderSettings settings) {
        return new OAuth2ClientCredentialsProvider(clientId, clientSecret, tokenUrl, scopes,
                settings.httpClientBuilder(), settings.skew(), settings.clock());
    }

    @Override
    public String toString() {
        return "OAuth2ClientCredentialsAuthConfig[clientId=" + clientId + ", clientSecret=***, tokenUrl="
                + tokenUrl + ", scopes=" + scopes + "]";
    }
}
