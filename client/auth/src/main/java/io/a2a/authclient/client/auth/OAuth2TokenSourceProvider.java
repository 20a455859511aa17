package io.a2a.authclient.client.auth;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

import io.a2a.authclient.util.Assert;

/**
 * Authenticates with bearer tokens taken from a caller supplied {@link TokenSource}.
 * <p>
 * The source is asked for a token on every call; this provider keeps no cache and never talks
 * to a token endpoint itself.
 */
public class OAuth2TokenSourceProvider implements CredentialProvider {

    private final TokenSource tokenSource;
    private final Clock clock;

    public OAuth2TokenSourceProvider(TokenSource tokenSource) {
        this(tokenSource, Clock.systemUTC());
    }

    public OAuth2TokenSourceProvider(TokenSource tokenSource, Clock clock) {
        this.tokenSource = Assert.checkNotNullParam("tokenSource", tokenSource);
        this.clock = Assert.checkNotNullParam("clock", clock);
    }

    @Override
    public CompletableFuture<CredentialArtifact> produceArtifact(CredentialContext context) {
        try {
            return CompletableFuture.completedFuture(fetch());
        } catch (TokenAcquisitionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CredentialArtifact fetch() throws TokenAcquisitionException {
        OAuth2Token token;
        try {
            token = tokenSource.token();
        } catch (IOException | RuntimeException e) {
            throw new TokenAcquisitionException("Token source failed: " + e.getMessage(), e);
        }
        if (token == null) {
            throw new TokenAcquisitionException("Token source returned no token");
        }
        if (!token.isBearer()) {
            throw new TokenAcquisitionException("Unsupported token type: " + token.tokenType());
        }
        if (token.expiry() != null && !clock.instant().isBefore(token.expiry())) {
            throw new TokenAcquisitionException("Token source returned a token that expired at " + token.expiry());
        }
        return CredentialArtifact.bearer(token.accessToken(), token.expiry());
    }
}
