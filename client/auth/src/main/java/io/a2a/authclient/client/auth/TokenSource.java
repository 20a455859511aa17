package io.a2a.authclient.client.auth;

import java.io.IOException;

import org.jspecify.annotations.Nullable;

/**
 * Supplies OAuth2 tokens managed outside of this client. The source is responsible for
 * obtaining, caching and refreshing its tokens; it is called once per outgoing request and
 * may be called from several threads at once.
 */
@FunctionalInterface
public interface TokenSource {

    /**
     * @return a currently valid token
     * @throws IOException if no token could be obtained
     */
    @Nullable
    OAuth2Token token() throws IOException;
}
