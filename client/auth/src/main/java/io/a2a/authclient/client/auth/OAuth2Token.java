package io.a2a.authclient.client.auth;

import java.time.Instant;

import io.a2a.authclient.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * An OAuth2 access token as handed out by a {@link TokenSource}.
 *
 * @param accessToken the token
 * @param tokenType the token type; null is treated as {@code Bearer}
 * @param expiry when the token expires, null if the source does not know
 */
public record OAuth2Token(String accessToken, @Nullable String tokenType, @Nullable Instant expiry) {

    public static final String BEARER = "Bearer";

    public OAuth2Token {
        Assert.checkNotBlankParam("accessToken", accessToken);
    }

    public OAuth2Token(String accessToken, @Nullable Instant expiry) {
        this(accessToken, BEARER, expiry);
    }

    public boolean isBearer() {
        return tokenType == null || tokenType.isEmpty() || BEARER.equalsIgnoreCase(tokenType);
    }

    @Override
    public String toString() {
        return "OAuth2Token[accessToken=***, tokenType=" + tokenType + ", expiry=" + expiry + "]";
    }
}
