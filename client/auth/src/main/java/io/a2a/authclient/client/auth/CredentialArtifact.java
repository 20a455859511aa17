package io.a2a.authclient.client.auth;

import java.time.Duration;
import java.time.Instant;

import io.a2a.authclient.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Credential material ready to be attached to a request.
 * <p>
 * For {@link CredentialScheme#HEADER} artifacts {@code name} is the header name and {@code value}
 * the header value. For {@link CredentialScheme#BEARER} artifacts {@code value} is the token and
 * {@code name} is always {@value #AUTHORIZATION}.
 *
 * @param scheme how the artifact is attached
 * @param name the header name
 * @param value the header value or bearer token
 * @param expiresAt the instant the credential stops being valid, null if it never expires
 */
public record CredentialArtifact(CredentialScheme scheme, String name, String value, @Nullable Instant expiresAt) {

    public static final String AUTHORIZATION = "Authorization";
    public static final String BEARER_PREFIX = "Bearer ";

    public CredentialArtifact {
        Assert.checkNotNullParam("scheme", scheme);
        Assert.checkNotBlankParam("name", name);
        Assert.checkNotBlankParam("value", value);
        if (scheme == CredentialScheme.BEARER && !AUTHORIZATION.equals(name)) {
            throw new IllegalArgumentException("Bearer credentials are always sent in the " + AUTHORIZATION + " header");
        }
    }

    public static CredentialArtifact header(String name, String value) {
        return new CredentialArtifact(CredentialScheme.HEADER, name, value, null);
    }

    public static CredentialArtifact bearer(String token, @Nullable Instant expiresAt) {
        return new CredentialArtifact(CredentialScheme.BEARER, AUTHORIZATION, token, expiresAt);
    }

    /**
     * Returns the value to put in the {@link #name()} header.
     *
     * @return the header value, prefixed with {@code Bearer } for bearer tokens
     */
    public String headerValue() {
        return scheme == CredentialScheme.BEARER ? BEARER_PREFIX + value : value;
    }

    /**
     * @param now the current time
     * @return true if the credential is no longer valid at {@code now}
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /**
     * Checks whether the credential can still be handed out, keeping a safety margin so that a
     * token does not expire while the request carrying it is in flight.
     *
     * @param now the current time
     * @param skew the safety margin subtracted from the expiry
     * @return true if {@code now} is before {@code expiresAt - skew}, or the credential never expires
     */
    public boolean isUsable(Instant now, Duration skew) {
        return expiresAt == null || now.isBefore(expiresAt.minus(skew));
    }

    @Override
    public String toString() {
        return "CredentialArtifact[scheme=" + scheme + ", name=" + name + ", value=***, expiresAt=" + expiresAt + "]";
    }
}
