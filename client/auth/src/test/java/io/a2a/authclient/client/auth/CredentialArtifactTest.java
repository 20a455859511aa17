package io.a2a.authclient.client.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

public class CredentialArtifactTest {

    private static final Instant EXPIRY = Instant.parse("2025-01-01T01:00:00Z");

    @Test
    public void testBearerHeaderValue() {
        CredentialArtifact artifact = CredentialArtifact.bearer("abc", EXPIRY);
        assertEquals(CredentialScheme.BEARER, artifact.scheme());
        assertEquals("Authorization", artifact.name());
        assertEquals("Bearer abc", artifact.headerValue());
    }

    @Test
    public void testHeaderValueIsSentAsIs() {
        CredentialArtifact artifact = CredentialArtifact.header("X-API-Key", "my-api-key");
        assertEquals("my-api-key", artifact.headerValue());
        assertFalse(artifact.isExpired(Instant.MAX));
        assertTrue(artifact.isUsable(Instant.MAX, Duration.ofHours(1)));
    }

    @Test
    public void testBearerMustUseAuthorizationHeader() {
        assertThrows(IllegalArgumentException.class,
                () -> new CredentialArtifact(CredentialScheme.BEARER, "X-Token", "abc", null));
    }

    @Test
    public void testExpiryBoundaries() {
        CredentialArtifact artifact = CredentialArtifact.bearer("abc", EXPIRY);
        Duration skew = Duration.ofSeconds(10);

        assertFalse(artifact.isExpired(EXPIRY.minusMillis(1)));
        assertTrue(artifact.isExpired(EXPIRY));

        assertTrue(artifact.isUsable(EXPIRY.minusSeconds(11), skew));
        assertFalse(artifact.isUsable(EXPIRY.minusSeconds(10), skew));
        assertFalse(artifact.isUsable(EXPIRY.minusSeconds(5), skew));
    }

    @Test
    public void testToStringDoesNotRevealValue() {
        CredentialArtifact artifact = CredentialArtifact.bearer("top-secret-token", EXPIRY);
        assertFalse(artifact.toString().contains("top-secret-token"));
    }
}
