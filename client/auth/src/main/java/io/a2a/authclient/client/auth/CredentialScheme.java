package io.a2a.authclient.client.auth;

/**
 * How a {@link CredentialArtifact} is attached to an outgoing request.
 */
public enum CredentialScheme {
    /** Sent verbatim in a named request header, e.g. {@code X-API-Key}. */
    HEADER,
    /** Sent as {@code Authorization: Bearer <token>}. */
    BEARER
}
