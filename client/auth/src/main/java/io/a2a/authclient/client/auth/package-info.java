/**
 * Credential providers for the A2A client.
 * <p>
 * A {@link io.a2a.authclient.client.auth.CredentialProvider} produces a
 * {@link io.a2a.authclient.client.auth.CredentialArtifact} for each call. Providers backed by
 * expiring tokens keep them in a {@link io.a2a.authclient.client.auth.TokenCache}, which
 * refreshes them shortly before they expire and collapses concurrent refreshes into a
 * single exchange.
 */
@NullMarked
package io.a2a.authclient.client.auth;

import org.jspecify.annotations.NullMarked;
