package io.a2a.authclient.client.auth;

import java.util.concurrent.CompletableFuture;

/**
 * Produces the credentials attached to outgoing A2A calls.
 * <p>
 * One provider instance is selected when the client is built and used for every call the
 * client makes, possibly from many threads at once; implementations must be thread-safe.
 * Built-in implementations:
 * <ul>
 *   <li>{@link ApiKeyCredentialProvider} - a fixed header</li>
 *   <li>{@link SignedTokenCredentialProvider} - locally signed JWT bearer tokens</li>
 *   <li>{@link OAuth2ClientCredentialsProvider} - OAuth2 client credentials grant</li>
 *   <li>{@link OAuth2TokenSourceProvider} - tokens from a caller-managed {@link TokenSource}</li>
 * </ul>
 * Any other implementation, including a lambda, can be supplied as a custom provider.
 * <p>
 * The returned future must never complete with an artifact that is already expired. Failures
 * are reported by completing the future exceptionally, typically with a
 * {@link SigningException} or a {@link TokenAcquisitionException}. Cancelling the returned
 * future should abort any token exchange started on behalf of the caller.
 */
@FunctionalInterface
public interface CredentialProvider {

    /**
     * Produces a credential for the given call.
     *
     * @param context the call the credential is requested for
     * @return a future completed with a non-expired artifact
     */
    CompletableFuture<CredentialArtifact> produceArtifact(CredentialContext context);
}
