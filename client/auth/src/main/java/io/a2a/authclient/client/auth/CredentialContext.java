package io.a2a.authclient.client.auth;

import io.a2a.authclient.util.Assert;

/**
 * Describes the call a credential is requested for.
 *
 * @param method the JSON-RPC method about to be invoked
 * @param agentUrl the URL of the agent the call is sent to
 */
public record CredentialContext(String method, String agentUrl) {

    public CredentialContext {
        Assert.checkNotNullParam("method", method);
        Assert.checkNotNullParam("agentUrl", agentUrl);
    }
}
