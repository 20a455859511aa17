package io.a2a.authclient.client.auth;

/**
 * HMAC algorithms available to sign tokens with a shared secret.
 */
public enum SigningAlgorithm {
    HS256("HmacSHA256"),
    HS384("HmacSHA384"),
    HS512("HmacSHA512");

    private final String jcaName;

    SigningAlgorithm(String jcaName) {
        this.jcaName = jcaName;
    }

    /**
     * @return the name of the algorithm as known to {@link javax.crypto.Mac}
     */
    public String jcaName() {
        return jcaName;
    }
}
