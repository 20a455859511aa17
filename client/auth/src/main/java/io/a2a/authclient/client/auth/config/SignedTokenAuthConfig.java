package io.a2a.authclient.client.auth.config;

import java.time.Duration;

import io.a2a.authclient.client.auth.CredentialProvider;
import io.a2a.authclient.client.auth.SignedTokenCredentialProvider;
import io.a2a.authclient.client.auth.SigningAlgorithm;
import io.a2a.authclient.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Authenticates with JWT bearer tokens signed locally with a shared secret.
 *
 * @param secret the signing secret
 * @param audience the {@code aud} claim
 * @param issuer the {@code iss} claim
 * @param subject the {@code sub} claim
 * @param validity how long each token is valid
 * @param algorithm the HMAC algorithm
 * @param reuseUntilNearExpiry whether a signed token is reused until it nears expiry
 */
public record SignedTokenAuthConfig(byte[] secret, String audience, String issuer, String subject,
                                    Duration validity, SigningAlgorithm algorithm,
                                    boolean reuseUntilNearExpiry) implements AuthConfig {

    public SignedTokenAuthConfig {
        Assert.checkNotNullParam("secret", secret);
        Assert.checkNotBlankParam("audience", audience);
        Assert.checkNotBlankParam("issuer", issuer);
        Assert.checkNotBlankParam("subject", subject);
        Assert.checkNotNullParam("validity", validity);
        Assert.checkNotNullParam("algorithm", algorithm);
        secret = secret.clone();
    }

    public SignedTokenAuthConfig(byte[] secret, String audience, String issuer, Duration validity) {
        this(secret, audience, issuer, SignedTokenCredentialProvider.DEFAULT_SUBJECT, validity,
                SigningAlgorithm.HS256, false);
    }

    @Override
    public byte[] secret() {
        return secret.clone();
    }

    @Override
    public CredentialProvider createProvider(ProviderSettings settings) {
        return new SignedTokenCredentialProvider(secret, audience, issuer, subject, validity, algorithm,
                reuseUntilNearExpiry, settings.skew(), settings.clock());
    }

    @Override
    public String toString() {
        return "SignedTokenAuthConfig[secret=***, audience=" + audience + ", issuer=" + issuer
                + ", subject=" + subject + ", validity=" + validity + ", algorithm=" + algorithm
                + ", reuseUntilNearExpiry=" + reuseUntilNearExpiry + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private byte @Nullable [] secret;
        private @Nullable String audience;
        private @Nullable String issuer;
        private String subject = SignedTokenCredentialProvider.DEFAULT_SUBJECT;
        private @Nullable Duration validity;
        private SigningAlgorithm algorithm = SigningAlgorithm.HS256;
        private boolean reuseUntilNearExpiry;

        public Builder secret(byte[] secret) {
            this.secret = secret;
            return this;
        }

        public Builder audience(String audience) {
            this.audience = audience;
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder validity(Duration validity) {
            this.validity = validity;
            return this;
        }

        public Builder algorithm(SigningAlgorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder reuseUntilNearExpiry(boolean reuseUntilNearExpiry) {
            this.reuseUntilNearExpiry = reuseUntilNearExpiry;
            return this;
        }

        public SignedTokenAuthConfig build() {
            return new SignedTokenAuthConfig(secret, audience, issuer, subject, validity, algorithm,
                    reuseUntilNearExpiry);
        }
    }
}
