package io.a2a.authclient.client.auth;

import static io.a2a.authclient.util.Utils.OBJECT_MAPPER;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.a2a.authclient.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Authenticates with JWT bearer tokens signed locally with a shared secret.
 * <p>
 * Each token carries the claims {@code iss}, {@code sub}, {@code aud}, {@code iat} and
 * {@code exp}, where {@code exp} is {@code iat} plus the configured validity. By default a new
 * token is signed for every call. When {@code reuseUntilNearExpiry} is set, a signed token is
 * kept in a {@link TokenCache} and reused until it gets within the skew of its expiry.
 */
public class SignedTokenCredentialProvider implements CredentialProvider {

    public static final String DEFAULT_SUBJECT = "a2a-client";

    private static final Base64.Encoder BASE64_URL = Base64.getUrlEncoder().withoutPadding();

    private final byte[] secret;
    private final String audience;
    private final String issuer;
    private final String subject;
    private final Duration validity;
    private final SigningAlgorithm algorithm;
    private final Clock clock;
    private final @Nullable TokenCache cache;

    public SignedTokenCredentialProvider(byte[] secret, String audience, String issuer, Duration validity) {
        this(secret, audience, issuer, DEFAULT_SUBJECT, validity, SigningAlgorithm.HS256,
                false, TokenCache.DEFAULT_SKEW, Clock.systemUTC());
    }

    /**
     * @param secret the shared signing secret
     * @param audience the {@code aud} claim
     * @param issuer the {@code iss} claim
     * @param subject the {@code sub} claim
     * @param validity how long each token is valid, at least one second
     * @param algorithm the HMAC algorithm
     * @param reuseUntilNearExpiry whether to reuse a signed token until it nears expiry
     * @param skew the margin before expiry at which a reused token is replaced
     * @param clock the clock used for {@code iat} and {@code exp}
     */
    public SignedTokenCredentialProvider(byte[] secret, String audience, String issuer, String subject,
                                         Duration validity, SigningAlgorithm algorithm,
                                         boolean reuseUntilNearExpiry, Duration skew, Clock clock) {
        Assert.checkNotNullParam("secret", secret);
        Assert.checkNotNullParam("validity", validity);
        if (validity.getSeconds() < 1) {
            throw new IllegalArgumentException("Token validity must be at least one second: " + validity);
        }
        this.secret = secret.clone();
        this.audience = Assert.checkNotBlankParam("audience", audience);
        this.issuer = Assert.checkNotBlankParam("issuer", issuer);
        this.subject = Assert.checkNotBlankParam("subject", subject);
        this.validity = validity;
        this.algorithm = Assert.checkNotNullParam("algorithm", algorithm);
        this.clock = Assert.checkNotNullParam("clock", clock);
        this.cache = reuseUntilNearExpiry
                ? new TokenCache("signed token for " + audience, this::signAsync, clock, skew)
                : null;
    }

    @Override
    public CompletableFuture<CredentialArtifact> produceArtifact(CredentialContext context) {
        if (cache != null) {
            return cache.get();
        }
        return signAsync();
    }

    private CompletableFuture<CredentialArtifact> signAsync() {
        try {
            return CompletableFuture.completedFuture(sign());
        } catch (SigningException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Signs a new token valid from now for the configured validity.
     *
     * @return the token as a bearer credential
     * @throws SigningException if the secret is empty or the token cannot be signed
     */
    public CredentialArtifact sign() throws SigningException {
        if (secret.length == 0) {
            throw new SigningException("Signing secret must not be empty");
        }

        long issuedAt = clock.instant().getEpochSecond();
        long expiresAt = issuedAt + validity.getSeconds();

        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", algorithm.name());
        header.put("typ", "JWT");

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("iss", issuer);
        claims.put("sub", subject);
        claims.put("aud", audience);
        claims.put("iat", issuedAt);
        claims.put("exp", expiresAt);

        try {
            String signingInput = BASE64_URL.encodeToString(OBJECT_MAPPER.writeValueAsBytes(header))
                    + "." + BASE64_URL.encodeToString(OBJECT_MAPPER.writeValueAsBytes(claims));

            Mac mac = Mac.getInstance(algorithm.jcaName());
            mac.init(new SecretKeySpec(secret, algorithm.jcaName()));
            byte[] signature = mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII));

            String token = signingInput + "." + BASE64_URL.encodeToString(signature);
            return CredentialArtifact.bearer(token, Instant.ofEpochSecond(expiresAt));
        } catch (JsonProcessingException e) {
            throw new SigningException("Failed to encode token claims", e);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new SigningException("Failed to sign token with " + algorithm, e);
        }
    }

    public String getAudience() {
        return audience;
    }

    public String getIssuer() {
        return issuer;
    }

    public Duration getValidity() {
        return validity;
    }

    public boolean isReusingTokens() {
        return cache != null;
    }

    @Override
    public String toString() {
        return "SignedTokenCredentialProvider[issuer=" + issuer + ", audience=" + audience
                + ", algorithm=" + algorithm + ", secretLength=" + secret.length
                + ", reuse=" + isReusingTokens() + "]";
    }
}
