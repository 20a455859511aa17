package io.a2a.authclient.client.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import io.a2a.authclient.util.Assert;
import io.a2a.authclient.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current credential of one provider and re-acquires it before it expires.
 * <p>
 * The cache is either empty or holds a credential. A request is answered from the cache while
 * {@code now < expiresAt - skew}; otherwise the configured exchange is started and its result
 * replaces the cached credential. A failed exchange leaves the cache as it was and is
 * reported to every caller waiting on it; the next request starts a new exchange. Nothing is
 * retried in the background.
 * <p>
 * At most one exchange is in flight at a time. Callers arriving while it runs share its
 * result, each through its own future. Cancelling such a future detaches that caller only;
 * the exchange itself is cancelled once no caller is waiting for it anymore.
 * <p>
 * Each provider instance owns its own cache; nothing is shared between instances.
 */
public class TokenCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenCache.class);

    /** Default safety margin applied to credential expiry. */
    public static final Duration DEFAULT_SKEW = Duration.ofSeconds(10);

    private final String name;
    private final Supplier<CompletableFuture<CredentialArtifact>> exchange;
    private final Clock clock;
    private final Duration skew;

    private final ReentrantLock lock = new ReentrantLock();
    // guarded by lock
    private @Nullable CredentialArtifact current;
    private @Nullable Flight inFlight;

    /**
     * @param name a name identifying the owning provider in log messages
     * @param exchange starts a new exchange each time it is called
     * @param clock the clock expiry is checked against
     * @param skew the safety margin subtracted from the credential expiry
     */
    public TokenCache(String name, Supplier<CompletableFuture<CredentialArtifact>> exchange, Clock clock, Duration skew) {
        this.name = Assert.checkNotNullParam("name", name);
        this.exchange = Assert.checkNotNullParam("exchange", exchange);
        this.clock = Assert.checkNotNullParam("clock", clock);
        this.skew = Assert.checkNotNullParam("skew", skew);
        if (skew.isNegative()) {
            throw new IllegalArgumentException("Skew must not be negative: " + skew);
        }
    }

    /**
     * Returns the cached credential if it is still usable, or joins (starting it if needed)
     * the exchange that will replace it.
     *
     * @return a future completed with a credential that is not expired
     */
    public CompletableFuture<CredentialArtifact> get() {
        lock.lock();
        try {
            CredentialArtifact artifact = current;
            if (artifact != null && artifact.isUsable(clock.instant(), skew)) {
                return CompletableFuture.completedFuture(artifact);
            }
            Flight flight = inFlight;
            if (flight == null) {
                flight = startExchange();
            }
            return flight.join();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the cached credential, so that the next request starts a new exchange. An
     * exchange already in flight is not affected.
     */
    public void invalidate() {
        lock.lock();
        try {
            current = null;
        } finally {
            lock.unlock();
        }
    }

    private Flight startExchange() {
        LOGGER.debug("Acquiring new credential for {}", name);
        CompletableFuture<CredentialArtifact> started;
        try {
            started = exchange.get();
        } catch (RuntimeException e) {
            started = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<CredentialArtifact> checked = started.thenApply(this::checkNotExpired);
        Flight flight = new Flight(Utils.propagateCancellation(checked, started));
        inFlight = flight;
        flight.shared.whenComplete((artifact, throwable) -> onExchangeComplete(flight, artifact, throwable));
        return flight;
    }

    private CredentialArtifact checkNotExpired(@Nullable CredentialArtifact artifact) {
        Instant now = clock.instant();
        if (artifact == null) {
            throw Utils.asCompletionException(new TokenAcquisitionException("No credential returned for " + name));
        }
        if (artifact.isExpired(now)) {
            throw Utils.asCompletionException(new TokenAcquisitionException(
                    "Credential acquired for " + name + " expired at " + artifact.expiresAt()));
        }
        return artifact;
    }

    private void onExchangeComplete(Flight flight, @Nullable CredentialArtifact artifact, @Nullable Throwable throwable) {
        lock.lock();
        try {
            if (inFlight == flight) {
                inFlight = null;
            }
            if (throwable == null && artifact != null) {
                current = artifact;
                LOGGER.debug("Acquired credential for {}, expires at {}", name, artifact.expiresAt());
            } else if (throwable != null && Utils.isCancellation(throwable)) {
                LOGGER.debug("Credential exchange for {} was cancelled", name);
            } else if (throwable != null) {
                LOGGER.warn("Failed to acquire credential for {}: {}", name,
                        Utils.unwrapCompletionException(throwable).getMessage());
            }
        } finally {
            lock.unlock();
        }
    }

    private void leave(Flight flight) {
        lock.lock();
        try {
            if (inFlight != flight) {
                return;
            }
            flight.waiters--;
            if (flight.waiters == 0) {
                inFlight = null;
                LOGGER.debug("No caller waiting for the credential exchange of {} anymore, cancelling it", name);
                flight.shared.cancel(true);
            }
        } finally {
            lock.unlock();
        }
    }

    private final class Flight {
        private final CompletableFuture<CredentialArtifact> shared;
        // guarded by lock
        private int waiters;

        private Flight(CompletableFuture<CredentialArtifact> shared) {
            this.shared = shared;
        }

        private CompletableFuture<CredentialArtifact> join() {
            waiters++;
            CompletableFuture<CredentialArtifact> waiter = new CompletableFuture<>();
            shared.whenComplete((artifact, throwable) -> {
                if (throwable != null) {
                    waiter.completeExceptionally(Utils.unwrapCompletionException(throwable));
                } else {
                    waiter.complete(artifact);
                }
            });
            waiter.whenComplete((artifact, throwable) -> {
                if (waiter.isCancelled()) {
                    leave(this);
                }
            });
            return waiter;
        }
    }
}
