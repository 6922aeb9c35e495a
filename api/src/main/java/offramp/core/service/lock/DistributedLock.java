package offramp.core.service.lock;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import offramp.core.port.out.KeyValueStore;
import offramp.core.port.out.Metrics;

/**
 * Mutual exclusion across application instances for one category of resources.
 *
 * <p>A lock is a store key {@code lock:{category}:{resourceId}} holding a random
 * ownership token. The key is created only if absent and expires after the
 * configured TTL, so a crashed holder cannot block the resource forever.
 *
 * <p>Usage:
 * <pre>{@code
 * lockRegistry.get("withdrawals")
 *         .withLock(walletId, () -> processWithdrawal(walletId));
 * }</pre>
 *
 * <p>The lock must cover the whole critical section. If the section outlives
 * the TTL, a second holder can enter and the first holder's release fails
 * with {@link LockOwnershipMismatchException}.
 *
 * <p>Release reads the token and then deletes the key in two store operations.
 * A lock expiring and being re-acquired between those two operations would be
 * deleted by the previous holder; the TTL must leave headroom to make this
 * unlikely.
 */
public class DistributedLock {

    private static final Logger LOG = Logger.getLogger(DistributedLock.class);

    static final String KEY_PREFIX = "lock:";

    private final KeyValueStore store;
    private final String category;
    private final Duration ttl;
    private final Metrics metrics;

    public DistributedLock(KeyValueStore store, String category, Duration ttl, Metrics metrics) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Lock category cannot be null or blank");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Lock TTL must be positive");
        }
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.category = category;
        this.ttl = ttl;
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    public String category() {
        return category;
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Try once to acquire the lock of a resource.
     *
     * @param resourceId the resource
     * @return Uni with the ownership token, failing with {@link LockAlreadyHeldException}
     *     if the lock is held
     */
    public Uni<String> acquire(String resourceId) {
        final var key = key(resourceId);
        final var token = UUID.randomUUID().toString();

        return store.setIfAbsent(key, token, ttl).map(created -> {
            metrics.recordLockAcquisition(category, created);
            if (!created) {
                LOG.debugf("Lock %s already held", key);
                throw new LockAlreadyHeldException(category, resourceId);
            }
            LOG.debugf("Acquired lock %s for %s", key, ttl);
            return token;
        });
    }

    /**
     * Release the lock of a resource if the token still owns it.
     *
     * @param resourceId the resource
     * @param token the token returned by {@link #acquire(String)}
     * @return Uni completing when released, failing with
     *     {@link LockOwnershipMismatchException} if the token does not own the lock
     */
    public Uni<Void> release(String resourceId, String token) {
        final var key = key(resourceId);

        return store.get(key).flatMap(current -> {
            if (current.isEmpty() || !current.get().equals(token)) {
                LOG.warnv("Refusing to release lock {0}: caller does not own it", key);
                metrics.recordLockOwnershipMismatch(category);
                return Uni.createFrom().<Void>failure(new LockOwnershipMismatchException(category, resourceId));
            }
            return store.delete(key)
                    .invoke(() -> LOG.debugf("Released lock %s", key))
                    .replaceWithVoid();
        });
    }

    /**
     * Run a critical section while holding the lock of a resource.
     *
     * <p>The lock is released whether the section succeeds or fails. If both the
     * section and the release fail, the section's failure is propagated with the
     * release failure attached as suppressed.
     *
     * @param resourceId the resource
     * @param criticalSection the work to run, invoked only once the lock is held
     * @param <T> the result type
     * @return Uni with the section's result
     */
    public <T> Uni<T> withLock(String resourceId, Supplier<Uni<T>> criticalSection) {
        return acquire(resourceId).flatMap(token -> Uni.createFrom()
                .<T>deferred(criticalSection::get)
                .onItemOrFailure()
                .transformToUni((item, failure) -> {
                    if (failure == null) {
                        return release(resourceId, token).replaceWith(item);
                    }
                    return release(resourceId, token)
                            .onItemOrFailure()
                            .transformToUni((ignored, releaseFailure) -> {
                                if (releaseFailure != null) {
                                    failure.addSuppressed(releaseFailure);
                                }
                                return Uni.createFrom().<T>failure(failure);
                            });
                }));
    }

    String key(String resourceId) {
        return KEY_PREFIX + category + ":" + resourceId;
    }
}
