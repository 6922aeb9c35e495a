package offramp.adapter.out.store.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import offramp.core.port.out.Metrics;
import offramp.core.port.out.StoreException;

/**
 * Applies the operation timeout to Redis calls and translates failures.
 *
 * <p>Every failure leaves as a {@link StoreException}: timeouts as
 * {@link RedisTimeoutException}, connection and server errors wrapped with
 * their cause. Callers never see Redis client exceptions.
 *
 * <h2>Metrics</h2>
 * Records timeouts ({@code offramp.store.timeouts.total}) and non-timeout
 * failures ({@code offramp.store.failures.total}) separately.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final Metrics metrics;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance for recording failures (may be null)
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics) {
        this.timeout = timeout;
        this.metrics = metrics;
    }

    /**
     * Apply the timeout to an operation and translate its failures.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with {@link StoreException} on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} after {1}", operationName, timeout);
                    recordTimeout(operationName);
                    return new RedisTimeoutException(operationName, timeout);
                })
                .onFailure(failure -> !(failure instanceof StoreException))
                .transform(failure -> {
                    LOG.warnv("Redis operation failure: {0}: {1}", operationName, failure.getMessage());
                    recordFailure(operationName);
                    return new StoreException(operationName, "Redis operation failed: " + operationName, failure);
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStoreTimeout(operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStoreFailure(operationName);
        }
    }

    /**
     * A Redis operation did not complete within the configured timeout.
     */
    public static class RedisTimeoutException extends StoreException {

        public RedisTimeoutException(String operation, Duration timeout) {
            super(operation, "Redis operation timed out: %s after %s".formatted(operation, timeout));
        }
    }
}
