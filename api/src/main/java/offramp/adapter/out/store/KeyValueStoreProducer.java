package offramp.adapter.out.store;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import offramp.adapter.out.store.memory.InMemoryKeyValueStore;
import offramp.adapter.out.store.redis.RedisKeyValueStore;
import offramp.config.StoreConfig;
import offramp.core.port.out.KeyValueStore;
import offramp.core.port.out.Metrics;

/**
 * CDI producer for the key-value store.
 *
 * <p>Selects the implementation based on configuration and availability:
 * <ul>
 *   <li>Redis - used when enabled and a Redis client is available</li>
 *   <li>In-memory - fallback, correct only for a single instance</li>
 * </ul>
 */
@ApplicationScoped
public class KeyValueStoreProducer {

    private static final Logger LOG = Logger.getLogger(KeyValueStoreProducer.class);

    private final StoreConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public KeyValueStoreProducer(
            StoreConfig config, Instance<ReactiveRedisDataSource> redisDataSource, Metrics metrics, Clock clock) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Produces the key-value store instance for CDI injection.
     *
     * @return the configured store
     */
    @Produces
    @ApplicationScoped
    public KeyValueStore produceKeyValueStore() {
        final var redis = createRedisStore();
        if (redis.isPresent()) {
            LOG.infov("Using Redis key-value store, operation timeout {0}", config.redis().operationTimeout());
            return redis.get();
        }

        LOG.warn("Using in-memory key-value store; limits and locks are not shared between instances");
        return new InMemoryKeyValueStore(clock);
    }

    /**
     * Disposes the store, shutting down any cleanup executors.
     */
    void disposeKeyValueStore(@Disposes KeyValueStore store) {
        if (store instanceof InMemoryKeyValueStore inMemory) {
            inMemory.shutdown();
        }
    }

    private Optional<KeyValueStore> createRedisStore() {
        if (!config.redis().enabled()) {
            LOG.debug("Redis store not enabled in configuration");
            return Optional.empty();
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis store enabled but ReactiveRedisDataSource not available");
            return Optional.empty();
        }

        try {
            return Optional.of(
                    new RedisKeyValueStore(redisDataSource.get(), config.redis().operationTimeout(), metrics));
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize Redis store, falling back to in-memory");
            return Optional.empty();
        }
    }

    /**
     * Name of the backend that {@link #produceKeyValueStore()} selects.
     */
    public String backendName() {
        return config.redis().enabled() && redisDataSource.isResolvable() ? "redis" : "memory";
    }
}
