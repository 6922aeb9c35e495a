package offramp.core.service.lock;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import offramp.core.config.LockConfig;
import offramp.core.port.out.KeyValueStore;
import offramp.core.port.out.Metrics;

/**
 * Per-category cache of {@link DistributedLock} instances.
 *
 * <p>Holds no lock state of its own; all state lives in the store.
 */
@ApplicationScoped
public class LockRegistry {

    public static final String DEPOSITS = "deposits";
    public static final String WITHDRAWALS = "withdrawals";

    private final KeyValueStore store;
    private final Duration ttl;
    private final Metrics metrics;
    private final ConcurrentMap<String, DistributedLock> locks = new ConcurrentHashMap<>();

    @Inject
    public LockRegistry(KeyValueStore store, LockConfig config, Metrics metrics) {
        this(store, config.ttl(), metrics);
    }

    public LockRegistry(KeyValueStore store, Duration ttl, Metrics metrics) {
        this.store = store;
        this.ttl = ttl;
        this.metrics = metrics;
    }

    /**
     * Get the lock of a category, creating it on first use.
     *
     * @param category the category, e.g. {@link #WITHDRAWALS}
     * @return the cached lock
     */
    public DistributedLock get(String category) {
        return locks.computeIfAbsent(category, name -> new DistributedLock(store, name, ttl, metrics));
    }

    public Set<String> categories() {
        return Set.copyOf(locks.keySet());
    }
}
