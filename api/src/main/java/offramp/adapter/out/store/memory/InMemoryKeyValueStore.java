package offramp.adapter.out.store.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import offramp.core.port.out.KeyValueStore;
import offramp.core.port.out.StoreException;

/**
 * In-memory implementation of KeyValueStore.
 *
 * <p>This implementation is intended for development and testing only.
 * State is lost on restart and not shared across instances, so limits and
 * locks only hold within one process.
 *
 * <p>Expiry follows the injected clock. Expired keys are invisible to every
 * operation and are purged by a background task once a minute.
 *
 * <p><strong>Warning:</strong> Do not use in production with multiple instances.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyValueStore.class);

    private static final long NO_EXPIRY = Long.MAX_VALUE;

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "kv-store-cleanup");
            t.setDaemon(true);
            return t;
        });

        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory key-value store");
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(() -> {
            final var entry = live(key);
            if (entry == null) {
                return Optional.<String>empty();
            }
            return Optional.of(asString("get", key, entry));
        });
    }

    @Override
    public Uni<Void> setWithExpiry(String key, String value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            entries.put(key, new Entry(value, expiresAt(ttl)));
            return null;
        });
    }

    @Override
    public Uni<Boolean> setIfAbsent(String key, String value, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var candidate = new Entry(value, now + ttl.toMillis());
            final var result = entries.compute(key, (k, existing) -> isLive(existing, now) ? existing : candidate);
            return result == candidate;
        });
    }

    @Override
    public Uni<Long> delete(String... keys) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            long removed = 0;
            for (var key : keys) {
                final var entry = entries.remove(key);
                if (isLive(entry, now)) {
                    removed++;
                }
            }
            return removed;
        });
    }

    @Override
    public Uni<Long> increment(String key) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var updated = entries.compute(key, (k, existing) -> {
                if (!isLive(existing, now)) {
                    return new Entry("1", NO_EXPIRY);
                }
                final var current = asString("increment", key, existing);
                try {
                    return new Entry(Long.toString(Long.parseLong(current) + 1), existing.expiresAtMillis());
                } catch (NumberFormatException e) {
                    throw new StoreException("increment", "value is not an integer: " + key, e);
                }
            });
            return Long.parseLong((String) updated.value());
        });
    }

    @Override
    public Uni<Boolean> expire(String key, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var updated = entries.computeIfPresent(
                    key,
                    (k, existing) ->
                            isLive(existing, now) ? new Entry(existing.value(), now + ttl.toMillis()) : null);
            return updated != null;
        });
    }

    @Override
    public Uni<Boolean> sortedSetAdd(String key, double score, String member) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var added = new AtomicBoolean();
            entries.compute(key, (k, existing) -> {
                final var members = isLive(existing, now)
                        ? new HashMap<>(asSortedSet("sortedSetAdd", key, existing))
                        : new HashMap<String, Double>();
                added.set(members.put(member, score) == null);
                return new Entry(
                        new SortedSetValue(Map.copyOf(members)),
                        isLive(existing, now) ? existing.expiresAtMillis() : NO_EXPIRY);
            });
            return added.get();
        });
    }

    @Override
    public Uni<Long> sortedSetRemoveRangeByScore(String key, double min, double max) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            final var removed = new AtomicLong();
            entries.computeIfPresent(key, (k, existing) -> {
                if (!isLive(existing, now)) {
                    return null;
                }
                final var members = new HashMap<>(asSortedSet("sortedSetRemoveRangeByScore", key, existing));
                final var before = members.size();
                members.values().removeIf(score -> score >= min && score <= max);
                removed.set(before - members.size());
                return members.isEmpty()
                        ? null
                        : new Entry(new SortedSetValue(Map.copyOf(members)), existing.expiresAtMillis());
            });
            return removed.get();
        });
    }

    @Override
    public Uni<Long> sortedSetCardinality(String key) {
        return Uni.createFrom().item(() -> {
            final var entry = live(key);
            return entry == null ? 0L : (long) asSortedSet("sortedSetCardinality", key, entry).size();
        });
    }

    @Override
    public Uni<Void> hashSet(String key, Map<String, String> fields) {
        return Uni.createFrom().item(() -> {
            final var now = clock.millis();
            entries.compute(key, (k, existing) -> {
                final var hash = isLive(existing, now)
                        ? new HashMap<>(asHash("hashSet", key, existing))
                        : new HashMap<String, String>();
                hash.putAll(fields);
                return new Entry(
                        new HashValue(Map.copyOf(hash)), isLive(existing, now) ? existing.expiresAtMillis() : NO_EXPIRY);
            });
            return null;
        });
    }

    @Override
    public Uni<Map<String, String>> hashGetAll(String key) {
        return Uni.createFrom().item(() -> {
            final var entry = live(key);
            return entry == null ? Map.<String, String>of() : asHash("hashGetAll", key, entry);
        });
    }

    /**
     * Remaining time to live of a key, empty if the key is absent or has no expiry.
     */
    public Optional<Duration> ttl(String key) {
        final var entry = live(key);
        if (entry == null || entry.expiresAtMillis() == NO_EXPIRY) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(entry.expiresAtMillis() - clock.millis()));
    }

    public boolean exists(String key) {
        return live(key) != null;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Remove expired keys.
     */
    public void cleanupExpired() {
        final var now = clock.millis();
        final var before = entries.size();
        entries.entrySet().removeIf(e -> !isLive(e.getValue(), now));
        final var removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Purged %d expired keys", removed);
        }
    }

    /**
     * Shutdown the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Entry live(String key) {
        final var entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (!isLive(entry, clock.millis())) {
            entries.remove(key, entry);
            return null;
        }
        return entry;
    }

    private long expiresAt(Duration ttl) {
        return clock.millis() + ttl.toMillis();
    }

    private static boolean isLive(Entry entry, long now) {
        return entry != null && entry.expiresAtMillis() > now;
    }

    private static String asString(String operation, String key, Entry entry) {
        if (entry.value() instanceof String value) {
            return value;
        }
        throw wrongType(operation, key);
    }

    private static Map<String, Double> asSortedSet(String operation, String key, Entry entry) {
        if (entry.value() instanceof SortedSetValue sortedSet) {
            return sortedSet.members();
        }
        throw wrongType(operation, key);
    }

    private static Map<String, String> asHash(String operation, String key, Entry entry) {
        if (entry.value() instanceof HashValue hash) {
            return hash.fields();
        }
        throw wrongType(operation, key);
    }

    private static StoreException wrongType(String operation, String key) {
        return new StoreException(
                operation, "WRONGTYPE operation against a key holding the wrong kind of value: " + key);
    }

    private record Entry(Object value, long expiresAtMillis) {}

    private record SortedSetValue(Map<String, Double> members) {}

    private record HashValue(Map<String, String> fields) {}
}
