package offramp.core.port.out;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port for the shared key-value store that backs rate limiting, locking and lockouts.
 *
 * <p>This is the only synchronization substrate between application instances.
 * Each operation is atomic on its own; sequences of operations are not.
 *
 * <p>Implementation requirements:
 * <ul>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 *   <li>Every key written with an expiry MUST disappear once the expiry elapses</li>
 *   <li>Connection failures and timeouts MUST fail the returned Uni with {@link StoreException}</li>
 * </ul>
 */
public interface KeyValueStore {

    /**
     * Read a string value.
     *
     * @param key the key
     * @return Uni with the value, or empty if absent or expired
     */
    Uni<Optional<String>> get(String key);

    /**
     * Write a string value with an expiry, replacing any existing value.
     *
     * @param key the key
     * @param value the value
     * @param ttl expiry of the key
     * @return Uni completing when written
     */
    Uni<Void> setWithExpiry(String key, String value, Duration ttl);

    /**
     * Write a string value with an expiry only if the key does not exist.
     *
     * @param key the key
     * @param value the value
     * @param ttl expiry of the key
     * @return Uni with true if the key was created, false if it already existed
     */
    Uni<Boolean> setIfAbsent(String key, String value, Duration ttl);

    /**
     * Delete keys.
     *
     * @param keys the keys to delete
     * @return Uni with the number of keys removed
     */
    Uni<Long> delete(String... keys);

    /**
     * Atomically increment an integer value, creating it at 0 first if absent.
     *
     * @param key the key
     * @return Uni with the value after incrementing
     */
    Uni<Long> increment(String key);

    /**
     * Set the expiry of an existing key.
     *
     * @param key the key
     * @param ttl the new expiry
     * @return Uni with true if the key exists and the expiry was set
     */
    Uni<Boolean> expire(String key, Duration ttl);

    /**
     * Add a member to a sorted set, or update its score.
     *
     * @param key the sorted set key
     * @param score the member's score
     * @param member the member
     * @return Uni with true if the member was newly added
     */
    Uni<Boolean> sortedSetAdd(String key, double score, String member);

    /**
     * Remove sorted set members whose score lies within {@code [min, max]}.
     *
     * @return Uni with the number of members removed
     */
    Uni<Long> sortedSetRemoveRangeByScore(String key, double min, double max);

    /**
     * Count the members of a sorted set.
     *
     * @return Uni with the cardinality, 0 if the key is absent
     */
    Uni<Long> sortedSetCardinality(String key);

    /**
     * Set fields of a hash.
     *
     * @param key the hash key
     * @param fields field values to write
     * @return Uni completing when written
     */
    Uni<Void> hashSet(String key, Map<String, String> fields);

    /**
     * Read all fields of a hash.
     *
     * @param key the hash key
     * @return Uni with the fields, empty if the key is absent
     */
    Uni<Map<String, String>> hashGetAll(String key);
}
