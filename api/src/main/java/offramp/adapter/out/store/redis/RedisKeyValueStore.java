package offramp.adapter.out.store.redis;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.sortedset.ReactiveSortedSetCommands;
import io.quarkus.redis.datasource.sortedset.ScoreRange;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;

import offramp.core.port.out.KeyValueStore;
import offramp.core.port.out.Metrics;

/**
 * Redis implementation of KeyValueStore.
 *
 * <p>This is the implementation for production deployments, where Redis is
 * shared by every instance. Each method maps to a single Redis command, so
 * each is atomic on the server.
 *
 * <p>Create-if-absent uses the raw {@code SET key value NX PX ttl} command,
 * whose nil reply tells whether the key was created.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ReactiveSortedSetCommands<String, String> sortedSetCommands;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisKeyValueStore(ReactiveRedisDataSource redisDataSource, Duration timeout, Metrics metrics) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.sortedSetCommands = redisDataSource.sortedSet(String.class, String.class);
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.timeoutHelper = new RedisTimeoutHelper(timeout, metrics);
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return timeoutHelper.withTimeout(valueCommands.get(key), "get").map(Optional::ofNullable);
    }

    @Override
    public Uni<Void> setWithExpiry(String key, String value, Duration ttl) {
        return timeoutHelper.withTimeout(valueCommands.setex(key, ttl.toSeconds(), value), "setex");
    }

    @Override
    public Uni<Boolean> setIfAbsent(String key, String value, Duration ttl) {
        final var operation =
                redisDataSource.execute("SET", key, value, "NX", "PX", String.valueOf(ttl.toMillis()));
        return timeoutHelper.withTimeout(operation, "setnx").map(response -> response != null);
    }

    @Override
    public Uni<Long> delete(String... keys) {
        return timeoutHelper.withTimeout(keyCommands.del(keys), "del").map(Integer::longValue);
    }

    @Override
    public Uni<Long> increment(String key) {
        return timeoutHelper.withTimeout(valueCommands.incr(key), "incr");
    }

    @Override
    public Uni<Boolean> expire(String key, Duration ttl) {
        return timeoutHelper.withTimeout(keyCommands.expire(key, ttl), "expire");
    }

    @Override
    public Uni<Boolean> sortedSetAdd(String key, double score, String member) {
        return timeoutHelper.withTimeout(sortedSetCommands.zadd(key, score, member), "zadd");
    }

    @Override
    public Uni<Long> sortedSetRemoveRangeByScore(String key, double min, double max) {
        return timeoutHelper.withTimeout(
                sortedSetCommands.zremrangebyscore(key, new ScoreRange<>(min, max)), "zremrangebyscore");
    }

    @Override
    public Uni<Long> sortedSetCardinality(String key) {
        return timeoutHelper.withTimeout(sortedSetCommands.zcard(key), "zcard");
    }

    @Override
    public Uni<Void> hashSet(String key, Map<String, String> fields) {
        return timeoutHelper.withTimeout(hashCommands.hset(key, fields), "hset").replaceWithVoid();
    }

    @Override
    public Uni<Map<String, String>> hashGetAll(String key) {
        return timeoutHelper.withTimeout(hashCommands.hgetall(key), "hgetall");
    }
}
