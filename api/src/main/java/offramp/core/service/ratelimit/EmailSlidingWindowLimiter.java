package offramp.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import offramp.core.model.ratelimit.LimitStage;
import offramp.core.model.ratelimit.RateLimitKeys;
import offramp.core.model.ratelimit.RateLimitPolicy;
import offramp.core.model.ratelimit.RateLimitResult;
import offramp.core.port.out.KeyValueStore;

/**
 * Sliding window limit per identifier.
 *
 * <p>Each admitted request is recorded in a sorted set scored by its timestamp.
 * Entries older than the window are pruned before counting, so the set holds
 * exactly the requests of the trailing window.
 *
 * <p>Pruning, counting and recording are separate store operations. Concurrent
 * requests for the same identifier may all read a count below the limit and
 * all be admitted.
 */
@ApplicationScoped
public class EmailSlidingWindowLimiter {

    private static final Logger LOG = Logger.getLogger(EmailSlidingWindowLimiter.class);

    private final KeyValueStore store;
    private final Clock clock;

    @Inject
    public EmailSlidingWindowLimiter(KeyValueStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Check and record one request for an identifier.
     *
     * @param policy the subject's policy
     * @param email the identifier
     * @return Uni with the result; a denial does not record the request
     */
    public Uni<RateLimitResult> check(RateLimitPolicy policy, String email) {
        final var window = policy.email();
        final var key = RateLimitKeys.email(policy.subject(), email);
        final var now = clock.millis();
        final var windowStart = now - window.windowMillis();

        return store.sortedSetRemoveRangeByScore(key, 0, windowStart)
                .flatMap(removed -> store.sortedSetCardinality(key))
                .flatMap(count -> {
                    if (count >= window.count()) {
                        LOG.debugf(
                                "Email window exceeded for subject %s: %d requests in %ds",
                                policy.subject(), count, window.windowSeconds());
                        return Uni.createFrom()
                                .item(RateLimitResult.deny(LimitStage.EMAIL, denialMessage(policy)));
                    }
                    return store.sortedSetAdd(key, now, member(now))
                            .call(() -> store.expire(key, Duration.ofSeconds(window.keyTtlSeconds())))
                            .replaceWith(RateLimitResult.allow());
                });
    }

    static String denialMessage(RateLimitPolicy policy) {
        return "Maximum %d requests per %s for this identifier"
                .formatted(policy.email().count(), describeWindow(policy.email().windowSeconds()));
    }

    static String describeWindow(long windowSeconds) {
        if (windowSeconds == 60) {
            return "minute";
        }
        if (windowSeconds == 3600) {
            return "hour";
        }
        if (windowSeconds == 86400) {
            return "day";
        }
        return windowSeconds + " seconds";
    }

    // Requests in the same millisecond must stay distinct members.
    private static String member(long now) {
        return now + "-" + Long.toHexString(ThreadLocalRandom.current().nextLong());
    }
}
