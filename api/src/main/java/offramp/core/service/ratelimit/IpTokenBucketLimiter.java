package offramp.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import offramp.core.model.ratelimit.IpBucketPolicy;
import offramp.core.model.ratelimit.LimitStage;
import offramp.core.model.ratelimit.RateLimitKeys;
import offramp.core.model.ratelimit.RateLimitPolicy;
import offramp.core.model.ratelimit.RateLimitResult;
import offramp.core.model.ratelimit.TokenBucketState;
import offramp.core.port.out.KeyValueStore;

/**
 * Token bucket limit per client IP.
 *
 * <p>Allows bursts up to the bucket capacity and a sustained rate equal to the
 * refill rate. The bucket is stored as a hash with fields {@code tokens} and
 * {@code last_update}; a denial leaves the stored state untouched.
 */
@ApplicationScoped
public class IpTokenBucketLimiter {

    private static final Logger LOG = Logger.getLogger(IpTokenBucketLimiter.class);

    static final String FIELD_TOKENS = "tokens";
    static final String FIELD_LAST_UPDATE = "last_update";

    private final KeyValueStore store;
    private final Clock clock;

    @Inject
    public IpTokenBucketLimiter(KeyValueStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Try to take one token from the bucket of an IP.
     *
     * @param policy the subject's policy
     * @param ip the client IP
     * @return Uni with the result; denials carry the seconds until a token is available
     */
    public Uni<RateLimitResult> check(RateLimitPolicy policy, String ip) {
        final var bucket = policy.ip();
        final var key = RateLimitKeys.ip(policy.subject(), ip);
        final var now = clock.millis();

        return store.hashGetAll(key).flatMap(fields -> {
            final var state = parse(fields);
            if (state == null) {
                return persist(key, TokenBucketState.firstRequest(bucket.capacity(), now), bucket);
            }

            final var tokens = state.refilled(bucket.capacity(), bucket.refillPerSecond(), now);
            if (tokens < 1) {
                final var retryAfter = retryAfterSeconds(tokens, bucket);
                LOG.debugf("IP bucket empty for subject %s, retry after %ds", policy.subject(), retryAfter);
                return Uni.createFrom()
                        .item(RateLimitResult.denyRetryAfter(
                                LimitStage.IP,
                                "Too many requests from this IP. Retry after %d seconds".formatted(retryAfter),
                                retryAfter));
            }
            return persist(key, new TokenBucketState(tokens - 1, now), bucket);
        });
    }

    private Uni<RateLimitResult> persist(String key, TokenBucketState state, IpBucketPolicy bucket) {
        final var fields = Map.of(
                FIELD_TOKENS, Double.toString(state.tokens()),
                FIELD_LAST_UPDATE, Long.toString(state.lastUpdateMillis()));
        return store.hashSet(key, fields)
                .call(() -> store.expire(key, Duration.ofSeconds(bucket.keyTtlSeconds())))
                .replaceWith(RateLimitResult.allow());
    }

    static long retryAfterSeconds(double tokens, IpBucketPolicy bucket) {
        return Math.max(1L, (long) Math.ceil((1.0 - tokens) / bucket.refillPerSecond()));
    }

    private static TokenBucketState parse(Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return null;
        }
        final var tokens = fields.get(FIELD_TOKENS);
        final var lastUpdate = fields.get(FIELD_LAST_UPDATE);
        if (tokens == null || lastUpdate == null) {
            LOG.warnv("Ignoring incomplete token bucket state: {0}", fields.keySet());
            return null;
        }
        try {
            return new TokenBucketState(Double.parseDouble(tokens), Long.parseLong(lastUpdate));
        } catch (NumberFormatException e) {
            LOG.warnv("Ignoring malformed token bucket state: {0}", e.getMessage());
            return null;
        }
    }
}
