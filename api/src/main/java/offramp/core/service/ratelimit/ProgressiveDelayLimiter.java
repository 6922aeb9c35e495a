package offramp.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import offramp.core.model.ratelimit.RateLimitKeys;
import offramp.core.model.ratelimit.RateLimitPolicy;
import offramp.core.model.ratelimit.RateLimitResult;
import offramp.core.port.out.KeyValueStore;

/**
 * Escalating minimum spacing between attempts of one identifier.
 *
 * <p>Every check takes the next attempt number, denied or not, so hammering
 * the endpoint climbs the delay ladder. The last-attempt timestamp only moves
 * on admitted attempts.
 */
@ApplicationScoped
public class ProgressiveDelayLimiter {

    private static final Logger LOG = Logger.getLogger(ProgressiveDelayLimiter.class);

    private final KeyValueStore store;
    private final Clock clock;

    @Inject
    public ProgressiveDelayLimiter(KeyValueStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Take the next attempt number for an identifier and check its required delay.
     *
     * @param policy the subject's policy
     * @param identifier the identifier
     * @return Uni with the result, always carrying the attempt number
     */
    public Uni<RateLimitResult> check(RateLimitPolicy policy, String identifier) {
        final var delays = policy.progressiveDelay();
        final var attemptsKey = RateLimitKeys.attempts(policy.subject(), identifier);
        final var lastKey = RateLimitKeys.lastAttempt(policy.subject(), identifier);
        final var now = clock.millis();

        return store.increment(attemptsKey)
                .call(attempt -> attempt == 1
                        ? store.expire(attemptsKey, Duration.ofSeconds(delays.attemptsKeyTtlSeconds()))
                        : Uni.createFrom().voidItem())
                .flatMap(attempt -> {
                    final var requiredSeconds = delays.requiredDelaySeconds(attempt);
                    if (requiredSeconds <= 0) {
                        return admit(policy, lastKey, now, attempt);
                    }
                    return store.get(lastKey).flatMap(last -> {
                        final var remaining = remainingSeconds(parse(last), now, requiredSeconds);
                        if (remaining > 0) {
                            LOG.debugf(
                                    "Progressive delay for subject %s: attempt %d must wait %ds",
                                    policy.subject(), attempt, remaining);
                            return Uni.createFrom()
                                    .item(RateLimitResult.denyAttempt(
                                            "Please wait %d seconds".formatted(remaining), attempt));
                        }
                        return admit(policy, lastKey, now, attempt);
                    });
                });
    }

    private Uni<RateLimitResult> admit(RateLimitPolicy policy, String lastKey, long now, long attempt) {
        final var ttl = Duration.ofSeconds(policy.progressiveDelay().lastAttemptKeyTtlSeconds());
        return store.setWithExpiry(lastKey, Long.toString(now), ttl)
                .replaceWith(RateLimitResult.allowAttempt(attempt));
    }

    /**
     * Whole seconds still to wait, rounded up, or 0 if the delay has passed.
     */
    static long remainingSeconds(Long lastMillis, long nowMillis, long requiredSeconds) {
        if (lastMillis == null) {
            return 0;
        }
        final var elapsedMillis = Math.max(0L, nowMillis - lastMillis);
        final var requiredMillis = requiredSeconds * 1000L;
        if (elapsedMillis >= requiredMillis) {
            return 0;
        }
        return (long) Math.ceil((requiredMillis - elapsedMillis) / 1000.0);
    }

    private static Long parse(Optional<String> last) {
        if (last.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(last.get());
        } catch (NumberFormatException e) {
            LOG.warnv("Ignoring malformed last-attempt timestamp: {0}", last.get());
            return null;
        }
    }
}
