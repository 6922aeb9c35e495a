package offramp.core.service.ratelimit;

import java.time.Duration;

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
 * Fixed window cap on all traffic of a subject.
 *
 * <p>The window starts with the first increment and ends when the counter
 * expires, so up to twice the cap can pass around a window boundary.
 */
@ApplicationScoped
public class GlobalCounterLimiter {

    private static final Logger LOG = Logger.getLogger(GlobalCounterLimiter.class);

    static final String HIGH_LOAD_MESSAGE = "System is experiencing high load";

    private final KeyValueStore store;

    @Inject
    public GlobalCounterLimiter(KeyValueStore store) {
        this.store = store;
    }

    public Uni<RateLimitResult> check(RateLimitPolicy policy) {
        final var global = policy.global();
        final var key = RateLimitKeys.global(policy.subject());

        return store.increment(key)
                .call(count -> count == 1
                        ? store.expire(key, Duration.ofSeconds(global.windowSeconds()))
                        : Uni.createFrom().voidItem())
                .map(count -> {
                    if (count > global.count()) {
                        LOG.debugf("Global cap reached for subject %s: %d > %d", policy.subject(), count, global.count());
                        return RateLimitResult.deny(LimitStage.GLOBAL, HIGH_LOAD_MESSAGE);
                    }
                    return RateLimitResult.allow();
                });
    }
}
