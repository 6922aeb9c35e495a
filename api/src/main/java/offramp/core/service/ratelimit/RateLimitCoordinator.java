package offramp.core.service.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import offramp.core.config.RateLimitConfig;
import offramp.core.model.ratelimit.RateLimitPolicies;
import offramp.core.model.ratelimit.RateLimitPolicy;
import offramp.core.model.ratelimit.RateLimitResult;
import offramp.core.port.out.Metrics;

/**
 * Single entry point for rate limit checks.
 *
 * <p>Evaluates the sub-limiters of a subject in a fixed order and stops at the
 * first denial:
 * <ol>
 *   <li>Email sliding window</li>
 *   <li>IP token bucket</li>
 *   <li>Progressive delay</li>
 *   <li>Global counter</li>
 * </ol>
 *
 * <p>Stages after a denial do not run and leave no trace in the store. Because
 * the order is fixed, the first violated policy always determines the reason
 * the caller sees.
 *
 * <p>A subject without a policy is allowed. This is a configuration error, so
 * it is logged and counted rather than surfaced to the caller. Store failures
 * propagate unchanged as {@link offramp.core.port.out.StoreException}.
 */
@ApplicationScoped
public class RateLimitCoordinator {

    private static final Logger LOG = Logger.getLogger(RateLimitCoordinator.class);

    private final boolean enabled;
    private final RateLimitPolicies policies;
    private final EmailSlidingWindowLimiter emailLimiter;
    private final IpTokenBucketLimiter ipLimiter;
    private final ProgressiveDelayLimiter progressiveDelayLimiter;
    private final GlobalCounterLimiter globalLimiter;
    private final Metrics metrics;

    @Inject
    public RateLimitCoordinator(
            RateLimitConfig config,
            RateLimitPolicies policies,
            EmailSlidingWindowLimiter emailLimiter,
            IpTokenBucketLimiter ipLimiter,
            ProgressiveDelayLimiter progressiveDelayLimiter,
            GlobalCounterLimiter globalLimiter,
            Metrics metrics) {
        this(config.enabled(), policies, emailLimiter, ipLimiter, progressiveDelayLimiter, globalLimiter, metrics);
    }

    public RateLimitCoordinator(
            boolean enabled,
            RateLimitPolicies policies,
            EmailSlidingWindowLimiter emailLimiter,
            IpTokenBucketLimiter ipLimiter,
            ProgressiveDelayLimiter progressiveDelayLimiter,
            GlobalCounterLimiter globalLimiter,
            Metrics metrics) {
        this.enabled = enabled;
        this.policies = policies;
        this.emailLimiter = emailLimiter;
        this.ipLimiter = ipLimiter;
        this.progressiveDelayLimiter = progressiveDelayLimiter;
        this.globalLimiter = globalLimiter;
        this.metrics = metrics;
    }

    /**
     * Check all limits of a subject for one request.
     *
     * @param subject the protected operation, e.g. {@code otp}
     * @param email the identifier
     * @param ip the client IP
     * @return Uni with the result of the first denying stage, or an allowed result
     *     carrying the attempt number
     */
    public Uni<RateLimitResult> checkLimit(String subject, String email, String ip) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitResult.allow());
        }

        final var policy = policies.find(subject);
        if (policy.isEmpty()) {
            LOG.warnv("No rate limit policy registered for subject {0}, allowing request", subject);
            metrics.recordPolicyMissing(subject);
            return Uni.createFrom().item(RateLimitResult.allow());
        }

        return evaluate(policy.get(), email, ip)
                .invoke(result -> metrics.recordRateLimitCheck(subject, result.deniedBy()));
    }

    public boolean isEnabled() {
        return enabled;
    }

    private Uni<RateLimitResult> evaluate(RateLimitPolicy policy, String email, String ip) {
        return emailLimiter
                .check(policy, email)
                .flatMap(result -> result.allowed() ? ipLimiter.check(policy, ip) : done(result))
                .flatMap(result ->
                        result.allowed() ? progressiveDelayLimiter.check(policy, email) : done(result))
                .flatMap(result -> result.allowed()
                        ? globalLimiter.check(policy).map(global -> global.allowed() ? result : global)
                        : done(result));
    }

    private static Uni<RateLimitResult> done(RateLimitResult result) {
        return Uni.createFrom().item(result);
    }
}
