package offramp.adapter.in.http;

import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import offramp.core.model.ratelimit.RateLimitPolicies;
import offramp.core.model.ratelimit.RateLimitPolicy;
import offramp.core.model.ratelimit.StoreFailureMode;
import offramp.core.port.out.Metrics;
import offramp.core.service.ratelimit.RateLimitCoordinator;

/**
 * Creates {@link RateLimitInterceptor} instances bound to a subject.
 *
 * <p>The store failure mode comes from the subject's policy; subjects
 * without a policy fail open.
 */
@ApplicationScoped
public class RateLimitInterceptors {

    private final RateLimitCoordinator coordinator;
    private final RateLimitPolicies policies;
    private final Metrics metrics;

    @Inject
    public RateLimitInterceptors(RateLimitCoordinator coordinator, RateLimitPolicies policies, Metrics metrics) {
        this.coordinator = coordinator;
        this.policies = policies;
        this.metrics = metrics;
    }

    /**
     * Create an interceptor for a subject.
     *
     * @param subject the subject, e.g. {@code otp}
     * @param identifierExtractor extracts the identifier (email) from the request
     * @param <T> the request type
     * @return the interceptor
     */
    public <T> RateLimitInterceptor<T> forSubject(String subject, Function<T, String> identifierExtractor) {
        final var mode = policies.find(subject)
                .map(RateLimitPolicy::storeFailureMode)
                .orElse(StoreFailureMode.OPEN);
        return new RateLimitInterceptor<>(coordinator, subject, identifierExtractor, mode, metrics);
    }
}
