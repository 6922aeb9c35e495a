package offramp.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import offramp.adapter.out.store.KeyValueStoreProducer;
import offramp.core.model.ratelimit.RateLimitPolicies;
import offramp.core.service.ratelimit.RateLimitCoordinator;

/**
 * Readiness check reporting the store backend and loaded rate limit policies.
 *
 * <p>Always UP once configuration is loaded. Store outages are visible through
 * the store failure and timeout counters, not through readiness.
 */
@Readiness
@ApplicationScoped
public class StoreHealthCheck implements HealthCheck {

    private final KeyValueStoreProducer storeProducer;
    private final RateLimitPolicies policies;
    private final RateLimitCoordinator coordinator;

    @Inject
    public StoreHealthCheck(
            KeyValueStoreProducer storeProducer, RateLimitPolicies policies, RateLimitCoordinator coordinator) {
        this.storeProducer = storeProducer;
        this.policies = policies;
        this.coordinator = coordinator;
    }

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.builder()
                .name("rate-limit-store")
                .withData("store.backend", storeProducer.backendName())
                .withData("ratelimit.enabled", coordinator.isEnabled())
                .withData("ratelimit.subjects", String.join(",", policies.subjects()))
                .up()
                .build();
    }
}
