package offramp.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import offramp.config.TelemetryConfig;
import offramp.core.model.ratelimit.LimitStage;
import offramp.core.port.out.Metrics;

/**
 * Records operational metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code offramp.ratelimit.checks.total} - Checks by subject and outcome</li>
 *   <li>{@code offramp.ratelimit.policy.missing} - Checks for subjects without a policy</li>
 *   <li>{@code offramp.ratelimit.store.failopen} - Requests forwarded unchecked</li>
 *   <li>{@code offramp.store.timeouts.total} - Store operation timeouts</li>
 *   <li>{@code offramp.store.failures.total} - Store operation failures</li>
 *   <li>{@code offramp.lock.acquisitions.total} - Lock acquisition attempts by outcome</li>
 *   <li>{@code offramp.lock.ownership.mismatch} - Releases refused for non-owners</li>
 *   <li>{@code offramp.auth.lockouts.total} - Account lockouts placed</li>
 * </ul>
 */
@ApplicationScoped
public class OfframpMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public OfframpMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordRateLimitCheck(String subject, LimitStage deniedBy) {
        if (!enabled) {
            return;
        }

        Counter.builder("offramp.ratelimit.checks.total")
                .description("Rate limit checks by outcome")
                .tag("subject", nullSafe(subject))
                .tag("outcome", deniedBy == null ? "allowed" : "denied")
                .tag("stage", deniedBy == null ? "none" : deniedBy.name().toLowerCase())
                .register(registry)
                .increment();
    }

    @Override
    public void recordPolicyMissing(String subject) {
        if (!enabled) {
            return;
        }

        Counter.builder("offramp.ratelimit.policy.missing")
                .description("Rate limit checks for subjects without a policy")
                .tag("subject", nullSafe(subject))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailOpen(String subject) {
        if (!enabled) {
            return;
        }

        Counter.builder("offramp.ratelimit.store.failopen")
                .description("Requests forwarded unchecked because the store was unavailable")
                .tag("subject", nullSafe(subject))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreTimeout(String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("offramp.store.timeouts.total")
                .description("Store operations that timed out")
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("offramp.store.failures.total")
                .description("Store operations that failed")
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordLockAcquisition(String category, boolean acquired) {
        if (!enabled) {
            return;
        }

        Counter.builder("offramp.lock.acquisitions.total")
                .description("Lock acquisition attempts")
                .tag("category", nullSafe(category))
                .tag("outcome", acquired ? "acquired" : "held")
                .register(registry)
                .increment();
    }

    @Override
    public void recordLockOwnershipMismatch(String category) {
        if (!enabled) {
            return;
        }

        Counter.builder("offramp.lock.ownership.mismatch")
                .description("Lock releases refused because the caller did not own the lock")
                .tag("category", nullSafe(category))
                .register(registry)
                .increment();
    }

    @Override
    public void recordAccountLockout(String subject) {
        if (!enabled) {
            return;
        }

        Counter.builder("offramp.auth.lockouts.total")
                .description("Accounts locked after repeated failed verifications")
                .tag("subject", nullSafe(subject))
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuthFailure(String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("offramp.auth.failures.total")
                .description("Admin requests rejected for an invalid API key")
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
