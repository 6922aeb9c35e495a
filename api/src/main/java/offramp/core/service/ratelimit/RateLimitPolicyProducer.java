package offramp.core.service.ratelimit;

import java.util.ArrayList;
import java.util.HashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import offramp.core.config.RateLimitConfig;
import offramp.core.model.ratelimit.EmailWindowPolicy;
import offramp.core.model.ratelimit.GlobalCapPolicy;
import offramp.core.model.ratelimit.IpBucketPolicy;
import offramp.core.model.ratelimit.ProgressiveDelayPolicy;
import offramp.core.model.ratelimit.RateLimitPolicies;
import offramp.core.model.ratelimit.RateLimitPolicy;

/**
 * Builds the immutable policy registry from configuration at startup.
 *
 * <p>Invalid values fail the build of the registry, which aborts startup.
 */
@ApplicationScoped
public class RateLimitPolicyProducer {

    private static final Logger LOG = Logger.getLogger(RateLimitPolicyProducer.class);

    private final RateLimitConfig config;

    @Inject
    public RateLimitPolicyProducer(RateLimitConfig config) {
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public RateLimitPolicies producePolicies() {
        final var policies = fromConfig(config);
        LOG.infov("Loaded rate limit policies for subjects {0}", policies.subjects());
        return policies;
    }

    /**
     * Convert the configuration of every subject into a policy.
     */
    public static RateLimitPolicies fromConfig(RateLimitConfig config) {
        final var policies = new ArrayList<RateLimitPolicy>();
        config.subjects().forEach((subject, subjectConfig) -> policies.add(toPolicy(subject, subjectConfig)));
        return RateLimitPolicies.of(policies);
    }

    static RateLimitPolicy toPolicy(String subject, RateLimitConfig.SubjectConfig config) {
        final var email = config.email();
        final var ip = config.ip();
        final var progressive = config.progressiveDelay();
        final var global = config.global();

        final var delays = new HashMap<Long, Long>();
        final var configured = progressive.delaysSeconds();
        for (int i = 0; i < configured.size(); i++) {
            delays.put((long) i + 1, configured.get(i));
        }

        return new RateLimitPolicy(
                subject,
                new EmailWindowPolicy(email.count(), email.windowSeconds(), email.keyTtlSeconds()),
                new IpBucketPolicy(ip.capacity(), ip.refillPerHour(), ip.keyTtlSeconds()),
                new ProgressiveDelayPolicy(
                        delays,
                        progressive.defaultDelaySeconds(),
                        progressive.attemptsKeyTtlSeconds(),
                        progressive.lastAttemptKeyTtlSeconds()),
                new GlobalCapPolicy(global.count(), global.windowSeconds()),
                config.storeFailureMode());
    }
}
