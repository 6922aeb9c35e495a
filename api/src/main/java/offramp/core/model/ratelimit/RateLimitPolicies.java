package offramp.core.model.ratelimit;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable registry of rate limit policies keyed by subject.
 *
 * <p>Built once at startup and never mutated, so it can be shared freely
 * between concurrent requests.
 */
public final class RateLimitPolicies {

    private final Map<String, RateLimitPolicy> bySubject;

    private RateLimitPolicies(Map<String, RateLimitPolicy> bySubject) {
        this.bySubject = Map.copyOf(bySubject);
    }

    public static RateLimitPolicies of(Collection<RateLimitPolicy> policies) {
        return new RateLimitPolicies(
                policies.stream().collect(Collectors.toMap(RateLimitPolicy::subject, Function.identity())));
    }

    public static RateLimitPolicies of(RateLimitPolicy... policies) {
        return of(List.of(policies));
    }

    public Optional<RateLimitPolicy> find(String subject) {
        if (subject == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bySubject.get(subject));
    }

    public Set<String> subjects() {
        return bySubject.keySet();
    }

    public int size() {
        return bySubject.size();
    }
}
