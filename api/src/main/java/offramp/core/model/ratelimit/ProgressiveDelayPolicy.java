package offramp.core.model.ratelimit;

import java.util.Map;

/**
 * Escalating minimum spacing between consecutive attempts of one identifier.
 *
 * @param delays required delay in seconds keyed by attempt number (1-based)
 * @param defaultDelaySeconds delay for attempt numbers not present in {@code delays}
 * @param attemptsKeyTtlSeconds expiry of the attempt counter, set when the counter is created
 * @param lastAttemptKeyTtlSeconds expiry of the last-attempt timestamp, set on every admitted attempt
 */
public record ProgressiveDelayPolicy(
        Map<Long, Long> delays, long defaultDelaySeconds, long attemptsKeyTtlSeconds, long lastAttemptKeyTtlSeconds) {

    public static final long DEFAULT_DELAY_SECONDS = 900;

    public ProgressiveDelayPolicy {
        delays = Map.copyOf(delays);
        for (var entry : delays.entrySet()) {
            if (entry.getKey() < 1) {
                throw new IllegalArgumentException("progressive delay attempt numbers start at 1");
            }
            if (entry.getValue() < 0) {
                throw new IllegalArgumentException("progressive delay must be non-negative for attempt " + entry.getKey());
            }
        }
        if (defaultDelaySeconds < 0) {
            throw new IllegalArgumentException("progressive defaultDelaySeconds must be non-negative");
        }
        if (attemptsKeyTtlSeconds <= 0) {
            throw new IllegalArgumentException("progressive attemptsKeyTtlSeconds must be positive");
        }
        if (lastAttemptKeyTtlSeconds <= 0) {
            throw new IllegalArgumentException("progressive lastAttemptKeyTtlSeconds must be positive");
        }
    }

    /**
     * Required delay before the given attempt may be admitted.
     *
     * @param attempt attempt number, 1-based
     * @return the delay in seconds
     */
    public long requiredDelaySeconds(long attempt) {
        return delays.getOrDefault(attempt, defaultDelaySeconds);
    }
}
