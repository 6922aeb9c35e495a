package offramp.core.model.ratelimit;

/**
 * Stored state of an IP token bucket.
 *
 * <p>Tokens are fractional because the bucket refills continuously.
 *
 * @param tokens tokens available after the last admitted request
 * @param lastUpdateMillis time of the last admitted request (epoch millis)
 */
public record TokenBucketState(double tokens, long lastUpdateMillis) {

    /**
     * State of a new bucket that has just admitted its first request.
     */
    public static TokenBucketState firstRequest(long capacity, long nowMillis) {
        return new TokenBucketState(capacity - 1, nowMillis);
    }

    /**
     * Tokens available at {@code nowMillis}, capped at capacity.
     *
     * <p>Elapsed time is clamped at zero so a clock running behind the one
     * that wrote the state never drains the bucket.
     */
    public double refilled(long capacity, double refillPerSecond, long nowMillis) {
        final var elapsedSeconds = Math.max(0L, nowMillis - lastUpdateMillis) / 1000.0;
        final var available = Math.max(0.0, tokens) + elapsedSeconds * refillPerSecond;
        return Math.min(capacity, available);
    }
}
