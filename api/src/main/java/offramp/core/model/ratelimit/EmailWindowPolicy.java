package offramp.core.model.ratelimit;

/**
 * Sliding window limit applied per identifier (email).
 *
 * @param count maximum requests admitted within the window
 * @param windowSeconds length of the sliding window
 * @param keyTtlSeconds expiry of the window's store key, refreshed on every admitted request
 */
public record EmailWindowPolicy(long count, long windowSeconds, long keyTtlSeconds) {

    public EmailWindowPolicy {
        if (count < 1) {
            throw new IllegalArgumentException("email count must be at least 1");
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("email windowSeconds must be positive");
        }
        if (keyTtlSeconds <= 0) {
            throw new IllegalArgumentException("email keyTtlSeconds must be positive");
        }
    }

    public long windowMillis() {
        return windowSeconds * 1000L;
    }
}
