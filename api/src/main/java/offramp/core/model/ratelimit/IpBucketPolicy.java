package offramp.core.model.ratelimit;

/**
 * Token bucket limit applied per client IP.
 *
 * @param capacity maximum number of tokens the bucket holds
 * @param refillPerHour tokens added per hour, continuously
 * @param keyTtlSeconds expiry of the bucket's store key
 */
public record IpBucketPolicy(long capacity, double refillPerHour, long keyTtlSeconds) {

    public IpBucketPolicy {
        if (capacity < 1) {
            throw new IllegalArgumentException("ip capacity must be at least 1");
        }
        if (!(refillPerHour > 0)) {
            throw new IllegalArgumentException("ip refillPerHour must be positive");
        }
        if (keyTtlSeconds <= 0) {
            throw new IllegalArgumentException("ip keyTtlSeconds must be positive");
        }
    }

    /**
     * Tokens added per second of elapsed time.
     */
    public double refillPerSecond() {
        return refillPerHour / 3600.0;
    }
}
