package offramp.core.model.ratelimit;

import java.util.Objects;

/**
 * Complete rate limit configuration of one subject.
 *
 * <p>A subject is a named category of protected operation, such as {@code otp}
 * or {@code withdrawal}. Each subject configures all four sub-limiters.
 *
 * @param subject the subject name
 * @param email sliding window per identifier
 * @param ip token bucket per client IP
 * @param progressiveDelay escalating delay per identifier
 * @param global fixed window per subject
 * @param storeFailureMode treatment of requests when the store is unavailable
 */
public record RateLimitPolicy(
        String subject,
        EmailWindowPolicy email,
        IpBucketPolicy ip,
        ProgressiveDelayPolicy progressiveDelay,
        GlobalCapPolicy global,
        StoreFailureMode storeFailureMode) {

    public RateLimitPolicy {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject cannot be null or blank");
        }
        Objects.requireNonNull(email, "email policy cannot be null");
        Objects.requireNonNull(ip, "ip policy cannot be null");
        Objects.requireNonNull(progressiveDelay, "progressiveDelay policy cannot be null");
        Objects.requireNonNull(global, "global policy cannot be null");
        if (storeFailureMode == null) {
            storeFailureMode = StoreFailureMode.OPEN;
        }
    }
}
