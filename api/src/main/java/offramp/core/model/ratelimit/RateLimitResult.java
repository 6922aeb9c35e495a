package offramp.core.model.ratelimit;

/**
 * Outcome of a rate limit check.
 *
 * <p>Denials are ordinary results, not errors. A denial always carries a
 * human-readable message and the stage that produced it. The progressive
 * delay stage attaches the attempt number it assigned, and the IP stage
 * attaches the number of seconds until a token becomes available.
 *
 * @param allowed whether the request may proceed
 * @param message denial message, null when allowed
 * @param attempt attempt number assigned by the progressive delay stage, if it ran
 * @param retryAfterSeconds seconds until a retry can succeed, if known
 * @param deniedBy the stage that denied the request, null when allowed
 */
public record RateLimitResult(
        boolean allowed, String message, Long attempt, Long retryAfterSeconds, LimitStage deniedBy) {

    private static final RateLimitResult ALLOWED = new RateLimitResult(true, null, null, null, null);

    /**
     * Create an allowed result with no attempt information.
     */
    public static RateLimitResult allow() {
        return ALLOWED;
    }

    /**
     * Create an allowed result carrying the progressive delay attempt number.
     */
    public static RateLimitResult allowAttempt(long attempt) {
        return new RateLimitResult(true, null, attempt, null, null);
    }

    /**
     * Create a denial.
     */
    public static RateLimitResult deny(LimitStage stage, String message) {
        return new RateLimitResult(false, message, null, null, stage);
    }

    /**
     * Create a denial with a retry hint.
     */
    public static RateLimitResult denyRetryAfter(LimitStage stage, String message, long retryAfterSeconds) {
        return new RateLimitResult(false, message, null, retryAfterSeconds, stage);
    }

    /**
     * Create a progressive delay denial.
     */
    public static RateLimitResult denyAttempt(String message, long attempt) {
        return new RateLimitResult(false, message, attempt, null, LimitStage.PROGRESSIVE_DELAY);
    }

    public boolean hasRetryAfter() {
        return retryAfterSeconds != null;
    }

    public boolean hasAttempt() {
        return attempt != null;
    }
}
