package offramp.core.port.out;

import offramp.core.model.ratelimit.LimitStage;

/**
 * Port for recording operational metrics.
 *
 * <p>Implementations must be cheap to call and never throw.
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a completed rate limit check.
     *
     * @param subject the subject checked
     * @param deniedBy the denying stage, or null when allowed
     */
    void recordRateLimitCheck(String subject, LimitStage deniedBy);

    /**
     * Record a check for a subject that has no configured policy.
     */
    void recordPolicyMissing(String subject);

    /**
     * Record a request forwarded unchecked because the store was unavailable.
     */
    void recordStoreFailOpen(String subject);

    /**
     * Record a store operation timeout.
     */
    void recordStoreTimeout(String operation);

    /**
     * Record a store operation failure other than a timeout.
     */
    void recordStoreFailure(String operation);

    /**
     * Record a lock acquisition attempt.
     *
     * @param category the lock category
     * @param acquired whether the lock was obtained
     */
    void recordLockAcquisition(String category, boolean acquired);

    /**
     * Record a release attempt by a caller that does not own the lock.
     */
    void recordLockOwnershipMismatch(String category);

    /**
     * Record an account lockout being placed.
     */
    void recordAccountLockout(String subject);

    /**
     * Record a rejected admin API key.
     */
    void recordAuthFailure(String reason);
}
