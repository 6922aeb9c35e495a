package offramp.core.model.auth;

import java.time.Instant;

/**
 * Lockout state of one email for one subject.
 *
 * @param locked whether the account is currently locked
 * @param lockedAt when the lock was placed, null if not locked or unknown
 * @param failedAttempts failed attempts counted in the current window
 */
public record LockoutStatus(boolean locked, Instant lockedAt, long failedAttempts) {

    public static LockoutStatus unlocked(long failedAttempts) {
        return new LockoutStatus(false, null, failedAttempts);
    }

    public static LockoutStatus locked(Instant lockedAt, long failedAttempts) {
        return new LockoutStatus(true, lockedAt, failedAttempts);
    }
}
