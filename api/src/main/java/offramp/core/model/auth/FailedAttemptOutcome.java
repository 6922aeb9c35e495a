package offramp.core.model.auth;

/**
 * Result of recording a failed OTP verification.
 *
 * @param attempts failed attempts counted in the current lockout window
 * @param locked whether the account is locked after this attempt
 */
public record FailedAttemptOutcome(long attempts, boolean locked) {}
