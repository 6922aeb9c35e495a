package offramp.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import offramp.core.config.AccountLockoutConfig;
import offramp.core.model.auth.FailedAttemptOutcome;
import offramp.core.model.auth.LockoutStatus;
import offramp.core.port.out.KeyValueStore;
import offramp.core.port.out.Metrics;

/**
 * Locks an account after repeated failed OTP verifications.
 *
 * <p>Failures are counted per subject and email. The counter expires one
 * lockout duration after the first failure it counts. Reaching the threshold
 * places a lock that also expires after the lockout duration; there is no
 * permanent lockout.
 *
 * <p>Key format:
 * <ul>
 *   <li>Failed attempts: {@code auth_lock:{subject}:failed_attempts:{email}}</li>
 *   <li>Lock: {@code auth_lock:{subject}:account_lock:{email}} holding {@code {"locked_at": ...}}</li>
 * </ul>
 */
@ApplicationScoped
public class AccountLockoutService {

    private static final Logger LOG = Logger.getLogger(AccountLockoutService.class);

    private static final String KEY_PREFIX = "auth_lock:";
    private static final String FIELD_LOCKED_AT = "locked_at";

    private final KeyValueStore store;
    private final int maxFailedAttempts;
    private final Duration lockoutDuration;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Metrics metrics;

    @Inject
    public AccountLockoutService(
            KeyValueStore store,
            AccountLockoutConfig config,
            Clock clock,
            ObjectMapper objectMapper,
            Metrics metrics) {
        this.store = store;
        this.maxFailedAttempts = config.maxFailedAttempts();
        this.lockoutDuration = config.duration();
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Count a failed verification and lock the account once the threshold is reached.
     *
     * @param subject the subject, e.g. {@code otp}
     * @param email the account email
     * @return Uni with the attempt count and whether the account is now locked
     */
    public Uni<FailedAttemptOutcome> recordFailedAttempt(String subject, String email) {
        final var attemptsKey = failedAttemptsKey(subject, email);

        return store.increment(attemptsKey)
                .call(attempts ->
                        attempts == 1 ? store.expire(attemptsKey, lockoutDuration) : Uni.createFrom().voidItem())
                .flatMap(attempts -> {
                    if (attempts < maxFailedAttempts) {
                        LOG.debugf("Failed attempt %d/%d for subject %s", (long) attempts, maxFailedAttempts, subject);
                        return Uni.createFrom().item(new FailedAttemptOutcome(attempts, false));
                    }
                    return lock(subject, email).replaceWith(new FailedAttemptOutcome(attempts, true));
                });
    }

    /**
     * Check whether an account is locked.
     */
    public Uni<Boolean> isLocked(String subject, String email) {
        return store.get(accountLockKey(subject, email)).map(Optional::isPresent);
    }

    /**
     * Get the lock state and failed attempt count of an account.
     */
    public Uni<LockoutStatus> status(String subject, String email) {
        return store.get(accountLockKey(subject, email))
                .flatMap(lock -> failedAttempts(subject, email)
                        .map(attempts -> lock.isPresent()
                                ? LockoutStatus.locked(parseLockedAt(lock.get()), attempts)
                                : LockoutStatus.unlocked(attempts)));
    }

    /**
     * Get the failed attempts counted in the current window.
     */
    public Uni<Long> failedAttempts(String subject, String email) {
        return store.get(failedAttemptsKey(subject, email)).map(value -> value.map(this::parseCount).orElse(0L));
    }

    /**
     * Forget failed attempts, typically after a successful verification.
     */
    public Uni<Void> resetFailedAttempts(String subject, String email) {
        return store.delete(failedAttemptsKey(subject, email)).replaceWithVoid();
    }

    /**
     * Remove an account lock and its failed attempts.
     *
     * @return Uni with true if anything was removed
     */
    public Uni<Boolean> clearLockout(String subject, String email) {
        return store.delete(accountLockKey(subject, email), failedAttemptsKey(subject, email))
                .map(removed -> {
                    if (removed > 0) {
                        LOG.infov("Cleared lockout for subject {0}", subject);
                    }
                    return removed > 0;
                });
    }

    public int maxFailedAttempts() {
        return maxFailedAttempts;
    }

    public Duration lockoutDuration() {
        return lockoutDuration;
    }

    private Uni<Boolean> lock(String subject, String email) {
        final var payload = lockPayload(Instant.now(clock));
        return store.setIfAbsent(accountLockKey(subject, email), payload, lockoutDuration)
                .invoke(created -> {
                    if (created) {
                        LOG.warnv("Account locked for subject {0} after {1} failed attempts", subject, maxFailedAttempts);
                        metrics.recordAccountLockout(subject);
                    }
                });
    }

    private String lockPayload(Instant lockedAt) {
        try {
            return objectMapper.writeValueAsString(Map.of(FIELD_LOCKED_AT, lockedAt.toString()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize account lock", e);
        }
    }

    private Instant parseLockedAt(String payload) {
        try {
            final var lockedAt = objectMapper.readTree(payload).path(FIELD_LOCKED_AT);
            return lockedAt.isTextual() ? Instant.parse(lockedAt.asText()) : null;
        } catch (JsonProcessingException | DateTimeParseException e) {
            LOG.warnv("Unreadable account lock payload: {0}", e.getMessage());
            return null;
        }
    }

    private long parseCount(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            LOG.warnv("Unreadable failed attempt counter: {0}", value);
            return 0L;
        }
    }

    static String failedAttemptsKey(String subject, String email) {
        return KEY_PREFIX + subject + ":failed_attempts:" + email;
    }

    static String accountLockKey(String subject, String email) {
        return KEY_PREFIX + subject + ":account_lock:" + email;
    }
}
