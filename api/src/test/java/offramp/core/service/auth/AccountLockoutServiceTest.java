package offramp.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import offramp.adapter.out.store.memory.InMemoryKeyValueStore;
import offramp.core.config.AccountLockoutConfig;
import offramp.core.port.out.Metrics;
import offramp.mock.MutableClock;

@DisplayName("AccountLockoutService")
class AccountLockoutServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String SUBJECT = "otp";
    private static final String EMAIL = "user@example.com";

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private Metrics metrics;
    private AccountLockoutService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        store = new InMemoryKeyValueStore(clock);
        metrics = mock(Metrics.class);

        final var config = mock(AccountLockoutConfig.class);
        when(config.maxFailedAttempts()).thenReturn(3);
        when(config.duration()).thenReturn(Duration.ofMinutes(15));

        service = new AccountLockoutService(store, config, clock, new ObjectMapper(), metrics);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private void failAttempts(int times) {
        for (int i = 0; i < times; i++) {
            service.recordFailedAttempt(SUBJECT, EMAIL).await().atMost(TIMEOUT);
        }
    }

    @Nested
    @DisplayName("recordFailedAttempt")
    class RecordFailedAttemptTests {

        @Test
        @DisplayName("should count attempts below the threshold without locking")
        void shouldCountBelowThreshold() {
            final var first = service.recordFailedAttempt(SUBJECT, EMAIL).await().atMost(TIMEOUT);
            final var second = service.recordFailedAttempt(SUBJECT, EMAIL).await().atMost(TIMEOUT);

            assertEquals(1, first.attempts());
            assertFalse(first.locked());
            assertEquals(2, second.attempts());
            assertFalse(second.locked());
            assertFalse(service.isLocked(SUBJECT, EMAIL).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should lock the account at the threshold")
        void shouldLockAtThreshold() {
            failAttempts(2);

            final var third = service.recordFailedAttempt(SUBJECT, EMAIL).await().atMost(TIMEOUT);

            assertEquals(3, third.attempts());
            assertTrue(third.locked());
            assertTrue(service.isLocked(SUBJECT, EMAIL).await().atMost(TIMEOUT));
            verify(metrics).recordAccountLockout(SUBJECT);
        }

        @Test
        @DisplayName("should not re-lock or re-count a lockout for further failures")
        void shouldNotReLock() {
            failAttempts(3);
            clock.advance(Duration.ofMinutes(5));

            final var fourth = service.recordFailedAttempt(SUBJECT, EMAIL).await().atMost(TIMEOUT);

            assertTrue(fourth.locked());
            verify(metrics, times(1)).recordAccountLockout(SUBJECT);
            final var status = service.status(SUBJECT, EMAIL).await().atMost(TIMEOUT);
            assertEquals(Instant.parse("2024-01-01T00:00:00Z"), status.lockedAt());
        }

        @Test
        @DisplayName("should expire the counter one lockout duration after the first failure")
        void shouldExpireCounter() {
            failAttempts(2);

            assertEquals(Duration.ofMinutes(15), store.ttl(AccountLockoutService.failedAttemptsKey(SUBJECT, EMAIL))
                    .orElseThrow());

            clock.advance(Duration.ofMinutes(15).plusSeconds(1));

            final var next = service.recordFailedAttempt(SUBJECT, EMAIL).await().atMost(TIMEOUT);
            assertEquals(1, next.attempts());
            assertFalse(next.locked());
        }

        @Test
        @DisplayName("should count accounts and subjects independently")
        void shouldIsolateAccounts() {
            failAttempts(3);

            final var other = service.recordFailedAttempt(SUBJECT, "other@example.com").await().atMost(TIMEOUT);
            final var otherSubject = service.recordFailedAttempt("login", EMAIL).await().atMost(TIMEOUT);

            assertEquals(1, other.attempts());
            assertEquals(1, otherSubject.attempts());
            assertFalse(service.isLocked("login", EMAIL).await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("lock expiry")
    class LockExpiryTests {

        @Test
        @DisplayName("should unlock automatically after the lockout duration")
        void shouldUnlockAfterDuration() {
            failAttempts(3);

            clock.advance(Duration.ofMinutes(14));
            assertTrue(service.isLocked(SUBJECT, EMAIL).await().atMost(TIMEOUT));

            clock.advance(Duration.ofMinutes(1).plusSeconds(1));
            assertFalse(service.isLocked(SUBJECT, EMAIL).await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("status")
    class StatusTests {

        @Test
        @DisplayName("should report unlocked accounts with their attempt count")
        void shouldReportUnlocked() {
            failAttempts(1);

            final var status = service.status(SUBJECT, EMAIL).await().atMost(TIMEOUT);

            assertFalse(status.locked());
            assertNull(status.lockedAt());
            assertEquals(1, status.failedAttempts());
        }

        @Test
        @DisplayName("should report zero attempts for unknown accounts")
        void shouldReportZeroForUnknown() {
            final var status = service.status(SUBJECT, "nobody@example.com").await().atMost(TIMEOUT);

            assertFalse(status.locked());
            assertEquals(0, status.failedAttempts());
        }

        @Test
        @DisplayName("should tolerate an unreadable lock payload")
        void shouldTolerateUnreadablePayload() {
            store.setWithExpiry(AccountLockoutService.accountLockKey(SUBJECT, EMAIL), "not-json", Duration.ofMinutes(1))
                    .await()
                    .atMost(TIMEOUT);

            final var status = service.status(SUBJECT, EMAIL).await().atMost(TIMEOUT);

            assertTrue(status.locked());
            assertNull(status.lockedAt());
        }
    }

    @Nested
    @DisplayName("reset and clear")
    class ResetTests {

        @Test
        @DisplayName("should reset failed attempts without touching an existing lock")
        void shouldResetAttempts() {
            failAttempts(3);

            service.resetFailedAttempts(SUBJECT, EMAIL).await().atMost(TIMEOUT);

            assertEquals(0L, service.failedAttempts(SUBJECT, EMAIL).await().atMost(TIMEOUT));
            assertTrue(service.isLocked(SUBJECT, EMAIL).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should clear a lockout and its attempts")
        void shouldClearLockout() {
            failAttempts(3);

            assertTrue(service.clearLockout(SUBJECT, EMAIL).await().atMost(TIMEOUT));
            assertFalse(service.isLocked(SUBJECT, EMAIL).await().atMost(TIMEOUT));
            assertEquals(0L, service.failedAttempts(SUBJECT, EMAIL).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should report nothing cleared for an unknown account")
        void shouldReportNothingCleared() {
            assertFalse(service.clearLockout(SUBJECT, EMAIL).await().atMost(TIMEOUT));
            verify(metrics, never()).recordAccountLockout(SUBJECT);
        }
    }
}
