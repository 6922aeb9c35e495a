package offramp.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import offramp.adapter.out.store.memory.InMemoryKeyValueStore;
import offramp.core.model.ratelimit.LimitStage;
import offramp.core.model.ratelimit.RateLimitKeys;
import offramp.core.model.ratelimit.RateLimitPolicy;
import offramp.mock.MutableClock;
import offramp.mock.TestPolicies;

@DisplayName("EmailSlidingWindowLimiter")
class EmailSlidingWindowLimiterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String EMAIL = "user@example.com";

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private EmailSlidingWindowLimiter limiter;
    private RateLimitPolicy policy;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        store = new InMemoryKeyValueStore(clock);
        limiter = new EmailSlidingWindowLimiter(store, clock);
        policy = TestPolicies.otp();
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private boolean check(String email) {
        return limiter.check(policy, email).await().atMost(TIMEOUT).allowed();
    }

    @Nested
    @DisplayName("window")
    class WindowTests {

        @Test
        @DisplayName("should allow five requests in an hour and deny the sixth")
        void shouldDenySixthRequestWithinHour() {
            for (int i = 0; i < 5; i++) {
                assertTrue(check(EMAIL), "request " + (i + 1));
                clock.advanceSeconds(60);
            }

            final var result = limiter.check(policy, EMAIL).await().atMost(TIMEOUT);

            assertFalse(result.allowed());
            assertEquals(LimitStage.EMAIL, result.deniedBy());
            assertEquals("Maximum 5 requests per hour for this identifier", result.message());
            assertNull(result.retryAfterSeconds());
        }

        @Test
        @DisplayName("should allow again once the oldest request leaves the window")
        void shouldAllowOnceOldestLeavesWindow() {
            for (int i = 0; i < 5; i++) {
                assertTrue(check(EMAIL));
                clock.advanceSeconds(60);
            }
            assertFalse(check(EMAIL));

            // First request was at t=0; the window now starts after it.
            clock.set(Instant.parse("2024-01-01T01:00:00.001Z"));

            assertTrue(check(EMAIL));
            assertFalse(check(EMAIL));
        }

        @Test
        @DisplayName("should count same-instant requests separately")
        void shouldCountSameInstantRequestsSeparately() {
            for (int i = 0; i < 5; i++) {
                assertTrue(check(EMAIL));
            }

            assertFalse(check(EMAIL));
        }

        @Test
        @DisplayName("should not record denied requests")
        void shouldNotRecordDeniedRequests() {
            for (int i = 0; i < 5; i++) {
                check(EMAIL);
            }
            check(EMAIL);
            check(EMAIL);

            final var count = store.sortedSetCardinality(RateLimitKeys.email("otp", EMAIL))
                    .await()
                    .atMost(TIMEOUT);
            assertEquals(5L, count);
        }

        @Test
        @DisplayName("should track identifiers independently")
        void shouldTrackIdentifiersIndependently() {
            for (int i = 0; i < 5; i++) {
                check(EMAIL);
            }

            assertFalse(check(EMAIL));
            assertTrue(check("other@example.com"));
        }
    }

    @Test
    @DisplayName("should refresh key TTL on admitted requests")
    void shouldRefreshKeyTtl() {
        check(EMAIL);

        assertEquals(Duration.ofSeconds(7200), store.ttl(RateLimitKeys.email("otp", EMAIL)).orElseThrow());
    }

    @Test
    @DisplayName("should describe common windows by name")
    void shouldDescribeCommonWindows() {
        assertEquals("minute", EmailSlidingWindowLimiter.describeWindow(60));
        assertEquals("hour", EmailSlidingWindowLimiter.describeWindow(3600));
        assertEquals("day", EmailSlidingWindowLimiter.describeWindow(86400));
        assertEquals("900 seconds", EmailSlidingWindowLimiter.describeWindow(900));
    }
}
