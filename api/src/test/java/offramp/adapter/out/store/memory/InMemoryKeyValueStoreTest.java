package offramp.adapter.out.store.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import offramp.core.port.out.StoreException;
import offramp.mock.MutableClock;

@DisplayName("InMemoryKeyValueStore")
class InMemoryKeyValueStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        store = new InMemoryKeyValueStore(clock);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Nested
    @DisplayName("string values")
    class StringValueTests {

        @Test
        @DisplayName("should return empty for missing key")
        void shouldReturnEmptyForMissingKey() {
            assertEquals(Optional.empty(), store.get("missing").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should expire value after its TTL")
        void shouldExpireValueAfterTtl() {
            store.setWithExpiry("k", "v", Duration.ofSeconds(10)).await().atMost(TIMEOUT);

            clock.advanceSeconds(9);
            assertEquals(Optional.of("v"), store.get("k").await().atMost(TIMEOUT));

            clock.advanceSeconds(1);
            assertEquals(Optional.empty(), store.get("k").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("setIfAbsent should only create missing keys")
        void setIfAbsentShouldOnlyCreateMissingKeys() {
            assertTrue(store.setIfAbsent("k", "first", Duration.ofSeconds(5)).await().atMost(TIMEOUT));
            assertFalse(store.setIfAbsent("k", "second", Duration.ofSeconds(5)).await().atMost(TIMEOUT));
            assertEquals(Optional.of("first"), store.get("k").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("setIfAbsent should replace an expired key")
        void setIfAbsentShouldReplaceExpiredKey() {
            store.setIfAbsent("k", "first", Duration.ofSeconds(5)).await().atMost(TIMEOUT);
            clock.advanceSeconds(5);

            assertTrue(store.setIfAbsent("k", "second", Duration.ofSeconds(5)).await().atMost(TIMEOUT));
            assertEquals(Optional.of("second"), store.get("k").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("delete should count only live keys")
        void deleteShouldCountOnlyLiveKeys() {
            store.setWithExpiry("a", "1", Duration.ofSeconds(5)).await().atMost(TIMEOUT);
            store.setWithExpiry("b", "1", Duration.ofSeconds(1)).await().atMost(TIMEOUT);
            clock.advanceSeconds(2);

            assertEquals(1L, store.delete("a", "b", "c").await().atMost(TIMEOUT));
            assertFalse(store.exists("a"));
        }
    }

    @Nested
    @DisplayName("counters")
    class CounterTests {

        @Test
        @DisplayName("should start at one and keep no expiry until set")
        void shouldStartAtOne() {
            assertEquals(1L, store.increment("c").await().atMost(TIMEOUT));
            assertEquals(2L, store.increment("c").await().atMost(TIMEOUT));
            assertEquals(Optional.empty(), store.ttl("c"));
        }

        @Test
        @DisplayName("should keep the expiry across increments")
        void shouldKeepExpiryAcrossIncrements() {
            store.increment("c").await().atMost(TIMEOUT);
            assertTrue(store.expire("c", Duration.ofSeconds(60)).await().atMost(TIMEOUT));

            clock.advanceSeconds(30);
            assertEquals(2L, store.increment("c").await().atMost(TIMEOUT));
            assertEquals(Optional.of(Duration.ofSeconds(30)), store.ttl("c"));

            clock.advanceSeconds(30);
            assertEquals(1L, store.increment("c").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("expire should report missing key")
        void expireShouldReportMissingKey() {
            assertFalse(store.expire("missing", Duration.ofSeconds(1)).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should fail on non-integer value")
        void shouldFailOnNonIntegerValue() {
            store.setWithExpiry("c", "abc", Duration.ofSeconds(5)).await().atMost(TIMEOUT);

            final var error = assertThrows(
                    StoreException.class, () -> store.increment("c").await().atMost(TIMEOUT));
            assertEquals("increment", error.operation());
        }
    }

    @Nested
    @DisplayName("sorted sets")
    class SortedSetTests {

        @Test
        @DisplayName("should add, count and remove by inclusive score range")
        void shouldAddCountAndRemoveByScore() {
            assertTrue(store.sortedSetAdd("z", 10, "a").await().atMost(TIMEOUT));
            assertTrue(store.sortedSetAdd("z", 20, "b").await().atMost(TIMEOUT));
            assertTrue(store.sortedSetAdd("z", 30, "c").await().atMost(TIMEOUT));
            assertFalse(store.sortedSetAdd("z", 31, "c").await().atMost(TIMEOUT));

            assertEquals(2L, store.sortedSetRemoveRangeByScore("z", 0, 20).await().atMost(TIMEOUT));
            assertEquals(1L, store.sortedSetCardinality("z").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should drop the key once empty")
        void shouldDropKeyOnceEmpty() {
            store.sortedSetAdd("z", 10, "a").await().atMost(TIMEOUT);
            store.sortedSetRemoveRangeByScore("z", 0, 10).await().atMost(TIMEOUT);

            assertFalse(store.exists("z"));
            assertEquals(0L, store.sortedSetCardinality("z").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should reject sorted set operations on a string key")
        void shouldRejectWrongType() {
            store.setWithExpiry("k", "v", Duration.ofSeconds(5)).await().atMost(TIMEOUT);

            final var error = assertThrows(
                    StoreException.class, () -> store.sortedSetCardinality("k").await().atMost(TIMEOUT));
            assertTrue(error.getMessage().startsWith("WRONGTYPE"));
        }
    }

    @Nested
    @DisplayName("hashes")
    class HashTests {

        @Test
        @DisplayName("should merge fields and read them back")
        void shouldMergeFields() {
            store.hashSet("h", Map.of("a", "1", "b", "2")).await().atMost(TIMEOUT);
            store.hashSet("h", Map.of("b", "3")).await().atMost(TIMEOUT);

            assertEquals(Map.of("a", "1", "b", "3"), store.hashGetAll("h").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should return empty map for missing hash")
        void shouldReturnEmptyMapForMissingHash() {
            assertTrue(store.hashGetAll("h").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should expire hash with its key")
        void shouldExpireHash() {
            store.hashSet("h", Map.of("a", "1")).await().atMost(TIMEOUT);
            store.expire("h", Duration.ofSeconds(5)).await().atMost(TIMEOUT);
            clock.advanceSeconds(5);

            assertTrue(store.hashGetAll("h").await().atMost(TIMEOUT).isEmpty());
        }
    }

    @Test
    @DisplayName("cleanupExpired should purge expired keys")
    void cleanupExpiredShouldPurgeExpiredKeys() {
        store.setWithExpiry("a", "1", Duration.ofSeconds(1)).await().atMost(TIMEOUT);
        store.setWithExpiry("b", "1", Duration.ofSeconds(10)).await().atMost(TIMEOUT);
        clock.advanceSeconds(2);

        store.cleanupExpired();

        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("failures should be StoreException")
    void failuresShouldBeStoreException() {
        store.hashSet("h", Map.of("a", "1")).await().atMost(TIMEOUT);

        final var error = assertThrows(RuntimeException.class, () -> store.get("h").await().atMost(TIMEOUT));
        assertInstanceOf(StoreException.class, error);
    }
}
