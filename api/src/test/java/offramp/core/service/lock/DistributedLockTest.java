package offramp.core.service.lock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import offramp.adapter.out.store.memory.InMemoryKeyValueStore;
import offramp.core.port.out.Metrics;
import offramp.mock.MutableClock;

@DisplayName("DistributedLock")
class DistributedLockTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String WALLET = "wallet-42";

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private Metrics metrics;
    private DistributedLock lock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        store = new InMemoryKeyValueStore(clock);
        metrics = mock(Metrics.class);
        lock = new DistributedLock(store, "withdrawals", Duration.ofSeconds(30), metrics);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Nested
    @DisplayName("acquire()")
    class AcquireTests {

        @Test
        @DisplayName("should store the token under the category key with the TTL")
        void shouldStoreToken() {
            final var token = lock.acquire(WALLET).await().atMost(TIMEOUT);

            assertNotNull(token);
            assertEquals(Optional.of(token), store.get("lock:withdrawals:wallet-42").await().atMost(TIMEOUT));
            assertEquals(Duration.ofSeconds(30), store.ttl("lock:withdrawals:wallet-42").orElseThrow());
            verify(metrics).recordLockAcquisition("withdrawals", true);
        }

        @Test
        @DisplayName("should fail while another holder owns the lock")
        void shouldFailWhileHeld() {
            lock.acquire(WALLET).await().atMost(TIMEOUT);

            final var error = assertThrows(
                    LockAlreadyHeldException.class, () -> lock.acquire(WALLET).await().atMost(TIMEOUT));

            assertEquals("withdrawals", error.category());
            assertEquals(WALLET, error.resourceId());
            verify(metrics).recordLockAcquisition("withdrawals", false);
        }

        @Test
        @DisplayName("should grant exactly one of many acquirers")
        void shouldGrantExactlyOneOfManyAcquirers() {
            final var granted = new ArrayList<String>();
            for (int i = 0; i < 10; i++) {
                final var token = lock.acquire(WALLET)
                        .onFailure(LockAlreadyHeldException.class)
                        .recoverWithNull()
                        .await()
                        .atMost(TIMEOUT);
                if (token != null) {
                    granted.add(token);
                }
            }

            assertEquals(1, granted.size());
            verify(metrics, times(9)).recordLockAcquisition("withdrawals", false);
        }

        @Test
        @DisplayName("should grant exactly one of many concurrent acquirers")
        void shouldGrantExactlyOneOfConcurrentAcquirers() throws Exception {
            final var executor = Executors.newFixedThreadPool(8);
            final var start = new CountDownLatch(1);
            try {
                final var futures = new ArrayList<Future<String>>();
                for (int i = 0; i < 16; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return lock.acquire(WALLET)
                                .onFailure(LockAlreadyHeldException.class)
                                .recoverWithNull()
                                .await()
                                .atMost(TIMEOUT);
                    }));
                }
                start.countDown();

                var granted = 0;
                for (var future : futures) {
                    if (future.get(5, TimeUnit.SECONDS) != null) {
                        granted++;
                    }
                }
                assertEquals(1, granted);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("should be acquirable again after the TTL elapses")
        void shouldExpireAfterTtl() {
            final var first = lock.acquire(WALLET).await().atMost(TIMEOUT);
            clock.advanceSeconds(30);

            final var second = lock.acquire(WALLET).await().atMost(TIMEOUT);

            assertNotEquals(first, second);
        }

        @Test
        @DisplayName("should keep resources independent")
        void shouldKeepResourcesIndependent() {
            lock.acquire(WALLET).await().atMost(TIMEOUT);

            assertNotNull(lock.acquire("wallet-43").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("release()")
    class ReleaseTests {

        @Test
        @DisplayName("should delete the key for the owner")
        void shouldDeleteForOwner() {
            final var token = lock.acquire(WALLET).await().atMost(TIMEOUT);

            lock.release(WALLET, token).await().atMost(TIMEOUT);

            assertTrue(store.get("lock:withdrawals:wallet-42").await().atMost(TIMEOUT).isEmpty());
            assertNotNull(lock.acquire(WALLET).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should refuse a stale token and keep the newer holder's lock")
        void shouldRefuseStaleToken() {
            final var stale = lock.acquire(WALLET).await().atMost(TIMEOUT);
            clock.advanceSeconds(31);
            final var current = lock.acquire(WALLET).await().atMost(TIMEOUT);

            assertThrows(LockOwnershipMismatchException.class, () -> lock.release(WALLET, stale)
                    .await()
                    .atMost(TIMEOUT));

            assertEquals(Optional.of(current), store.get("lock:withdrawals:wallet-42").await().atMost(TIMEOUT));
            verify(metrics).recordLockOwnershipMismatch("withdrawals");
        }

        @Test
        @DisplayName("should refuse release of a lock that no longer exists")
        void shouldRefuseReleaseOfMissingLock() {
            final var token = lock.acquire(WALLET).await().atMost(TIMEOUT);
            clock.advanceSeconds(30);

            assertThrows(LockOwnershipMismatchException.class, () -> lock.release(WALLET, token)
                    .await()
                    .atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("withLock()")
    class WithLockTests {

        @Test
        @DisplayName("should run the section while holding the lock and release it afterwards")
        void shouldRunSectionAndRelease() {
            final var heldDuringSection = new AtomicBoolean();

            final var result = lock.withLock(WALLET, () -> {
                        heldDuringSection.set(store.exists("lock:withdrawals:wallet-42"));
                        return Uni.createFrom().item("done");
                    })
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("done", result);
            assertTrue(heldDuringSection.get());
            assertTrue(store.get("lock:withdrawals:wallet-42").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should release the lock when the section fails")
        void shouldReleaseOnFailure() {
            final var failure = new IllegalStateException("insufficient balance");

            final var thrown = assertThrows(IllegalStateException.class, () -> lock.<String>withLock(
                            WALLET, () -> Uni.createFrom().failure(failure))
                    .await()
                    .atMost(TIMEOUT));

            assertSame(failure, thrown);
            assertTrue(store.get("lock:withdrawals:wallet-42").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should release the lock when the section throws before returning")
        void shouldReleaseWhenSectionThrows() {
            assertThrows(IllegalStateException.class, () -> lock.<String>withLock(WALLET, () -> {
                        throw new IllegalStateException("boom");
                    })
                    .await()
                    .atMost(TIMEOUT));

            assertTrue(store.get("lock:withdrawals:wallet-42").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should not run the section when the lock is held")
        void shouldNotRunSectionWhenHeld() {
            lock.acquire(WALLET).await().atMost(TIMEOUT);
            final var ran = new AtomicBoolean();

            assertThrows(LockAlreadyHeldException.class, () -> lock.withLock(WALLET, () -> {
                        ran.set(true);
                        return Uni.createFrom().item("done");
                    })
                    .await()
                    .atMost(TIMEOUT));

            assertFalse(ran.get());
        }

        @Test
        @DisplayName("should attach a release failure to the section failure")
        void shouldAttachReleaseFailure() {
            final var failure = new IllegalStateException("insufficient balance");

            final var thrown = assertThrows(IllegalStateException.class, () -> lock.<String>withLock(WALLET, () -> {
                        // Section outlives the TTL and another holder takes over.
                        clock.advanceSeconds(31);
                        lock.acquire(WALLET).await().atMost(TIMEOUT);
                        return Uni.createFrom().failure(failure);
                    })
                    .await()
                    .atMost(TIMEOUT));

            assertSame(failure, thrown);
            assertEquals(1, thrown.getSuppressed().length);
            assertInstanceOf(LockOwnershipMismatchException.class, thrown.getSuppressed()[0]);
        }

        @Test
        @DisplayName("should fail with the release failure when the section outlives the lock")
        void shouldFailWhenSectionOutlivesLock() {
            assertThrows(LockOwnershipMismatchException.class, () -> lock.withLock(WALLET, () -> {
                        clock.advanceSeconds(31);
                        return Uni.createFrom().item("done");
                    })
                    .await()
                    .atMost(TIMEOUT));
        }
    }

    @Test
    @DisplayName("should reject invalid construction")
    void shouldRejectInvalidConstruction() {
        assertThrows(
                IllegalArgumentException.class, () -> new DistributedLock(store, " ", Duration.ofSeconds(1), metrics));
        assertThrows(IllegalArgumentException.class, () -> new DistributedLock(store, "x", Duration.ZERO, metrics));
    }
}
