package net.tenure.core.backend;

import net.tenure.core.model.KeyEntry;
import net.tenure.core.spi.KeyValueStore;
import net.tenure.core.spi.TxRunner;
import net.tenure.core.store.InMemoryKeyValueStore;
import net.tenure.core.store.InMemoryLeaseDocumentStore;
import net.tenure.core.support.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static net.tenure.core.backend.TtlKeyBackend.LEADER_KEY;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TtlKeyBackend over the in-memory TTL store.
 * The renewal race is staged with a store that runs a hook between GET and PEXPIRE.
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class TtlKeyBackendTest {
    private static final Duration LEASE = Duration.ofSeconds(10);

    private ManualClock clock;
    private InMemoryKeyValueStore store;
    private TtlKeyBackend backend;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        store = new InMemoryKeyValueStore(clock);
        backend = new TtlKeyBackend(store, TxRunner.direct(), LEASE);
    }

    @Test
    void a1_tryAcquire_setsKeyWithTtl() throws Exception {
        Instant now = clock.now();

        assertTrue(backend.tryAcquire("node-1", now));

        KeyEntry e = store.entry(LEADER_KEY).orElseThrow();
        assertEquals("node-1", e.value());
        assertEquals(now.plus(LEASE), e.expiresAt());
        assertEquals(now.plus(LEASE), backend.current().orElseThrow().expiresAt());
    }

    @Test
    void a2_tryAcquire_failsWhileKeyLives_succeedsAfterTtl() throws Exception {
        assertTrue(backend.tryAcquire("node-1", clock.now()));

        clock.advance(LEASE.minusMillis(1));
        assertFalse(backend.tryAcquire("node-2", clock.now()));
        assertEquals("node-1", store.get(LEADER_KEY).orElseThrow());

        clock.advance(Duration.ofMillis(1));
        assertTrue(backend.tryAcquire("node-2", clock.now()));
        assertEquals("node-2", store.get(LEADER_KEY).orElseThrow());
    }

    @Test
    void a3_renew_refreshesTtl_onlyForTheOwner() throws Exception {
        assertTrue(backend.tryAcquire("node-1", clock.now()));

        Instant t1 = clock.advance(Duration.ofSeconds(3));
        assertTrue(backend.renew("node-1", t1));
        assertEquals(t1.plus(LEASE), store.entry(LEADER_KEY).orElseThrow().expiresAt());

        clock.advance(Duration.ofSeconds(1));
        KeyEntry before = store.entry(LEADER_KEY).orElseThrow();
        assertFalse(backend.renew("node-2", clock.now()));
        assertEquals(before, store.entry(LEADER_KEY).orElseThrow());
    }

    @Test
    void a4_renew_fails_afterTheKeyExpired() {
        assertTrue(backend.tryAcquire("node-1", clock.now()));
        clock.advance(LEASE);

        assertFalse(backend.renew("node-1", clock.now()));
    }

    @Test
    void a5_concurrentAcquires_exactlyOneWins() throws Exception {
        Instant now = clock.now();

        List<Boolean> results = ConditionalWriteBackendTest.race(8, i -> backend.tryAcquire("node-" + i, now));

        assertEquals(1, results.stream().filter(Boolean::booleanValue).count());
    }

    @Test
    void a6_releaseAndReset_deleteTheKey() throws Exception {
        assertTrue(backend.tryAcquire("node-1", clock.now()));
        backend.release();
        backend.release();
        assertTrue(store.entry(LEADER_KEY).isEmpty());

        assertTrue(backend.tryAcquire("node-2", clock.now()));
        backend.reset();
        assertTrue(backend.current().isEmpty());
    }

    @Test
    void b1_renewRace_refreshesALeaseNowOwnedBySomeoneElse() throws Exception {
        HookedStore hooked = new HookedStore(store);
        TtlKeyBackend racy = new TtlKeyBackend(hooked, TxRunner.direct(), LEASE);
        assertTrue(racy.tryAcquire("node-1", clock.now()));

        Instant[] handover = new Instant[1];
        // between node-1's GET and PEXPIRE: the key expires, node-2 takes it, time moves on
        hooked.afterGet = () -> {
            clock.advance(LEASE.plusMillis(1));
            handover[0] = clock.now();
            assertTrue(racy.tryAcquire("node-2", clock.now()));
            clock.advance(Duration.ofSeconds(2));
        };

        assertTrue(racy.renew("node-1", clock.now()), "stale owner reports a successful renewal");

        KeyEntry e = store.entry(LEADER_KEY).orElseThrow();
        assertEquals("node-2", e.value());
        assertEquals(clock.now().plus(LEASE), e.expiresAt(), "node-1's refresh extended node-2's lease");
        assertTrue(e.expiresAt().isAfter(handover[0].plus(LEASE)));
    }

    @Test
    void b2_sameInterleaving_onConditionalWrite_isFenced() throws Exception {
        InMemoryLeaseDocumentStore docs = new InMemoryLeaseDocumentStore();
        ConditionalWriteBackend cw = new ConditionalWriteBackend(docs, TxRunner.direct(), LEASE);
        assertTrue(cw.tryAcquire("node-1", clock.now()));

        clock.advance(LEASE.plusMillis(1));
        assertTrue(cw.tryAcquire("node-2", clock.now()));
        clock.advance(Duration.ofSeconds(2));

        assertFalse(cw.renew("node-1", clock.now()));
        assertEquals("node-2", cw.current().orElseThrow().ownerId());
    }

    @Test
    void b3_storeFailures_areReportedAsLosses() {
        KeyValueStore broken = new HookedStore(store) {
            @Override public boolean setIfAbsent(String key, String value, Duration ttl) { throw new IllegalStateException("READONLY"); }
            @Override public Optional<String> get(String key) { throw new IllegalStateException("READONLY"); }
        };
        TtlKeyBackend b = new TtlKeyBackend(broken, TxRunner.direct(), LEASE);

        assertFalse(b.tryAcquire("node-1", clock.now()));
        assertFalse(b.renew("node-1", clock.now()));
    }

    /** Runs afterGet once, right after the first GET returns. */
    static class HookedStore implements KeyValueStore {
        final KeyValueStore delegate;
        Runnable afterGet;

        HookedStore(KeyValueStore delegate) { this.delegate = delegate; }

        @Override public boolean setIfAbsent(String key, String value, Duration ttl) throws Exception {
            return delegate.setIfAbsent(key, value, ttl);
        }

        @Override public Optional<String> get(String key) throws Exception {
            Optional<String> v = delegate.get(key);
            Runnable hook = afterGet;
            afterGet = null;
            if (hook != null) hook.run();
            return v;
        }

        @Override public boolean expire(String key, Duration ttl) throws Exception { return delegate.expire(key, ttl); }

        @Override public void delete(String key) throws Exception { delegate.delete(key); }

        @Override public Optional<KeyEntry> entry(String key) throws Exception { return delegate.entry(key); }
    }
}
